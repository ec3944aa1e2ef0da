package com.flamingo.ai.bookviews.indexing;

import com.flamingo.ai.bookviews.domain.IndexRecord;
import com.flamingo.ai.bookviews.domain.SummaryView;
import java.io.IOException;
import java.util.List;

/** Vector-similarity index holding one record per book with one embedding per view. */
public interface VectorIndex {

  /**
   * Upserts records keyed by their id.
   *
   * @return per-item failures by position in {@code records}
   * @throws IOException when the request as a whole could not be executed
   */
  BulkUpsertResult bulkUpsert(List<IndexRecord> records) throws IOException;

  /**
   * k-NN search over one view's embeddings.
   *
   * @param corpus restricts results to one corpus; {@code null} searches everything
   * @return hits ordered by descending cosine similarity
   */
  List<VectorHit> knnSearch(SummaryView view, float[] vector, int k, String corpus);

  /** Makes every acknowledged write visible to {@link #count} and {@link #knnSearch}. */
  void refresh();

  /** Number of records in {@code corpus}, or in the whole index when {@code corpus} is null. */
  long count(String corpus);

  /** Deletes the records of {@code corpus}, or every record when {@code corpus} is null. */
  long purge(String corpus);
}
