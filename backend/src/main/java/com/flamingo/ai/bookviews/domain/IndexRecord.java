package com.flamingo.ai.bookviews.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unit of upsert into the vector index, keyed by the source document id so that repeated
 * delivery converges on the same stored record.
 */
public record IndexRecord(
    String id,
    String title,
    String author,
    String corpus,
    Map<String, Object> metadata,
    Map<SummaryView, ViewPayload> views) {

  /** Summary text and embedding for one view. */
  public record ViewPayload(String summary, float[] embedding) {}

  public IndexRecord {
    Objects.requireNonNull(id, "id");
    metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    views = Collections.unmodifiableMap(new EnumMap<>(views));
  }

  /** Assembles a record from a complete bundle and its embeddings. */
  public static IndexRecord assemble(
      SourceDocument document,
      String corpus,
      SummaryBundle bundle,
      EmbeddingSet embeddings,
      Map<String, Object> metadata) {
    Map<SummaryView, ViewPayload> views = new EnumMap<>(SummaryView.class);
    for (SummaryView view : SummaryView.values()) {
      float[] vector = embeddings.vector(view);
      if (vector == null) {
        throw new IllegalArgumentException(
            "Missing embedding for view " + view.getValue() + " of " + document.id());
      }
      views.put(view, new ViewPayload(bundle.summary(view), vector));
    }
    return new IndexRecord(
        document.id(), document.title(), document.author(), corpus, metadata, views);
  }
}
