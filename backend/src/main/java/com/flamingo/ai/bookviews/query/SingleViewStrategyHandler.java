package com.flamingo.ai.bookviews.query;

import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.exception.SearchException;
import com.flamingo.ai.bookviews.indexing.VectorHit;
import com.flamingo.ai.bookviews.indexing.VectorIndex;
import java.util.List;
import java.util.Map;

/** One k-NN search restricted to a single view's embeddings. A failed search fails the query. */
class SingleViewStrategyHandler implements StrategyHandler {

  private final SummaryView view;
  private final VectorIndex vectorIndex;

  SingleViewStrategyHandler(SummaryView view, VectorIndex vectorIndex) {
    this.view = view;
    this.vectorIndex = vectorIndex;
  }

  @Override
  public RankedResults search(QueryRequest request, float[] queryVector) {
    List<VectorHit> hits;
    try {
      hits = vectorIndex.knnSearch(view, queryVector, request.size(), request.corpus());
    } catch (SearchException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SearchException("Search on " + view.getValue() + " view failed", e);
    }
    return new RankedResults(
        request.query(),
        request.strategy(),
        ResultMerger.merge(Map.of(view, hits), request.query(), request.size()),
        false,
        List.of());
  }
}
