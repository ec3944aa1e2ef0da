package com.flamingo.ai.bookviews.query;

import com.flamingo.ai.bookviews.domain.SearchStrategy;
import com.flamingo.ai.bookviews.domain.SummaryView;
import java.util.List;

/**
 * Answer to a {@link QueryRequest}.
 *
 * @param degraded true when at least one view search failed and was left out of the merge
 * @param droppedViews the views left out
 */
public record RankedResults(
    String query,
    SearchStrategy strategy,
    List<Recommendation> results,
    boolean degraded,
    List<SummaryView> droppedViews) {

  public RankedResults {
    results = List.copyOf(results);
    droppedViews = List.copyOf(droppedViews);
  }
}
