package com.flamingo.ai.bookviews.query;

import com.flamingo.ai.bookviews.domain.SummaryView;
import java.util.Map;

/**
 * One ranked book.
 *
 * @param score cosine similarity of the winning view
 * @param matchedView the view that produced {@code score}
 */
public record Recommendation(
    String id,
    double score,
    String title,
    String author,
    Map<String, Object> metadata,
    SummaryView matchedView) {}
