package com.flamingo.ai.bookviews.indexing;

import java.util.Map;

/**
 * One k-NN match.
 *
 * @param score cosine similarity in {@code [-1, 1]}, higher is better
 * @param combinedSummary the record's combined-view summary, used for lexical tie-breaking
 * @param metadata stored metadata fields
 */
public record VectorHit(
    String id,
    double score,
    String title,
    String author,
    String combinedSummary,
    Map<String, Object> metadata) {}
