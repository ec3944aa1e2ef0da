package com.flamingo.ai.bookviews.query;

/** Executes one search strategy against an already-embedded query. */
@FunctionalInterface
public interface StrategyHandler {

  RankedResults search(QueryRequest request, float[] queryVector);
}
