package com.flamingo.ai.bookviews.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** View to embedding vector for one document. All vectors share one dimension. */
public record EmbeddingSet(Map<SummaryView, float[]> vectors) {

  public EmbeddingSet {
    int dimension = -1;
    for (Map.Entry<SummaryView, float[]> entry : vectors.entrySet()) {
      int length = entry.getValue().length;
      if (dimension >= 0 && length != dimension) {
        throw new IllegalArgumentException(
            "Embedding for view "
                + entry.getKey().getValue()
                + " has dimension "
                + length
                + ", expected "
                + dimension);
      }
      dimension = length;
    }
    vectors = Collections.unmodifiableMap(new EnumMap<>(vectors));
  }

  public float[] vector(SummaryView view) {
    return vectors.get(view);
  }
}
