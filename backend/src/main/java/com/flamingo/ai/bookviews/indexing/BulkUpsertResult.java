package com.flamingo.ai.bookviews.indexing;

import java.util.Map;

/**
 * Outcome of one bulk request.
 *
 * @param failures reason per failed item, keyed by the item's position in the request
 */
public record BulkUpsertResult(Map<Integer, String> failures) {

  public BulkUpsertResult {
    failures = Map.copyOf(failures);
  }

  public static BulkUpsertResult success() {
    return new BulkUpsertResult(Map.of());
  }
}
