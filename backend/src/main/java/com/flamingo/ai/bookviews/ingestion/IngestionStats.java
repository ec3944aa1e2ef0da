package com.flamingo.ai.bookviews.ingestion;

import com.flamingo.ai.bookviews.exception.ErrorCategory;
import com.flamingo.ai.bookviews.indexing.ReconciliationReport;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one ingestion run.
 *
 * @param processed documents indexed in this run
 * @param failed documents that reached {@code FAILED} in this run
 * @param skipped documents already terminal in the ledger when the run started
 * @param retried failed attempts that were returned to {@code PENDING}
 * @param errorsByCategory every failed attempt, by taxonomy
 * @param cancelled whether the run stopped early on request
 * @param reconciliation index/ledger comparison, when enabled
 */
public record IngestionStats(
    int processed,
    int failed,
    int skipped,
    int retried,
    Map<ErrorCategory, Integer> errorsByCategory,
    boolean cancelled,
    ReconciliationReport reconciliation) {

  public IngestionStats {
    errorsByCategory =
        errorsByCategory.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(errorsByCategory));
  }

  public int errors(ErrorCategory category) {
    return errorsByCategory.getOrDefault(category, 0);
  }
}
