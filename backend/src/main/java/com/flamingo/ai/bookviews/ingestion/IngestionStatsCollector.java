package com.flamingo.ai.bookviews.ingestion;

import com.flamingo.ai.bookviews.exception.ErrorCategory;
import com.flamingo.ai.bookviews.indexing.ReconciliationReport;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Thread-safe counters updated by the workers of one run. */
class IngestionStatsCollector {

  private final AtomicInteger processed = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final AtomicInteger skipped = new AtomicInteger();
  private final AtomicInteger retried = new AtomicInteger();
  private final Map<ErrorCategory, AtomicInteger> errors = new EnumMap<>(ErrorCategory.class);

  IngestionStatsCollector() {
    for (ErrorCategory category : ErrorCategory.values()) {
      errors.put(category, new AtomicInteger());
    }
  }

  void processed() {
    processed.incrementAndGet();
  }

  void failed() {
    failed.incrementAndGet();
  }

  void skipped(int count) {
    skipped.addAndGet(count);
  }

  void retried() {
    retried.incrementAndGet();
  }

  void error(ErrorCategory category) {
    errors.get(category).incrementAndGet();
  }

  IngestionStats toStats(boolean cancelled, ReconciliationReport reconciliation) {
    Map<ErrorCategory, Integer> counts = new EnumMap<>(ErrorCategory.class);
    errors.forEach(
        (category, count) -> {
          if (count.get() > 0) {
            counts.put(category, count.get());
          }
        });
    return new IngestionStats(
        processed.get(), failed.get(), skipped.get(), retried.get(), counts, cancelled,
        reconciliation);
  }
}
