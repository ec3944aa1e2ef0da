package com.flamingo.ai.bookviews.ingestion;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for one ingestion run. Workers check it before claiming each batch and
 * before starting each document; steps already in flight are allowed to finish.
 */
public class IngestionContext {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private volatile String reason;

  public void cancel(String reason) {
    if (cancelled.compareAndSet(false, true)) {
      this.reason = reason;
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public String getReason() {
    return reason;
  }
}
