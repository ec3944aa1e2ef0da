package com.flamingo.ai.bookviews.exception;

/** Failure taxonomy used to route pipeline errors and aggregate run statistics. */
public enum ErrorCategory {
  /** Embedding or index call failed for a recoverable reason. */
  TRANSIENT,

  /** Document content is unusable. Never retried. */
  PERMANENT_CONTENT,

  /** Bulk upsert failed for an item after its own retries. */
  INDEX_WRITE,

  /** Document exhausted its ingestion attempts. */
  QUARANTINE,

  /** Systemic misconfiguration. Aborts the run. */
  CONFIGURATION,

  /** Anything not classified above; consumes an attempt like a transient error. */
  UNEXPECTED
}
