package com.flamingo.ai.bookviews.domain;

/** Ingestion status of a source document in the checkpoint ledger. */
public enum CheckpointStatus {
  /** Discovered, waiting to be claimed. */
  PENDING,

  /** Claimed by a worker. Reset to PENDING on restore after a crash. */
  IN_PROGRESS,

  /** Indexed across all views. */
  DONE,

  /** Permanently failed or out of attempts. Excluded from the index. */
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
