package com.flamingo.ai.bookviews.domain;

import java.time.Instant;

/** Ledger state of one source document. Entries are replaced, never mutated. */
public record CheckpointEntry(
    String documentId,
    CheckpointStatus status,
    int attemptCount,
    String lastError,
    Instant updatedAt) {

  public static CheckpointEntry pending(String documentId) {
    return new CheckpointEntry(documentId, CheckpointStatus.PENDING, 0, null, Instant.now());
  }

  public CheckpointEntry withStatus(CheckpointStatus newStatus) {
    return new CheckpointEntry(documentId, newStatus, attemptCount, lastError, Instant.now());
  }

  public CheckpointEntry withFailure(CheckpointStatus newStatus, String error) {
    return new CheckpointEntry(documentId, newStatus, attemptCount + 1, error, Instant.now());
  }
}
