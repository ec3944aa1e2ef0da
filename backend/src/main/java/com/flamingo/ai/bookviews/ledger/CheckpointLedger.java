package com.flamingo.ai.bookviews.ledger;

import com.flamingo.ai.bookviews.domain.CheckpointEntry;
import com.flamingo.ai.bookviews.domain.CheckpointStatus;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Per-document ingestion status, shared by all workers of a run.
 *
 * <p>State machine: {@code PENDING -> IN_PROGRESS -> DONE}; a retryable failure returns the entry
 * to {@code PENDING} with its attempt count incremented, until the count reaches the configured
 * maximum and the entry becomes {@code FAILED}. Every operation is atomic; concurrent {@link
 * #claimBatch(int)} calls never return the same id twice.
 */
public interface CheckpointLedger {

  /**
   * Adds unknown ids as {@code PENDING}. Known ids keep their state.
   *
   * @return number of ids that were newly added
   */
  int register(Collection<String> documentIds);

  /** Moves up to {@code n} pending entries to {@code IN_PROGRESS} and returns their ids. */
  default List<String> claimBatch(int n) {
    return claimBatch(n, id -> true);
  }

  /** Like {@link #claimBatch(int)}, restricted to ids accepted by {@code eligible}. */
  List<String> claimBatch(int n, Predicate<String> eligible);

  void markDone(String documentId);

  /**
   * Records a retryable failure.
   *
   * @return the resulting status: {@code PENDING}, or {@code FAILED} once attempts are exhausted
   */
  CheckpointStatus markFailed(String documentId, String error);

  /** Records a failure that must not be retried. */
  void markPermanentlyFailed(String documentId, String error);

  /** Returns a claimed entry to {@code PENDING} without consuming an attempt. */
  void release(String documentId);

  /**
   * Returns every matching entry that is not {@code IN_PROGRESS} to a fresh {@code PENDING} state
   * with no attempts, so the next run ingests it again.
   *
   * @return number of entries reset
   */
  int reset(Predicate<String> documentIds);

  /** Persists a consistent copy of every entry. */
  void snapshot();

  /**
   * Replaces the in-memory state with the last snapshot, mapping {@code IN_PROGRESS} back to
   * {@code PENDING}.
   *
   * @return number of entries restored
   */
  int restore();

  Optional<CheckpointEntry> get(String documentId);

  Map<CheckpointStatus, Long> countByStatus();
}
