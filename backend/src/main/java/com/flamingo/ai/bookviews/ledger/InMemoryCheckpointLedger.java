package com.flamingo.ai.bookviews.ledger;

import com.flamingo.ai.bookviews.domain.CheckpointEntry;
import com.flamingo.ai.bookviews.domain.CheckpointStatus;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Ledger held in an insertion-ordered map guarded by this object's monitor, persisted through a
 * {@link CheckpointStore} on {@link #snapshot()}. Claims are served in registration order.
 */
@Slf4j
public class InMemoryCheckpointLedger implements CheckpointLedger {

  private final Map<String, CheckpointEntry> entries = new LinkedHashMap<>();
  private final Object snapshotLock = new Object();
  private final CheckpointStore store;
  private final int maxAttempts;

  public InMemoryCheckpointLedger(CheckpointStore store, int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.store = store;
    this.maxAttempts = maxAttempts;
  }

  @Override
  public synchronized int register(Collection<String> documentIds) {
    int added = 0;
    for (String id : documentIds) {
      if (!entries.containsKey(id)) {
        entries.put(id, CheckpointEntry.pending(id));
        added++;
      }
    }
    return added;
  }

  @Override
  public synchronized List<String> claimBatch(int n, Predicate<String> eligible) {
    List<String> claimed = new ArrayList<>(Math.max(n, 0));
    for (CheckpointEntry entry : entries.values()) {
      if (claimed.size() >= n) {
        break;
      }
      if (entry.status() == CheckpointStatus.PENDING && eligible.test(entry.documentId())) {
        claimed.add(entry.documentId());
      }
    }
    for (String id : claimed) {
      entries.put(id, entries.get(id).withStatus(CheckpointStatus.IN_PROGRESS));
    }
    return claimed;
  }

  @Override
  public synchronized void markDone(String documentId) {
    entries.put(documentId, require(documentId).withStatus(CheckpointStatus.DONE));
  }

  @Override
  public synchronized CheckpointStatus markFailed(String documentId, String error) {
    CheckpointEntry current = require(documentId);
    CheckpointStatus next =
        current.attemptCount() + 1 >= maxAttempts
            ? CheckpointStatus.FAILED
            : CheckpointStatus.PENDING;
    entries.put(documentId, current.withFailure(next, error));
    return next;
  }

  @Override
  public synchronized void markPermanentlyFailed(String documentId, String error) {
    entries.put(documentId, require(documentId).withFailure(CheckpointStatus.FAILED, error));
  }

  @Override
  public synchronized void release(String documentId) {
    CheckpointEntry current = require(documentId);
    if (current.status() == CheckpointStatus.IN_PROGRESS) {
      entries.put(documentId, current.withStatus(CheckpointStatus.PENDING));
    }
  }

  @Override
  public synchronized int reset(Predicate<String> documentIds) {
    int reset = 0;
    for (Map.Entry<String, CheckpointEntry> entry : entries.entrySet()) {
      CheckpointStatus status = entry.getValue().status();
      if (status != CheckpointStatus.IN_PROGRESS && documentIds.test(entry.getKey())) {
        entry.setValue(CheckpointEntry.pending(entry.getKey()));
        reset++;
      }
    }
    return reset;
  }

  /**
   * Saves all entries. The copy is taken under the monitor and written outside it, so workers are
   * not blocked on disk I/O; concurrent snapshots are serialized so the newest copy lands last.
   */
  @Override
  public void snapshot() {
    synchronized (snapshotLock) {
      List<CheckpointEntry> copy;
      synchronized (this) {
        copy = new ArrayList<>(entries.values());
      }
      try {
        store.save(copy);
        log.debug("Ledger snapshot saved with {} entries", copy.size());
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to save ledger snapshot", e);
      }
    }
  }

  @Override
  public synchronized int restore() {
    List<CheckpointEntry> loaded;
    try {
      loaded = store.load();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load ledger snapshot", e);
    }
    entries.clear();
    int reset = 0;
    for (CheckpointEntry entry : loaded) {
      if (entry.status() == CheckpointStatus.IN_PROGRESS) {
        entry = entry.withStatus(CheckpointStatus.PENDING);
        reset++;
      }
      entries.put(entry.documentId(), entry);
    }
    if (reset > 0) {
      log.info("Restored ledger: {} in-progress entries reset to pending", reset);
    }
    return entries.size();
  }

  @Override
  public synchronized Optional<CheckpointEntry> get(String documentId) {
    return Optional.ofNullable(entries.get(documentId));
  }

  @Override
  public synchronized Map<CheckpointStatus, Long> countByStatus() {
    Map<CheckpointStatus, Long> counts = new EnumMap<>(CheckpointStatus.class);
    for (CheckpointStatus status : CheckpointStatus.values()) {
      counts.put(status, 0L);
    }
    for (CheckpointEntry entry : entries.values()) {
      counts.merge(entry.status(), 1L, Long::sum);
    }
    return counts;
  }

  private CheckpointEntry require(String documentId) {
    CheckpointEntry entry = entries.get(documentId);
    if (entry == null) {
      throw new IllegalArgumentException("Unknown document in ledger: " + documentId);
    }
    return entry;
  }
}
