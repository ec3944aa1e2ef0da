package com.flamingo.ai.bookviews.indexing;

import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.domain.IndexRecord;
import com.flamingo.ai.bookviews.exception.IndexWriteException;
import com.flamingo.ai.bookviews.retry.RetryPolicy;
import com.flamingo.ai.bookviews.retry.Sleeper;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Buffers index records and writes them to the vector index in bulk.
 *
 * <p>A batch is written when the buffer reaches {@code batch-size} or when the flush interval
 * elapses, whichever comes first. The buffer is guarded by a single lock that is only held to swap
 * it out; the bulk request runs outside the lock. When the index rejects individual items, only
 * those items are resubmitted, up to the retry policy's attempts. Each submitted record gets a
 * future that completes once the record is stored, or exceptionally with {@link
 * IndexWriteException} once its attempts are used up.
 */
@Service
@Slf4j
public class BulkIndexer implements DisposableBean {

  private final VectorIndex vectorIndex;
  private final MeterRegistry meterRegistry;
  private final int batchSize;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final ScheduledFuture<?> flushTimer;

  private final Object bufferLock = new Object();
  private List<PendingWrite> buffer = new ArrayList<>();

  private record PendingWrite(IndexRecord record, CompletableFuture<Void> result) {}

  @Autowired
  public BulkIndexer(
      VectorIndex vectorIndex,
      MeterRegistry meterRegistry,
      PipelineConfig config,
      @Qualifier("pipelineScheduler") TaskScheduler scheduler) {
    this(
        vectorIndex,
        meterRegistry,
        config.getIndexing().getBatchSize(),
        config.getIndexing().getRetry().toPolicy(),
        Sleeper.THREAD,
        scheduler,
        config.getIndexing().getFlushInterval());
  }

  /**
   * @param scheduler drives the time-based flush; {@code null} disables it
   */
  @VisibleForTesting
  BulkIndexer(
      VectorIndex vectorIndex,
      MeterRegistry meterRegistry,
      int batchSize,
      RetryPolicy retryPolicy,
      Sleeper sleeper,
      TaskScheduler scheduler,
      Duration flushInterval) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1");
    }
    this.vectorIndex = vectorIndex;
    this.meterRegistry = meterRegistry;
    this.batchSize = batchSize;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
    this.flushTimer =
        scheduler == null ? null : scheduler.scheduleAtFixedRate(this::flush, flushInterval);
  }

  /**
   * Queues a record. When this fills the buffer, the batch is written on the calling thread.
   *
   * @return future completing when the record is stored
   */
  public CompletableFuture<Void> submit(IndexRecord record) {
    CompletableFuture<Void> result = new CompletableFuture<>();
    List<PendingWrite> full = null;
    synchronized (bufferLock) {
      buffer.add(new PendingWrite(record, result));
      if (buffer.size() >= batchSize) {
        full = buffer;
        buffer = new ArrayList<>();
      }
    }
    if (full != null) {
      write(full);
    }
    return result;
  }

  /** Writes whatever is buffered. */
  public void flush() {
    List<PendingWrite> drained;
    synchronized (bufferLock) {
      if (buffer.isEmpty()) {
        return;
      }
      drained = buffer;
      buffer = new ArrayList<>();
    }
    write(drained);
  }

  public int buffered() {
    synchronized (bufferLock) {
      return buffer.size();
    }
  }

  /**
   * Compares the ledger's done count with what the index holds for {@code corpus}. A mismatch is
   * logged, not raised: the index may hold records from earlier runs. The index is refreshed first
   * so the count includes the writes just acknowledged.
   */
  public ReconciliationReport reconcile(String corpus, long ledgerDone) {
    vectorIndex.refresh();
    long indexed = vectorIndex.count(corpus);
    ReconciliationReport report = new ReconciliationReport(corpus, ledgerDone, indexed);
    if (report.isConsistent()) {
      log.info("Reconciliation for corpus {}: {} records, consistent", corpus, indexed);
    } else {
      log.warn(
          "Reconciliation for corpus {}: ledger has {} done, index holds {}",
          corpus,
          ledgerDone,
          indexed);
    }
    return report;
  }

  private void write(List<PendingWrite> batch) {
    List<PendingWrite> remaining = batch;
    String requestError = null;

    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      List<IndexRecord> records = new ArrayList<>(remaining.size());
      remaining.forEach(pending -> records.add(pending.record()));

      List<PendingWrite> failed = new ArrayList<>();
      try {
        BulkUpsertResult result = vectorIndex.bulkUpsert(records);
        Map<Integer, String> lastFailures = result.failures();
        requestError = null;
        for (int i = 0; i < remaining.size(); i++) {
          PendingWrite pending = remaining.get(i);
          if (lastFailures.containsKey(i)) {
            log.debug("Item {} rejected: {}", pending.record().id(), lastFailures.get(i));
            failed.add(pending);
          } else {
            pending.result().complete(null);
          }
        }
      } catch (IOException | RuntimeException e) {
        log.warn("Bulk request of {} items failed: {}", remaining.size(), e.getMessage());
        requestError = e.getMessage();
        failed = remaining;
      }

      if (failed.isEmpty()) {
        return;
      }
      remaining = failed;

      if (attempt < retryPolicy.maxAttempts()) {
        Duration delay = retryPolicy.delayAfter(attempt);
        log.warn(
            "Retrying {} failed items in {} (attempt {} of {})",
            remaining.size(),
            delay,
            attempt + 1,
            retryPolicy.maxAttempts());
        meterRegistry.counter("indexing.bulk.items", "outcome", "retried").increment(remaining.size());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          failAll(remaining, "interrupted before retry");
          return;
        }
      }
    }
    failAll(remaining, requestError != null ? requestError : "rejected by the index");
  }

  private void failAll(List<PendingWrite> pending, String reason) {
    meterRegistry.counter("indexing.bulk.items", "outcome", "failed").increment(pending.size());
    for (PendingWrite write : pending) {
      log.warn("Giving up on index record {}: {}", write.record().id(), reason);
      write
          .result()
          .completeExceptionally(
              new IndexWriteException(
                  write.record().id(),
                  "Record "
                      + write.record().id()
                      + " not indexed after "
                      + retryPolicy.maxAttempts()
                      + " attempts: "
                      + reason));
    }
  }

  @Override
  public void destroy() {
    if (flushTimer != null) {
      flushTimer.cancel(false);
    }
    flush();
  }
}
