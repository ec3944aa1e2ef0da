package com.flamingo.ai.bookviews.ingestion;

import com.flamingo.ai.bookviews.exception.IngestionAlreadyRunningException;
import com.flamingo.ai.bookviews.indexing.VectorIndex;
import com.flamingo.ai.bookviews.ledger.CheckpointLedger;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs at most one ingestion at a time in the background and tracks the latest run. Purges go
 * through here too, so they never race a run over the same ledger.
 */
@Service
@Slf4j
public class IngestionRunService {

  private final IngestionOrchestrator orchestrator;
  private final TaskExecutor runExecutor;
  private final VectorIndex vectorIndex;
  private final CheckpointLedger ledger;

  private final Object runLock = new Object();
  private IngestionRun current;

  public IngestionRunService(
      IngestionOrchestrator orchestrator,
      @Qualifier("pipelineScheduler") TaskExecutor runExecutor,
      VectorIndex vectorIndex,
      CheckpointLedger ledger) {
    this.orchestrator = orchestrator;
    this.runExecutor = runExecutor;
    this.vectorIndex = vectorIndex;
    this.ledger = ledger;
  }

  /**
   * Starts a run over {@code corpusPrefix}.
   *
   * @throws IngestionAlreadyRunningException when a run is still active
   */
  public IngestionRun start(String corpusPrefix) {
    IngestionRun run;
    synchronized (runLock) {
      if (current != null && current.isActive()) {
        throw new IngestionAlreadyRunningException(current.getCorpusPrefix());
      }
      run = new IngestionRun(corpusPrefix);
      current = run;
    }
    log.info("Starting ingestion run {} for {}", run.getId(), corpusPrefix);
    runExecutor.execute(() -> execute(run));
    return run;
  }

  public Optional<IngestionRun> current() {
    synchronized (runLock) {
      return Optional.ofNullable(current);
    }
  }

  /** Requests cooperative cancellation of the active run, if any. */
  public Optional<IngestionRun> cancelCurrent() {
    synchronized (runLock) {
      if (current == null || !current.isActive()) {
        return Optional.empty();
      }
      current.getContext().cancel("cancelled by request");
      log.info("Cancellation requested for ingestion run {}", current.getId());
      return Optional.of(current);
    }
  }

  /**
   * Deletes the index records of {@code corpus} (every record when null) and returns the matching
   * ledger entries to pending, so the next run ingests those books again.
   *
   * @throws IngestionAlreadyRunningException when a run is active
   */
  public CorpusPurge purge(String corpus) {
    synchronized (runLock) {
      if (current != null && current.isActive()) {
        throw new IngestionAlreadyRunningException(current.getCorpusPrefix());
      }
      long deleted = vectorIndex.purge(corpus);
      Predicate<String> owned =
          corpus == null ? id -> true : id -> IngestionOrchestrator.belongsToCorpus(id, corpus);
      int reset = ledger.reset(owned);
      ledger.snapshot();
      log.info(
          "Purged corpus {}: {} index records deleted, {} ledger entries reset",
          corpus == null ? "*" : corpus,
          deleted,
          reset);
      return new CorpusPurge(corpus, deleted, reset);
    }
  }

  private void execute(IngestionRun run) {
    try {
      run.complete(orchestrator.run(run.getContext(), run.getCorpusPrefix()));
    } catch (RuntimeException e) {
      log.error("Ingestion run {} failed: {}", run.getId(), e.getMessage(), e);
      run.fail(e);
    }
  }
}
