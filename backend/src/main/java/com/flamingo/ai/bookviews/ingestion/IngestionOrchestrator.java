package com.flamingo.ai.bookviews.ingestion;

import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.domain.CheckpointEntry;
import com.flamingo.ai.bookviews.domain.CheckpointStatus;
import com.flamingo.ai.bookviews.domain.EmbeddingSet;
import com.flamingo.ai.bookviews.domain.IndexRecord;
import com.flamingo.ai.bookviews.domain.SourceDocument;
import com.flamingo.ai.bookviews.domain.SummaryBundle;
import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.embedding.EmbeddingAdapter;
import com.flamingo.ai.bookviews.exception.ConfigurationException;
import com.flamingo.ai.bookviews.exception.ErrorCategory;
import com.flamingo.ai.bookviews.exception.PermanentContentException;
import com.flamingo.ai.bookviews.exception.PipelineException;
import com.flamingo.ai.bookviews.exception.QuarantineException;
import com.flamingo.ai.bookviews.exception.TransientServiceException;
import com.flamingo.ai.bookviews.indexing.BulkIndexer;
import com.flamingo.ai.bookviews.indexing.ReconciliationReport;
import com.flamingo.ai.bookviews.ledger.CheckpointLedger;
import com.flamingo.ai.bookviews.storage.BlobStore;
import com.flamingo.ai.bookviews.summary.HierarchicalSummarizer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives a corpus of raw books through summarization, embedding and indexing with a fixed pool of
 * workers.
 *
 * <p>Each worker repeatedly claims a batch from the checkpoint ledger, prepares an index record
 * per document, hands the records to the bulk indexer, waits for them to be stored and records the
 * outcome in the ledger, which is snapshotted after every batch. A failing document never affects
 * the others. Only a {@link ConfigurationException} stops the run: it cancels the context so no
 * new work is claimed, and is rethrown from {@link #run} once in-flight documents have settled.
 */
@Service
@Slf4j
public class IngestionOrchestrator {

  static final String DEFAULT_CORPUS = "default";

  private final BlobStore blobStore;
  private final SourceDocumentLoader documentLoader;
  private final HierarchicalSummarizer summarizer;
  private final EmbeddingAdapter embeddingAdapter;
  private final SummaryArtifactWriter artifactWriter;
  private final BulkIndexer bulkIndexer;
  private final CheckpointLedger ledger;
  private final Executor ingestionExecutor;
  private final MeterRegistry meterRegistry;
  private final PipelineConfig.Ingestion settings;
  private final boolean persistArtifacts;

  public IngestionOrchestrator(
      BlobStore blobStore,
      SourceDocumentLoader documentLoader,
      HierarchicalSummarizer summarizer,
      EmbeddingAdapter embeddingAdapter,
      SummaryArtifactWriter artifactWriter,
      BulkIndexer bulkIndexer,
      CheckpointLedger ledger,
      @Qualifier("ingestionExecutor") Executor ingestionExecutor,
      MeterRegistry meterRegistry,
      PipelineConfig config) {
    this.blobStore = blobStore;
    this.documentLoader = documentLoader;
    this.summarizer = summarizer;
    this.embeddingAdapter = embeddingAdapter;
    this.artifactWriter = artifactWriter;
    this.bulkIndexer = bulkIndexer;
    this.ledger = ledger;
    this.ingestionExecutor = ingestionExecutor;
    this.meterRegistry = meterRegistry;
    this.settings = config.getIngestion();
    this.persistArtifacts = config.getSummary().isPersistArtifacts();
  }

  /**
   * Ingests every document under {@code corpusPrefix} that the ledger does not already consider
   * finished.
   *
   * @return counts for this run
   * @throws ConfigurationException when a systemic misconfiguration aborted the run
   */
  @Timed(value = "ingestion.run", description = "Time for one ingestion run")
  public IngestionStats run(IngestionContext context, String corpusPrefix) {
    String corpus = corpusName(corpusPrefix);
    Map<String, String> keysById = discover(corpusPrefix);
    int added = ledger.register(keysById.keySet());

    IngestionStatsCollector stats = new IngestionStatsCollector();
    int alreadyFinished = 0;
    for (String id : keysById.keySet()) {
      if (ledger.get(id).map(entry -> entry.status().isTerminal()).orElse(false)) {
        alreadyFinished++;
      }
    }
    stats.skipped(alreadyFinished);
    log.info(
        "Starting ingestion of corpus {}: {} documents ({} new, {} already finished), {} workers",
        corpus,
        keysById.size(),
        added,
        alreadyFinished,
        settings.getWorkers());

    AtomicReference<ConfigurationException> fatal = new AtomicReference<>();
    List<CompletableFuture<Void>> workers = new ArrayList<>();
    for (int i = 0; i < settings.getWorkers(); i++) {
      int workerId = i + 1;
      workers.add(
          CompletableFuture.runAsync(
              () -> workerLoop(workerId, context, corpus, keysById, stats, fatal),
              ingestionExecutor));
    }
    try {
      CompletableFuture.allOf(workers.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException e) {
      ledger.snapshot();
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.error("Ingestion worker crashed: {}", cause.getMessage(), cause);
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException("Ingestion worker crashed", cause);
    }
    ledger.snapshot();

    if (fatal.get() != null) {
      log.error("Ingestion of corpus {} aborted: {}", corpus, fatal.get().getMessage());
      throw fatal.get();
    }

    if (context.isCancelled()) {
      log.info("Ingestion of corpus {} cancelled: {}", corpus, context.getReason());
    }
    ReconciliationReport reconciliation = null;
    if (settings.isReconcile() && !context.isCancelled()) {
      reconciliation = reconcile(corpus, keysById);
    }
    IngestionStats result = stats.toStats(context.isCancelled(), reconciliation);
    log.info(
        "Ingestion of corpus {} finished: processed={}, failed={}, skipped={}, retried={}, "
            + "errors={}, cancelled={}",
        corpus,
        result.processed(),
        result.failed(),
        result.skipped(),
        result.retried(),
        result.errorsByCategory(),
        result.cancelled());
    return result;
  }

  private Map<String, String> discover(String corpusPrefix) {
    List<String> keys;
    try {
      keys = blobStore.list(directoryPrefix(corpusPrefix));
    } catch (IOException e) {
      throw new TransientServiceException("Cannot list corpus " + corpusPrefix, e);
    }
    Map<String, String> keysById = new LinkedHashMap<>();
    for (String key : keys) {
      if (!key.endsWith(settings.getDocumentSuffix())) {
        continue;
      }
      String id = SourceDocumentLoader.idForKey(key);
      String previous = keysById.putIfAbsent(id, key);
      if (previous != null) {
        log.warn("Keys {} and {} map to the same document id {}, keeping the first", previous, key, id);
      }
    }
    return keysById;
  }

  private void workerLoop(
      int workerId,
      IngestionContext context,
      String corpus,
      Map<String, String> keysById,
      IngestionStatsCollector stats,
      AtomicReference<ConfigurationException> fatal) {
    try {
      while (!context.isCancelled()) {
        List<String> batch = ledger.claimBatch(settings.getClaimBatchSize(), keysById::containsKey);
        if (batch.isEmpty()) {
          break;
        }
        log.debug("Worker {} claimed {}", workerId, batch);
        processBatch(context, corpus, keysById, batch, stats, fatal);
        ledger.snapshot();
      }
      log.debug("Worker {} finished", workerId);
    } catch (RuntimeException e) {
      context.cancel("worker " + workerId + " crashed");
      throw e;
    }
  }

  private void processBatch(
      IngestionContext context,
      String corpus,
      Map<String, String> keysById,
      List<String> batch,
      IngestionStatsCollector stats,
      AtomicReference<ConfigurationException> fatal) {
    Map<String, CompletableFuture<Void>> submitted = new LinkedHashMap<>();
    for (String id : batch) {
      if (context.isCancelled()) {
        ledger.release(id);
        continue;
      }
      try {
        IndexRecord record = prepare(id, keysById.get(id), corpus);
        submitted.put(id, bulkIndexer.submit(record));
      } catch (ConfigurationException e) {
        stats.error(ErrorCategory.CONFIGURATION);
        fatal.compareAndSet(null, e);
        context.cancel("configuration error: " + e.getMessage());
        ledger.release(id);
      } catch (RuntimeException e) {
        recordFailure(id, e, stats);
      }
    }

    bulkIndexer.flush();
    submitted.forEach(
        (id, future) -> {
          try {
            future.join();
            ledger.markDone(id);
            stats.processed();
            meterRegistry.counter("ingestion.documents", "outcome", "processed").increment();
          } catch (CompletionException e) {
            recordFailure(id, e.getCause() != null ? e.getCause() : e, stats);
          }
        });
  }

  private IndexRecord prepare(String id, String key, String corpus) {
    SourceDocument document = load(key);
    SummaryBundle bundle = summarizer.summarize(document);
    Instant generatedAt = Instant.now();

    if (persistArtifacts) {
      try {
        artifactWriter.write(document, bundle, generatedAt);
      } catch (IOException e) {
        log.warn("Could not persist summary artifact for {}: {}", id, e.getMessage());
      }
    }

    Map<SummaryView, float[]> vectors = new EnumMap<>(SummaryView.class);
    for (SummaryView view : SummaryView.values()) {
      vectors.put(view, embeddingAdapter.embed(bundle.summary(view)));
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("sourceKey", document.sourceKey());
    metadata.put("contentChecksum", document.contentChecksum());
    metadata.put("totalChunks", bundle.totalChunks());
    metadata.put("summaryModelId", artifactWriter.getSummaryModelId());
    metadata.put("embeddingModelId", artifactWriter.getEmbeddingModelId());
    metadata.put("generatedAt", generatedAt.toString());
    metadata.put("description", bundle.excerpt());
    return IndexRecord.assemble(document, corpus, bundle, new EmbeddingSet(vectors), metadata);
  }

  private SourceDocument load(String key) {
    try {
      return documentLoader.load(key);
    } catch (NoSuchFileException e) {
      throw new PermanentContentException("Source " + key + " no longer exists", e);
    } catch (IOException e) {
      throw new TransientServiceException("Cannot read " + key + ": " + e.getMessage(), e);
    }
  }

  /**
   * Routes a per-document failure. Content errors fail the document at once; everything else
   * consumes an attempt and the document is quarantined when none are left.
   */
  private void recordFailure(String id, Throwable error, IngestionStatsCollector stats) {
    ErrorCategory category = PipelineException.categorize(error);
    stats.error(category);
    String message = category + ": " + error.getMessage();

    if (category == ErrorCategory.PERMANENT_CONTENT) {
      ledger.markPermanentlyFailed(id, message);
      stats.failed();
      meterRegistry.counter("ingestion.documents", "outcome", "failed").increment();
      log.warn("Document {} failed permanently: {}", id, error.getMessage());
      return;
    }

    CheckpointStatus next = ledger.markFailed(id, message);
    if (next == CheckpointStatus.FAILED) {
      int attempts = ledger.get(id).map(CheckpointEntry::attemptCount).orElse(0);
      QuarantineException quarantine = new QuarantineException(id, attempts, error);
      stats.error(quarantine.getCategory());
      stats.failed();
      meterRegistry.counter("ingestion.documents", "outcome", "quarantined").increment();
      log.warn("{}; last error: {}", quarantine.getMessage(), message);
    } else {
      stats.retried();
      meterRegistry.counter("ingestion.documents", "outcome", "retried").increment();
      log.warn("Document {} failed ({}), will retry", id, message);
    }
  }

  private ReconciliationReport reconcile(String corpus, Map<String, String> keysById) {
    long done =
        keysById.keySet().stream()
            .filter(
                id ->
                    ledger.get(id).map(entry -> entry.status() == CheckpointStatus.DONE).orElse(false))
            .count();
    try {
      return bulkIndexer.reconcile(corpus, done);
    } catch (RuntimeException e) {
      log.warn("Reconciliation for corpus {} skipped: {}", corpus, e.getMessage());
      return null;
    }
  }

  /**
   * Whether {@code documentId} was discovered under the corpus named {@code corpus}. The default
   * corpus spans the whole store.
   */
  public static boolean belongsToCorpus(String documentId, String corpus) {
    return DEFAULT_CORPUS.equals(corpus)
        || documentId.startsWith(SourceDocumentLoader.idPrefixForCorpus(corpus));
  }

  static String corpusName(String corpusPrefix) {
    String trimmed = stripSlashes(corpusPrefix);
    return trimmed.isEmpty() ? DEFAULT_CORPUS : trimmed;
  }

  /** Listing prefix ending in {@code /}, so {@code books} never matches {@code books-extra/}. */
  static String directoryPrefix(String corpusPrefix) {
    String trimmed = stripSlashes(corpusPrefix);
    return trimmed.isEmpty() ? "" : trimmed + "/";
  }

  private static String stripSlashes(String corpusPrefix) {
    String trimmed = corpusPrefix.strip();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }
}
