package com.flamingo.ai.bookviews.summary;

import com.flamingo.ai.bookviews.agent.ViewSummaryAgent;
import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.domain.SourceDocument;
import com.flamingo.ai.bookviews.domain.SummaryBundle;
import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.exception.ConfigurationException;
import com.flamingo.ai.bookviews.exception.PermanentContentException;
import com.flamingo.ai.bookviews.exception.TransientServiceException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RetriableException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Reduces a book of arbitrary length to one bounded summary per {@link SummaryView}.
 *
 * <p>Books that fit in one chunk are summarized directly. Longer books are chunked, every chunk is
 * condensed once per view in parallel (map), and the per-view digests are concatenated and
 * condensed again (reduce). A concatenation still above the reduce threshold is re-chunked and
 * mapped again, up to {@code max-depth} levels.
 *
 * <p>Map-phase calls run on the summary executor; each document holds at most {@code
 * chunk-concurrency} of them in flight so a long book cannot starve the other workers.
 */
@Service
@Slf4j
public class HierarchicalSummarizer {

  private static final String CONDENSE_SUFFIX =
      "\n\nThe previous attempt was too long. Rewrite it in at most %d characters.";

  private final ViewSummaryAgent summaryAgent;
  private final TextChunker chunker;
  private final Executor summaryExecutor;
  private final MeterRegistry meterRegistry;
  private final PipelineConfig.Chunking chunking;
  private final PipelineConfig.Summary settings;

  @Autowired
  public HierarchicalSummarizer(
      ViewSummaryAgent summaryAgent,
      TextChunker chunker,
      @Qualifier("summaryExecutor") Executor summaryExecutor,
      MeterRegistry meterRegistry,
      PipelineConfig config) {
    this(
        summaryAgent,
        chunker,
        summaryExecutor,
        meterRegistry,
        config.getChunking(),
        config.getSummary());
  }

  @VisibleForTesting
  HierarchicalSummarizer(
      ViewSummaryAgent summaryAgent,
      TextChunker chunker,
      Executor summaryExecutor,
      MeterRegistry meterRegistry,
      PipelineConfig.Chunking chunking,
      PipelineConfig.Summary settings) {
    this.summaryAgent = summaryAgent;
    this.chunker = chunker;
    this.summaryExecutor = summaryExecutor;
    this.meterRegistry = meterRegistry;
    this.chunking = chunking;
    this.settings = settings;
  }

  /**
   * Summarizes a document under every view.
   *
   * @return a complete bundle; never partial
   * @throws PermanentContentException when the source is too sparse, a summary comes back shorter
   *     than the minimum length, or the reduce phase does not converge
   */
  @Timed(value = "summarizer.summarize", description = "Time to summarize one book")
  public SummaryBundle summarize(SourceDocument document) {
    String content = document.content().strip();
    int effectiveLength = CharMatcher.whitespace().trimAndCollapseFrom(content, ' ').length();
    if (effectiveLength < settings.getMinLength()) {
      throw new PermanentContentException(
          document.id()
              + ": source has "
              + effectiveLength
              + " effective characters, below the minimum of "
              + settings.getMinLength());
    }

    List<String> chunks =
        chunker.split(content, chunking.getSize(), chunking.getOverlap(), chunking.getLookahead());
    Semaphore permits = new Semaphore(settings.getChunkConcurrency());
    Map<SummaryView, String> summaries = new EnumMap<>(SummaryView.class);

    if (chunks.size() == 1) {
      log.debug("Document {} fits in one chunk, summarizing directly", document.id());
      List<Supplier<String>> calls = new ArrayList<>();
      for (SummaryView view : SummaryView.values()) {
        calls.add(() -> callAgent(document, view.getReduceInstruction(), 1, 1, content));
      }
      List<String> results = runBounded(calls, permits);
      for (SummaryView view : SummaryView.values()) {
        summaries.put(view, finish(document, view, results.get(view.ordinal())));
      }
    } else {
      log.debug("Document {} split into {} chunks", document.id(), chunks.size());
      Map<SummaryView, List<String>> digests = mapAllViews(document, chunks, permits);
      for (SummaryView view : SummaryView.values()) {
        summaries.put(view, reduce(document, view, digests.get(view), permits, 1));
      }
    }

    meterRegistry.counter("summarizer.documents").increment();
    String excerpt = chunker.truncateAtSentence(content, settings.getExcerptLength());
    return new SummaryBundle(document.id(), summaries, excerpt, chunks.size());
  }

  /** One map task per chunk and view, all sharing the document's permits. */
  private Map<SummaryView, List<String>> mapAllViews(
      SourceDocument document, List<String> chunks, Semaphore permits) {
    List<Supplier<String>> calls = new ArrayList<>();
    for (SummaryView view : SummaryView.values()) {
      for (int i = 0; i < chunks.size(); i++) {
        int part = i + 1;
        String chunk = chunks.get(i);
        calls.add(
            () -> callAgent(document, view.getMapInstruction(), part, chunks.size(), chunk));
      }
    }
    List<String> results = runBounded(calls, permits);

    Map<SummaryView, List<String>> digests = new EnumMap<>(SummaryView.class);
    int index = 0;
    for (SummaryView view : SummaryView.values()) {
      List<String> viewDigests = new ArrayList<>(chunks.size());
      for (int i = 0; i < chunks.size(); i++) {
        String digest = results.get(index++);
        if (digest != null && !digest.isBlank()) {
          viewDigests.add(digest.strip());
        }
      }
      digests.put(view, viewDigests);
    }
    return digests;
  }

  private String reduce(
      SourceDocument document,
      SummaryView view,
      List<String> digests,
      Semaphore permits,
      int depth) {
    String joined = String.join("\n\n", digests);
    if (joined.isBlank()) {
      throw new PermanentContentException(
          document.id() + ": map phase produced no usable " + view.getValue() + " digests");
    }
    if (joined.length() <= settings.getReduceThreshold()) {
      return finish(
          document, view, callAgent(document, view.getReduceInstruction(), 1, 1, joined));
    }
    if (depth >= settings.getMaxDepth()) {
      throw new PermanentContentException(
          document.id()
              + ": reduce of "
              + view.getValue()
              + " did not converge within "
              + settings.getMaxDepth()
              + " levels ("
              + joined.length()
              + " chars left)");
    }

    List<String> parts =
        chunker.split(
            joined,
            chunking.getReduceSize(),
            chunking.getReduceOverlap(),
            chunking.getLookahead());
    log.debug(
        "Reducing {} view of {} at depth {}: {} chars in {} parts",
        view.getValue(),
        document.id(),
        depth,
        joined.length(),
        parts.size());
    List<Supplier<String>> calls = new ArrayList<>();
    for (int i = 0; i < parts.size(); i++) {
      int part = i + 1;
      String text = parts.get(i);
      calls.add(() -> callAgent(document, view.getMapInstruction(), part, parts.size(), text));
    }
    List<String> next = new ArrayList<>();
    for (String digest : runBounded(calls, permits)) {
      if (digest != null && !digest.isBlank()) {
        next.add(digest.strip());
      }
    }
    return reduce(document, view, next, permits, depth + 1);
  }

  /** Enforces the {@code [minLength, maxLength]} bound on a finished summary. */
  private String finish(SourceDocument document, SummaryView view, String raw) {
    String summary = raw == null ? "" : raw.strip();
    int maxLength = settings.getMaxLength();
    if (summary.length() > maxLength) {
      String instruction = view.getReduceInstruction() + CONDENSE_SUFFIX.formatted(maxLength);
      String condensed = callAgent(document, instruction, 1, 1, summary);
      summary = condensed == null ? "" : condensed.strip();
      if (summary.length() > maxLength) {
        summary = chunker.truncateAtSentence(summary, maxLength);
      }
    }
    if (summary.length() < settings.getMinLength()) {
      throw new PermanentContentException(
          document.id()
              + ": degenerate "
              + view.getValue()
              + " summary: "
              + summary.length()
              + " chars, minimum is "
              + settings.getMinLength());
    }
    return summary;
  }

  private String callAgent(
      SourceDocument document, String instruction, int part, int parts, String text) {
    try {
      return summaryAgent.summarize(
          instruction, document.title(), document.author(), part, parts, text);
    } catch (AuthenticationException e) {
      throw new ConfigurationException("Summary model rejected the credentials", e);
    } catch (RetriableException e) {
      throw new TransientServiceException("Summary call failed: " + e.getMessage(), e);
    }
  }

  /**
   * Runs the calls on the summary executor with at most {@code permits} in flight, preserving
   * order. The first failure stops further submissions and is rethrown unwrapped.
   */
  private List<String> runBounded(List<Supplier<String>> calls, Semaphore permits) {
    List<CompletableFuture<String>> futures = new ArrayList<>(calls.size());
    try {
      for (Supplier<String> call : calls) {
        if (futures.stream().anyMatch(CompletableFuture::isCompletedExceptionally)) {
          break;
        }
        permits.acquire();
        futures.add(
            CompletableFuture.supplyAsync(
                () -> {
                  try {
                    return call.get();
                  } finally {
                    permits.release();
                  }
                },
                summaryExecutor));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(future -> future.cancel(true));
      throw new IllegalStateException("Interrupted while summarizing", e);
    } catch (CompletionException e) {
      futures.forEach(future -> future.cancel(true));
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException("Summary task failed", cause);
    }

    List<String> results = new ArrayList<>(futures.size());
    for (CompletableFuture<String> future : futures) {
      results.add(future.join());
    }
    return results;
  }
}
