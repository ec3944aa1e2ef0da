package com.flamingo.ai.bookviews.query;

import com.flamingo.ai.bookviews.domain.SummaryView;
import com.flamingo.ai.bookviews.exception.SearchException;
import com.flamingo.ai.bookviews.indexing.VectorHit;
import com.flamingo.ai.bookviews.indexing.VectorIndex;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Searches every view in parallel with the same query vector and max-pools the results.
 *
 * <p>All view searches share one deadline. A view whose search fails or misses the deadline is
 * cancelled and dropped from the merge, and the response is flagged as degraded. Only when every
 * view is dropped does the query fail.
 */
@Slf4j
class MultiViewStrategyHandler implements StrategyHandler {

  private final List<SummaryView> views;
  private final VectorIndex vectorIndex;
  private final ExecutorService executor;
  private final Duration timeout;
  private final MeterRegistry meterRegistry;

  MultiViewStrategyHandler(
      List<SummaryView> views,
      VectorIndex vectorIndex,
      ExecutorService executor,
      Duration timeout,
      MeterRegistry meterRegistry) {
    this.views = List.copyOf(views);
    this.vectorIndex = vectorIndex;
    this.executor = executor;
    this.timeout = timeout;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public RankedResults search(QueryRequest request, float[] queryVector) {
    Map<SummaryView, Future<List<VectorHit>>> pending = new EnumMap<>(SummaryView.class);
    try {
      for (SummaryView view : views) {
        pending.put(
            view,
            executor.submit(
                () -> vectorIndex.knnSearch(view, queryVector, request.size(), request.corpus())));
      }
    } catch (RejectedExecutionException e) {
      pending.values().forEach(f -> f.cancel(true));
      meterRegistry.counter("query.rejected").increment();
      log.warn("Query executor saturated, {} view searches cancelled", pending.size());
      throw new SearchException("Search capacity exhausted, try again later", e);
    }

    long deadline = System.nanoTime() + timeout.toNanos();
    Map<SummaryView, List<VectorHit>> hitsByView = new EnumMap<>(SummaryView.class);
    List<SummaryView> dropped = new ArrayList<>();
    for (Map.Entry<SummaryView, Future<List<VectorHit>>> entry : pending.entrySet()) {
      SummaryView view = entry.getKey();
      Future<List<VectorHit>> future = entry.getValue();
      try {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        hitsByView.put(view, future.get(remaining, TimeUnit.NANOSECONDS));
      } catch (TimeoutException e) {
        future.cancel(true);
        dropped.add(view);
        log.warn("Search on {} view timed out after {}", view.getValue(), timeout);
      } catch (ExecutionException e) {
        dropped.add(view);
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("Search on {} view failed: {}", view.getValue(), cause.getMessage());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        pending.values().forEach(f -> f.cancel(true));
        throw new SearchException("Interrupted while searching views", e);
      }
    }

    if (!dropped.isEmpty()) {
      meterRegistry.counter("query.view.degraded").increment(dropped.size());
    }
    if (hitsByView.isEmpty()) {
      throw new SearchException("All " + views.size() + " view searches failed");
    }
    return new RankedResults(
        request.query(),
        request.strategy(),
        ResultMerger.merge(hitsByView, request.query(), request.size()),
        !dropped.isEmpty(),
        dropped);
  }
}
