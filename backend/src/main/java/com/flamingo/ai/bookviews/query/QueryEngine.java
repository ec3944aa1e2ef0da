package com.flamingo.ai.bookviews.query;

import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.domain.SearchStrategy;
import com.flamingo.ai.bookviews.embedding.EmbeddingAdapter;
import com.flamingo.ai.bookviews.exception.SearchException;
import com.flamingo.ai.bookviews.indexing.VectorIndex;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Answers recommendation queries. The query text is embedded once and handed to the handler
 * registered for the requested strategy. Read-only against the index; requests share no state.
 */
@Service
@Slf4j
public class QueryEngine {

  private final EmbeddingAdapter embeddingAdapter;
  private final MeterRegistry meterRegistry;
  private final int maxSize;
  private final Map<SearchStrategy, StrategyHandler> handlers;

  @Autowired
  public QueryEngine(
      EmbeddingAdapter embeddingAdapter,
      VectorIndex vectorIndex,
      MeterRegistry meterRegistry,
      PipelineConfig config,
      @Qualifier("queryExecutor") ThreadPoolTaskExecutor queryExecutor) {
    this(
        embeddingAdapter,
        vectorIndex,
        meterRegistry,
        queryExecutor.getThreadPoolExecutor(),
        config.getQuery().getTimeout(),
        config.getQuery().getMaxSize());
  }

  @VisibleForTesting
  QueryEngine(
      EmbeddingAdapter embeddingAdapter,
      VectorIndex vectorIndex,
      MeterRegistry meterRegistry,
      ExecutorService executor,
      Duration timeout,
      int maxSize) {
    this.embeddingAdapter = embeddingAdapter;
    this.meterRegistry = meterRegistry;
    this.maxSize = maxSize;
    this.handlers = new EnumMap<>(SearchStrategy.class);
    for (SearchStrategy strategy : SearchStrategy.values()) {
      StrategyHandler handler =
          strategy.isMultiView()
              ? new MultiViewStrategyHandler(
                  strategy.getViews(), vectorIndex, executor, timeout, meterRegistry)
              : new SingleViewStrategyHandler(strategy.getViews().get(0), vectorIndex);
      handlers.put(strategy, handler);
    }
  }

  /**
   * Runs a recommendation query.
   *
   * @throws IllegalArgumentException when the query is blank or the size is out of range
   * @throws SearchException when the query cannot be embedded or no view could be searched
   */
  @Timed(value = "query.recommend", description = "Time to answer a recommendation query")
  public RankedResults query(QueryRequest request) {
    validate(request);
    meterRegistry
        .counter("query.requests", "strategy", request.strategy().getValue())
        .increment();

    float[] queryVector;
    try {
      queryVector = embeddingAdapter.embedQuery(request.query().strip());
    } catch (IllegalArgumentException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SearchException("Could not embed query: " + e.getMessage(), e);
    }

    RankedResults results = handlers.get(request.strategy()).search(request, queryVector);
    log.info(
        "Query strategy={} size={} returned {} results{}",
        request.strategy().getValue(),
        request.size(),
        results.results().size(),
        results.degraded() ? " (degraded, dropped " + results.droppedViews() + ")" : "");
    return results;
  }

  private void validate(QueryRequest request) {
    if (request.query() == null || request.query().isBlank()) {
      throw new IllegalArgumentException("Query must not be empty");
    }
    if (request.strategy() == null) {
      throw new IllegalArgumentException("Search strategy is required");
    }
    if (request.size() <= 0 || request.size() > maxSize) {
      throw new IllegalArgumentException("Size must be between 1 and " + maxSize);
    }
  }
}
