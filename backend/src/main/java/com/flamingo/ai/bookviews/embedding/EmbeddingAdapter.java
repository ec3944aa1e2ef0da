package com.flamingo.ai.bookviews.embedding;

import com.flamingo.ai.bookviews.config.PipelineConfig;
import com.flamingo.ai.bookviews.exception.ConfigurationException;
import com.flamingo.ai.bookviews.exception.PermanentContentException;
import com.flamingo.ai.bookviews.exception.TransientServiceException;
import com.flamingo.ai.bookviews.retry.RetryPolicy;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Uniform {@code embed(text) -> vector} contract over the remote embedding endpoint.
 *
 * <p>Transient failures (rate limiting, server errors, timeouts) are retried with exponential
 * backoff and jitter. Once the attempts are used up a {@link TransientServiceException} is thrown;
 * a vector is never fabricated. Input is never truncated here: callers keep text within {@code
 * pipeline.embedding.max-input-chars}.
 */
@Service
@Slf4j
public class EmbeddingAdapter {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;
  private final int dimensions;
  private final int maxInputChars;
  private final RetryPolicy retryPolicy;
  private final Retry retry;

  @Autowired
  public EmbeddingAdapter(
      EmbeddingModel embeddingModel, MeterRegistry meterRegistry, PipelineConfig config) {
    this(
        embeddingModel,
        meterRegistry,
        config.getEmbedding().getDimensions(),
        config.getEmbedding().getMaxInputChars(),
        config.getEmbedding().getRetry().toPolicy());
  }

  @VisibleForTesting
  EmbeddingAdapter(
      EmbeddingModel embeddingModel,
      MeterRegistry meterRegistry,
      int dimensions,
      int maxInputChars,
      RetryPolicy retryPolicy) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
    this.dimensions = dimensions;
    this.maxInputChars = maxInputChars;
    this.retryPolicy = retryPolicy;
    this.retry = Retry.of("embedding", retryPolicy.toRetryConfig(TransientServiceException.class));
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Embedding attempt {} failed, retrying in {}: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(),
                    event.getLastThrowable() == null
                        ? "unknown"
                        : event.getLastThrowable().getMessage()));
  }

  /**
   * Embeds a summary passage.
   *
   * @param text non-blank text no longer than the configured maximum
   * @return vector of the configured dimension
   * @throws TransientServiceException when the endpoint keeps failing for a recoverable reason
   * @throws ConfigurationException on an authentication failure or a dimension mismatch
   * @throws PermanentContentException when the endpoint rejects the input itself
   */
  @Timed(value = "embedding.embed", description = "Time to embed a summary view")
  public float[] embed(String text) {
    validate(text);
    return embedWithRetry(text, "passage");
  }

  /** Embeds user query text. Same contract as {@link #embed(String)}. */
  @Timed(value = "embedding.embedQuery", description = "Time to embed a query")
  public float[] embedQuery(String query) {
    validate(query);
    return embedWithRetry(query, "query");
  }

  private void validate(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Text to embed must not be blank");
    }
    if (text.length() > maxInputChars) {
      throw new IllegalArgumentException(
          "Text to embed is "
              + text.length()
              + " chars, above the limit of "
              + maxInputChars
              + "; truncate upstream");
    }
  }

  private float[] embedWithRetry(String text, String type) {
    try {
      float[] vector = retry.executeSupplier(() -> embedOnce(text));
      meterRegistry.counter("embedding.requests", "type", type, "outcome", "success").increment();
      return vector;
    } catch (TransientServiceException e) {
      meterRegistry.counter("embedding.requests", "type", type, "outcome", "exhausted").increment();
      throw new TransientServiceException(
          "Embedding endpoint unavailable after " + retryPolicy.maxAttempts() + " attempts",
          retryPolicy.maxAttempts(),
          e.getCause() != null ? e.getCause() : e);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests", "type", type, "outcome", "failure").increment();
      throw e;
    }
  }

  private float[] embedOnce(String text) {
    Response<Embedding> response;
    try {
      response = embeddingModel.embed(text);
    } catch (AuthenticationException e) {
      throw new ConfigurationException("Embedding endpoint rejected the credentials", e);
    } catch (RetriableException e) {
      throw new TransientServiceException("Embedding call failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      if (isTimeout(e)) {
        throw new TransientServiceException("Embedding call timed out", e);
      }
      throw new PermanentContentException("Embedding endpoint rejected input", e);
    }

    if (response == null || response.content() == null) {
      throw new TransientServiceException("Embedding endpoint returned no vector", null);
    }
    float[] vector = response.content().vector();
    if (vector.length != dimensions) {
      throw new ConfigurationException(
          "Embedding dimension mismatch: model returned "
              + vector.length
              + ", index expects "
              + dimensions);
    }
    log.debug("Embedded {} chars into {} dimensions", text.length(), vector.length);
    return vector;
  }

  private static boolean isTimeout(Throwable error) {
    return Throwables.getCausalChain(error).stream()
        .anyMatch(
            cause ->
                cause instanceof SocketTimeoutException
                    || cause instanceof HttpTimeoutException
                    || cause instanceof TimeoutException);
  }
}
