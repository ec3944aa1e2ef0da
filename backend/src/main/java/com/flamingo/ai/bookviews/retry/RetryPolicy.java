package com.flamingo.ai.bookviews.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;

/**
 * Bounded exponential backoff with jitter, shared by the embedding adapter and the bulk indexer.
 *
 * @param maxAttempts total attempts including the first call
 * @param baseDelay wait before the second attempt
 * @param maxDelay upper bound for any single wait
 * @param multiplier growth factor between consecutive waits
 * @param jitter randomization factor in {@code [0, 1)}
 */
public record RetryPolicy(
    int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier, double jitter) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (jitter < 0 || jitter >= 1) {
      throw new IllegalArgumentException("jitter must be in [0, 1)");
    }
    if (multiplier < 1) {
      throw new IllegalArgumentException("multiplier must be at least 1");
    }
  }

  /** A policy that makes exactly one attempt. */
  public static RetryPolicy noRetry() {
    return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
  }

  public IntervalFunction intervalFunction() {
    if (baseDelay.toMillis() < 1) {
      return attempt -> 0L;
    }
    if (jitter == 0) {
      return IntervalFunction.ofExponentialBackoff(baseDelay, multiplier, maxDelay);
    }
    return IntervalFunction.ofExponentialRandomBackoff(baseDelay, multiplier, jitter, maxDelay);
  }

  /** Wait before attempt {@code attempt + 1}, given that {@code attempt} attempts have failed. */
  public Duration delayAfter(int attempt) {
    return Duration.ofMillis(intervalFunction().apply(attempt));
  }

  /** Resilience4j configuration retrying only the given exception type. */
  public RetryConfig toRetryConfig(Class<? extends Throwable> retryOn) {
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(intervalFunction())
        .retryExceptions(retryOn)
        .build();
  }
}
