package com.flamingo.ai.bookviews.exception;

/** Thrown when a remote call keeps failing for a recoverable reason after all retries. */
public class TransientServiceException extends PipelineException {

  private final int attempts;

  public TransientServiceException(String message, int attempts, Throwable cause) {
    super(ErrorCategory.TRANSIENT, message, cause);
    this.attempts = attempts;
  }

  public TransientServiceException(String message, Throwable cause) {
    this(message, 1, cause);
  }

  public int getAttempts() {
    return attempts;
  }
}
