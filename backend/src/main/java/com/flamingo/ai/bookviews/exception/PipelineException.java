package com.flamingo.ai.bookviews.exception;

/** Base class for all failures raised by the ingestion pipeline. */
public abstract class PipelineException extends RuntimeException {

  private final ErrorCategory category;

  protected PipelineException(ErrorCategory category, String message) {
    super(message);
    this.category = category;
  }

  protected PipelineException(ErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
  }

  public ErrorCategory getCategory() {
    return category;
  }

  /** Classifies any throwable raised while processing a document. */
  public static ErrorCategory categorize(Throwable error) {
    if (error instanceof PipelineException pipelineException) {
      return pipelineException.getCategory();
    }
    return ErrorCategory.UNEXPECTED;
  }
}
