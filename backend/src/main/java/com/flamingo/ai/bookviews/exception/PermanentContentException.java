package com.flamingo.ai.bookviews.exception;

/** Thrown when a document's content cannot produce a usable summary. */
public class PermanentContentException extends PipelineException {

  public PermanentContentException(String message) {
    super(ErrorCategory.PERMANENT_CONTENT, message);
  }

  public PermanentContentException(String message, Throwable cause) {
    super(ErrorCategory.PERMANENT_CONTENT, message, cause);
  }
}
