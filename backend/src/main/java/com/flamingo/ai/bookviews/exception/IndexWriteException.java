package com.flamingo.ai.bookviews.exception;

/** Thrown for an index record the vector index kept rejecting. */
public class IndexWriteException extends PipelineException {

  private final String recordId;

  public IndexWriteException(String recordId, String message) {
    super(ErrorCategory.INDEX_WRITE, message);
    this.recordId = recordId;
  }

  public IndexWriteException(String recordId, String message, Throwable cause) {
    super(ErrorCategory.INDEX_WRITE, message, cause);
    this.recordId = recordId;
  }

  public String getRecordId() {
    return recordId;
  }
}
