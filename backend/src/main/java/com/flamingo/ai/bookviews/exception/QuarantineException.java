package com.flamingo.ai.bookviews.exception;

/** Raised when a document has used up its ingestion attempts and is marked failed. */
public class QuarantineException extends PipelineException {

  public QuarantineException(String documentId, int attempts, Throwable lastError) {
    super(
        ErrorCategory.QUARANTINE,
        "Document " + documentId + " quarantined after " + attempts + " attempts",
        lastError);
  }
}
