package com.flamingo.ai.bookviews.exception;

/** Exception thrown when an ingestion run is requested while another is active. */
public class IngestionAlreadyRunningException extends RuntimeException {

  public IngestionAlreadyRunningException(String corpusPrefix) {
    super("An ingestion run is already active for corpus " + corpusPrefix);
  }
}
