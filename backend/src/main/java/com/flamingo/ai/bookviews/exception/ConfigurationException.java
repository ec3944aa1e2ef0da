package com.flamingo.ai.bookviews.exception;

/** Systemic misconfiguration, e.g. an embedding dimension that does not match the index. */
public class ConfigurationException extends PipelineException {

  public ConfigurationException(String message) {
    super(ErrorCategory.CONFIGURATION, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorCategory.CONFIGURATION, message, cause);
  }
}
