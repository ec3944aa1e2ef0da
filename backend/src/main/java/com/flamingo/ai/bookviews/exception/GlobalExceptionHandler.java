package com.flamingo.ai.bookviews.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {
    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.SEARCH_FAILED,
        ex.getUserMessage(), request);
  }

  @ExceptionHandler(TransientServiceException.class)
  public ResponseEntity<ApiError> handleTransient(
      TransientServiceException ex, HttpServletRequest request) {
    incrementErrorCounter("transient_service");
    String errorId = generateErrorId();
    log.error("Upstream service unavailable [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.EMBEDDING_UNAVAILABLE,
        "Embedding service is temporarily unavailable. Please try again later.", request);
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ConfigurationException ex, HttpServletRequest request) {
    incrementErrorCounter("configuration");
    String errorId = generateErrorId();
    log.error("Configuration error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.CONFIGURATION_ERROR,
        "Service is misconfigured", request);
  }

  @ExceptionHandler(IngestionAlreadyRunningException.class)
  public ResponseEntity<ApiError> handleIngestionConflict(
      IngestionAlreadyRunningException ex, HttpServletRequest request) {
    incrementErrorCounter("ingestion_conflict");
    String errorId = generateErrorId();
    log.warn("Ingestion conflict [{}]: {}", errorId, ex.getMessage());
    return respond(HttpStatus.CONFLICT, errorId, ApiError.INGESTION_CONFLICT, ex.getMessage(),
        request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(),
        request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR,
        "Request body is missing or malformed", request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.", request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
