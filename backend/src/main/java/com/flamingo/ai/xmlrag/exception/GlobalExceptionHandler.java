package com.flamingo.ai.xmlrag.exception;

import com.flamingo.ai.xmlrag.service.xml.model.HandlerScore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private static final int RANKING_DETAIL_LIMIT = 3;

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MalformedInputException.class)
  public ResponseEntity<ApiError> handleMalformedInput(
      MalformedInputException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_input");
    String errorId = generateErrorId();
    log.warn("Malformed input [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.MALFORMED_INPUT,
        ex.getUserMessage(),
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(UnclassifiedDocumentException.class)
  public ResponseEntity<ApiError> handleUnclassified(
      UnclassifiedDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("unclassified_document");
    String errorId = generateErrorId();
    log.warn("Unclassified document [{}]: {}", errorId, ex.getMessage());

    String ranking =
        ex.getRanking().stream()
            .limit(RANKING_DETAIL_LIMIT)
            .map(HandlerScore::handlerId)
            .collect(Collectors.joining(", ", "Best-ranked handlers: ", ""));

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.UNCLASSIFIED_DOCUMENT,
        ex.getUserMessage(),
        ranking,
        request);
  }

  @ExceptionHandler(ExtractionException.class)
  public ResponseEntity<ApiError> handleExtraction(
      ExtractionException ex, HttpServletRequest request) {

    incrementErrorCounter("extraction_failed");
    String errorId = generateErrorId();
    log.error(
        "Extraction failed [{}] in {}: {} (partial fields: {})",
        errorId,
        ex.getHandlerId(),
        ex.getMessage(),
        ex.getPartialSummary() == null ? List.of() : ex.getPartialSummary().fields().keySet(),
        ex);

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.EXTRACTION_FAILED,
        ex.getUserMessage(),
        "Handler: " + ex.getHandlerId(),
        request);
  }

  @ExceptionHandler(BindException.class)
  public ResponseEntity<ApiError> handleValidation(BindException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleInvalidOptions(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_options");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_OPTIONS, ex.getMessage(), null, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_input");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.MALFORMED_INPUT,
        "Request body must be an XML document",
        null,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .details(details)
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
