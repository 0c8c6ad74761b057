package com.flamingo.ai.xmlrag.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String MALFORMED_INPUT = "XML_001";
  public static final String UNCLASSIFIED_DOCUMENT = "XML_002";
  public static final String EXTRACTION_FAILED = "XML_003";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INVALID_OPTIONS = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, e.g. the best-ranked handlers of an unclassified document. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
