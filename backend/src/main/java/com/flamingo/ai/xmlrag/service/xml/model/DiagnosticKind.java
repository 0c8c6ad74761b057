package com.flamingo.ai.xmlrag.service.xml.model;

/** Categories of {@link Diagnostic}. */
public enum DiagnosticKind {
  /** A handler's detection function threw; the handler was scored 0. */
  DETECTION_FAILURE,
  /** A handler reported a score outside [0, 1] (or NaN); the score was clamped. */
  SCORE_OUT_OF_RANGE,
  /** No handler scored above zero. */
  UNCLASSIFIED,
  /** The winning handler's extraction failed; only a partial summary is available. */
  PARTIAL_EXTRACTION,
  /** Boundary hints were supplied but none matched; structural fallback was used. */
  HINTS_NOT_FOUND,
  /** A single element exceeds the maximum chunk size and cannot be split further. */
  OVERSIZED_ELEMENT,
  /** A declared reference points at an identifier no chunk carries. */
  UNRESOLVED_REFERENCE
}
