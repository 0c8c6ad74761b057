package com.flamingo.ai.xmlrag.service.xml.model;

/**
 * A non-fatal degradation recorded while processing a document.
 *
 * @param kind what degraded
 * @param source handler id, element path or chunk id the diagnostic is about
 * @param message human-readable detail
 */
public record Diagnostic(DiagnosticKind kind, String source, String message) {

  public static Diagnostic of(DiagnosticKind kind, String source, String message) {
    return new Diagnostic(kind, source, message);
  }
}
