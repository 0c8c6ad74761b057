package com.flamingo.ai.xmlrag.exception;

import com.flamingo.ai.xmlrag.service.xml.model.Diagnostic;
import com.flamingo.ai.xmlrag.service.xml.model.HandlerScore;
import java.util.List;

/**
 * Exception thrown when a well-formed document is claimed by no handler (every score was zero).
 *
 * <p>Carries the full ranking and the detection diagnostics so the caller can decide how to fall
 * back.
 */
public class UnclassifiedDocumentException extends XmlProcessingException {

  private final List<HandlerScore> ranking;
  private final List<Diagnostic> diagnostics;

  public UnclassifiedDocumentException(
      String message, List<HandlerScore> ranking, List<Diagnostic> diagnostics) {
    super(message, "No handler recognised this document type");
    this.ranking = List.copyOf(ranking);
    this.diagnostics = List.copyOf(diagnostics);
  }

  public List<HandlerScore> getRanking() {
    return ranking;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }
}
