package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.List;

/**
 * Outcome of dispatching a document over all registered handlers.
 *
 * @param documentType identifier of the winning handler
 * @param confidence the winner's rounded score, in (0, 1]
 * @param ranking every registered handler, best first
 * @param diagnostics isolated detection failures and clamped scores
 */
public record ClassificationResult(
    String documentType,
    double confidence,
    List<HandlerScore> ranking,
    List<Diagnostic> diagnostics) {

  public ClassificationResult {
    ranking = List.copyOf(ranking);
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public HandlerScore winner() {
    return ranking.get(0);
  }
}
