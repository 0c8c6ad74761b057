package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.List;

/**
 * One handler's standing in a classification ranking.
 *
 * @param handlerId handler identifier
 * @param score detection score after clamping to [0, 1] and rounding
 * @param priority declared tie-break weight
 * @param registrationIndex position in the registry (0 = registered first)
 * @param evidence signals the handler reported
 */
public record HandlerScore(
    String handlerId, double score, int priority, int registrationIndex, List<String> evidence) {

  public HandlerScore {
    evidence = evidence == null ? List.of() : List.copyOf(evidence);
  }
}
