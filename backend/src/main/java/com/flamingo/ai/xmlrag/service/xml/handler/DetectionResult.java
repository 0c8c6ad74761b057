package com.flamingo.ai.xmlrag.service.xml.handler;

import java.util.ArrayList;
import java.util.List;

/**
 * A handler's self-reported confidence that it owns a document.
 *
 * @param score confidence; the dispatcher clamps values outside [0, 1]
 * @param evidence short descriptions of the signals that contributed
 */
public record DetectionResult(double score, List<String> evidence) {

  private static final DetectionResult NONE = new DetectionResult(0.0, List.of());

  public DetectionResult {
    evidence = evidence == null ? List.of() : List.copyOf(evidence);
  }

  public static DetectionResult none() {
    return NONE;
  }

  public static DetectionResult of(double score, String... evidence) {
    return new DetectionResult(score, List.of(evidence));
  }

  public static Signals signals() {
    return new Signals();
  }

  /**
   * Accumulates weighted detection signals.
   *
   * <pre>{@code
   * return DetectionResult.signals()
   *     .add(root.localName().equals("unload"), 0.4, "root is <unload>")
   *     .add(root.hasDescendant("incident"), 0.3, "contains <incident>")
   *     .result();
   * }</pre>
   */
  public static final class Signals {

    private double score;
    private final List<String> evidence = new ArrayList<>();

    private Signals() {}

    public Signals add(boolean present, double weight, String description) {
      if (present) {
        score += weight;
        evidence.add(description);
      }
      return this;
    }

    /** Raises the score to {@code value} when {@code present} and the sum so far is lower. */
    public Signals decisive(boolean present, double value, String description) {
      if (present && value > score) {
        score = value;
        evidence.add(description);
      }
      return this;
    }

    /** Final result, capped at 1.0; zero when no signal fired. */
    public DetectionResult result() {
      return new DetectionResult(Math.min(score, 1.0), evidence);
    }

    /** Like {@link #result()} but zero unless the accumulated score reaches {@code threshold}. */
    public DetectionResult resultAtLeast(double threshold) {
      return score >= threshold ? result() : DetectionResult.none();
    }
  }
}
