package com.flamingo.ai.xmlrag.service.xml.classification;

import com.flamingo.ai.xmlrag.config.XmlRagConfig;
import com.flamingo.ai.xmlrag.exception.UnclassifiedDocumentException;
import com.flamingo.ai.xmlrag.service.xml.handler.DetectionResult;
import com.flamingo.ai.xmlrag.service.xml.model.ClassificationResult;
import com.flamingo.ai.xmlrag.service.xml.model.Diagnostic;
import com.flamingo.ai.xmlrag.service.xml.model.DiagnosticKind;
import com.flamingo.ai.xmlrag.service.xml.model.HandlerScore;
import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.registry.HandlerRegistry;
import com.flamingo.ai.xmlrag.service.xml.registry.RegisteredHandler;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chooses the handler that owns a document.
 *
 * <p>Every registered handler's detection function is run independently. Scores are clamped to
 * [0, 1] and rounded to {@code xmlrag.dispatch.score-scale} decimal places, then all handlers are
 * ranked by (score desc, priority desc, registration index asc). The first entry wins if its score
 * is above zero; otherwise the document is unclassified.
 *
 * <p>A detection function that throws is scored 0 and reported as a {@link
 * DiagnosticKind#DETECTION_FAILURE} diagnostic; it never aborts the dispatch. Only exceptions are
 * isolated, not errors. Detectors walk the element tree recursively, which is safe because the
 * parser rejects documents nested beyond {@code xmlrag.parsing.max-element-depth}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClassificationDispatcher {

  static final Comparator<HandlerScore> RANKING =
      Comparator.comparingDouble(HandlerScore::score)
          .reversed()
          .thenComparing(Comparator.comparingInt(HandlerScore::priority).reversed())
          .thenComparingInt(HandlerScore::registrationIndex);

  private final HandlerRegistry registry;
  private final XmlRagConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Classifies the document.
   *
   * @param document parsed document
   * @return the winner, its confidence, the full ranking and any isolated detection failures
   * @throws UnclassifiedDocumentException if no handler scores above zero
   */
  public ClassificationResult classify(ParsedDocument document) {
    List<HandlerScore> scores = new ArrayList<>();
    List<Diagnostic> diagnostics = new ArrayList<>();

    for (RegisteredHandler handler : registry.all()) {
      DetectionResult detection = runDetection(handler, document, diagnostics);
      double score = normalize(handler.id(), detection.score(), diagnostics);
      scores.add(
          new HandlerScore(
              handler.id(),
              score,
              handler.priority(),
              handler.registrationIndex(),
              detection.evidence()));
    }

    scores.sort(RANKING);

    if (scores.isEmpty() || scores.get(0).score() <= 0.0) {
      meterRegistry.counter("xml.classification.unclassified").increment();
      diagnostics.add(
          Diagnostic.of(
              DiagnosticKind.UNCLASSIFIED,
              document.root().path(),
              "No handler scored above zero among " + scores.size() + " registered"));
      log.debug("Document with root <{}> is unclassified", document.root().qualifiedName());
      throw new UnclassifiedDocumentException(
          "No handler recognised document with root <" + document.root().qualifiedName() + ">",
          scores,
          diagnostics);
    }

    HandlerScore winner = scores.get(0);
    meterRegistry.counter("xml.classification.result", "type", winner.handlerId()).increment();
    if (log.isDebugEnabled()) {
      log.debug(
          "Classified as {} (confidence={}); runners-up: {}",
          winner.handlerId(),
          winner.score(),
          scores.stream()
              .skip(1)
              .filter(s -> s.score() > 0)
              .limit(3)
              .map(s -> s.handlerId() + "=" + s.score())
              .toList());
    }
    return new ClassificationResult(winner.handlerId(), winner.score(), scores, diagnostics);
  }

  // ---- private helpers ----

  private DetectionResult runDetection(
      RegisteredHandler handler, ParsedDocument document, List<Diagnostic> diagnostics) {
    try {
      DetectionResult result = handler.descriptor().detection().detect(document);
      return result != null ? result : DetectionResult.none();
    } catch (RuntimeException e) {
      log.warn("Detection failed for handler {}: {}", handler.id(), e.toString());
      meterRegistry.counter("xml.detection.failures", "handler", handler.id()).increment();
      diagnostics.add(
          Diagnostic.of(
              DiagnosticKind.DETECTION_FAILURE,
              handler.id(),
              e.getClass().getSimpleName() + ": " + e.getMessage()));
      return DetectionResult.none();
    }
  }

  private double normalize(String handlerId, double raw, List<Diagnostic> diagnostics) {
    double clamped = raw;
    if (Double.isNaN(raw) || raw < 0.0) {
      clamped = 0.0;
    } else if (raw > 1.0) {
      clamped = 1.0;
    }
    if (clamped != raw) {
      log.warn("Handler {} reported out-of-range score {}; using {}", handlerId, raw, clamped);
      diagnostics.add(
          Diagnostic.of(
              DiagnosticKind.SCORE_OUT_OF_RANGE,
              handlerId,
              "Score " + raw + " clamped to " + clamped));
    }
    return BigDecimal.valueOf(clamped)
        .setScale(config.getDispatch().getScoreScale(), RoundingMode.HALF_UP)
        .doubleValue();
  }
}
