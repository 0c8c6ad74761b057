package com.flamingo.ai.xmlrag.service.xml.extraction;

import com.flamingo.ai.xmlrag.exception.ExtractionException;
import com.flamingo.ai.xmlrag.service.xml.handler.HandlerDescriptor;
import com.flamingo.ai.xmlrag.service.xml.model.ClassificationResult;
import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.registry.HandlerRegistry;
import com.flamingo.ai.xmlrag.service.xml.registry.RegisteredHandler;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the winning handler's extraction function over the already-parsed document.
 *
 * <p>The handler writes into a fresh {@link SummaryRecord.Builder}. If it throws, the builder's
 * contents at that moment become the partial summary carried by the {@link ExtractionException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionAdapter {

  private final HandlerRegistry registry;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts the summary of a classified document.
   *
   * @param classification result naming the winning handler
   * @param document the document that was classified
   * @return complete summary record
   * @throws ExtractionException if the handler fails; carries the partial record
   * @throws IllegalStateException if the winning handler is not registered here
   */
  public SummaryRecord extract(ClassificationResult classification, ParsedDocument document) {
    String handlerId = classification.documentType();
    HandlerDescriptor handler =
        registry
            .find(handlerId)
            .map(RegisteredHandler::descriptor)
            .orElseThrow(
                () -> new IllegalStateException("Winning handler is not registered: " + handlerId));

    SummaryRecord.Builder builder = SummaryRecord.builder(handler.displayName());
    try {
      handler.extraction().extract(document, builder);
    } catch (ExtractionException e) {
      meterRegistry.counter("xml.extraction.partial", "handler", handlerId).increment();
      throw e;
    } catch (RuntimeException e) {
      SummaryRecord partial = builder.build();
      meterRegistry.counter("xml.extraction.partial", "handler", handlerId).increment();
      log.warn(
          "Extraction by {} failed after {} fields: {}",
          handlerId,
          partial.fields().size(),
          e.toString());
      throw new ExtractionException(
          handlerId, "Extraction by " + handlerId + " failed: " + e.getMessage(), partial, e);
    }

    SummaryRecord summary = builder.build();
    log.debug(
        "Extracted {} fields and {} boundary hints with {}",
        summary.fields().size(),
        summary.hints().boundaries().size(),
        handlerId);
    return summary;
  }
}
