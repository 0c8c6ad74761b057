package com.flamingo.ai.xmlrag.service.xml.handler;

import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;

/**
 * Plugin contract for one XML document family.
 *
 * <p>Implementations are Spring beans; {@link
 * com.flamingo.ai.xmlrag.config.HandlerRegistryConfig} registers them in {@code @Order} order.
 * Adding a family means adding one implementation, with no change to the dispatcher or chunker.
 *
 * <p>Implementations must be stateless: one instance serves concurrent classifications.
 */
public interface FormatHandler {

  /** Unique identifier, e.g. {@code maven-pom}. */
  String id();

  /** Human-readable family name, e.g. {@code Maven POM}. */
  String displayName();

  /** Tie-break weight; higher wins when two handlers report the same score. */
  default int priority() {
    return 10;
  }

  DetectionResult detect(ParsedDocument document);

  void extract(ParsedDocument document, SummaryRecord.Builder summary);

  default HandlerDescriptor descriptor() {
    return new HandlerDescriptor(id(), displayName(), priority(), this::detect, this::extract);
  }
}
