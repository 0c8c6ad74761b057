package com.flamingo.ai.xmlrag.service.xml.handler;

import java.util.Objects;

/**
 * Registry entry for one document family.
 *
 * @param id unique identifier, also used as the classification result's document type
 * @param displayName human-readable family name written into summaries
 * @param priority tie-break weight; higher wins when scores are equal
 * @param detection detection function
 * @param extraction extraction function
 */
public record HandlerDescriptor(
    String id,
    String displayName,
    int priority,
    DetectionFunction detection,
    ExtractionFunction extraction) {

  public HandlerDescriptor {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Handler id must not be blank");
    }
    Objects.requireNonNull(detection, "detection");
    Objects.requireNonNull(extraction, "extraction");
    if (displayName == null || displayName.isBlank()) {
      displayName = id;
    }
  }

  public static HandlerDescriptor of(
      String id, int priority, DetectionFunction detection, ExtractionFunction extraction) {
    return new HandlerDescriptor(id, id, priority, detection, extraction);
  }
}
