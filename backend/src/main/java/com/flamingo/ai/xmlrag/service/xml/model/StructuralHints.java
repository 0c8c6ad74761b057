package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.List;

/**
 * Handler-supplied guidance for the chunker.
 *
 * @param boundaries chunk boundary declarations
 * @param references cross-reference declarations between boundary chunks
 */
public record StructuralHints(List<BoundaryHint> boundaries, List<ReferenceHint> references) {

  private static final StructuralHints NONE = new StructuralHints(List.of(), List.of());

  public StructuralHints {
    boundaries = boundaries == null ? List.of() : List.copyOf(boundaries);
    references = references == null ? List.of() : List.copyOf(references);
  }

  public static StructuralHints none() {
    return NONE;
  }

  public boolean isEmpty() {
    return boundaries.isEmpty();
  }
}
