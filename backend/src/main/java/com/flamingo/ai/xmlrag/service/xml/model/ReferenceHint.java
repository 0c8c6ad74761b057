package com.flamingo.ai.xmlrag.service.xml.model;

/**
 * Declares that boundary elements matching {@code path} refer to other chunks by identifier.
 *
 * @param path {@link PathPattern} expression selecting the referring boundary elements
 * @param valuePath value path yielding the referenced identifier(s)
 * @param relation name of the relation, e.g. {@code journal} or {@code appender}
 * @param groupWithTarget when {@code true} the referring chunk is moved to directly follow the
 *     referenced chunk in the output sequence
 */
public record ReferenceHint(
    String path, String valuePath, String relation, boolean groupWithTarget) {

  public ReferenceHint {
    PathPattern.compile(path);
    if (valuePath == null || valuePath.isBlank()) {
      throw new IllegalArgumentException("Reference hint needs a value path");
    }
    if (relation == null || relation.isBlank()) {
      relation = "references";
    }
  }

  public PathPattern pattern() {
    return PathPattern.compile(path);
  }
}
