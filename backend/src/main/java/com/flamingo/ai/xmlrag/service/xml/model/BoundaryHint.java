package com.flamingo.ai.xmlrag.service.xml.model;

/**
 * Marks elements that start a chunk of their own in hinted chunking mode.
 *
 * @param path {@link PathPattern} expression selecting boundary elements
 * @param kind kind tag given to the resulting chunks, e.g. {@code record} or {@code annotation}
 * @param identifierPath value path (see {@link XmlElement#values}) yielding the chunk's identifier;
 *     {@code null} when chunks of this kind carry no identifier
 */
public record BoundaryHint(String path, String kind, String identifierPath) {

  public BoundaryHint {
    PathPattern.compile(path);
    if (kind == null || kind.isBlank()) {
      kind = "record";
    }
  }

  public PathPattern pattern() {
    return PathPattern.compile(path);
  }
}
