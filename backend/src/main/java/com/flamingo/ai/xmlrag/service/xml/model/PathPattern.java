package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Element path pattern used by structural hints.
 *
 * <ul>
 *   <li>{@code unload/incident} matches elements whose full path is exactly that
 *   <li>{@code unload/*} matches any direct child of the root {@code unload}
 *   <li>{@code //dependency} matches a {@code dependency} element at any depth
 *   <li>{@code //Appenders/*} matches any child of an {@code Appenders} element at any depth
 * </ul>
 *
 * <p>Segments compare local names only.
 */
public final class PathPattern {

  private final String expression;
  private final String[] segments;
  private final boolean anywhere;

  private PathPattern(String expression, String[] segments, boolean anywhere) {
    this.expression = expression;
    this.segments = segments;
    this.anywhere = anywhere;
  }

  public static PathPattern compile(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("Path pattern must not be blank");
    }
    String trimmed = expression.trim();
    boolean anywhere = trimmed.startsWith("//");
    String body = anywhere ? trimmed.substring(2) : trimmed;
    if (body.startsWith("/")) {
      body = body.substring(1);
    }
    if (body.isEmpty()) {
      throw new IllegalArgumentException("Path pattern has no segments: " + expression);
    }
    String[] segments = body.split("/");
    for (String segment : segments) {
      if (segment.isEmpty()) {
        throw new IllegalArgumentException("Path pattern has an empty segment: " + expression);
      }
    }
    return new PathPattern(trimmed, segments, anywhere);
  }

  public boolean matches(XmlElement element) {
    return matches(element.path());
  }

  public boolean matches(String path) {
    String[] actual = path.split("/");
    if (anywhere) {
      if (actual.length < segments.length) {
        return false;
      }
      return segmentsMatch(actual, actual.length - segments.length);
    }
    return actual.length == segments.length && segmentsMatch(actual, 0);
  }

  private boolean segmentsMatch(String[] actual, int offset) {
    for (int i = 0; i < segments.length; i++) {
      String expected = segments[i];
      if (!"*".equals(expected) && !expected.equals(actual[offset + i])) {
        return false;
      }
    }
    return true;
  }

  public String expression() {
    return expression;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PathPattern other)) {
      return false;
    }
    return anywhere == other.anywhere && Arrays.equals(segments, other.segments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(anywhere, Arrays.hashCode(segments));
  }

  @Override
  public String toString() {
    return expression;
  }
}
