package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable element node of a {@link ParsedDocument}.
 *
 * <p>Nodes are built once by {@link com.flamingo.ai.xmlrag.service.xml.parsing.XmlDocumentParser}
 * and never mutated afterwards, so a tree can be read from any number of threads.
 *
 * <p>{@link #text()} holds only the element's own (direct) character data, whitespace-normalised.
 * {@link #textContent()} renders the whole subtree: own text first, then each child in document
 * order, separated by single spaces.
 */
public final class XmlElement {

  private final String localName;
  private final String namespaceUri;
  private final String prefix;
  private final Map<String, String> attributes;
  private final String text;
  private final List<XmlElement> children;
  private final String path;
  private final int depth;
  private final int position;
  private final int parentPosition;
  private final int textLength;

  public XmlElement(
      String localName,
      String namespaceUri,
      String prefix,
      Map<String, String> attributes,
      String text,
      List<XmlElement> children,
      String path,
      int depth,
      int position,
      int parentPosition) {
    this.localName = localName;
    this.namespaceUri = namespaceUri;
    this.prefix = prefix;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.text = text == null ? "" : text;
    this.children = List.copyOf(children);
    this.path = path;
    this.depth = depth;
    this.position = position;
    this.parentPosition = parentPosition;
    this.textLength = computeTextLength();
  }

  public String localName() {
    return localName;
  }

  /** Namespace URI, or {@code null} when the element is not in a namespace. */
  public String namespaceUri() {
    return namespaceUri;
  }

  public String prefix() {
    return prefix;
  }

  public String qualifiedName() {
    return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
  }

  /** Attributes keyed by their qualified name as written in the source, in source order. */
  public Map<String, String> attributes() {
    return attributes;
  }

  public String text() {
    return text;
  }

  public List<XmlElement> children() {
    return children;
  }

  /** Slash-separated local names from the root to this element, e.g. {@code unload/incident}. */
  public String path() {
    return path;
  }

  /** Distance from the root; the root itself has depth 0. */
  public int depth() {
    return depth;
  }

  /** Pre-order index of this element in its document; unique within one document. */
  public int position() {
    return position;
  }

  /** {@link #position()} of the parent element, or -1 for the root. */
  public int parentPosition() {
    return parentPosition;
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  public boolean hasText() {
    return !text.isEmpty();
  }

  /** Length of {@link #textContent()} without rendering it. */
  public int textLength() {
    return textLength;
  }

  public String textContent() {
    StringBuilder sb = new StringBuilder(textLength);
    appendTextContent(sb);
    return sb.toString();
  }

  void appendTextContent(StringBuilder sb) {
    boolean first = true;
    if (!text.isEmpty()) {
      sb.append(text);
      first = false;
    }
    for (XmlElement child : children) {
      if (child.textLength > 0) {
        if (!first) {
          sb.append(' ');
        }
        child.appendTextContent(sb);
        first = false;
      }
    }
  }

  private int computeTextLength() {
    int length = 0;
    int parts = 0;
    if (!text.isEmpty()) {
      length += text.length();
      parts++;
    }
    for (XmlElement child : children) {
      if (child.textLength > 0) {
        length += child.textLength;
        parts++;
      }
    }
    return parts == 0 ? 0 : length + parts - 1;
  }

  // ---- queries ----

  /** First direct child with the given local name, or {@code null}. */
  public XmlElement child(String name) {
    for (XmlElement child : children) {
      if (child.localName.equals(name)) {
        return child;
      }
    }
    return null;
  }

  public List<XmlElement> children(String name) {
    List<XmlElement> result = new ArrayList<>();
    for (XmlElement child : children) {
      if (child.localName.equals(name)) {
        result.add(child);
      }
    }
    return result;
  }

  /** All descendants (not including this element) with the given local name, in document order. */
  public List<XmlElement> descendants(String name) {
    List<XmlElement> result = new ArrayList<>();
    collectDescendants(name, result);
    return result;
  }

  private void collectDescendants(String name, List<XmlElement> result) {
    for (XmlElement child : children) {
      if (child.localName.equals(name)) {
        result.add(child);
      }
      child.collectDescendants(name, result);
    }
  }

  /** First descendant in document order with the given local name, or {@code null}. */
  public XmlElement firstDescendant(String name) {
    for (XmlElement child : children) {
      if (child.localName.equals(name)) {
        return child;
      }
      XmlElement found = child.firstDescendant(name);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  public boolean hasDescendant(String name) {
    return firstDescendant(name) != null;
  }

  /** Subtree text of the first child with the given name, or {@code null} if there is none. */
  public String childText(String name) {
    XmlElement child = child(name);
    return child == null ? null : child.textContent();
  }

  /**
   * Attribute value by qualified name, falling back to a local-name match ({@code id} finds {@code
   * xml:id}). Returns {@code null} when absent.
   */
  public String attribute(String name) {
    String value = attributes.get(name);
    if (value != null) {
      return value;
    }
    for (Map.Entry<String, String> entry : attributes.entrySet()) {
      String key = entry.getKey();
      int colon = key.indexOf(':');
      if (colon >= 0 && key.substring(colon + 1).equals(name) && !key.startsWith("xmlns")) {
        return entry.getValue();
      }
    }
    return null;
  }

  /**
   * Resolves a value path relative to this element.
   *
   * <p>Syntax: {@code @attr} reads an attribute; {@code a/b} reads the text of every matching
   * descendant chain; {@code a/@attr} reads an attribute on every matching child. Blank values are
   * skipped.
   *
   * @param valuePath value path
   * @return matching values in document order; empty when nothing matches
   */
  public List<String> values(String valuePath) {
    List<String> result = new ArrayList<>();
    if (valuePath == null || valuePath.isBlank()) {
      return result;
    }
    collectValues(this, valuePath.trim().split("/"), 0, result);
    return result;
  }

  private static void collectValues(
      XmlElement element, String[] steps, int index, List<String> result) {
    String step = steps[index];
    boolean last = index == steps.length - 1;
    if (step.startsWith("@")) {
      String value = element.attribute(step.substring(1));
      if (value != null && !value.isBlank()) {
        result.add(value.trim());
      }
      return;
    }
    for (XmlElement child : element.children) {
      if (!"*".equals(step) && !child.localName.equals(step)) {
        continue;
      }
      if (last) {
        String value = child.textContent();
        if (!value.isBlank()) {
          result.add(value);
        }
      } else {
        collectValues(child, steps, index + 1, result);
      }
    }
  }

  /** First value of {@link #values(String)}, or {@code null}. */
  public String value(String valuePath) {
    List<String> values = values(valuePath);
    return values.isEmpty() ? null : values.get(0);
  }

  @Override
  public String toString() {
    return "XmlElement[" + path + "@" + position + "]";
  }
}
