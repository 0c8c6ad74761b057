package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory representation of one XML document: the element tree plus a flat path index.
 *
 * <p>Built once per input by {@link com.flamingo.ai.xmlrag.service.xml.parsing.XmlDocumentParser}
 * and immutable afterwards. Handlers, the chunker and the cross-reference resolver all read from
 * the same instance; nothing re-parses the source.
 */
public final class ParsedDocument {

  private final XmlElement root;
  private final Map<String, String> namespaces;
  private final Map<String, List<XmlElement>> pathIndex;
  private final List<XmlElement> elementsInOrder;
  private final int maxDepth;

  public ParsedDocument(XmlElement root, Map<String, String> namespaces) {
    this.root = root;
    this.namespaces = Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));

    Map<String, List<XmlElement>> index = new LinkedHashMap<>();
    List<XmlElement> ordered = new ArrayList<>();
    int deepest = 0;
    Deque<XmlElement> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      XmlElement element = stack.pop();
      ordered.add(element);
      index.computeIfAbsent(element.path(), k -> new ArrayList<>()).add(element);
      deepest = Math.max(deepest, element.depth());
      List<XmlElement> children = element.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    Map<String, List<XmlElement>> frozen = new LinkedHashMap<>();
    index.forEach((path, elements) -> frozen.put(path, List.copyOf(elements)));
    this.pathIndex = Collections.unmodifiableMap(frozen);
    this.elementsInOrder = List.copyOf(ordered);
    this.maxDepth = deepest;
  }

  public XmlElement root() {
    return root;
  }

  /** Namespace declarations found anywhere in the document, prefix to URI. */
  public Map<String, String> namespaces() {
    return namespaces;
  }

  public boolean declaresNamespace(String uriFragment) {
    return namespaces.values().stream().anyMatch(uri -> uri.contains(uriFragment));
  }

  /** Element path to the elements at that path, in document order. */
  public Map<String, List<XmlElement>> pathIndex() {
    return pathIndex;
  }

  public List<XmlElement> elementsAt(String path) {
    return pathIndex.getOrDefault(path, List.of());
  }

  /** Every element whose path matches the pattern, in document order. */
  public List<XmlElement> select(PathPattern pattern) {
    List<XmlElement> result = new ArrayList<>();
    for (XmlElement element : elementsInOrder) {
      if (pattern.matches(element)) {
        result.add(element);
      }
    }
    return result;
  }

  /** All elements in document (pre-)order; index {@code i} holds the element at position i. */
  public List<XmlElement> elements() {
    return elementsInOrder;
  }

  /** Enclosing elements of {@code element}, root first; empty for the root. */
  public List<XmlElement> ancestors(XmlElement element) {
    List<XmlElement> ancestors = new ArrayList<>();
    for (int p = element.parentPosition(); p >= 0; p = elementsInOrder.get(p).parentPosition()) {
      ancestors.add(elementsInOrder.get(p));
    }
    Collections.reverse(ancestors);
    return ancestors;
  }

  public int elementCount() {
    return elementsInOrder.size();
  }

  public int maxDepth() {
    return maxDepth;
  }

  /** {@code true} when the root has neither children nor text. */
  public boolean isEmpty() {
    return root.isLeaf() && !root.hasText();
  }
}
