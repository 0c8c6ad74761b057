package com.flamingo.ai.xmlrag.service.xml.chunking;

import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.ArrayList;
import java.util.List;

/**
 * Smallest piece of content the chunker moves around: either a whole element subtree or only an
 * element's own text (used for ancestors whose children are chunked separately).
 */
record ChunkUnit(XmlElement element, boolean ownTextOnly) {

  static ChunkUnit whole(XmlElement element) {
    return new ChunkUnit(element, false);
  }

  static ChunkUnit ownText(XmlElement element) {
    return new ChunkUnit(element, true);
  }

  String text() {
    return ownTextOnly ? element.text() : element.textContent();
  }

  int length() {
    return ownTextOnly ? element.text().length() : element.textLength();
  }

  /**
   * Sibling group this unit belongs to. Whole elements group under their parent; an element's own
   * text groups with that element's children.
   */
  int groupKey() {
    return ownTextOnly ? element.position() : element.parentPosition();
  }

  /** Tree level of the content; an element's own text sits at the level of its children. */
  int level() {
    return ownTextOnly ? element.depth() + 1 : element.depth();
  }

  /** Whether {@link #expand()} yields smaller units. */
  boolean canExpand() {
    return !ownTextOnly && !element.isLeaf();
  }

  /** The next-deeper level: own text first, then each child with text. */
  List<ChunkUnit> expand() {
    List<ChunkUnit> units = new ArrayList<>();
    if (element.hasText()) {
      units.add(ownText(element));
    }
    for (XmlElement child : element.children()) {
      if (child.textLength() > 0) {
        units.add(whole(child));
      }
    }
    return units;
  }
}
