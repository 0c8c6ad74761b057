package com.flamingo.ai.xmlrag.service.xml.chunking;

import com.flamingo.ai.xmlrag.service.xml.model.DeclaredReference;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.ArrayList;
import java.util.List;

/** Mutable chunk under construction, turned into a {@code Chunk} once splitting is done. */
final class DraftChunk {

  private final List<ChunkUnit> units = new ArrayList<>();
  private final String kind;
  private String identifier;
  private List<DeclaredReference> references = List.of();
  private String groupTarget;
  private int length;

  DraftChunk(String kind) {
    this.kind = kind;
  }

  DraftChunk(String kind, ChunkUnit first) {
    this(kind);
    add(first);
  }

  void add(ChunkUnit unit) {
    int unitLength = unit.length();
    length = units.isEmpty() ? unitLength : length + 1 + unitLength;
    units.add(unit);
  }

  /** Length the text would have after appending {@code unit}. */
  int lengthWith(ChunkUnit unit) {
    return units.isEmpty() ? unit.length() : length + 1 + unit.length();
  }

  List<ChunkUnit> units() {
    return units;
  }

  boolean isEmpty() {
    return units.isEmpty();
  }

  int length() {
    return length;
  }

  String text() {
    StringBuilder sb = new StringBuilder(length);
    for (ChunkUnit unit : units) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(unit.text());
    }
    return sb.toString();
  }

  String sourcePath() {
    return firstElement().path();
  }

  XmlElement firstElement() {
    return units.get(0).element();
  }

  String kind() {
    return kind;
  }

  String identifier() {
    return identifier;
  }

  void identifier(String identifier) {
    this.identifier = identifier;
  }

  List<DeclaredReference> references() {
    return references;
  }

  void references(List<DeclaredReference> references) {
    this.references = List.copyOf(references);
  }

  /** Identifier of the chunk this one is grouped after, or {@code null}. */
  String groupTarget() {
    return groupTarget;
  }

  void groupTarget(String groupTarget) {
    this.groupTarget = groupTarget;
  }

  /** New draft of the same kind with no units, carrying over identity and references. */
  DraftChunk emptyCopyWithIdentity() {
    DraftChunk copy = new DraftChunk(kind);
    copy.identifier = identifier;
    copy.references = references;
    copy.groupTarget = groupTarget;
    return copy;
  }
}
