package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * One addressable unit of document content, ready for downstream retrieval indexing.
 *
 * @param index zero-based position in the final chunk sequence
 * @param chunkId stable id derived from index and content, e.g. {@code chunk_3_1a2b3c4d}
 * @param sourcePath element path of the (first) element the chunk was cut from
 * @param kind kind tag, e.g. {@code record}, {@code annotation}, {@code section}, {@code context}
 * @param text rendered text of the whole elements included in the chunk
 * @param identifier identifier read from the source element, or {@code null}
 * @param declaredReferences references read from the source element, before resolution
 * @param references resolved links; empty until the cross-reference resolver has run
 * @param tokenEstimate rough token count of {@code text}, 1.3 tokens per word
 * @param parentContext breadcrumb of the elements enclosing the source element, e.g. {@code book >
 *     chapter[id=intro]}, or {@code null} when disabled or the source is the root
 */
@Builder(toBuilder = true)
public record Chunk(
    int index,
    String chunkId,
    String sourcePath,
    String kind,
    String text,
    String identifier,
    List<DeclaredReference> declaredReferences,
    List<CrossReference> references,
    int tokenEstimate,
    String parentContext) {

  public Chunk {
    declaredReferences = declaredReferences == null ? List.of() : List.copyOf(declaredReferences);
    references = references == null ? List.of() : List.copyOf(references);
  }

  /** Rough token count of {@code text}: whitespace-separated words times 1.3, rounded down. */
  public static int estimateTokens(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    int words = text.trim().split("\\s+").length;
    return (int) (words * 1.3);
  }

  public List<CrossReference> forwardReferences() {
    return filter(CrossReference.Direction.FORWARD);
  }

  public List<CrossReference> backReferences() {
    return filter(CrossReference.Direction.BACK);
  }

  public List<CrossReference> externalReferences() {
    return filter(CrossReference.Direction.EXTERNAL);
  }

  /** Relation name to the indices of the chunks this chunk points at. */
  public Map<String, List<Integer>> referenceIndex() {
    Map<String, List<Integer>> index = new LinkedHashMap<>();
    for (CrossReference ref : forwardReferences()) {
      index.computeIfAbsent(ref.relation(), k -> new ArrayList<>()).add(ref.chunkIndex());
    }
    return index;
  }

  private List<CrossReference> filter(CrossReference.Direction direction) {
    return references.stream().filter(r -> r.direction() == direction).toList();
  }
}
