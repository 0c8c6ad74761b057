package com.flamingo.ai.xmlrag.service.xml.model;

/**
 * A resolved (or unresolvable) link between chunks.
 *
 * @param relation relation name, e.g. {@code journal}
 * @param targetId identifier on the other end of the link
 * @param chunkIndex index of the chunk on the other end; -1 for {@link Direction#EXTERNAL}
 * @param direction whether this chunk points at the other one, is pointed at, or points outside
 *     the document
 */
public record CrossReference(
    String relation, String targetId, int chunkIndex, Direction direction) {

  public enum Direction {
    FORWARD,
    BACK,
    EXTERNAL
  }

  public static CrossReference forward(String relation, String targetId, int chunkIndex) {
    return new CrossReference(relation, targetId, chunkIndex, Direction.FORWARD);
  }

  public static CrossReference back(String relation, String sourceId, int chunkIndex) {
    return new CrossReference(relation, sourceId, chunkIndex, Direction.BACK);
  }

  public static CrossReference external(String relation, String targetId) {
    return new CrossReference(relation, targetId, -1, Direction.EXTERNAL);
  }
}
