package com.flamingo.ai.xmlrag.service.xml.model;

/**
 * Tunables of the chunking engine.
 *
 * @param targetDepth depth (root = 0) whose elements become chunks in structural mode
 * @param minChunkChars chunks shorter than this are merged into a neighbouring chunk at the same
 *     level in structural mode
 * @param maxChunkChars chunks longer than this are split at the next-deeper element level
 * @param includeParentContext whether chunks carry the breadcrumb of their enclosing elements
 */
public record ChunkingOptions(
    int targetDepth, int minChunkChars, int maxChunkChars, boolean includeParentContext) {

  public static final int DEFAULT_TARGET_DEPTH = 2;
  public static final int DEFAULT_MIN_CHUNK_CHARS = 80;
  public static final int DEFAULT_MAX_CHUNK_CHARS = 3500;

  public ChunkingOptions {
    if (targetDepth < 1) {
      throw new IllegalArgumentException("targetDepth must be at least 1, was " + targetDepth);
    }
    if (minChunkChars < 0) {
      throw new IllegalArgumentException("minChunkChars must not be negative");
    }
    if (maxChunkChars < 1) {
      throw new IllegalArgumentException("maxChunkChars must be positive");
    }
    if (minChunkChars > maxChunkChars) {
      throw new IllegalArgumentException(
          "minChunkChars (" + minChunkChars + ") exceeds maxChunkChars (" + maxChunkChars + ")");
    }
  }

  /** Options with the parent context breadcrumb switched on. */
  public ChunkingOptions(int targetDepth, int minChunkChars, int maxChunkChars) {
    this(targetDepth, minChunkChars, maxChunkChars, true);
  }

  public static ChunkingOptions defaults() {
    return new ChunkingOptions(
        DEFAULT_TARGET_DEPTH, DEFAULT_MIN_CHUNK_CHARS, DEFAULT_MAX_CHUNK_CHARS);
  }

  public ChunkingOptions withTargetDepth(int value) {
    return new ChunkingOptions(value, minChunkChars, maxChunkChars, includeParentContext);
  }

  public ChunkingOptions withMinChunkChars(int value) {
    return new ChunkingOptions(targetDepth, value, maxChunkChars, includeParentContext);
  }

  /** Lowers {@code minChunkChars} to the new maximum when it would otherwise exceed it. */
  public ChunkingOptions withMaxChunkChars(int value) {
    return new ChunkingOptions(
        targetDepth, Math.min(minChunkChars, value), value, includeParentContext);
  }

  public ChunkingOptions withIncludeParentContext(boolean value) {
    return new ChunkingOptions(targetDepth, minChunkChars, maxChunkChars, value);
  }

  /**
   * Applies each non-null override on top of these options. An inherited minimum larger than an
   * overridden maximum is lowered to that maximum.
   */
  public ChunkingOptions override(
      Integer targetDepth, Integer minChunkChars, Integer maxChunkChars) {
    return override(targetDepth, minChunkChars, maxChunkChars, null);
  }

  public ChunkingOptions override(
      Integer targetDepth,
      Integer minChunkChars,
      Integer maxChunkChars,
      Boolean includeParentContext) {
    int max = maxChunkChars != null ? maxChunkChars : this.maxChunkChars;
    int min = minChunkChars != null ? minChunkChars : Math.min(this.minChunkChars, max);
    return new ChunkingOptions(
        targetDepth != null ? targetDepth : this.targetDepth,
        min,
        max,
        includeParentContext != null ? includeParentContext : this.includeParentContext);
  }
}
