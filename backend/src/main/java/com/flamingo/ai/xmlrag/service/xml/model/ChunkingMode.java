package com.flamingo.ai.xmlrag.service.xml.model;

/** How a chunk sequence was cut. */
public enum ChunkingMode {
  /** Boundaries came from the handler's structural hints. */
  HINTED,
  /** Boundaries came from the configured target depth. */
  STRUCTURAL
}
