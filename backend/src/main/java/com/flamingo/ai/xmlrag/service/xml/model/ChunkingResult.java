package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.List;

/**
 * Ordered chunk sequence of one document together with how it was produced.
 *
 * @param chunks chunks in final order; {@code chunks.get(i).index() == i}
 * @param mode whether hints or the structural fallback drove the boundaries
 * @param diagnostics degradations met while chunking (unmatched hints, oversized leaves,
 *     unresolved references, …)
 */
public record ChunkingResult(
    List<Chunk> chunks, ChunkingMode mode, List<Diagnostic> diagnostics) {

  public ChunkingResult {
    chunks = List.copyOf(chunks);
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
