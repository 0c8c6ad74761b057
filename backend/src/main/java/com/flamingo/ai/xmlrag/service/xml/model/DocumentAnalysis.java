package com.flamingo.ai.xmlrag.service.xml.model;

import java.util.List;

/**
 * Full pipeline output for one document.
 *
 * @param classification chosen handler and ranking
 * @param summary extracted summary; partial when extraction failed part-way
 * @param chunking ordered chunks with cross-references resolved
 * @param diagnostics every degradation from classification, extraction and chunking
 */
public record DocumentAnalysis(
    ClassificationResult classification,
    SummaryRecord summary,
    ChunkingResult chunking,
    List<Diagnostic> diagnostics) {

  public DocumentAnalysis {
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public List<Chunk> chunks() {
    return chunking.chunks();
  }
}
