package com.flamingo.ai.xmlrag.service.xml.chunking;

import com.flamingo.ai.xmlrag.service.xml.model.ChunkingOptions;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingResult;
import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.StructuralHints;

/** Splits a parsed document into an ordered sequence of chunks. */
public interface XmlChunker {

  /**
   * Chunks {@code document}, guided by {@code hints} when they select at least one element.
   *
   * <p>The returned chunks carry their declared references but no resolved cross-references; run
   * {@link CrossReferenceResolver} for those.
   *
   * @param document the parsed document
   * @param hints structural hints of the winning handler, or {@link StructuralHints#none()}
   * @param options size and depth limits
   * @return chunks in final order, never {@code null}
   */
  ChunkingResult chunk(ParsedDocument document, StructuralHints hints, ChunkingOptions options);
}
