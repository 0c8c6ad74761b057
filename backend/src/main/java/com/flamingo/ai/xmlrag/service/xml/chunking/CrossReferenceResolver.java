package com.flamingo.ai.xmlrag.service.xml.chunking;

import com.flamingo.ai.xmlrag.service.xml.model.Chunk;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingResult;
import com.flamingo.ai.xmlrag.service.xml.model.CrossReference;
import com.flamingo.ai.xmlrag.service.xml.model.DeclaredReference;
import com.flamingo.ai.xmlrag.service.xml.model.Diagnostic;
import com.flamingo.ai.xmlrag.service.xml.model.DiagnosticKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns the declared references of a chunk sequence into links between chunk indices.
 *
 * <p>For every declared reference whose target identifier belongs to a chunk of the same
 * sequence, the referring chunk gets a {@link CrossReference.Direction#FORWARD} link and the target
 * gets a matching {@link CrossReference.Direction#BACK} link. When several chunks carry the same
 * identifier the first one wins. Targets outside the sequence are kept as {@link
 * CrossReference.Direction#EXTERNAL} links and reported as {@link
 * DiagnosticKind#UNRESOLVED_REFERENCE}; they are expected for exports of partial data sets.
 */
@Service
@Slf4j
public class CrossReferenceResolver {

  public ChunkingResult resolve(ChunkingResult result) {
    List<Diagnostic> diagnostics = new ArrayList<>(result.diagnostics());
    List<Chunk> chunks = resolve(result.chunks(), diagnostics);
    return new ChunkingResult(chunks, result.mode(), diagnostics);
  }

  /**
   * Resolves references of {@code chunks}, appending a diagnostic to {@code diagnostics} for every
   * reference that points outside the sequence.
   */
  public List<Chunk> resolve(List<Chunk> chunks, List<Diagnostic> diagnostics) {
    Map<String, Integer> byIdentifier = new HashMap<>();
    List<List<CrossReference>> links = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      if (chunk.identifier() != null) {
        byIdentifier.putIfAbsent(chunk.identifier(), chunk.index());
      }
      links.add(new ArrayList<>());
    }

    int resolved = 0;
    int external = 0;
    for (Chunk chunk : chunks) {
      for (DeclaredReference declared : chunk.declaredReferences()) {
        Integer target = byIdentifier.get(declared.targetId());
        if (target == null) {
          links
              .get(chunk.index())
              .add(CrossReference.external(declared.relation(), declared.targetId()));
          diagnostics.add(
              Diagnostic.of(
                  DiagnosticKind.UNRESOLVED_REFERENCE,
                  chunk.chunkId(),
                  declared.relation() + " -> " + declared.targetId() + " is not in this document"));
          external++;
          continue;
        }
        links
            .get(chunk.index())
            .add(CrossReference.forward(declared.relation(), declared.targetId(), target));
        String sourceId = chunk.identifier() != null ? chunk.identifier() : chunk.chunkId();
        links.get(target).add(CrossReference.back(declared.relation(), sourceId, chunk.index()));
        resolved++;
      }
    }

    List<Chunk> linked = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      linked.add(chunk.toBuilder().references(links.get(chunk.index())).build());
    }
    log.debug("Resolved {} references, {} external", resolved, external);
    return linked;
  }
}
