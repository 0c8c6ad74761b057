package com.flamingo.ai.xmlrag.service.xml.chunking;

import com.flamingo.ai.xmlrag.service.xml.model.Diagnostic;
import com.flamingo.ai.xmlrag.service.xml.model.DiagnosticKind;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits drafts longer than the maximum at the next-deeper element level, recursively.
 *
 * <p>Pieces of one draft stay contiguous and in document order. Only the first piece keeps the
 * draft's identifier, declared references and group target. A single element with no children
 * that still exceeds the maximum is emitted whole and reported as {@link
 * DiagnosticKind#OVERSIZED_ELEMENT}.
 */
@Slf4j
final class ChunkSplitter {

  List<DraftChunk> split(List<DraftChunk> drafts, int maxChunkChars, List<Diagnostic> diagnostics) {
    List<DraftChunk> result = new ArrayList<>(drafts.size());
    for (DraftChunk draft : drafts) {
      if (draft.length() <= maxChunkChars) {
        result.add(draft);
      } else {
        result.addAll(splitDraft(draft, maxChunkChars, diagnostics));
      }
    }
    return result;
  }

  private List<DraftChunk> splitDraft(
      DraftChunk draft, int maxChunkChars, List<Diagnostic> diagnostics) {
    List<ChunkUnit> units = new ArrayList<>();
    for (ChunkUnit unit : draft.units()) {
      flatten(unit, maxChunkChars, units, diagnostics);
    }

    List<DraftChunk> pieces = new ArrayList<>();
    DraftChunk current = draft.emptyCopyWithIdentity();
    for (ChunkUnit unit : units) {
      if (!current.isEmpty() && current.lengthWith(unit) > maxChunkChars) {
        pieces.add(current);
        current = new DraftChunk(draft.kind());
      }
      current.add(unit);
    }
    if (!current.isEmpty()) {
      pieces.add(current);
    }
    log.debug(
        "Split {} chars at {} into {} pieces", draft.length(), draft.sourcePath(), pieces.size());
    return pieces;
  }

  private void flatten(
      ChunkUnit unit, int maxChunkChars, List<ChunkUnit> out, List<Diagnostic> diagnostics) {
    if (unit.length() <= maxChunkChars) {
      out.add(unit);
      return;
    }
    if (!unit.canExpand()) {
      diagnostics.add(
          Diagnostic.of(
              DiagnosticKind.OVERSIZED_ELEMENT,
              unit.element().path(),
              "Element text of "
                  + unit.length()
                  + " chars exceeds the "
                  + maxChunkChars
                  + " char limit and cannot be split further"));
      log.warn(
          "Oversized element {} ({} chars) emitted as a single chunk",
          unit.element().path(),
          unit.length());
      out.add(unit);
      return;
    }
    for (ChunkUnit part : unit.expand()) {
      flatten(part, maxChunkChars, out, diagnostics);
    }
  }
}
