package com.flamingo.ai.xmlrag.service.xml.chunking;

import com.flamingo.ai.xmlrag.service.xml.model.BoundaryHint;
import com.flamingo.ai.xmlrag.service.xml.model.Chunk;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingMode;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingOptions;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingResult;
import com.flamingo.ai.xmlrag.service.xml.model.DeclaredReference;
import com.flamingo.ai.xmlrag.service.xml.model.Diagnostic;
import com.flamingo.ai.xmlrag.service.xml.model.DiagnosticKind;
import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.PathPattern;
import com.flamingo.ai.xmlrag.service.xml.model.ReferenceHint;
import com.flamingo.ai.xmlrag.service.xml.model.StructuralHints;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

/**
 * {@link XmlChunker} that cuts chunks along the element tree.
 *
 * <p><b>Hinted mode.</b> Every element matching a boundary hint becomes one chunk holding its whole
 * subtree; boundaries nested inside another boundary stay with the outer one. Content outside all
 * boundaries is collected as {@code context} chunks: subtrees without a boundary are kept whole,
 * ancestors of boundaries contribute their own text only, and small neighbours at the same level
 * are merged. Chunks declared as grouped with a target are then moved to follow that target.
 *
 * <p><b>Structural mode.</b> Used when there are no hints or no hint selects anything. Elements at
 * {@link ChunkingOptions#targetDepth()} become {@code section} chunks, as do leaves above that
 * depth; non-leaf elements above it contribute their own text. A unit shorter than {@link
 * ChunkingOptions#minChunkChars()} is merged with the neighbouring unit at the same tree level,
 * even under a different parent, while the result stays within {@link
 * ChunkingOptions#maxChunkChars()}. When the maximum forbids the merge the small chunk is kept.
 *
 * <p>In both modes chunks over the maximum are split at the next-deeper level afterwards, and
 * chunks with blank text are never emitted. Every chunk carries a token estimate and, unless
 * {@link ChunkingOptions#includeParentContext()} is off, the breadcrumb of its enclosing elements.
 */
@Service
@Slf4j
public class HierarchicalXmlChunker implements XmlChunker {

  static final String SECTION_KIND = "section";
  static final String CONTEXT_KIND = "context";
  static final String BREADCRUMB_SEPARATOR = " > ";

  private final ChunkGrouper grouper = new ChunkGrouper();
  private final ChunkSplitter splitter = new ChunkSplitter();

  @Override
  public ChunkingResult chunk(
      ParsedDocument document, StructuralHints hints, ChunkingOptions options) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    if (document.isEmpty()) {
      log.debug("Document <{}> has no text, no chunks produced", document.root().localName());
      return new ChunkingResult(List.of(), ChunkingMode.STRUCTURAL, diagnostics);
    }

    List<DraftChunk> drafts = null;
    ChunkingMode mode = ChunkingMode.STRUCTURAL;
    if (hints != null && !hints.isEmpty()) {
      drafts = hintedDrafts(document, hints, options);
      if (drafts == null) {
        diagnostics.add(
            Diagnostic.of(
                DiagnosticKind.HINTS_NOT_FOUND,
                document.root().path(),
                "No element matched any of "
                    + hints.boundaries().size()
                    + " boundary hints, falling back to structural chunking"));
        log.info("Boundary hints matched nothing, using structural chunking");
      } else {
        drafts = grouper.reorder(drafts);
        mode = ChunkingMode.HINTED;
      }
    }
    if (drafts == null) {
      drafts = structuralDrafts(document, options);
    }

    List<DraftChunk> pieces = splitter.split(drafts, options.maxChunkChars(), diagnostics);
    List<Chunk> chunks = new ArrayList<>(pieces.size());
    for (DraftChunk piece : pieces) {
      String text = piece.text();
      if (text.isBlank()) {
        continue;
      }
      int index = chunks.size();
      chunks.add(
          Chunk.builder()
              .index(index)
              .chunkId(chunkId(index, text))
              .sourcePath(piece.sourcePath())
              .kind(piece.kind())
              .text(text)
              .identifier(piece.identifier())
              .declaredReferences(piece.references())
              .tokenEstimate(Chunk.estimateTokens(text))
              .parentContext(
                  options.includeParentContext()
                      ? parentContext(document, piece.firstElement())
                      : null)
              .build());
    }
    log.debug("{} chunking produced {} chunks", mode, chunks.size());
    return new ChunkingResult(chunks, mode, diagnostics);
  }

  /** {@code chunk_<index>_<first 8 hex chars of the MD5 of the text>}. */
  static String chunkId(int index, String text) {
    String digest = DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
    return "chunk_" + index + "_" + digest.substring(0, 8);
  }

  /** Breadcrumb of the ancestors of {@code element}, or {@code null} for the root. */
  static String parentContext(ParsedDocument document, XmlElement element) {
    List<XmlElement> ancestors = document.ancestors(element);
    if (ancestors.isEmpty()) {
      return null;
    }
    List<String> labels = new ArrayList<>(ancestors.size());
    for (XmlElement ancestor : ancestors) {
      labels.add(label(ancestor));
    }
    return String.join(BREADCRUMB_SEPARATOR, labels);
  }

  private static String label(XmlElement element) {
    for (String name : List.of("id", "name")) {
      String value = element.attribute(name);
      if (value != null && !value.isBlank()) {
        return element.localName() + "[" + name + "=" + value + "]";
      }
    }
    return element.localName();
  }

  // ---- hinted mode ----

  /** Returns {@code null} when no boundary hint selects any element. */
  private List<DraftChunk> hintedDrafts(
      ParsedDocument document, StructuralHints hints, ChunkingOptions options) {
    List<BoundaryHint> boundaries = hints.boundaries();
    List<PathPattern> patterns = boundaries.stream().map(BoundaryHint::pattern).toList();

    List<XmlElement> elements = document.elements();
    boolean[] containsBoundary = new boolean[elements.size()];
    boolean matched = false;
    for (XmlElement element : elements) {
      if (boundaryFor(element, patterns) >= 0) {
        matched = true;
        for (int p = element.position(); p >= 0; p = elements.get(p).parentPosition()) {
          if (containsBoundary[p]) {
            break;
          }
          containsBoundary[p] = true;
        }
      }
    }
    if (!matched) {
      return null;
    }

    HintedWalk walk =
        new HintedWalk(boundaries, patterns, hints.references(), containsBoundary, options);
    walk.visit(document.root());
    return walk.finish();
  }

  private static int boundaryFor(XmlElement element, List<PathPattern> patterns) {
    for (int i = 0; i < patterns.size(); i++) {
      if (patterns.get(i).matches(element)) {
        return i;
      }
    }
    return -1;
  }

  private static final class HintedWalk {

    private final List<BoundaryHint> boundaries;
    private final List<PathPattern> patterns;
    private final List<ReferenceHint> references;
    private final List<PathPattern> referencePatterns;
    private final boolean[] containsBoundary;
    private final ChunkingOptions options;
    private final List<DraftChunk> drafts = new ArrayList<>();
    private final List<ChunkUnit> context = new ArrayList<>();

    HintedWalk(
        List<BoundaryHint> boundaries,
        List<PathPattern> patterns,
        List<ReferenceHint> references,
        boolean[] containsBoundary,
        ChunkingOptions options) {
      this.boundaries = boundaries;
      this.patterns = patterns;
      this.references = references;
      this.referencePatterns = references.stream().map(ReferenceHint::pattern).toList();
      this.containsBoundary = containsBoundary;
      this.options = options;
    }

    void visit(XmlElement element) {
      int hint = boundaryFor(element, patterns);
      if (hint >= 0) {
        flushContext();
        drafts.add(boundaryDraft(element, boundaries.get(hint)));
        return;
      }
      if (!containsBoundary[element.position()]) {
        if (element.textLength() > 0) {
          context.add(ChunkUnit.whole(element));
        }
        return;
      }
      if (element.hasText()) {
        context.add(ChunkUnit.ownText(element));
      }
      for (XmlElement child : element.children()) {
        visit(child);
      }
    }

    List<DraftChunk> finish() {
      flushContext();
      return drafts;
    }

    private void flushContext() {
      if (!context.isEmpty()) {
        drafts.addAll(pack(context, options, CONTEXT_KIND, ChunkUnit::groupKey));
        context.clear();
      }
    }

    private DraftChunk boundaryDraft(XmlElement element, BoundaryHint hint) {
      DraftChunk draft = new DraftChunk(hint.kind(), ChunkUnit.whole(element));
      if (hint.identifierPath() != null) {
        draft.identifier(element.value(hint.identifierPath()));
      }
      List<DeclaredReference> declared = new ArrayList<>();
      for (int i = 0; i < references.size(); i++) {
        if (!referencePatterns.get(i).matches(element)) {
          continue;
        }
        ReferenceHint ref = references.get(i);
        for (String target : element.values(ref.valuePath())) {
          declared.add(new DeclaredReference(ref.relation(), target));
          if (ref.groupWithTarget() && draft.groupTarget() == null) {
            draft.groupTarget(target);
          }
        }
      }
      draft.references(declared);
      return draft;
    }
  }

  // ---- structural mode ----

  private static List<DraftChunk> structuralDrafts(
      ParsedDocument document, ChunkingOptions options) {
    List<ChunkUnit> units = new ArrayList<>();
    collectStructural(document.root(), options.targetDepth(), units);
    return pack(units, options, SECTION_KIND, ChunkUnit::level);
  }

  private static void collectStructural(
      XmlElement element, int targetDepth, List<ChunkUnit> units) {
    if (element.depth() >= targetDepth || element.isLeaf()) {
      if (element.textLength() > 0) {
        units.add(ChunkUnit.whole(element));
      }
      return;
    }
    if (element.hasText()) {
      units.add(ChunkUnit.ownText(element));
    }
    for (XmlElement child : element.children()) {
      collectStructural(child, targetDepth, units);
    }
  }

  /**
   * Packs consecutive units into drafts. A unit joins the open draft when both have the same merge
   * key, one of them is below the minimum, and the merged text stays within the maximum.
   */
  static List<DraftChunk> pack(
      List<ChunkUnit> units,
      ChunkingOptions options,
      String kind,
      ToIntFunction<ChunkUnit> mergeKey) {
    List<DraftChunk> drafts = new ArrayList<>();
    DraftChunk current = null;
    int currentGroup = Integer.MIN_VALUE;
    for (ChunkUnit unit : units) {
      if (unit.length() == 0) {
        continue;
      }
      int group = mergeKey.applyAsInt(unit);
      if (current != null
          && group == currentGroup
          && (unit.length() < options.minChunkChars()
              || current.length() < options.minChunkChars())
          && current.lengthWith(unit) <= options.maxChunkChars()) {
        current.add(unit);
        continue;
      }
      current = new DraftChunk(kind, unit);
      currentGroup = group;
      drafts.add(current);
    }
    return drafts;
  }
}
