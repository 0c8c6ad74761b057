package com.flamingo.ai.xmlrag.service.xml.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.xmlrag.service.xml.TestDocuments;
import com.flamingo.ai.xmlrag.service.xml.model.BoundaryHint;
import com.flamingo.ai.xmlrag.service.xml.model.Chunk;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingMode;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingOptions;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingResult;
import com.flamingo.ai.xmlrag.service.xml.model.CrossReference;
import com.flamingo.ai.xmlrag.service.xml.model.DiagnosticKind;
import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.ReferenceHint;
import com.flamingo.ai.xmlrag.service.xml.model.StructuralHints;
import com.flamingo.ai.xmlrag.service.xml.model.XmlElement;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HierarchicalXmlChunker Tests")
class HierarchicalXmlChunkerTest {

  private static final StructuralHints RECORD_HINTS =
      new StructuralHints(
          List.of(
              new BoundaryHint("records/record", "record", "@id"),
              new BoundaryHint("records/annotation", "annotation", null)),
          List.of(new ReferenceHint("records/annotation", "@ref", "annotates", true)));

  private HierarchicalXmlChunker chunker;
  private CrossReferenceResolver resolver;

  @BeforeEach
  void setUp() {
    chunker = new HierarchicalXmlChunker();
    resolver = new CrossReferenceResolver();
  }

  @Nested
  @DisplayName("Hinted mode")
  class HintedMode {

    @Test
    @DisplayName("should place a record's annotations right after it and link them back")
    void shouldGroupAnnotationsWithTheirRecord() {
      ParsedDocument doc =
          TestDocuments.parse(
              "<records>"
                  + "<record id=\"R1\"><title>First record</title><body>Alpha body.</body></record>"
                  + "<annotation ref=\"R1\">Note one on R1.</annotation>"
                  + "<annotation ref=\"R1\">Note two on R1.</annotation>"
                  + "<annotation ref=\"R1\">Note three on R1.</annotation>"
                  + "<record id=\"R2\"><title>Second record</title><body>Beta body.</body></record>"
                  + "</records>");

      ChunkingResult result =
          resolver.resolve(chunker.chunk(doc, RECORD_HINTS, ChunkingOptions.defaults()));

      List<Chunk> chunks = result.chunks();
      assertThat(result.mode()).isEqualTo(ChunkingMode.HINTED);
      assertThat(chunks).extracting(Chunk::kind)
          .containsExactly("record", "annotation", "annotation", "annotation", "record");
      assertThat(chunks.get(0).identifier()).isEqualTo("R1");
      assertThat(chunks.get(4).identifier()).isEqualTo("R2");
      assertThat(chunks.subList(1, 4)).extracting(Chunk::text)
          .containsExactly("Note one on R1.", "Note two on R1.", "Note three on R1.");
      for (Chunk annotation : chunks.subList(1, 4)) {
        assertThat(annotation.referenceIndex()).containsEntry("annotates", List.of(0));
      }
      assertThat(chunks.get(0).backReferences())
          .extracting(CrossReference::chunkIndex)
          .containsExactly(1, 2, 3);
      assertThat(chunks.get(4).references()).isEmpty();
    }

    @Test
    @DisplayName("should move annotations that appear later in the document up to their record")
    void shouldReorderStablyAcrossTheDocument() {
      ParsedDocument doc =
          TestDocuments.parse(
              "<records>"
                  + "<record id=\"R1\">First record</record>"
                  + "<record id=\"R2\">Second record</record>"
                  + "<annotation ref=\"R1\">a1</annotation>"
                  + "<annotation ref=\"R2\">b1</annotation>"
                  + "<annotation ref=\"R1\">a2</annotation>"
                  + "</records>");

      List<Chunk> chunks = chunker.chunk(doc, RECORD_HINTS, ChunkingOptions.defaults()).chunks();

      assertThat(chunks).extracting(Chunk::text)
          .containsExactly("First record", "a1", "a2", "Second record", "b1");
      assertThat(chunks).extracting(Chunk::index).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("should keep nested groups together and leave cycles in document order")
    void shouldHandleNestedGroupsAndCycles() {
      StructuralHints hints =
          new StructuralHints(
              List.of(new BoundaryHint("items/item", "item", "@id")),
              List.of(new ReferenceHint("items/item", "@parent", "child-of", true)));

      ParsedDocument nested =
          TestDocuments.parse(
              "<items>"
                  + "<item id=\"P\">Parent</item>"
                  + "<item id=\"X\">Other</item>"
                  + "<item id=\"C1\" parent=\"P\">Child</item>"
                  + "<item id=\"G1\" parent=\"C1\">Grandchild</item>"
                  + "<item id=\"C2\" parent=\"P\">Second child</item>"
                  + "</items>");
      ParsedDocument cyclic =
          TestDocuments.parse(
              "<items>"
                  + "<item id=\"A\" parent=\"B\">Alpha</item>"
                  + "<item id=\"B\" parent=\"A\">Beta</item>"
                  + "<item id=\"S\" parent=\"S\">Self</item>"
                  + "<item id=\"E\">Epsilon</item>"
                  + "</items>");

      assertThat(chunker.chunk(nested, hints, ChunkingOptions.defaults()).chunks())
          .extracting(Chunk::identifier)
          .containsExactly("P", "C1", "G1", "C2", "X");
      assertThat(chunker.chunk(cyclic, hints, ChunkingOptions.defaults()).chunks())
          .extracting(Chunk::identifier)
          .containsExactly("A", "B", "S", "E");
    }

    @Test
    @DisplayName("outermost boundary should win and content outside boundaries becomes context")
    void shouldKeepContextAndPreferOutermostBoundary() {
      StructuralHints hints =
          new StructuralHints(
              List.of(
                  new BoundaryHint("//chapter", "chapter", "@id"),
                  new BoundaryHint("//section", "section", null)),
              List.of());
      ParsedDocument doc =
          TestDocuments.parse(
              "<book><title>Guide</title>"
                  + "<chapter id=\"c1\"><title>One</title><section>Nested text</section></chapter>"
                  + "<appendix>Extra notes</appendix></book>");

      List<Chunk> chunks = chunker.chunk(doc, hints, ChunkingOptions.defaults()).chunks();

      assertThat(chunks).extracting(Chunk::kind).containsExactly("context", "chapter", "context");
      assertThat(chunks).extracting(Chunk::text)
          .containsExactly("Guide", "One Nested text", "Extra notes");
      assertThat(chunks.get(1).sourcePath()).isEqualTo("book/chapter");
    }

    @Test
    @DisplayName("should fall back to structural mode when no boundary matches")
    void shouldFallBackWhenHintsMatchNothing() {
      StructuralHints hints =
          new StructuralHints(List.of(new BoundaryHint("nowhere/none", "x", null)), List.of());
      ParsedDocument doc = TestDocuments.parse("<doc><part><p>Some text here</p></part></doc>");

      ChunkingResult result = chunker.chunk(doc, hints, ChunkingOptions.defaults());

      assertThat(result.mode()).isEqualTo(ChunkingMode.STRUCTURAL);
      assertThat(result.chunks()).extracting(Chunk::kind).containsExactly("section");
      assertThat(result.diagnostics())
          .extracting(d -> d.kind())
          .containsExactly(DiagnosticKind.HINTS_NOT_FOUND);
    }
  }

  @Nested
  @DisplayName("Structural mode")
  class StructuralMode {

    @Test
    @DisplayName("should merge small units into a sibling while staying under the maximum")
    void shouldMergeSmallSiblings() {
      String longNote = "L".repeat(100);
      ParsedDocument doc =
          TestDocuments.parse(
              "<notes><note>Tiny</note><note>"
                  + longNote
                  + "</note><note>Also tiny</note></notes>");

      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(1, 20, 110)).chunks();

      assertThat(chunks).extracting(Chunk::text)
          .containsExactly("Tiny\n" + longNote, "Also tiny");
    }

    @Test
    @DisplayName("a small unit should merge into the preceding chunk at the same level")
    void shouldMergeSmallUnitsAcrossParentsAtSameLevel() {
      String big = "x".repeat(95);
      ParsedDocument doc =
          TestDocuments.parse(
              "<r><a><x>"
                  + big
                  + "</x><y>tiny</y></a><b><z>"
                  + big
                  + "</z></b><c><w>sm</w></c></r>");

      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(2, 80, 100)).chunks();

      assertThat(chunks).extracting(Chunk::text)
          .containsExactly(big + "\ntiny", big + "\nsm");
      assertThat(chunks).extracting(Chunk::sourcePath).containsExactly("r/a/x", "r/b/z");
    }

    @Test
    @DisplayName("a small unit should stay on its own when merging would exceed the maximum")
    void shouldKeepSmallUnitWhenMergeWouldOverflow() {
      String big = "x".repeat(95);
      ParsedDocument doc =
          TestDocuments.parse("<r><a><x>" + big + "</x></a><b><w>sm</w></b></r>");

      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(2, 80, 96)).chunks();

      assertThat(chunks).extracting(Chunk::text).containsExactly(big, "sm");
    }

    @Test
    @DisplayName("units at different levels should not merge")
    void shouldNotMergeAcrossLevels() {
      ParsedDocument doc =
          TestDocuments.parse("<doc><meta>m</meta><body><p>para</p><p>more</p></body></doc>");

      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), ChunkingOptions.defaults()).chunks();

      assertThat(chunks).extracting(Chunk::text).containsExactly("m", "para\nmore");
      assertThat(chunks).extracting(Chunk::sourcePath).containsExactly("doc/meta", "doc/body/p");
    }

    @Test
    @DisplayName("shallow leaves and ancestor text should become units of their own")
    void shouldKeepShallowContent() {
      ParsedDocument doc =
          TestDocuments.parse("<doc>Intro text<meta>m</meta><body><p>para</p></body></doc>");

      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(2, 0, 3500)).chunks();

      assertThat(chunks).extracting(Chunk::text).containsExactly("Intro text", "m", "para");
      assertThat(chunks).allSatisfy(c -> assertThat(c.kind()).isEqualTo("section"));
    }

    @Test
    @DisplayName("an empty root should yield no chunks")
    void emptyRootYieldsNoChunks() {
      ChunkingResult result =
          chunker.chunk(
              TestDocuments.parse("<root/>"), StructuralHints.none(), ChunkingOptions.defaults());

      assertThat(result.isEmpty()).isTrue();
      assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("elements without text should not produce blank chunks")
    void shouldSkipBlankContent() {
      ParsedDocument doc =
          TestDocuments.parse("<doc><a><b/><c>  </c></a><d><e>text</e></d></doc>");

      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), ChunkingOptions.defaults()).chunks();

      assertThat(chunks).extracting(Chunk::text).containsExactly("text");
    }
  }

  @Nested
  @DisplayName("Splitting")
  class Splitting {

    @Test
    @DisplayName("a section three times the maximum should split into whole-element pieces")
    void shouldSplitOversizedSection() {
      List<String> paragraphs =
          IntStream.range(0, 6)
              .mapToObj(i -> String.format("Paragraph %02d %s", i, "x".repeat(37)))
              .toList();
      String body =
          paragraphs.stream().map(p -> "<p>" + p + "</p>").collect(Collectors.joining());
      ParsedDocument doc = TestDocuments.parse("<doc><section>" + body + "</section></doc>");
      XmlElement section = doc.elementsAt("doc/section").get(0);
      assertThat(section.textLength()).isGreaterThanOrEqualTo(300);

      ChunkingResult result =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(1, 0, 100));

      assertThat(result.chunks()).hasSizeGreaterThanOrEqualTo(3);
      assertThat(result.chunks())
          .allSatisfy(
              c -> {
                assertThat(c.text().length()).isLessThanOrEqualTo(100);
                assertThat(paragraphs).contains(c.text());
                assertThat(c.kind()).isEqualTo("section");
              });
      assertThat(result.chunks()).extracting(Chunk::text).containsExactlyElementsOf(paragraphs);
      assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("an oversized leaf should be emitted whole and reported")
    void shouldReportOversizedLeaf() {
      String huge = "y".repeat(250);
      ParsedDocument doc =
          TestDocuments.parse("<doc><section><p>" + huge + "</p></section></doc>");

      ChunkingResult result =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(1, 0, 100));

      assertThat(result.chunks()).extracting(Chunk::text).containsExactly(huge);
      assertThat(result.diagnostics())
          .singleElement()
          .satisfies(
              d -> {
                assertThat(d.kind()).isEqualTo(DiagnosticKind.OVERSIZED_ELEMENT);
                assertThat(d.source()).isEqualTo("doc/section/p");
              });
    }

    @Test
    @DisplayName("split pieces should stay contiguous with identity on the first piece")
    void splitPiecesStayContiguous() {
      String field = "f".repeat(52);
      ParsedDocument doc =
          TestDocuments.parse(
              "<records><record id=\"R1\">"
                  + "<a>Field 1 "
                  + field
                  + "</a><b>Field 2 "
                  + field
                  + "</b><c>Field 3 "
                  + field
                  + "</c></record>"
                  + "<record id=\"R2\">Short</record>"
                  + "<annotation ref=\"R1\">About R1</annotation>"
                  + "</records>");

      ChunkingResult result =
          resolver.resolve(chunker.chunk(doc, RECORD_HINTS, new ChunkingOptions(2, 0, 100)));

      List<Chunk> chunks = result.chunks();
      assertThat(chunks).extracting(Chunk::identifier)
          .containsExactly("R1", null, null, null, "R2");
      assertThat(chunks).extracting(Chunk::kind)
          .containsExactly("record", "record", "record", "annotation", "record");
      assertThat(chunks.get(3).referenceIndex()).containsEntry("annotates", List.of(0));
    }
  }

  @Nested
  @DisplayName("Chunk metadata")
  class Metadata {

    private final ParsedDocument doc =
        TestDocuments.parse(
            "<book id=\"b1\"><chapter name=\"Intro\"><section>"
                + "<p>one two three four five six seven eight nine ten</p>"
                + "</section></chapter></book>");

    @Test
    @DisplayName("should estimate 1.3 tokens per word of chunk text")
    void shouldEstimateTokens() {
      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(3, 0, 3500)).chunks();

      assertThat(chunks).extracting(Chunk::tokenEstimate).containsExactly(13);
      assertThat(Chunk.estimateTokens("  ")).isZero();
      assertThat(Chunk.estimateTokens("two words")).isEqualTo(2);
    }

    @Test
    @DisplayName("should describe the enclosing elements as a breadcrumb")
    void shouldBuildParentBreadcrumb() {
      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(3, 0, 3500)).chunks();

      assertThat(chunks).singleElement()
          .satisfies(
              c -> {
                assertThat(c.sourcePath()).isEqualTo("book/chapter/section/p");
                assertThat(c.parentContext())
                    .isEqualTo("book[id=b1] > chapter[name=Intro] > section");
              });
    }

    @Test
    @DisplayName("should leave the breadcrumb out when disabled or when the chunk is the root")
    void shouldOmitBreadcrumb() {
      ChunkingOptions withoutContext =
          new ChunkingOptions(3, 0, 3500).withIncludeParentContext(false);

      assertThat(chunker.chunk(doc, StructuralHints.none(), withoutContext).chunks())
          .extracting(Chunk::parentContext)
          .containsOnlyNulls();
      assertThat(
              chunker
                  .chunk(
                      TestDocuments.parse("<note>just text</note>"),
                      StructuralHints.none(),
                      ChunkingOptions.defaults())
                  .chunks())
          .extracting(Chunk::parentContext)
          .containsExactly((String) null);
    }

    @Test
    @DisplayName("split pieces should each carry the breadcrumb of their own first element")
    void splitPiecesCarryTheirOwnBreadcrumb() {
      String para = "w ".repeat(30).trim();
      ParsedDocument book =
          TestDocuments.parse(
              "<book><chapter id=\"c1\"><p>" + para + "</p><p>" + para + "</p></chapter></book>");

      List<Chunk> chunks =
          chunker.chunk(book, StructuralHints.none(), new ChunkingOptions(1, 0, 80)).chunks();

      assertThat(chunks).hasSize(2)
          .allSatisfy(c -> assertThat(c.parentContext()).isEqualTo("book > chapter[id=c1]"));
    }

    @Test
    @DisplayName("unset overrides should keep the breadcrumb setting of the defaults")
    void overridesKeepBreadcrumbSetting() {
      ChunkingOptions off = ChunkingOptions.defaults().withIncludeParentContext(false);

      assertThat(off.override(3, null, null).includeParentContext()).isFalse();
      assertThat(off.override(null, null, null, true).includeParentContext()).isTrue();
      assertThat(ChunkingOptions.defaults().includeParentContext()).isTrue();
    }
  }

  @Nested
  @DisplayName("Whole-document guarantees")
  class Guarantees {

    private final ParsedDocument doc = TestDocuments.parseFixture("docbook-article.xml");

    @Test
    @DisplayName("chunking the same document twice should give identical results")
    void chunkingIsIdempotent() {
      ChunkingOptions options = new ChunkingOptions(2, 10, 60);

      assertThat(chunker.chunk(doc, StructuralHints.none(), options))
          .isEqualTo(chunker.chunk(doc, StructuralHints.none(), options));
    }

    @Test
    @DisplayName("every leaf text should appear in some chunk")
    void noLeafTextIsLost() {
      String all =
          chunker.chunk(doc, StructuralHints.none(), new ChunkingOptions(1, 0, 40)).chunks()
              .stream()
              .map(Chunk::text)
              .collect(Collectors.joining("\n"));

      for (XmlElement element : doc.elements()) {
        if (element.hasText()) {
          assertThat(all).contains(element.text());
        }
      }
    }

    @Test
    @DisplayName("chunk ids should combine the index with a digest of the text")
    void chunkIdsAreDerivedFromContent() {
      List<Chunk> chunks =
          chunker.chunk(doc, StructuralHints.none(), ChunkingOptions.defaults()).chunks();

      assertThat(chunks).isNotEmpty();
      for (Chunk chunk : chunks) {
        assertThat(chunk.chunkId()).matches("chunk_" + chunk.index() + "_[0-9a-f]{8}");
        assertThat(chunk.chunkId())
            .isEqualTo(HierarchicalXmlChunker.chunkId(chunk.index(), chunk.text()));
      }
    }
  }
}
