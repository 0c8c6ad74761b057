package com.flamingo.ai.xmlrag.service.xml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.xmlrag.config.XmlRagConfig;
import com.flamingo.ai.xmlrag.exception.MalformedInputException;
import com.flamingo.ai.xmlrag.exception.UnclassifiedDocumentException;
import com.flamingo.ai.xmlrag.service.xml.chunking.CrossReferenceResolver;
import com.flamingo.ai.xmlrag.service.xml.chunking.HierarchicalXmlChunker;
import com.flamingo.ai.xmlrag.service.xml.classification.ClassificationDispatcher;
import com.flamingo.ai.xmlrag.service.xml.extraction.ExtractionAdapter;
import com.flamingo.ai.xmlrag.service.xml.handler.DetectionResult;
import com.flamingo.ai.xmlrag.service.xml.handler.HandlerDescriptor;
import com.flamingo.ai.xmlrag.service.xml.model.Chunk;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingMode;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingOptions;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingResult;
import com.flamingo.ai.xmlrag.service.xml.model.Diagnostic;
import com.flamingo.ai.xmlrag.service.xml.model.DiagnosticKind;
import com.flamingo.ai.xmlrag.service.xml.model.DocumentAnalysis;
import com.flamingo.ai.xmlrag.service.xml.parsing.XmlDocumentParser;
import com.flamingo.ai.xmlrag.service.xml.registry.HandlerRegistry;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("XmlDocumentService Tests")
class XmlDocumentServiceTest {

  private static final String ORDERS =
      "<orders>"
          + "<order id=\"o-1\">Two chairs for the meeting room</order>"
          + "<order id=\"o-2\">One standing desk</order>"
          + "</orders>";

  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
  }

  private XmlDocumentService service(HandlerRegistry registry) {
    XmlRagConfig config = new XmlRagConfig();
    return new XmlDocumentService(
        new XmlDocumentParser(config),
        new ClassificationDispatcher(registry, config, meterRegistry),
        new ExtractionAdapter(registry, meterRegistry),
        new HierarchicalXmlChunker(),
        new CrossReferenceResolver(),
        config,
        meterRegistry);
  }

  private static HandlerRegistry registryOf(HandlerDescriptor... handlers) {
    HandlerRegistry registry = new HandlerRegistry();
    for (HandlerDescriptor handler : handlers) {
      registry.register(handler);
    }
    registry.seal();
    return registry;
  }

  @Nested
  @DisplayName("With the shipped handlers")
  class Shipped {

    private XmlDocumentService service;

    @BeforeEach
    void setUp() {
      service = service(TestDocuments.shippedRegistry());
    }

    @Test
    @DisplayName("process should classify, summarise, chunk and link in one pass")
    void shouldRunFullPipeline() {
      DocumentAnalysis analysis =
          service.process(TestDocuments.fixture("servicenow-incident.xml"), null);

      assertThat(analysis.classification().documentType()).isEqualTo("servicenow-export");
      assertThat(analysis.summary().field("journalCount")).isEqualTo(3);
      assertThat(analysis.chunks()).hasSize(5);
      assertThat(analysis.chunking().mode()).isEqualTo(ChunkingMode.HINTED);
      assertThat(analysis.diagnostics())
          .extracting(Diagnostic::kind)
          .containsExactly(DiagnosticKind.UNRESOLVED_REFERENCE);

      DistributionSummary produced = meterRegistry.find("xml.chunks.produced").summary();
      assertThat(produced).isNotNull();
      assertThat(produced.count()).isEqualTo(1);
      assertThat(produced.totalAmount()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("an empty root should chunk to nothing without failing")
    void emptyRootChunksToNothing() {
      ChunkingResult result = service.chunk("<root/>", null);

      assertThat(result.chunks()).isEmpty();
      assertThatThrownBy(() -> service.classify("<root/>"))
          .isInstanceOf(UnclassifiedDocumentException.class);
    }

    @Test
    @DisplayName("malformed input should fail every entry point")
    void malformedInputFails() {
      String broken = "<orders><order></orders>";

      assertThatThrownBy(() -> service.chunk(broken, null))
          .isInstanceOf(MalformedInputException.class);
      assertThatThrownBy(() -> service.process(broken, null))
          .isInstanceOf(MalformedInputException.class);
      assertThatThrownBy(() -> service.analyze(broken))
          .isInstanceOf(MalformedInputException.class);
    }

    @Test
    @DisplayName("explicit options should override the configured defaults")
    void explicitOptionsOverrideDefaults() {
      ChunkingResult byDefault = service.chunk(ORDERS, null);
      ChunkingResult custom = service.chunk(ORDERS, new ChunkingOptions(1, 0, 3500));

      assertThat(service.defaultOptions()).isEqualTo(ChunkingOptions.defaults());
      assertThat(byDefault.chunks()).extracting(Chunk::text)
          .containsExactly("Two chairs for the meeting room\nOne standing desk");
      assertThat(custom.chunks()).hasSize(2);
    }

    @Test
    @DisplayName("null text should be rejected as an invalid argument")
    void nullTextIsRejected() {
      assertThatThrownBy(() -> service.classify((String) null))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  @DisplayName("deeply nested input should be rejected as malformed before any handler runs")
  void deepNestingIsRejectedBeforeDispatch() {
    AtomicInteger detections = new AtomicInteger();
    HandlerDescriptor counting =
        new HandlerDescriptor(
            "counting",
            "Counting",
            10,
            doc -> {
              detections.incrementAndGet();
              return DetectionResult.of(0.5, "always");
            },
            (doc, summary) -> {});
    XmlDocumentService service = service(registryOf(counting));
    String deep = "<a>".repeat(5000) + "leaf text" + "</a>".repeat(5000);

    assertThatThrownBy(() -> service.classify(deep)).isInstanceOf(MalformedInputException.class);
    assertThatThrownBy(() -> service.chunk(deep, null))
        .isInstanceOf(MalformedInputException.class);
    assertThatThrownBy(() -> service.process(deep, ChunkingOptions.defaults()))
        .isInstanceOf(MalformedInputException.class);
    assertThat(detections).hasValue(0);
  }

  @Test
  @DisplayName("chunk should fall back to structural mode for unclassified documents")
  void chunkFallsBackWhenUnclassified() {
    XmlDocumentService service =
        service(registryOf(TestDocuments.fixedScore("never", 0.0, 10)));

    ChunkingResult result = service.chunk(ORDERS, new ChunkingOptions(1, 0, 3500));

    assertThat(result.mode()).isEqualTo(ChunkingMode.STRUCTURAL);
    assertThat(result.chunks()).extracting(Chunk::text)
        .containsExactly("Two chairs for the meeting room", "One standing desk");
    assertThatThrownBy(() -> service.process(ORDERS, null))
        .isInstanceOf(UnclassifiedDocumentException.class);
  }

  @Test
  @DisplayName("a failing extraction should still chunk with the hints written before the failure")
  void partialExtractionStillChunks() {
    HandlerDescriptor fragile =
        new HandlerDescriptor(
            "orders",
            "Order Export",
            10,
            doc -> DetectionResult.of(0.9, "root is <orders>"),
            (doc, summary) -> {
              summary.field("orderCount", 2).boundary("orders/order", "order", "@id");
              throw new IllegalStateException("totals element missing");
            });
    XmlDocumentService service = service(registryOf(fragile));

    DocumentAnalysis analysis = service.process(ORDERS, null);

    assertThat(analysis.summary().field("orderCount")).isEqualTo(2);
    assertThat(analysis.chunking().mode()).isEqualTo(ChunkingMode.HINTED);
    assertThat(analysis.chunks()).extracting(Chunk::identifier).containsExactly("o-1", "o-2");
    assertThat(analysis.diagnostics())
        .singleElement()
        .satisfies(
            d -> {
              assertThat(d.kind()).isEqualTo(DiagnosticKind.PARTIAL_EXTRACTION);
              assertThat(d.source()).isEqualTo("orders");
            });
    assertThat(meterRegistry.counter("xml.extraction.partial", "handler", "orders").count())
        .isEqualTo(1.0);
  }
}
