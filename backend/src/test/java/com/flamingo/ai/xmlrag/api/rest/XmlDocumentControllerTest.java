package com.flamingo.ai.xmlrag.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.xmlrag.config.XmlRagConfig;
import com.flamingo.ai.xmlrag.exception.ApiError;
import com.flamingo.ai.xmlrag.exception.ExtractionException;
import com.flamingo.ai.xmlrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.xmlrag.service.xml.TestDocuments;
import com.flamingo.ai.xmlrag.service.xml.XmlDocumentService;
import com.flamingo.ai.xmlrag.service.xml.chunking.CrossReferenceResolver;
import com.flamingo.ai.xmlrag.service.xml.chunking.HierarchicalXmlChunker;
import com.flamingo.ai.xmlrag.service.xml.classification.ClassificationDispatcher;
import com.flamingo.ai.xmlrag.service.xml.extraction.ExtractionAdapter;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.parsing.XmlDocumentParser;
import com.flamingo.ai.xmlrag.service.xml.registry.HandlerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("XmlDocumentController Tests")
class XmlDocumentControllerTest {

  private final HandlerRegistry registry = TestDocuments.shippedRegistry();
  private MeterRegistry meterRegistry;

  @Mock private XmlDocumentService stubbedService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
  }

  private MockMvc mockMvc(XmlDocumentService service) {
    return MockMvcBuilders.standaloneSetup(
            new XmlDocumentController(service, registry), new HealthController(registry))
        .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
        .build();
  }

  private static byte[] xml(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Nested
  @DisplayName("Against the shipped handlers")
  class Shipped {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
      XmlRagConfig config = new XmlRagConfig();
      XmlDocumentService service =
          new XmlDocumentService(
              new XmlDocumentParser(config),
              new ClassificationDispatcher(registry, config, meterRegistry),
              new ExtractionAdapter(registry, meterRegistry),
              new HierarchicalXmlChunker(),
              new CrossReferenceResolver(),
              config,
              meterRegistry);
      mockMvc = mockMvc(service);
    }

    @Test
    @DisplayName("Should classify a POM with its full ranking")
    void shouldClassifyPom() throws Exception {
      mockMvc
          .perform(
              post("/api/xml/classify")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(TestDocuments.fixture("pom.xml")))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.documentType").value("maven-pom"))
          .andExpect(jsonPath("$.ranking[0].handlerId").value("maven-pom"))
          .andExpect(jsonPath("$.ranking.length()").value(12));
    }

    @Test
    @DisplayName("Should return the summary of an analysed document")
    void shouldAnalyzeFeed() throws Exception {
      mockMvc
          .perform(
              post("/api/xml/analyze")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(TestDocuments.fixture("rss-feed.xml")))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.classification.documentType").value("rss-atom-feed"))
          .andExpect(jsonPath("$.summary.fields.itemCount").value(2));
    }

    @Test
    @DisplayName("Should chunk a ServiceNow export with linked journal entries")
    void shouldChunkServiceNowExport() throws Exception {
      mockMvc
          .perform(
              post("/api/xml/chunks")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(TestDocuments.fixture("servicenow-incident.xml")))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.mode").value("HINTED"))
          .andExpect(jsonPath("$.chunkCount").value(5))
          .andExpect(jsonPath("$.chunks[1].kind").value("journal"))
          .andExpect(jsonPath("$.chunks[1].referenceIndex.journal[0]").value(0))
          .andExpect(jsonPath("$.diagnostics[0].kind").value("UNRESOLVED_REFERENCE"));
    }

    @Test
    @DisplayName("Should apply chunking options from query parameters")
    void shouldApplyQueryOptions() throws Exception {
      mockMvc
          .perform(
              post("/api/xml/process")
                  .param("targetDepth", "1")
                  .param("minChunkChars", "0")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(xml("<notes><note>first</note><note>second</note></notes>")))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.classification.documentType").value("generic-xml"))
          .andExpect(jsonPath("$.chunking.chunkCount").value(2));
    }

    @Test
    @DisplayName("Should report token estimates and a parent breadcrumb that can be switched off")
    void shouldReportChunkMetadata() throws Exception {
      String notes = "<notes><group name=\"g1\"><note>first entry here</note></group></notes>";
      mockMvc
          .perform(
              post("/api/xml/chunks")
                  .param("minChunkChars", "0")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(xml(notes)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.chunks[0].sourcePath").value("notes/group/note"))
          .andExpect(jsonPath("$.chunks[0].tokenEstimate").value(3))
          .andExpect(jsonPath("$.chunks[0].parentContext").value("notes > group[name=g1]"));

      mockMvc
          .perform(
              post("/api/xml/chunks")
                  .param("minChunkChars", "0")
                  .param("includeParentContext", "false")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(xml(notes)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.chunks[0].tokenEstimate").value(3))
          .andExpect(jsonPath("$.chunks[0].parentContext").doesNotExist());
    }

    @Test
    @DisplayName("Should reject XML nested beyond the depth limit with 400")
    void shouldRejectExcessiveNesting() throws Exception {
      mockMvc
          .perform(
              post("/api/xml/classify")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(xml("<a>".repeat(5000) + "leaf text" + "</a>".repeat(5000))))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.MALFORMED_INPUT));
    }

    @Test
    @DisplayName("Should reject malformed XML with 400")
    void shouldRejectMalformedXml() throws Exception {
      mockMvc
          .perform(
              post("/api/xml/chunks")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(xml("<a><b></a>")))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.MALFORMED_INPUT));
    }

    @Test
    @DisplayName("Should answer 422 for a document no handler claims")
    void shouldRejectUnclassifiedDocument() throws Exception {
      mockMvc
          .perform(
              post("/api/xml/classify")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(xml("<root/>")))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.code").value(ApiError.UNCLASSIFIED_DOCUMENT));
    }

    @Test
    @DisplayName("Should reject out-of-range options with 400")
    void shouldRejectInvalidOptions() throws Exception {
      mockMvc
          .perform(
              post("/api/xml/chunks")
                  .param("maxChunkChars", "0")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(TestDocuments.fixture("pom.xml")))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

      mockMvc
          .perform(
              post("/api/xml/chunks")
                  .param("minChunkChars", "500")
                  .param("maxChunkChars", "100")
                  .contentType(MediaType.APPLICATION_XML)
                  .content(TestDocuments.fixture("pom.xml")))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.INVALID_OPTIONS));
    }

    @Test
    @DisplayName("Should list handlers in registration order")
    void shouldListHandlers() throws Exception {
      mockMvc
          .perform(get("/api/xml/handlers"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.length()").value(12))
          .andExpect(jsonPath("$[0].id").value("servicenow-export"))
          .andExpect(jsonPath("$[11].id").value("generic-xml"))
          .andExpect(jsonPath("$[11].registrationIndex").value(11));
    }

    @Test
    @DisplayName("Health endpoint should report the handler count")
    void shouldReportHealth() throws Exception {
      mockMvc
          .perform(get("/health"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("UP"))
          .andExpect(jsonPath("$.handlers").value(12));
    }
  }

  @Test
  @DisplayName("Should answer 422 when extraction fails")
  void shouldMapExtractionFailure() throws Exception {
    when(stubbedService.analyze(any(byte[].class)))
        .thenThrow(
            new ExtractionException(
                "maven-pom",
                "Extraction by maven-pom failed: boom",
                SummaryRecord.builder("Maven POM").field("groupId", "com.example").build(),
                new IllegalStateException("boom")));

    mockMvc(stubbedService)
        .perform(
            post("/api/xml/analyze").contentType(MediaType.APPLICATION_XML).content(xml("<a/>")))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value(ApiError.EXTRACTION_FAILED))
        .andExpect(jsonPath("$.details").value("Handler: maven-pom"));
  }

  @Test
  @DisplayName("Should answer 500 for unexpected failures and count them")
  void shouldMapUnexpectedFailure() throws Exception {
    when(stubbedService.classify(any(byte[].class)))
        .thenThrow(new IllegalStateException("registry not sealed"));

    mockMvc(stubbedService)
        .perform(
            post("/api/xml/classify").contentType(MediaType.APPLICATION_XML).content(xml("<a/>")))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value(ApiError.INTERNAL_ERROR));

    assertThat(meterRegistry.counter("api_errors_total", "error_type", "internal_error").count())
        .isEqualTo(1.0);
  }
}
