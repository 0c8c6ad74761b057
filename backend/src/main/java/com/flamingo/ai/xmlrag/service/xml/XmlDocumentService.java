package com.flamingo.ai.xmlrag.service.xml;

import com.flamingo.ai.xmlrag.config.XmlRagConfig;
import com.flamingo.ai.xmlrag.exception.ExtractionException;
import com.flamingo.ai.xmlrag.exception.UnclassifiedDocumentException;
import com.flamingo.ai.xmlrag.service.xml.chunking.CrossReferenceResolver;
import com.flamingo.ai.xmlrag.service.xml.chunking.XmlChunker;
import com.flamingo.ai.xmlrag.service.xml.classification.ClassificationDispatcher;
import com.flamingo.ai.xmlrag.service.xml.extraction.ExtractionAdapter;
import com.flamingo.ai.xmlrag.service.xml.model.AnalysisResult;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingOptions;
import com.flamingo.ai.xmlrag.service.xml.model.ChunkingResult;
import com.flamingo.ai.xmlrag.service.xml.model.ClassificationResult;
import com.flamingo.ai.xmlrag.service.xml.model.Diagnostic;
import com.flamingo.ai.xmlrag.service.xml.model.DiagnosticKind;
import com.flamingo.ai.xmlrag.service.xml.model.DocumentAnalysis;
import com.flamingo.ai.xmlrag.service.xml.model.ParsedDocument;
import com.flamingo.ai.xmlrag.service.xml.model.StructuralHints;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import com.flamingo.ai.xmlrag.service.xml.parsing.XmlDocumentParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the XML pipeline: parse, classify, extract, chunk and link.
 *
 * <p>The document is parsed once per call; every later step reads the same {@link
 * ParsedDocument}. Chunking degrades instead of failing: an unclassified document is chunked
 * structurally, and a failed extraction still contributes whatever hints it produced. Each such
 * degradation is reported as a {@link Diagnostic} on the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class XmlDocumentService {

  private final XmlDocumentParser parser;
  private final ClassificationDispatcher dispatcher;
  private final ExtractionAdapter extractionAdapter;
  private final XmlChunker chunker;
  private final CrossReferenceResolver resolver;
  private final XmlRagConfig config;
  private final MeterRegistry meterRegistry;

  /** Chunking options built from {@code xmlrag.chunking.*}. */
  public ChunkingOptions defaultOptions() {
    return config.getChunking().toOptions();
  }

  /**
   * Classifies raw XML.
   *
   * @throws com.flamingo.ai.xmlrag.exception.MalformedInputException if the input is not XML
   * @throws UnclassifiedDocumentException if no handler claims the document
   */
  @Timed(value = "xml.classify", description = "Time to parse and classify an XML document")
  public ClassificationResult classify(byte[] xml) {
    return dispatcher.classify(parser.parse(xml));
  }

  public ClassificationResult classify(String xml) {
    return classify(bytes(xml));
  }

  /**
   * Classifies raw XML and extracts the winner's summary.
   *
   * @throws com.flamingo.ai.xmlrag.exception.MalformedInputException if the input is not XML
   * @throws UnclassifiedDocumentException if no handler claims the document
   * @throws ExtractionException if extraction fails; carries the partial summary
   */
  @Timed(value = "xml.analyze", description = "Time to classify and extract an XML document")
  public AnalysisResult analyze(byte[] xml) {
    ParsedDocument document = parser.parse(xml);
    ClassificationResult classification = dispatcher.classify(document);
    SummaryRecord summary = extractionAdapter.extract(classification, document);
    return new AnalysisResult(classification, summary);
  }

  public AnalysisResult analyze(String xml) {
    return analyze(bytes(xml));
  }

  /**
   * Chunks raw XML. Fails only on malformed input.
   *
   * @param xml document bytes
   * @param options chunking options; {@code null} means {@link #defaultOptions()}
   * @return chunks with resolved cross-references and every degradation met on the way
   */
  @Timed(value = "xml.chunk", description = "Time to chunk an XML document")
  public ChunkingResult chunk(byte[] xml, ChunkingOptions options) {
    ParsedDocument document = parser.parse(xml);
    List<Diagnostic> diagnostics = new ArrayList<>();
    StructuralHints hints = StructuralHints.none();
    try {
      ClassificationResult classification = dispatcher.classify(document);
      diagnostics.addAll(classification.diagnostics());
      hints = extractHints(classification, document, diagnostics).hints();
    } catch (UnclassifiedDocumentException e) {
      log.debug("Unclassified document chunked structurally: {}", e.getMessage());
      diagnostics.addAll(e.getDiagnostics());
    }
    ChunkingResult result = chunkAndLink(document, hints, options, diagnostics);
    return new ChunkingResult(result.chunks(), result.mode(), diagnostics);
  }

  public ChunkingResult chunk(String xml, ChunkingOptions options) {
    return chunk(bytes(xml), options);
  }

  /**
   * Runs the full pipeline.
   *
   * @param xml document bytes
   * @param options chunking options; {@code null} means {@link #defaultOptions()}
   * @throws com.flamingo.ai.xmlrag.exception.MalformedInputException if the input is not XML
   * @throws UnclassifiedDocumentException if no handler claims the document
   */
  @Timed(value = "xml.process", description = "Time to run the full XML pipeline")
  public DocumentAnalysis process(byte[] xml, ChunkingOptions options) {
    ParsedDocument document = parser.parse(xml);
    ClassificationResult classification = dispatcher.classify(document);
    List<Diagnostic> diagnostics = new ArrayList<>(classification.diagnostics());
    SummaryRecord summary = extractHints(classification, document, diagnostics);
    ChunkingResult chunking = chunkAndLink(document, summary.hints(), options, diagnostics);
    log.debug(
        "Processed {} document into {} chunks ({} diagnostics)",
        classification.documentType(),
        chunking.chunks().size(),
        diagnostics.size());
    return new DocumentAnalysis(classification, summary, chunking, diagnostics);
  }

  public DocumentAnalysis process(String xml, ChunkingOptions options) {
    return process(bytes(xml), options);
  }

  /** Extracts the summary, falling back to the partial record when extraction fails. */
  private SummaryRecord extractHints(
      ClassificationResult classification,
      ParsedDocument document,
      List<Diagnostic> diagnostics) {
    try {
      return extractionAdapter.extract(classification, document);
    } catch (ExtractionException e) {
      log.warn(
          "Continuing with partial summary from {}: {}", e.getHandlerId(), e.getMessage());
      diagnostics.add(
          Diagnostic.of(DiagnosticKind.PARTIAL_EXTRACTION, e.getHandlerId(), e.getMessage()));
      return e.getPartialSummary();
    }
  }

  private ChunkingResult chunkAndLink(
      ParsedDocument document,
      StructuralHints hints,
      ChunkingOptions options,
      List<Diagnostic> diagnostics) {
    ChunkingOptions effective = options != null ? options : defaultOptions();
    ChunkingResult result = resolver.resolve(chunker.chunk(document, hints, effective));
    diagnostics.addAll(result.diagnostics());
    meterRegistry.summary("xml.chunks.produced").record(result.chunks().size());
    return result;
  }

  private static byte[] bytes(String xml) {
    if (xml == null) {
      throw new IllegalArgumentException("XML text must not be null");
    }
    return xml.getBytes(StandardCharsets.UTF_8);
  }
}
