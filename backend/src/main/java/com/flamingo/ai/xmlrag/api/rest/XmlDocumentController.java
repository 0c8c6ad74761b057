package com.flamingo.ai.xmlrag.api.rest;

import com.flamingo.ai.xmlrag.api.dto.request.ChunkingOptionsRequest;
import com.flamingo.ai.xmlrag.api.dto.response.AnalysisResponse;
import com.flamingo.ai.xmlrag.api.dto.response.ChunkingResponse;
import com.flamingo.ai.xmlrag.api.dto.response.ClassificationResponse;
import com.flamingo.ai.xmlrag.api.dto.response.DocumentAnalysisResponse;
import com.flamingo.ai.xmlrag.api.dto.response.HandlerResponse;
import com.flamingo.ai.xmlrag.service.xml.XmlDocumentService;
import com.flamingo.ai.xmlrag.service.xml.registry.HandlerRegistry;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for XML classification and chunking. Request bodies are the raw XML document.
 */
@RestController
@RequestMapping("/api/xml")
@RequiredArgsConstructor
public class XmlDocumentController {

  private final XmlDocumentService xmlDocumentService;
  private final HandlerRegistry handlerRegistry;

  /** Classifies a document. */
  @PostMapping("/classify")
  public ResponseEntity<ClassificationResponse> classify(@RequestBody byte[] xml) {
    return ResponseEntity.ok(ClassificationResponse.fromResult(xmlDocumentService.classify(xml)));
  }

  /** Classifies a document and extracts its summary. */
  @PostMapping("/analyze")
  public ResponseEntity<AnalysisResponse> analyze(@RequestBody byte[] xml) {
    return ResponseEntity.ok(AnalysisResponse.fromResult(xmlDocumentService.analyze(xml)));
  }

  /** Chunks a document; never fails for well-formed XML. */
  @PostMapping("/chunks")
  public ResponseEntity<ChunkingResponse> chunk(
      @RequestBody byte[] xml, @Valid @ModelAttribute ChunkingOptionsRequest options) {
    return ResponseEntity.ok(
        ChunkingResponse.fromResult(
            xmlDocumentService.chunk(
                xml, options.applyTo(xmlDocumentService.defaultOptions()))));
  }

  /** Runs the full pipeline. */
  @PostMapping("/process")
  public ResponseEntity<DocumentAnalysisResponse> process(
      @RequestBody byte[] xml, @Valid @ModelAttribute ChunkingOptionsRequest options) {
    return ResponseEntity.ok(
        DocumentAnalysisResponse.fromAnalysis(
            xmlDocumentService.process(
                xml, options.applyTo(xmlDocumentService.defaultOptions()))));
  }

  /** Lists the registered handlers in registration order. */
  @GetMapping("/handlers")
  public ResponseEntity<List<HandlerResponse>> handlers() {
    return ResponseEntity.ok(
        handlerRegistry.all().stream().map(HandlerResponse::fromHandler).toList());
  }
}
