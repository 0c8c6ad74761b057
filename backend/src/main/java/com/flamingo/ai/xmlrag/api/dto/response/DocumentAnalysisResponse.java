package com.flamingo.ai.xmlrag.api.dto.response;

import com.flamingo.ai.xmlrag.service.xml.model.DocumentAnalysis;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the full pipeline output. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentAnalysisResponse {

  private ClassificationResponse classification;
  private SummaryResponse summary;
  private ChunkingResponse chunking;
  private List<DiagnosticResponse> diagnostics;

  public static DocumentAnalysisResponse fromAnalysis(DocumentAnalysis analysis) {
    return DocumentAnalysisResponse.builder()
        .classification(ClassificationResponse.fromResult(analysis.classification()))
        .summary(SummaryResponse.fromRecord(analysis.summary()))
        .chunking(ChunkingResponse.fromResult(analysis.chunking()))
        .diagnostics(DiagnosticResponse.fromDiagnostics(analysis.diagnostics()))
        .build();
  }
}
