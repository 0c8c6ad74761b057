package com.flamingo.ai.xmlrag.api.dto.response;

import com.flamingo.ai.xmlrag.service.xml.model.ClassificationResult;
import com.flamingo.ai.xmlrag.service.xml.model.HandlerScore;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a classification, including the full ranking. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResponse {

  private String documentType;
  private double confidence;
  private List<RankingEntry> ranking;
  private List<DiagnosticResponse> diagnostics;

  /** One handler's position in the ranking. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class RankingEntry {
    private String handlerId;
    private double score;
    private int priority;
    private List<String> evidence;

    static RankingEntry fromScore(HandlerScore score) {
      return RankingEntry.builder()
          .handlerId(score.handlerId())
          .score(score.score())
          .priority(score.priority())
          .evidence(score.evidence())
          .build();
    }
  }

  public static ClassificationResponse fromResult(ClassificationResult result) {
    return ClassificationResponse.builder()
        .documentType(result.documentType())
        .confidence(result.confidence())
        .ranking(result.ranking().stream().map(RankingEntry::fromScore).toList())
        .diagnostics(DiagnosticResponse.fromDiagnostics(result.diagnostics()))
        .build();
  }
}
