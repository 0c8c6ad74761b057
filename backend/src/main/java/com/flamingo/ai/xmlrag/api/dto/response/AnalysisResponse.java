package com.flamingo.ai.xmlrag.api.dto.response;

import com.flamingo.ai.xmlrag.service.xml.model.AnalysisResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for classification plus extraction. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

  private ClassificationResponse classification;
  private SummaryResponse summary;

  public static AnalysisResponse fromResult(AnalysisResult result) {
    return AnalysisResponse.builder()
        .classification(ClassificationResponse.fromResult(result.classification()))
        .summary(SummaryResponse.fromRecord(result.summary()))
        .build();
  }
}
