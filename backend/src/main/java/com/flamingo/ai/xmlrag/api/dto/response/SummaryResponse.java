package com.flamingo.ai.xmlrag.api.dto.response;

import com.flamingo.ai.xmlrag.service.xml.model.BoundaryHint;
import com.flamingo.ai.xmlrag.service.xml.model.ReferenceHint;
import com.flamingo.ai.xmlrag.service.xml.model.SummaryRecord;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an extracted summary record and its structural hints. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResponse {

  private String documentType;
  private Map<String, Object> fields;
  private List<BoundaryHint> boundaries;
  private List<ReferenceHint> references;

  public static SummaryResponse fromRecord(SummaryRecord summary) {
    return SummaryResponse.builder()
        .documentType(summary.documentType())
        .fields(summary.fields())
        .boundaries(summary.hints().boundaries())
        .references(summary.hints().references())
        .build();
  }
}
