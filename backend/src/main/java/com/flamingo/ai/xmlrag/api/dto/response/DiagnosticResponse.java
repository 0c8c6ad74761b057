package com.flamingo.ai.xmlrag.api.dto.response;

import com.flamingo.ai.xmlrag.service.xml.model.Diagnostic;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a non-fatal processing diagnostic. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticResponse {

  private String kind;
  private String source;
  private String message;

  public static DiagnosticResponse fromDiagnostic(Diagnostic diagnostic) {
    return DiagnosticResponse.builder()
        .kind(diagnostic.kind().name())
        .source(diagnostic.source())
        .message(diagnostic.message())
        .build();
  }

  public static List<DiagnosticResponse> fromDiagnostics(List<Diagnostic> diagnostics) {
    return diagnostics.stream().map(DiagnosticResponse::fromDiagnostic).toList();
  }
}
