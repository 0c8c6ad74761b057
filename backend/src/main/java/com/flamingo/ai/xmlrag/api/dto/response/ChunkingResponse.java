package com.flamingo.ai.xmlrag.api.dto.response;

import com.flamingo.ai.xmlrag.service.xml.model.ChunkingResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunk sequence. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkingResponse {

  private String mode;
  private int chunkCount;
  private List<ChunkResponse> chunks;
  private List<DiagnosticResponse> diagnostics;

  public static ChunkingResponse fromResult(ChunkingResult result) {
    return ChunkingResponse.builder()
        .mode(result.mode().name())
        .chunkCount(result.chunks().size())
        .chunks(result.chunks().stream().map(ChunkResponse::fromChunk).toList())
        .diagnostics(DiagnosticResponse.fromDiagnostics(result.diagnostics()))
        .build();
  }
}
