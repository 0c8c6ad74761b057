package com.flamingo.ai.xmlrag.api.dto.response;

import com.flamingo.ai.xmlrag.service.xml.model.Chunk;
import com.flamingo.ai.xmlrag.service.xml.model.CrossReference;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a single chunk with its resolved links. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private int index;
  private String chunkId;
  private String sourcePath;
  private String kind;
  private String text;
  private String identifier;
  private int tokenEstimate;
  private String parentContext;
  private Map<String, List<Integer>> referenceIndex;
  private List<CrossReference> references;

  public static ChunkResponse fromChunk(Chunk chunk) {
    return ChunkResponse.builder()
        .index(chunk.index())
        .chunkId(chunk.chunkId())
        .sourcePath(chunk.sourcePath())
        .kind(chunk.kind())
        .text(chunk.text())
        .identifier(chunk.identifier())
        .tokenEstimate(chunk.tokenEstimate())
        .parentContext(chunk.parentContext())
        .referenceIndex(chunk.referenceIndex())
        .references(chunk.references())
        .build();
  }
}
