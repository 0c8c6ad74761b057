package com.flamingo.ai.xmlrag.api.dto.request;

import com.flamingo.ai.xmlrag.service.xml.model.ChunkingOptions;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Optional chunking overrides, bound from query parameters. Unset fields keep the configured
 * defaults.
 */
@Data
public class ChunkingOptionsRequest {

  @Min(value = 1, message = "targetDepth must be at least 1")
  private Integer targetDepth;

  @Min(value = 0, message = "minChunkChars must not be negative")
  private Integer minChunkChars;

  @Min(value = 1, message = "maxChunkChars must be positive")
  private Integer maxChunkChars;

  private Boolean includeParentContext;

  /** Applies the set fields on top of {@code defaults}. */
  public ChunkingOptions applyTo(ChunkingOptions defaults) {
    return defaults.override(targetDepth, minChunkChars, maxChunkChars, includeParentContext);
  }
}
