package com.flamingo.ai.xmlrag.config;

import com.flamingo.ai.xmlrag.service.xml.model.ChunkingOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the XML classification and chunking pipeline. */
@Configuration
@ConfigurationProperties(prefix = "xmlrag")
@Getter
@Setter
public class XmlRagConfig {

  private Parsing parsing = new Parsing();
  private Dispatch dispatch = new Dispatch();
  private Chunking chunking = new Chunking();

  @Getter
  @Setter
  public static class Parsing {
    /** Inputs larger than this are rejected before parsing. */
    private long maxDocumentBytes = 100L * 1024 * 1024; // 100 MB

    /** Documents nesting elements deeper than this are rejected; 0 disables the check. */
    private int maxElementDepth = 1000;
  }

  @Getter
  @Setter
  public static class Dispatch {
    /** Decimal places detection scores are rounded to before they are compared. */
    private int scoreScale = 6;
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Depth (root = 0) whose elements become chunks when no hints apply. */
    private int targetDepth = ChunkingOptions.DEFAULT_TARGET_DEPTH;

    /** Structural chunks shorter than this are merged into a neighbour at the same level. */
    private int minChunkChars = ChunkingOptions.DEFAULT_MIN_CHUNK_CHARS;

    /** Chunks longer than this are split at the next-deeper element level. */
    private int maxChunkChars = ChunkingOptions.DEFAULT_MAX_CHUNK_CHARS;

    /** Whether chunks carry the breadcrumb of their enclosing elements. */
    private boolean includeParentContext = true;

    public ChunkingOptions toOptions() {
      return new ChunkingOptions(
          targetDepth, minChunkChars, maxChunkChars, includeParentContext);
    }
  }
}
