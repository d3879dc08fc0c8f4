package com.flamingo.ai.stylecheck.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for style-guide ingestion and document correction. */
@Configuration
@ConfigurationProperties(prefix = "style")
@Getter
@Setter
public class StyleCheckConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Correction correction = new Correction();
  private Embedding embedding = new Embedding();
  private Cli cli = new Cli();

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum characters per chunk; a single longer sentence is kept whole. */
    private int maxChunkSize = 500;

    /** Style-guide chunks shorter than this are not indexed. */
    private int minStyleChunkLength = 50;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 3;

    /** Squared-L2 acceptance threshold for raw (un-normalised) rule embeddings. */
    private double ruleDistanceThreshold = 100.0;

    /** Squared-L2 acceptance threshold for normalised chunk embeddings. */
    private double chunkDistanceThreshold = 1.5;

    /** Matches below this confidence are never applied automatically. */
    private double minConfidence = 0.1;
  }

  @Getter
  @Setter
  public static class Correction {
    /** Correct chunks on the correction executor instead of the calling thread. */
    private boolean parallel = false;

    /** Chunks submitted to the correction executor but not yet collected. */
    private int maxInFlight = 64;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Embedding provider: "local" (in-process all-MiniLM-L6-v2) or "openai". */
    private String provider = "local";
  }

  @Getter
  @Setter
  public static class Cli {
    private boolean enabled = true;
  }
}
