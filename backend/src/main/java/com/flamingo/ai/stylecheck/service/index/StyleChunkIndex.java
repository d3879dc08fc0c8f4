package com.flamingo.ai.stylecheck.service.index;

import com.flamingo.ai.stylecheck.domain.model.StyleChunk;
import com.flamingo.ai.stylecheck.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Index over style-guide chunks. Vectors are L2-normalised, so squared distances fall in [0, 4]
 * and confidence is {@code 1 - distance / 2}.
 */
public class StyleChunkIndex extends EmbeddingIndex<StyleChunk> {

  private final double distanceThreshold;

  public StyleChunkIndex(
      EmbeddingService embeddingService, MeterRegistry meterRegistry, double distanceThreshold) {
    super(embeddingService, meterRegistry, "chunks");
    this.distanceThreshold = distanceThreshold;
  }

  /**
   * Embeds the chunk content, attaches the normalised vector to the chunk and appends it.
   *
   * @return {@code true} if the chunk was stored
   */
  public boolean addChunk(StyleChunk chunk) {
    float[] vector = embeddingService.embed(chunk.embeddingText());
    if (vector.length == 0) {
      return addPrecomputed(chunk, vector);
    }
    float[] normalized = prepareVector(vector);
    chunk.attachEmbedding(normalized);
    return addPrecomputed(chunk, normalized);
  }

  @Override
  public double distanceThreshold() {
    return distanceThreshold;
  }

  @Override
  public double confidence(double distance) {
    return Math.max(0.0, 1.0 - distance / 2.0);
  }

  @Override
  protected float[] prepareVector(float[] raw) {
    double norm = 0;
    for (float v : raw) {
      norm += v * v;
    }
    norm = Math.sqrt(norm);
    if (norm == 0) {
      return raw;
    }
    float[] normalized = new float[raw.length];
    for (int i = 0; i < raw.length; i++) {
      normalized[i] = (float) (raw[i] / norm);
    }
    return normalized;
  }
}
