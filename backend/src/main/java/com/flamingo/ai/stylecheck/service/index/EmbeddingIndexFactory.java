package com.flamingo.ai.stylecheck.service.index;

import com.flamingo.ai.stylecheck.config.StyleCheckConfig;
import com.flamingo.ai.stylecheck.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Creates empty indexes configured with the retrieval thresholds. One pair per ingestion. */
@Component
@RequiredArgsConstructor
public class EmbeddingIndexFactory {

  private final EmbeddingService embeddingService;
  private final MeterRegistry meterRegistry;
  private final StyleCheckConfig config;

  public StyleRuleIndex newRuleIndex() {
    return new StyleRuleIndex(
        embeddingService, meterRegistry, config.getRetrieval().getRuleDistanceThreshold());
  }

  public StyleChunkIndex newChunkIndex() {
    return new StyleChunkIndex(
        embeddingService, meterRegistry, config.getRetrieval().getChunkDistanceThreshold());
  }
}
