package com.flamingo.ai.stylecheck.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j embedding model. */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  private final StyleCheckConfig styleCheckConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Bean
  public EmbeddingModel embeddingModel() {
    String provider = styleCheckConfig.getEmbedding().getProvider();
    if ("openai".equalsIgnoreCase(provider)) {
      validateApiKey();
      log.info("Using OpenAI embedding model {}", embeddingModelName);
      return OpenAiEmbeddingModel.builder()
          .apiKey(openAiApiKey)
          .modelName(embeddingModelName)
          .dimensions(embeddingDimensions)
          .timeout(Duration.ofSeconds(30))
          .build();
    }
    if (!"local".equalsIgnoreCase(provider)) {
      throw new IllegalStateException("Unknown embedding provider: " + provider);
    }
    log.info("Using in-process all-MiniLM-L6-v2 embedding model");
    return new AllMiniLmL6V2EmbeddingModel();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
