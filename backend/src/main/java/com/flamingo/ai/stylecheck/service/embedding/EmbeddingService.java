package com.flamingo.ai.stylecheck.service.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns text into fixed-length vectors with the configured LangChain4j {@link EmbeddingModel}.
 *
 * <p>Failures never propagate: once retries are exhausted the fallbacks return empty vectors and
 * callers skip the affected items.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // Well below the input limit of every supported model; style rules and chunks are short
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a single text.
   *
   * @param text the text to embed
   * @return embedding vector, or an empty array if embedding failed
   */
  @Timed(value = "style.embedding.embed", description = "Time to embed one text")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  @Retry(name = "embedding")
  public float[] embed(String text) {
    String input = truncate(text, 0);
    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("style.embedding.requests.success", "type", "single").increment();
    return response.content().vector();
  }

  /**
   * Embeds several texts in one model call.
   *
   * @param texts the texts to embed
   * @return one vector per input in the same order, or an empty list if embedding failed
   */
  @Timed(value = "style.embedding.embedBatch", description = "Time to embed a batch")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedAllFallback")
  @Retry(name = "embedding")
  public List<float[]> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), i)));
    }

    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> embeddings = response.content();
    if (embeddings.size() != texts.size()) {
      throw new IllegalStateException(
          String.format(
              "Embedding model returned %d vectors for %d texts", embeddings.size(), texts.size()));
    }

    List<float[]> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(embedding.vector());
    }
    meterRegistry.counter("style.embedding.requests.success", "type", "batch").increment();
    log.debug("Embedded batch of {} texts", texts.size());
    return vectors;
  }

  private String truncate(String text, int position) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        position,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.error("Embedding failed, returning empty vector: {}", t.getMessage());
    meterRegistry.counter("style.embedding.requests.failure", "type", "single").increment();
    return new float[0];
  }

  @SuppressWarnings("unused")
  private List<float[]> embedAllFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("style.embedding.requests.failure", "type", "batch").increment();
    return List.of();
  }
}
