package com.flamingo.ai.stylecheck.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A bounded span of style-guide text indexed for retrieval.
 *
 * <p>The embedding is attached once, when the chunk is added to an index, and keeps its dimension
 * for the lifetime of the chunk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StyleChunk implements StyleGuideEntry {

  private String content;

  /** Coarse label such as "formatting", "terminology" or "general". */
  private String ruleType;

  /** Title of the style-guide section the chunk came from. */
  private String section;

  @Builder.Default private List<String> examples = List.of();

  @Builder.Default private Map<String, Object> metadata = Map.of();

  @JsonProperty
  @Setter(AccessLevel.NONE)
  private float[] embedding;

  /**
   * Attaches the computed embedding.
   *
   * @throws IllegalStateException if a vector of a different dimension is already attached
   */
  public void attachEmbedding(float[] vector) {
    if (embedding != null && embedding.length != vector.length) {
      throw new IllegalStateException(
          String.format(
              "Embedding dimension is fixed at %d, refusing %d", embedding.length, vector.length));
    }
    this.embedding = vector;
  }

  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  @Override
  public String triggerText() {
    return content;
  }

  @Override
  public String embeddingText() {
    return content;
  }

  @Override
  public String label() {
    String prefix = section == null || section.isBlank() ? "" : section + ": ";
    String text = content.length() > 80 ? content.substring(0, 80) + "..." : content;
    return prefix + text;
  }

  @Override
  public Optional<String> replacementFor(String matchedSpan) {
    return examples == null || examples.isEmpty()
        ? Optional.empty()
        : Optional.of(examples.get(0));
  }
}
