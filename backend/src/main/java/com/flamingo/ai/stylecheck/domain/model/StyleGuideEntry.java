package com.flamingo.ai.stylecheck.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Common view over the two kinds of indexed style-guide material: extracted {@link StyleRule}s and
 * embedded {@link StyleChunk}s.
 */
public interface StyleGuideEntry {

  /** Text searched for (case-insensitively) in a document when this entry is applied. */
  String triggerText();

  /** Text fed to the embedder when this entry is indexed. */
  String embeddingText();

  /** Short human-readable label for reports and logs. */
  String label();

  List<String> getExamples();

  /**
   * Computes the text that replaces a matched span, or empty if this entry has nothing to apply.
   *
   * @param matchedSpan the document text found at the trigger position
   * @return replacement text
   */
  Optional<String> replacementFor(String matchedSpan);
}
