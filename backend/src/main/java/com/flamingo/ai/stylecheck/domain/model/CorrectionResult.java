package com.flamingo.ai.stylecheck.domain.model;

import java.util.List;

/**
 * Outcome of correcting one chunk of a target document.
 *
 * @param originalText chunk text as extracted
 * @param correctedText chunk text after all passes; retrieval-based edits carry change markers
 * @param appliedRules retrieved entries that changed the text
 * @param changes every change description for this chunk, in application order
 */
public record CorrectionResult(
    String originalText,
    String correctedText,
    List<CorrectionMatch> appliedRules,
    List<String> changes) {

  public CorrectionResult {
    appliedRules = appliedRules != null ? List.copyOf(appliedRules) : List.of();
    changes = changes != null ? List.copyOf(changes) : List.of();
  }

  public static CorrectionResult unchanged(String text) {
    return new CorrectionResult(text, text, List.of(), List.of());
  }

  public boolean hasChanges() {
    return !changes.isEmpty() || !originalText.equals(correctedText);
  }
}
