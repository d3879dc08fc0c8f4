package com.flamingo.ai.stylecheck.domain.model;

import java.util.List;

/**
 * A style-guide entry retrieved for a chunk, with its distance and derived confidence.
 *
 * @param entry the matched rule or chunk
 * @param distance squared L2 distance between the chunk and the entry embeddings
 * @param confidence score in [0, 1] derived from the distance
 * @param changes change descriptions produced when the entry was applied; empty if not applied
 */
public record CorrectionMatch(
    StyleGuideEntry entry, double distance, double confidence, List<String> changes) {

  public CorrectionMatch {
    changes = changes != null ? List.copyOf(changes) : List.of();
  }

  public CorrectionMatch withChanges(List<String> appliedChanges) {
    return new CorrectionMatch(entry, distance, confidence, appliedChanges);
  }
}
