package com.flamingo.ai.stylecheck.service.correction;

import java.util.List;

/**
 * Text after the deterministic passes and the changes made to it.
 *
 * @param correctedText rewritten text
 * @param changes {@code Changed '<original>' to '<replacement>'} entries in application order
 */
public record CorrectionOutcome(String correctedText, List<String> changes) {

  public CorrectionOutcome {
    changes = List.copyOf(changes);
  }
}
