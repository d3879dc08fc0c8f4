package com.flamingo.ai.stylecheck.service.correction;

import com.flamingo.ai.stylecheck.config.StyleCheckConfig;
import com.flamingo.ai.stylecheck.domain.model.CorrectionMatch;
import com.flamingo.ai.stylecheck.domain.model.CorrectionResult;
import com.flamingo.ai.stylecheck.domain.model.StyleGuideEntry;
import com.flamingo.ai.stylecheck.service.index.IndexHit;
import com.flamingo.ai.stylecheck.service.index.StyleGuideSession;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Corrects chunks of a target document.
 *
 * <p>Passes run in a fixed order: the deterministic table, the adverse-event precedence pass, then
 * post-formatting. Each pass assumes the output shape of the previous one. With a style-guide
 * session, entries retrieved from both indexes are layered on top of the deterministic result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorrectionEngine {

  private final ClinicalTermPrecedencePass precedencePass;
  private final RetrievalCorrectionApplier retrievalApplier;
  private final StyleCheckConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the deterministic passes. Applying the result a second time changes nothing.
   *
   * @param text chunk text
   * @return corrected text and change descriptions
   */
  public CorrectionOutcome applyCorrections(String text) {
    if (text == null || text.isEmpty()) {
      return new CorrectionOutcome(text == null ? "" : text, List.of());
    }
    List<String> changes = new ArrayList<>();
    String corrected = applyTable(CorrectionRules.DETERMINISTIC, text, changes);
    try {
      corrected = precedencePass.apply(corrected, changes);
    } catch (RuntimeException e) {
      log.warn("Adverse-event precedence pass failed, skipping it: {}", e.getMessage());
      meterRegistry.counter("style.correction.rule.failure", "rule", "precedence").increment();
    }
    corrected = applyTable(CorrectionRules.POST_FORMATTING, corrected, changes);

    if (!changes.isEmpty()) {
      meterRegistry
          .counter("style.correction.changes", "source", "deterministic")
          .increment(changes.size());
    }
    return new CorrectionOutcome(corrected, changes);
  }

  private String applyTable(List<CorrectionRule> rules, String text, List<String> changes) {
    String current = text;
    for (CorrectionRule rule : rules) {
      List<String> ruleChanges = new ArrayList<>();
      try {
        current = rule.apply(current, ruleChanges);
        changes.addAll(ruleChanges);
      } catch (RuntimeException e) {
        log.warn("Correction rule '{}' failed, skipping it: {}", rule.name(), e.getMessage());
        meterRegistry.counter("style.correction.rule.failure", "rule", rule.name()).increment();
      }
    }
    return current;
  }

  /**
   * Runs the deterministic passes, then applies entries retrieved from the session's indexes.
   *
   * @param text chunk text
   * @param session ingested style guide
   * @return result with every change; retrieval edits carry change markers
   */
  public CorrectionResult correct(String text, StyleGuideSession session) {
    CorrectionOutcome outcome = applyCorrections(text);
    String corrected = outcome.correctedText();

    List<CorrectionMatch> matches = new ArrayList<>();
    int topK = config.getRetrieval().getTopK();
    collect(session.ruleIndex().searchAccepted(corrected, topK), matches);
    collect(session.chunkIndex().searchAccepted(corrected, topK), matches);
    log.debug("Retrieved {} candidate matches for a {}-char chunk", matches.size(), text.length());

    RetrievalCorrectionApplier.Applied applied = retrievalApplier.apply(corrected, matches);
    if (!applied.changes().isEmpty()) {
      meterRegistry
          .counter("style.correction.changes", "source", "retrieval")
          .increment(applied.changes().size());
    }

    List<String> changes = new ArrayList<>(outcome.changes());
    changes.addAll(applied.changes());
    return new CorrectionResult(text, applied.text(), applied.appliedMatches(), changes);
  }

  private <T extends StyleGuideEntry> void collect(
      List<IndexHit<T>> hits, List<CorrectionMatch> matches) {
    double minConfidence = config.getRetrieval().getMinConfidence();
    for (IndexHit<T> hit : hits) {
      if (hit.confidence() >= minConfidence) {
        matches.add(new CorrectionMatch(hit.item(), hit.distance(), hit.confidence(), List.of()));
      }
    }
  }
}
