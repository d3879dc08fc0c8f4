package com.flamingo.ai.stylecheck.service.correction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.stylecheck.domain.model.CorrectionMatch;
import com.flamingo.ai.stylecheck.domain.model.StyleChunk;
import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetrievalCorrectionApplier Tests")
class RetrievalCorrectionApplierTest {

  private final RetrievalCorrectionApplier applier = new RetrievalCorrectionApplier();

  private static CorrectionMatch rule(String pattern, String replacement, double confidence) {
    StyleRule rule = StyleRule.builder().pattern(pattern).replacement(replacement).build();
    return new CorrectionMatch(rule, 1.0, confidence, List.of());
  }

  @Test
  @DisplayName("should apply non-overlapping replacements right to left")
  void shouldApplyAllNonOverlappingEdits() {
    RetrievalCorrectionApplier.Applied applied =
        applier.apply(
            "The patient took the study drug.",
            List.of(
                rule("patient", "Subject", 0.9),
                rule("study drug", "investigational product", 0.8)));

    assertThat(applied.text())
        .isEqualTo(
            "The <change confidence=0.90>Subject</change> took the "
                + "<change confidence=0.80>investigational product</change>.");
    assertThat(applied.changes())
        .containsExactly(
            "Changed 'study drug' to 'investigational product'", "Changed 'patient' to 'Subject'");
    assertThat(applied.appliedMatches()).hasSize(2);
  }

  @Test
  @DisplayName("should skip a replacement overlapping one already applied")
  void shouldSkipOverlappingEdit() {
    RetrievalCorrectionApplier.Applied applied =
        applier.apply(
            "An adverse event occurred.",
            List.of(rule("adverse event", "AE", 0.9), rule("event", "incident", 0.8)));

    assertThat(applied.text())
        .isEqualTo("An adverse <change confidence=0.80>incident</change> occurred.");
    assertThat(applied.appliedMatches()).hasSize(1);
    assertThat(applied.appliedMatches().get(0).changes())
        .containsExactly("Changed 'event' to 'incident'");
  }

  @Test
  @DisplayName("should prefer the more confident match at the same position")
  void shouldPreferHigherConfidence_whenSameStart() {
    RetrievalCorrectionApplier.Applied applied =
        applier.apply(
            "The patient was seen.",
            List.of(rule("patient", "participant", 0.4), rule("patient", "Subject", 0.9)));

    assertThat(applied.text()).isEqualTo("The <change confidence=0.90>Subject</change> was seen.");
  }

  @Test
  @DisplayName("should match triggers case-insensitively on word boundaries only")
  void shouldMatchWholeWordsIgnoringCase() {
    assertThat(applier.apply("Send the HTML file.", List.of(rule("ml", "mL", 0.9))).text())
        .isEqualTo("Send the HTML file.");
    assertThat(applier.apply("PATIENT data", List.of(rule("patient", "Subject", 0.5))).text())
        .isEqualTo("<change confidence=0.50>Subject</change> data");
  }

  @Test
  @DisplayName("should not count text already equal to the replacement as a change")
  void shouldSkipUnchangedOccurrence() {
    RetrievalCorrectionApplier.Applied applied =
        applier.apply("Subject data", List.of(rule("subject", "Subject", 0.9)));

    assertThat(applied.text()).isEqualTo("Subject data");
    assertThat(applied.changes()).isEmpty();
  }

  @Test
  @DisplayName("should skip deletions and chunks without examples")
  void shouldSkipEntriesWithoutReplacement() {
    StyleChunk chunk = StyleChunk.builder().content("patient").section("Terms").build();

    RetrievalCorrectionApplier.Applied applied =
        applier.apply(
            "The patient, in order to rest, slept.",
            List.of(
                rule("in order to", "", 0.9), new CorrectionMatch(chunk, 0.2, 0.9, List.of())));

    assertThat(applied.text()).isEqualTo("The patient, in order to rest, slept.");
    assertThat(applied.appliedMatches()).isEmpty();
  }

  @Test
  @DisplayName("should use the first example of a chunk as its replacement")
  void shouldApplyChunkExample() {
    StyleChunk chunk =
        StyleChunk.builder()
            .content("patient")
            .section("Terms")
            .examples(List.of("Subject"))
            .build();

    RetrievalCorrectionApplier.Applied applied =
        applier.apply("The patient slept.", List.of(new CorrectionMatch(chunk, 0.2, 0.9, null)));

    assertThat(applied.text()).isEqualTo("The <change confidence=0.90>Subject</change> slept.");
  }

  @Test
  @DisplayName("should locate whole-word occurrences")
  void shouldFindWholeWordIndex() {
    assertThat(
            RetrievalCorrectionApplier.indexOfWholeWordIgnoreCase("patients, patient", "patient"))
        .isEqualTo(10);
    assertThat(RetrievalCorrectionApplier.indexOfWholeWordIgnoreCase("outpatient", "patient"))
        .isEqualTo(-1);
  }
}
