package com.flamingo.ai.stylecheck.service.rule;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StyleChunkAnnotator Tests")
class StyleChunkAnnotatorTest {

  private final StyleChunkAnnotator annotator = new StyleChunkAnnotator();

  @Test
  @DisplayName("should extract examples introduced by example phrases")
  void shouldExtractInlineExamples() {
    assertThat(
            annotator.extractExamples(
                "Spell out numbers below ten. For example: nine subjects. Use digits otherwise."))
        .containsExactly("nine subjects");
    assertThat(annotator.extractExamples("Abbreviate units, e.g. mg or mL."))
        .containsExactly("mg or mL");
  }

  @Test
  @DisplayName("should extract bullet and numbered list items")
  void shouldExtractListItems() {
    assertThat(annotator.extractExamples("Preferred terms:\n• Subject\n• Investigational product"))
        .containsExactly("Subject", "Investigational product");
    assertThat(annotator.extractExamples("1. Use SI units\n2. Spell out numbers"))
        .containsExactly("Use SI units", "Spell out numbers");
  }

  @Test
  @DisplayName("should return no examples for blank text")
  void shouldReturnEmpty_whenBlank() {
    assertThat(annotator.extractExamples(null)).isEmpty();
    assertThat(annotator.extractExamples("No examples here.")).isEmpty();
  }

  @Test
  @DisplayName("should label chunks using text and section title")
  void shouldIdentifyRuleType() {
    assertThat(
            annotator.identifyRuleType(
                "Place a comma after the introductory clause.", "Punctuation"))
        .isEqualTo("punctuation");
    assertThat(annotator.identifyRuleType("Use past tense verbs.", "Grammar"))
        .isEqualTo("grammar");
    assertThat(annotator.identifyRuleType("Hello there.", null))
        .isEqualTo(StyleChunkAnnotator.GENERAL);
  }
}
