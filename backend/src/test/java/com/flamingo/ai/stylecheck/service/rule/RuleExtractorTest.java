package com.flamingo.ai.stylecheck.service.rule;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.stylecheck.domain.enums.RuleCategory;
import com.flamingo.ai.stylecheck.domain.enums.RuleType;
import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RuleExtractor Tests")
class RuleExtractorTest {

  private RuleExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new RuleExtractor(new BreakIteratorSentenceTokenizer());
  }

  private StyleRule single(String text) {
    List<StyleRule> rules = extractor.extractRules(text);
    assertThat(rules).hasSize(1);
    return rules.get(0);
  }

  @Test
  @DisplayName("should extract arrow rules")
  void shouldExtractArrowRule() {
    StyleRule rule = single("patient → Subject");

    assertThat(rule.getPattern()).isEqualTo("patient");
    assertThat(rule.getReplacement()).isEqualTo("Subject");
    assertThat(rule.getType()).isEqualTo(RuleType.DIRECT);
    assertThat(rule.getDescription()).isEqualTo("patient → Subject");
    assertThat(rule.getExamples()).isEmpty();
    assertThat(rule.getId()).isNotBlank();
  }

  @Test
  @DisplayName("should extract modal rules and trim trailing punctuation")
  void shouldExtractModalRule() {
    StyleRule rule = single("Patient should be Subject.");

    assertThat(rule.getPattern()).isEqualTo("Patient");
    assertThat(rule.getReplacement()).isEqualTo("Subject");
  }

  @Test
  @DisplayName("should extract quoted instructions")
  void shouldExtractQuotedInstructions() {
    StyleRule useInstead = single("Use \"participant\" instead of \"patient\".");
    StyleRule writeNot = single("Write \"mL\", not \"ml\".");
    StyleRule replace = single("Replace \"utilize\" with \"use\".");

    assertThat(useInstead.getPattern()).isEqualTo("patient");
    assertThat(useInstead.getReplacement()).isEqualTo("participant");
    assertThat(writeNot.getPattern()).isEqualTo("ml");
    assertThat(writeNot.getReplacement()).isEqualTo("mL");
    assertThat(replace.getPattern()).isEqualTo("utilize");
    assertThat(replace.getReplacement()).isEqualTo("use");
  }

  @Test
  @DisplayName("should keep punctuation that belongs inside quotes")
  void shouldKeepQuotedPunctuation() {
    StyleRule writeNot = single("Write \"e.g.\" not \"eg\".");
    StyleRule deletion = single("Avoid \"etc.\" at the end of lists.");

    assertThat(writeNot.getPattern()).isEqualTo("eg");
    assertThat(writeNot.getReplacement()).isEqualTo("e.g.");
    assertThat(deletion.getPattern()).isEqualTo("etc.");
    assertThat(deletion.isDeletion()).isTrue();
  }

  @Test
  @DisplayName("should only treat a leading word label as a prefix")
  void shouldKeepColonsInsidePattern() {
    StyleRule time = single("Time 10:30 -> 10.30");
    StyleRule labelled = single("Terminology: patient -> Subject");

    assertThat(time.getPattern()).isEqualTo("Time 10:30");
    assertThat(time.getReplacement()).isEqualTo("10.30");
    assertThat(labelled.getPattern()).isEqualTo("patient");
    assertThat(labelled.getReplacement()).isEqualTo("Subject");
  }

  @Test
  @DisplayName("should extract transformation rules")
  void shouldExtractTransformationRule() {
    StyleRule rule = single("Study drug becomes investigational product.");

    assertThat(rule.getPattern()).isEqualTo("Study drug");
    assertThat(rule.getReplacement()).isEqualTo("investigational product");
    assertThat(rule.getCategory()).isEqualTo(RuleCategory.DOMAIN);
  }

  @Test
  @DisplayName("should extract case rules instead of treating them as modal rules")
  void shouldExtractCaseRule() {
    StyleRule rule = single("Drug names should be capitalized.");

    assertThat(rule.getPattern()).isEqualTo("Drug names");
    assertThat(rule.getReplacement()).isEqualTo("capitalized");
    assertThat(rule.getType()).isEqualTo(RuleType.CASE);
  }

  @Test
  @DisplayName("should extract context rules with their condition")
  void shouldExtractContextRule() {
    StyleRule rule =
        single("When reporting results, percentages should be written as whole numbers.");

    assertThat(rule.getPattern()).isEqualTo("percentages");
    assertThat(rule.getReplacement()).isEqualTo("whole numbers");
    assertThat(rule.getContext()).containsEntry("condition", "reporting results");
    assertThat(rule.getType()).isEqualTo(RuleType.CONTEXT);
  }

  @Test
  @DisplayName("should extract deletion rules with an empty replacement")
  void shouldExtractDeletionRule() {
    StyleRule rule = single("Avoid the phrase \"in order to\".");

    assertThat(rule.getPattern()).isEqualTo("in order to");
    assertThat(rule.isDeletion()).isTrue();
  }

  @Test
  @DisplayName("should split list items and skip sentences without rules")
  void shouldSplitListItems_andSkipProse() {
    String text =
        "Terminology:\n"
            + "1. Patient should be Subject.\n"
            + "2. Replace \"utilize\" with \"use\".\n"
            + "\n"
            + "This guide describes the house style.";

    List<StyleRule> rules = extractor.extractRules(text);

    assertThat(rules).extracting(StyleRule::getPattern).containsExactly("Patient", "utilize");
    assertThat(rules).extracting(StyleRule::getId).doesNotHaveDuplicates();
  }

  @Test
  @DisplayName("should return no rules for blank or rule-free text")
  void shouldReturnEmpty_whenNoRules() {
    assertThat(extractor.extractRules(null)).isEmpty();
    assertThat(extractor.extractRules("")).isEmpty();
    assertThat(extractor.extractRules("This guide describes the house style.")).isEmpty();
  }

  @Test
  @DisplayName("should classify rule types in priority order")
  void shouldDetermineRuleType() {
    assertThat(extractor.determineRuleType("Use upper case for ICH", "ich", "upper case"))
        .isEqualTo(RuleType.CASE);
    assertThat(
            extractor.determineRuleType(
                "x", "adverse events that are serious", "serious adverse events"))
        .isEqualTo(RuleType.MULTI);
    assertThat(extractor.determineRuleType("x", "colou?r", "color")).isEqualTo(RuleType.PATTERN);
    assertThat(extractor.determineRuleType("Unless quoted, pt is patient", "pt", "patient"))
        .isEqualTo(RuleType.CONTEXT);
    assertThat(extractor.determineRuleType("pt is patient", "pt", "patient"))
        .isEqualTo(RuleType.DIRECT);
  }

  @Test
  @DisplayName("should categorise by keyword score with ties going to the first category")
  void shouldDetermineCategory() {
    assertThat(extractor.determineCategory("Use a comma before the conjunction"))
        .isEqualTo(RuleCategory.PUNCTUATION);
    assertThat(extractor.determineCategory("Cite the reference source"))
        .isEqualTo(RuleCategory.REFERENCE);
    assertThat(extractor.determineCategory("Section headings use font Arial"))
        .isEqualTo(RuleCategory.STRUCTURE);
    assertThat(extractor.determineCategory("table font")).isEqualTo(RuleCategory.STRUCTURE);
    assertThat(extractor.determineCategory("Define acronyms at first use"))
        .isEqualTo(RuleCategory.ABBREVIATION);
    assertThat(extractor.determineCategory("Hello world")).isEqualTo(RuleCategory.FORMATTING);
  }

  @Test
  @DisplayName("should group rules under every category")
  void shouldCategorizeRules() {
    StyleRule numbers =
        StyleRule.builder().pattern("ten").replacement("10").category(RuleCategory.NUMBERS).build();
    StyleRule domain =
        StyleRule.builder()
            .pattern("pt")
            .replacement("patient")
            .category(RuleCategory.DOMAIN)
            .build();

    Map<RuleCategory, List<StyleRule>> grouped =
        extractor.categorizeRules(List.of(numbers, domain));

    assertThat(grouped).containsOnlyKeys(RuleCategory.values());
    assertThat(grouped.get(RuleCategory.NUMBERS)).containsExactly(numbers);
    assertThat(grouped.get(RuleCategory.DOMAIN)).containsExactly(domain);
    assertThat(grouped.get(RuleCategory.GRAMMAR)).isEmpty();
  }
}
