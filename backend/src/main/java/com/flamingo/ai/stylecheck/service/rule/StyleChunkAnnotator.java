package com.flamingo.ai.stylecheck.service.rule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Labels style-guide chunks before they are embedded: mines worked examples from the text and
 * assigns a coarse rule-type label used in analysis reports.
 */
@Component
public class StyleChunkAnnotator {

  public static final String GENERAL = "general";

  private static final List<Pattern> EXAMPLE_PATTERNS =
      List.of(
          Pattern.compile(
              "(?:for example|example|e\\.g\\.)[:,]?\\s+(.+?)(?=\\.\\s|\\.$|\\n|$)",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile("(?m)^\\s*•\\s*(.+)$"),
          Pattern.compile("(?m)^\\s*\\d+\\.\\s+(.+)$"));

  private static final Map<String, List<String>> RULE_TYPE_KEYWORDS = ruleTypeKeywords();

  /**
   * Finds example text introduced by "Example:", "For example" or "e.g.", and bullet or numbered
   * list items.
   *
   * @param text chunk text
   * @return examples in discovery order, quotes and trailing punctuation removed
   */
  public List<String> extractExamples(String text) {
    List<String> examples = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return examples;
    }
    for (Pattern pattern : EXAMPLE_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        String example = RuleExtractionPattern.clean(matcher.group(1));
        if (!example.isEmpty()) {
          examples.add(example);
        }
      }
    }
    return examples;
  }

  /**
   * Scores the chunk text and its section title against keyword lists and returns the best label,
   * or {@value #GENERAL} when nothing matches.
   */
  public String identifyRuleType(String text, String section) {
    String haystack =
        ((text != null ? text : "") + " " + (section != null ? section : ""))
            .toLowerCase(Locale.ROOT);
    String best = GENERAL;
    int bestScore = 0;
    for (Map.Entry<String, List<String>> entry : RULE_TYPE_KEYWORDS.entrySet()) {
      int score = (int) entry.getValue().stream().filter(haystack::contains).count();
      if (score > bestScore) {
        best = entry.getKey();
        bestScore = score;
      }
    }
    return best;
  }

  private static Map<String, List<String>> ruleTypeKeywords() {
    Map<String, List<String>> keywords = new LinkedHashMap<>();
    keywords.put(
        "formatting", List.of("format", "style", "font", "spacing", "margin", "indent", "layout"));
    keywords.put("grammar", List.of("grammar", "tense", "verb", "noun", "sentence", "phrase"));
    keywords.put("punctuation", List.of("punctuation", "comma", "period", "colon", "semicolon"));
    keywords.put("terminology", List.of("term", "word", "vocabulary", "glossary", "definition"));
    keywords.put(
        "structure", List.of("structure", "organization", "section", "heading", "outline"));
    return keywords;
  }
}
