package com.flamingo.ai.stylecheck.service.rule;

import com.flamingo.ai.stylecheck.domain.enums.RuleCategory;
import com.flamingo.ai.stylecheck.domain.enums.RuleType;
import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Mines structured {@link StyleRule}s from free-form style-guide prose.
 *
 * <p>Text is cut into blocks at blank lines and list items, each block into sentences, and every
 * sentence is run through {@link RuleExtractionPatterns#ORDERED}. Sentences that match nothing are
 * skipped. The extractor never fails on malformed text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RuleExtractor {

  private static final String LIST_MARKER = "(?:\\d+[.)]|[-•*]|[a-zA-Z]\\))";
  private static final Pattern BLOCK_BREAK =
      Pattern.compile("\\n\\s*\\n|\\n(?=[ \\t]*" + LIST_MARKER + "\\s)");
  private static final Pattern LEADING_MARKER = Pattern.compile("^\\s*" + LIST_MARKER + "\\s+");
  private static final Pattern LINE_WRAP = Pattern.compile("\\s*\\n\\s*");

  private static final Pattern CASE_HINT = Pattern.compile("case|upper|lower|capitali[sz]");
  private static final Pattern PATTERN_METACHARS = Pattern.compile("[*?+\\[\\](]");
  private static final Pattern CONDITION_WORD =
      Pattern.compile("\\b(?:when|if|unless|except)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}]+");
  private static final int MULTI_WORD_THRESHOLD = 3;

  private static final Map<RuleCategory, List<String>> CATEGORY_KEYWORDS = categoryKeywords();

  private final SentenceTokenizer sentenceTokenizer;

  /**
   * Extracts every rule found in the given guide text.
   *
   * @param text style-guide text, may be {@code null}
   * @return rules in document order
   */
  public List<StyleRule> extractRules(String text) {
    List<StyleRule> rules = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return rules;
    }

    int segments = 0;
    for (String block : BLOCK_BREAK.split(text)) {
      String unmarked = LEADING_MARKER.matcher(block).replaceFirst("");
      String normalized = LINE_WRAP.matcher(unmarked).replaceAll(" ").trim();
      if (normalized.isEmpty()) {
        continue;
      }
      for (String segment : sentenceTokenizer.sentences(normalized)) {
        segments++;
        extractRule(segment).ifPresent(rules::add);
      }
    }

    log.info("Extracted {} rules from {} segments", rules.size(), segments);
    return rules;
  }

  private Optional<StyleRule> extractRule(String segment) {
    for (RuleExtractionPattern extractionPattern : RuleExtractionPatterns.ORDERED) {
      Optional<RuleCandidate> candidate = extractionPattern.match(segment);
      if (candidate.isPresent()) {
        RuleCandidate rule = candidate.get();
        log.debug("Segment matched '{}' strategy: {}", rule.strategy(), segment);
        return Optional.of(
            StyleRule.builder()
                .id(UUID.randomUUID().toString())
                .category(determineCategory(segment))
                .type(determineRuleType(segment, rule.pattern(), rule.replacement()))
                .description(segment)
                .pattern(rule.pattern())
                .replacement(rule.replacement())
                .examples(List.of())
                .context(rule.context())
                .build());
      }
    }
    return Optional.empty();
  }

  /**
   * Classifies a rule. Checks run in a fixed order: case wording, multi-word spans, pattern
   * metacharacters, conditional wording, then direct substitution.
   */
  public RuleType determineRuleType(String segment, String pattern, String replacement) {
    String lower = segment.toLowerCase(Locale.ROOT);
    if (CASE_HINT.matcher(lower).find()) {
      return RuleType.CASE;
    }
    if (wordCount(pattern) > MULTI_WORD_THRESHOLD
        || wordCount(replacement) > MULTI_WORD_THRESHOLD) {
      return RuleType.MULTI;
    }
    if (PATTERN_METACHARS.matcher(pattern).find()) {
      return RuleType.PATTERN;
    }
    if (CONDITION_WORD.matcher(segment).find()) {
      return RuleType.CONTEXT;
    }
    return RuleType.DIRECT;
  }

  /**
   * Picks the category whose keywords occur most often in the segment's tokens. Ties go to the
   * category declared first; no hits at all means {@link RuleCategory#FORMATTING}.
   */
  public RuleCategory determineCategory(String segment) {
    Map<RuleCategory, Integer> scores = new EnumMap<>(RuleCategory.class);
    for (String token : NON_LETTERS.split(segment.toLowerCase(Locale.ROOT))) {
      if (token.isEmpty()) {
        continue;
      }
      CATEGORY_KEYWORDS.forEach(
          (category, keywords) -> {
            if (keywords.stream().anyMatch(token::contains)) {
              scores.merge(category, 1, Integer::sum);
            }
          });
    }

    RuleCategory best = RuleCategory.FORMATTING;
    int bestScore = 0;
    for (RuleCategory category : RuleCategory.values()) {
      int score = scores.getOrDefault(category, 0);
      if (score > bestScore) {
        best = category;
        bestScore = score;
      }
    }
    return best;
  }

  /**
   * Groups rules by category. Every category is present in the result, rule order is kept.
   *
   * @param rules rules to group
   * @return category to rules, in declaration order of {@link RuleCategory}
   */
  public Map<RuleCategory, List<StyleRule>> categorizeRules(List<StyleRule> rules) {
    Map<RuleCategory, List<StyleRule>> grouped = new EnumMap<>(RuleCategory.class);
    for (RuleCategory category : RuleCategory.values()) {
      grouped.put(category, new ArrayList<>());
    }
    for (StyleRule rule : rules) {
      grouped.get(rule.getCategory()).add(rule);
    }
    return grouped;
  }

  private static int wordCount(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  private static Map<RuleCategory, List<String>> categoryKeywords() {
    Map<RuleCategory, List<String>> keywords = new EnumMap<>(RuleCategory.class);
    keywords.put(
        RuleCategory.STRUCTURE, List.of("section", "heading", "table", "format", "layout"));
    keywords.put(RuleCategory.NUMBERS, List.of("number", "measurement", "range", "value", "unit"));
    keywords.put(RuleCategory.DOMAIN, List.of("medical", "drug", "company", "clinical", "disease"));
    keywords.put(RuleCategory.FORMATTING, List.of("capital", "space", "hyphen", "indent", "font"));
    keywords.put(RuleCategory.PUNCTUATION, List.of("comma", "period", "colon", "semicolon"));
    keywords.put(RuleCategory.GRAMMAR, List.of("tense", "verb", "sentence", "plural", "singular"));
    keywords.put(RuleCategory.ABBREVIATION, List.of("abbreviat", "acronym"));
    keywords.put(RuleCategory.REFERENCE, List.of("reference", "citation", "source", "bibliograph"));
    return keywords;
  }
}
