package com.flamingo.ai.stylecheck.service.correction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Introduces adverse-event abbreviations where terms overlap.
 *
 * <p>A single alternation lists the most specific term first, and the abbreviation is chosen from
 * the whole matched span, so "serious adverse event" gets {@code (SAE)} and never {@code (AE)}.
 * Each abbreviation is introduced once per text and never when it already appears. A parenthesised
 * abbreviation that belongs to a different term is replaced.
 */
@Component
public class ClinicalTermPrecedencePass {

  private static final Pattern ADVERSE_EVENT_TERMS =
      Pattern.compile(
          "(?i)\\b(treatment[-\\s]+emergent\\s+adverse\\s+events?"
              + "|serious\\s+adverse\\s+events?"
              + "|adverse\\s+drug\\s+reactions?"
              + "|adverse\\s+events?)\\b"
              + "(\\s*\\((TEAE|SAE|ADR|AE)s?\\))?");

  private static final Pattern EXISTING_ABBREVIATION = Pattern.compile("\\b(TEAE|SAE|ADR|AE)s?\\b");

  private static final Pattern TREATMENT_EMERGENT =
      Pattern.compile("(?i)^(treatment)[-\\s]+(emergent)");

  /**
   * Rewrites adverse-event terms in {@code text}.
   *
   * @param changes receives one description per effective rewrite
   * @return the rewritten text
   */
  public String apply(String text, List<String> changes) {
    List<MatchResult> terms = new ArrayList<>();
    Matcher matcher = ADVERSE_EVENT_TERMS.matcher(text);
    while (matcher.find()) {
      terms.add(matcher.toMatchResult());
    }
    if (terms.isEmpty()) {
      return text;
    }

    Set<String> introduced = new HashSet<>();
    Matcher existing = EXISTING_ABBREVIATION.matcher(text);
    while (existing.find()) {
      if (!insideMisattributed(existing.start(), terms)) {
        introduced.add(existing.group(1));
      }
    }

    StringBuilder sb = new StringBuilder(text.length() + 16);
    int last = 0;
    for (MatchResult term : terms) {
      String original = term.group();
      String replacement = rewrite(term, introduced);
      if (!replacement.equals(original)) {
        changes.add(CorrectionRule.describe(original, replacement));
      }
      sb.append(text, last, term.start()).append(replacement);
      last = term.end();
    }
    sb.append(text, last, text.length());
    return sb.toString();
  }

  private static String abbreviationFor(String term) {
    String lower = term.toLowerCase(Locale.ROOT);
    if (lower.startsWith("treatment")) {
      return "TEAE";
    }
    if (lower.startsWith("serious")) {
      return "SAE";
    }
    return lower.contains("drug") ? "ADR" : "AE";
  }

  private static boolean insideMisattributed(int position, List<MatchResult> terms) {
    for (MatchResult term : terms) {
      if (term.group(2) != null
          && !term.group(3).equalsIgnoreCase(abbreviationFor(term.group(1)))
          && position >= term.start(2)
          && position < term.end(2)) {
        return true;
      }
    }
    return false;
  }

  private String rewrite(MatchResult match, Set<String> introduced) {
    String span = match.group(1);
    String abbreviation = abbreviationFor(span);
    String term =
        abbreviation.equals("TEAE") ? TREATMENT_EMERGENT.matcher(span).replaceFirst("$1-$2") : span;

    if (match.group(2) != null && match.group(3).equalsIgnoreCase(abbreviation)) {
      return term + match.group(2);
    }
    // a missing or misattributed abbreviation
    if (!introduced.add(abbreviation)) {
      return term;
    }
    String plural = span.toLowerCase(Locale.ROOT).endsWith("s") ? "s" : "";
    return term + " (" + abbreviation + plural + ")";
  }
}
