package com.flamingo.ai.stylecheck.service.correction;

import java.util.List;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of a correction table: a matcher and the substitution for each match.
 *
 * @param name short label used in logs
 * @param pattern what to match
 * @param substitution replacement text computed from the match
 * @param skipIfPresent when this pattern already occurs in the text the rule does nothing; {@code
 *     null} to always apply
 * @param firstMatchOnly rewrite only the first match
 */
public record CorrectionRule(
    String name,
    Pattern pattern,
    Function<MatchResult, String> substitution,
    Pattern skipIfPresent,
    boolean firstMatchOnly) {

  public static CorrectionRule replace(String name, String regex, String replacement) {
    return new CorrectionRule(name, Pattern.compile(regex), match -> replacement, null, false);
  }

  public static CorrectionRule compute(
      String name, String regex, Function<MatchResult, String> substitution) {
    return new CorrectionRule(name, Pattern.compile(regex), substitution, null, false);
  }

  /**
   * Rule that introduces an abbreviation: only the first match is rewritten, and nothing happens
   * when the abbreviation already appears in the text.
   */
  public static CorrectionRule firstMention(
      String name, String regex, Function<MatchResult, String> substitution, String abbreviation) {
    return new CorrectionRule(
        name,
        Pattern.compile(regex),
        substitution,
        Pattern.compile("\\b" + Pattern.quote(abbreviation) + "s?\\b"),
        true);
  }

  /**
   * Applies the rule and appends a description of every effective substitution to {@code changes}.
   *
   * @return the rewritten text
   */
  public String apply(String text, List<String> changes) {
    if (skipIfPresent != null && skipIfPresent.matcher(text).find()) {
      return text;
    }
    Matcher matcher = pattern.matcher(text);
    StringBuilder sb = new StringBuilder(text.length() + 16);
    boolean found = false;
    while (matcher.find()) {
      found = true;
      String original = matcher.group();
      String replacement = substitution.apply(matcher.toMatchResult());
      if (!replacement.equals(original)) {
        changes.add(describe(original, replacement));
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
      if (firstMatchOnly) {
        break;
      }
    }
    if (!found) {
      return text;
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  static String describe(String original, String replacement) {
    return "Changed '" + original + "' to '" + replacement + "'";
  }
}
