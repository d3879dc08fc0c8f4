package com.flamingo.ai.stylecheck.service.correction;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.MatchResult;

/**
 * The fixed correction tables for clinical study reports.
 *
 * <p>Order inside each table is significant. Every rule maps text it has already corrected onto
 * itself, so running a table twice gives the same result as running it once.
 */
final class CorrectionRules {

  private static final Map<String, String> UNITS =
      Map.of("mg", "mg", "ml", "mL", "kg", "kg", "mcg", "mcg", "l", "L", "g", "g");

  private static final Map<String, String> PHASES =
      Map.ofEntries(
          Map.entry("1", "1"),
          Map.entry("i", "1"),
          Map.entry("one", "1"),
          Map.entry("2", "2"),
          Map.entry("ii", "2"),
          Map.entry("two", "2"),
          Map.entry("3", "3"),
          Map.entry("iii", "3"),
          Map.entry("three", "3"),
          Map.entry("4", "4"),
          Map.entry("iv", "4"),
          Map.entry("four", "4"));

  private static final String DEMOGRAPHIC = "white|black|asian|male|female";
  private static final String POPULATION =
      "subjects?|participants?|patients?|population|individuals|volunteers|adults|children"
          + "|men|women";

  static final List<CorrectionRule> DETERMINISTIC =
      List.of(
          // units
          CorrectionRule.compute(
              "unit-spacing",
              "(?i)\\b(\\d+(?:\\.\\d+)?) ?(mcg|mg|ml|kg|l|g)\\b",
              m -> m.group(1) + " " + UNITS.get(m.group(2).toLowerCase(Locale.ROOT))),

          // comparisons
          CorrectionRule.replace("approximately", "(?i)\\bapproximately\\s+(?=\\d)", "~"),
          CorrectionRule.replace(
              "greater-or-equal", "(?i)\\bgreater\\s+than\\s+or\\s+equal\\s+to\\s*(?=\\d)", "≥"),
          CorrectionRule.replace(
              "less-or-equal", "(?i)\\bless\\s+than\\s+or\\s+equal\\s+to\\s*(?=\\d)", "≤"),

          // study phase
          CorrectionRule.compute(
              "phase",
              "(?i)\\bphase\\s+(iii|ii|iv|i|one|two|three|four|[1-4])\\b(?!\\.\\w)",
              m -> "Phase " + PHASES.get(m.group(1).toLowerCase(Locale.ROOT))),

          // statistics
          CorrectionRule.replace("p-value", "(?i)\\bp[-\\s]?value\\b", "P value"),
          CorrectionRule.compute(
              "ci", "(?i)\\bci(s?)\\b", m -> m.group(1).isEmpty() ? "CI" : "CIs"),
          CorrectionRule.compute(
              "dispersion", "(?i)\\((sd|se)\\)", m -> "(" + upper(m.group(1)) + ")"),
          CorrectionRule.replace("itt", "(?i)\\bitt\\b", "ITT"),
          CorrectionRule.replace(
              "per-protocol", "(?i)\\bpp\\b(?=\\s+(?:population|analysis|set)\\b)", "PP"),
          abbreviation("odds-ratio", "odds\\s+ratio", "OR"),
          abbreviation("hazard-ratio", "hazard\\s+ratio", "HR"),

          // organisations
          CorrectionRule.compute(
              "organisation", "(?i)\\b(fda|ema|irb|iec|ich|gcp)\\b", m -> upper(m.group(1))),
          CorrectionRule.replace(
              "daiichi-sankyo", "(?i)\\bdaiichi[\\s-]+sankyo\\b", "Daiichi Sankyo"),

          // medical acronyms
          CorrectionRule.compute(
              "medical-acronym", "(?i)\\b(ecg|mri|ct|dna|rna|pcr|bmi)\\b", m -> upper(m.group(1))),

          // demographics before a population noun
          CorrectionRule.compute(
              "demographic",
              "(?i)\\b("
                  + DEMOGRAPHIC
                  + ")\\b(?=(?:\\s+(?:"
                  + DEMOGRAPHIC
                  + "))*\\s+(?:"
                  + POPULATION
                  + ")\\b)",
              m -> capitalize(m.group(1))),
          CorrectionRule.compute(
              "other-ethnicity",
              "(?i)\\b(other)\\b(?=\\s+(?:ethnicit(?:y|ies)|races?|ethnic)\\b)",
              m -> capitalize(m.group(1))),

          // report structure
          CorrectionRule.replace("synopsis", "(?i)\\bsynopsis\\b", "Synopsis"),
          CorrectionRule.compute(
              "numbered-item",
              "\\b(?i:(appendix|table|figure|listing|section))(?=\\s+(?:\\d|[A-Z]\\b))",
              m -> capitalize(m.group(1))),
          CorrectionRule.replace(
              "materials-and-methods",
              "(?i)\\bmaterials\\s+and\\s+methods\\b",
              "Materials and Methods"),
          CorrectionRule.replace(
              "results-and-discussion",
              "(?i)\\bresults\\s+and\\s+discussion\\b",
              "Results and Discussion"),

          // time points; end of treatment must precede treatment period
          CorrectionRule.compute(
              "baseline", "(?i)\\b(base)[-\\s]line\\b", m -> m.group(1) + "line"),
          CorrectionRule.compute(
              "follow-up", "(?i)\\b(follow)\\s+(up)\\b", m -> m.group(1) + "-" + m.group(2)),
          abbreviation("end-of-treatment", "end\\s+of\\s+treatment", "EOT"),
          abbreviation("end-of-study", "end\\s+of\\s+study", "EOS"),
          CorrectionRule.replace(
              "screening-period", "(?i)\\bscreening\\s+period\\b", "Screening Period"),
          CorrectionRule.replace(
              "treatment-period", "(?i)\\btreatment\\s+period\\b", "Treatment Period"),

          // clinical abbreviations introduced on first mention
          pluralAbbreviation("investigational-product", "investigational\\s+product", "IP"),
          pluralAbbreviation("concomitant-medication", "concomitant\\s+medication", "CM"),
          abbreviation("quality-of-life", "quality\\s+of\\s+life", "QoL"),

          // Latin abbreviations
          CorrectionRule.compute(
              "ie-eg",
              "(?i)\\b(i\\.e|e\\.g)\\.?,?\\s*(?=\\w)",
              m -> m.group(1).toLowerCase(Locale.ROOT) + "., "),
          CorrectionRule.replace("versus", "(?i)\\bvs\\.\\s*(?=\\w)", "vs "),
          CorrectionRule.replace("etc", "(?i)\\betc\\.(?=\\w)", "etc. "));

  static final List<CorrectionRule> POST_FORMATTING =
      List.of(
          CorrectionRule.compute("symbol-spacing", "([~≤≥])[ \\t]+(?=\\d)", m -> m.group(1)),
          CorrectionRule.compute("percent-spacing", "(\\d)[ \\t]+%", m -> m.group(1) + "%"),
          CorrectionRule.replace("double-space", "(?<=\\S) {2,}(?=\\S)", " "));

  private CorrectionRules() {}

  /** {@code term} becomes {@code term (ABBR)} on first mention. */
  private static CorrectionRule abbreviation(String name, String termRegex, String abbreviation) {
    return CorrectionRule.firstMention(
        name,
        "(?i)\\b(" + termRegex + ")\\b(?!\\s*\\(" + abbreviation + "\\))",
        m -> m.group(1) + " (" + abbreviation + ")",
        abbreviation);
  }

  /** Like {@link #abbreviation} but a plural term gets a plural abbreviation. */
  private static CorrectionRule pluralAbbreviation(
      String name, String termRegex, String abbreviation) {
    return CorrectionRule.firstMention(
        name,
        "(?i)\\b(" + termRegex + ")(s?)\\b(?!\\s*\\(" + abbreviation + "s?\\))",
        m -> m.group(1) + m.group(2) + " (" + abbreviation + pluralSuffix(m) + ")",
        abbreviation);
  }

  private static String pluralSuffix(MatchResult m) {
    return m.group(2).isEmpty() ? "" : "s";
  }

  private static String upper(String value) {
    return value.toUpperCase(Locale.ROOT);
  }

  private static String capitalize(String value) {
    return value.isEmpty()
        ? value
        : Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase(Locale.ROOT);
  }
}
