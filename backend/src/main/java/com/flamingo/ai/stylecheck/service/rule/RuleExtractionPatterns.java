package com.flamingo.ai.stylecheck.service.rule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The extraction chain in priority order. The first entry that matches a sentence wins, so more
 * reliable signals (arrows, quoted instructions) come before looser phrasings.
 */
final class RuleExtractionPatterns {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private static final String Q_OPEN = "[\"“”]";
  private static final String Q_CLOSE = "[\"“”]";
  private static final String QUOTED_TEXT = "[^\"“”]+";
  private static final String LABEL = "(?:[A-Za-z][A-Za-z ]*:\\s+)?";
  private static final String MODAL = "\\s+(?:should|must)\\s+(?:always\\s+)?be\\s+";
  private static final String REWRITE_VERB =
      "(?:(?:written|spelled|expressed)\\s+as\\s+|replaced\\s+(?:with|by)\\s+|changed\\s+to\\s+)?";
  private static final String CASE_WORD =
      "(?:upper|lower|title|sentence)\\s*case|capitali[sz]ed|all\\s+caps";
  private static final String NO_CONDITION = "(?!(?:when|if|unless)\\b)";

  static final RuleExtractionPattern ARROW =
      new RuleExtractionPattern(
          "arrow",
          Pattern.compile(
              "^" + LABEL + "(?<pattern>.+?)\\s*(?:→|=>|->)\\s*(?<replacement>.+?)$", FLAGS));

  static final RuleExtractionPattern MODAL_FORM =
      new RuleExtractionPattern(
          "modal",
          Pattern.compile(
              "^"
                  + NO_CONDITION
                  + "(?<pattern>.+?)"
                  + MODAL
                  + "(?!(?:written\\s+)?(?:in\\s+)?(?:"
                  + CASE_WORD
                  + ")\\b)"
                  + REWRITE_VERB
                  + "(?<replacement>.+?)$",
              FLAGS));

  static final RuleExtractionPattern USE_INSTEAD =
      new RuleExtractionPattern(
          "use-instead",
          Pattern.compile(
              "\\buse\\s+"
                  + Q_OPEN
                  + "(?<replacement>"
                  + QUOTED_TEXT
                  + ")"
                  + Q_CLOSE
                  + ",?\\s+(?:instead\\s+of|rather\\s+than)\\s+"
                  + Q_OPEN
                  + "(?<pattern>"
                  + QUOTED_TEXT
                  + ")"
                  + Q_CLOSE,
              FLAGS),
          true);

  static final RuleExtractionPattern WRITE_NOT =
      new RuleExtractionPattern(
          "write-not",
          Pattern.compile(
              "\\bwrite\\s+"
                  + Q_OPEN
                  + "(?<replacement>"
                  + QUOTED_TEXT
                  + ")"
                  + Q_CLOSE
                  + ",?\\s+not\\s+"
                  + Q_OPEN
                  + "(?<pattern>"
                  + QUOTED_TEXT
                  + ")"
                  + Q_CLOSE,
              FLAGS),
          true);

  static final RuleExtractionPattern REPLACE_WITH =
      new RuleExtractionPattern(
          "replace-with",
          Pattern.compile(
              "\\breplace\\s+"
                  + Q_OPEN
                  + "(?<pattern>"
                  + QUOTED_TEXT
                  + ")"
                  + Q_CLOSE
                  + "\\s+(?:with|by)\\s+"
                  + Q_OPEN
                  + "(?<replacement>"
                  + QUOTED_TEXT
                  + ")"
                  + Q_CLOSE,
              FLAGS),
          true);

  static final RuleExtractionPattern TRANSFORMATION =
      new RuleExtractionPattern(
          "transformation",
          Pattern.compile(
              "^" + LABEL + "(?<pattern>.+?)\\s+(?:changes\\s+to|becomes)\\s+"
                  + "(?<replacement>.+?)$",
              FLAGS));

  static final RuleExtractionPattern CASE_FORM =
      new RuleExtractionPattern(
          "case",
          Pattern.compile(
              "^"
                  + NO_CONDITION
                  + "(?<pattern>.+?)"
                  + MODAL
                  + "(?:written\\s+)?(?:in\\s+)?(?<replacement>"
                  + CASE_WORD
                  + ")\\b",
              FLAGS));

  static final RuleExtractionPattern CONTEXT_FORM =
      new RuleExtractionPattern(
          "context",
          Pattern.compile(
              "^(?:when|if|unless)\\s+(?<condition>[^,]+),\\s*(?<pattern>.+?)"
                  + MODAL
                  + REWRITE_VERB
                  + "(?:written\\s+)?(?:in\\s+)?(?<replacement>.+?)$",
              FLAGS));

  static final RuleExtractionPattern DELETION =
      new RuleExtractionPattern(
          "deletion",
          Pattern.compile(
              "\\b(?:omit|delete|remove|avoid)\\s+(?:(?:the|using)\\s+)?"
                  + "(?:(?:word|term|phrase)\\s+)?"
                  + Q_OPEN
                  + "(?<pattern>"
                  + QUOTED_TEXT
                  + ")"
                  + Q_CLOSE,
              FLAGS),
          true);

  static final List<RuleExtractionPattern> ORDERED =
      List.of(
          ARROW,
          MODAL_FORM,
          USE_INSTEAD,
          WRITE_NOT,
          REPLACE_WITH,
          TRANSFORMATION,
          CASE_FORM,
          CONTEXT_FORM,
          DELETION);

  private RuleExtractionPatterns() {}
}
