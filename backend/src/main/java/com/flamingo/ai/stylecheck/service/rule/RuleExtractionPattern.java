package com.flamingo.ai.stylecheck.service.rule;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of the ordered extraction chain: a regex with named groups {@code pattern}, optionally
 * {@code replacement} and {@code condition}.
 *
 * <p>Unquoted captures are cleaned of surrounding quotes and trailing punctuation. Captures taken
 * from inside explicit quotes are kept verbatim apart from whitespace, since punctuation there is
 * part of the rule. A capture whose pattern is blank after cleaning is not a match.
 */
public record RuleExtractionPattern(String name, Pattern regex, boolean quoted) {

  private static final Pattern EDGE_NOISE =
      Pattern.compile("^[\\s\"“”'‘’`]+|[\\s\"“”'‘’`.,;:!?]+$");

  public RuleExtractionPattern(String name, Pattern regex) {
    this(name, regex, false);
  }

  public Optional<RuleCandidate> match(String segment) {
    Matcher matcher = regex.matcher(segment);
    if (!matcher.find()) {
      return Optional.empty();
    }
    String pattern = capture(matcher, "pattern");
    if (pattern.isEmpty()) {
      return Optional.empty();
    }
    String replacement = capture(matcher, "replacement");
    Map<String, String> context = new LinkedHashMap<>();
    String condition = clean(group(matcher, "condition"));
    if (!condition.isEmpty()) {
      context.put("condition", condition);
    }
    return Optional.of(new RuleCandidate(name, pattern, replacement, context));
  }

  private String capture(Matcher matcher, String groupName) {
    String value = group(matcher, groupName);
    return quoted ? value.strip() : clean(value);
  }

  private String group(Matcher matcher, String groupName) {
    if (!regex.pattern().contains("(?<" + groupName + ">")) {
      return "";
    }
    String value = matcher.group(groupName);
    return value != null ? value : "";
  }

  static String clean(String value) {
    String previous;
    String current = value;
    do {
      previous = current;
      current = EDGE_NOISE.matcher(current).replaceAll("");
    } while (!current.equals(previous));
    return current;
  }
}
