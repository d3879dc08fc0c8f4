package com.flamingo.ai.stylecheck.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.stylecheck.domain.enums.RuleCategory;
import com.flamingo.ai.stylecheck.domain.enums.RuleType;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A structured style-guide requirement: replace {@code pattern} with {@code replacement}.
 *
 * <p>Immutable. {@code pattern} is never blank; {@code replacement} is empty only for deletion
 * rules.
 */
@Value
public class StyleRule implements StyleGuideEntry {

  String id;
  RuleCategory category;
  RuleType type;
  String description;
  String pattern;
  String replacement;
  List<String> examples;
  Map<String, String> context;

  @Builder(toBuilder = true)
  @Jacksonized
  public StyleRule(
      String id,
      RuleCategory category,
      RuleType type,
      String description,
      String pattern,
      String replacement,
      List<String> examples,
      Map<String, String> context) {
    if (pattern == null || pattern.isBlank()) {
      throw new IllegalArgumentException("Style rule pattern must not be blank");
    }
    this.id = id;
    this.category = category != null ? category : RuleCategory.FORMATTING;
    this.type = type != null ? type : RuleType.DIRECT;
    this.description = description != null ? description : "";
    this.pattern = pattern;
    this.replacement = replacement != null ? replacement : "";
    this.examples = examples != null ? List.copyOf(examples) : List.of();
    this.context = context != null ? Map.copyOf(context) : Map.of();
  }

  @JsonIgnore
  public boolean isDeletion() {
    return replacement.isEmpty();
  }

  @Override
  public String triggerText() {
    return pattern;
  }

  @Override
  public String embeddingText() {
    return pattern + " " + replacement;
  }

  @Override
  public String label() {
    return description.isBlank() ? pattern + " -> " + replacement : description;
  }

  @Override
  public Optional<String> replacementFor(String matchedSpan) {
    if (!examples.isEmpty()) {
      return Optional.of(examples.get(0));
    }
    if (type == RuleType.CASE) {
      return Optional.of(applyCase(matchedSpan));
    }
    return Optional.of(replacement);
  }

  private String applyCase(String span) {
    String instruction = replacement.toLowerCase(Locale.ROOT);
    if (instruction.contains("lower")) {
      return span.toLowerCase(Locale.ROOT);
    }
    if (instruction.contains("title") || instruction.contains("capitali")) {
      return titleCase(span);
    }
    if (instruction.contains("sentence") && !span.isEmpty()) {
      return Character.toUpperCase(span.charAt(0)) + span.substring(1).toLowerCase(Locale.ROOT);
    }
    return span.toUpperCase(Locale.ROOT);
  }

  private static String titleCase(String span) {
    StringBuilder sb = new StringBuilder(span.length());
    boolean startOfWord = true;
    for (char c : span.toCharArray()) {
      sb.append(startOfWord ? Character.toUpperCase(c) : c);
      startOfWord = Character.isWhitespace(c) || c == '-';
    }
    return sb.toString();
  }
}
