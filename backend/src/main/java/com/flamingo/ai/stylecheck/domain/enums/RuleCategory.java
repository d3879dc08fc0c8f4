package com.flamingo.ai.stylecheck.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subject area a style rule belongs to.
 *
 * <p>Declaration order is significant: when two categories score equally during classification
 * the one declared first wins.
 */
public enum RuleCategory {
  STRUCTURE("Structure"),
  NUMBERS("Numbers"),
  DOMAIN("Domain"),
  FORMATTING("Formatting"),
  PUNCTUATION("Punctuation"),
  GRAMMAR("Grammar"),
  ABBREVIATION("Abbreviation"),
  REFERENCE("Reference");

  private final String displayName;

  RuleCategory(String displayName) {
    this.displayName = displayName;
  }

  @JsonValue
  public String getDisplayName() {
    return displayName;
  }

  @JsonCreator
  public static RuleCategory fromDisplayName(String value) {
    for (RuleCategory category : values()) {
      if (category.displayName.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown rule category: " + value);
  }
}
