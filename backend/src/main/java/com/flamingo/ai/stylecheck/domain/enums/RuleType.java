package com.flamingo.ai.stylecheck.domain.enums;

/** How a style rule is matched and applied. */
public enum RuleType {
  /** Literal substitution of one term by another. */
  DIRECT,

  /** Pattern text contains wildcard or regex metacharacters. */
  PATTERN,

  /** Pattern or replacement spans several words. */
  MULTI,

  /** Changes the letter case of the matched text. */
  CASE,

  /** Applies only under a stated condition. */
  CONTEXT
}
