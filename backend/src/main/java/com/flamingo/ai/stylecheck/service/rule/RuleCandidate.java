package com.flamingo.ai.stylecheck.service.rule;

import java.util.Map;

/**
 * Raw pattern/replacement pair captured from one style-guide sentence, before classification.
 *
 * @param strategy name of the extraction pattern that produced it
 * @param pattern text to look for
 * @param replacement text to put in its place; empty for deletions
 * @param context extra conditions such as {@code condition}
 */
public record RuleCandidate(
    String strategy, String pattern, String replacement, Map<String, String> context) {}
