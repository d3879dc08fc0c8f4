package com.flamingo.ai.stylecheck.service.pipeline;

import com.flamingo.ai.stylecheck.domain.enums.RuleCategory;
import java.util.Map;

/**
 * Result of ingesting a style guide.
 *
 * @param sourceName guide file name or label
 * @param sections sections detected
 * @param chunksIndexed chunks stored in the chunk index
 * @param rulesIndexed rules stored in the rule index
 * @param rulesByCategory rule counts per category
 */
public record StyleGuideSummary(
    String sourceName,
    int sections,
    int chunksIndexed,
    int rulesIndexed,
    Map<RuleCategory, Integer> rulesByCategory) {}
