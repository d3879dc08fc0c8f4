package com.flamingo.ai.stylecheck.service.index;

import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import com.flamingo.ai.stylecheck.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Index over extracted rules. Each rule is embedded from {@code pattern + " " + replacement}
 * without normalisation.
 */
@Slf4j
public class StyleRuleIndex extends EmbeddingIndex<StyleRule> {

  private final double distanceThreshold;

  public StyleRuleIndex(
      EmbeddingService embeddingService, MeterRegistry meterRegistry, double distanceThreshold) {
    super(embeddingService, meterRegistry, "rules");
    this.distanceThreshold = distanceThreshold;
  }

  /**
   * Embeds and appends rules in order. Rules whose embedding fails are skipped.
   *
   * @return number of rules stored
   */
  public int addRules(List<StyleRule> rules) {
    if (rules.isEmpty()) {
      return 0;
    }
    List<float[]> vectors =
        embeddingService.embedAll(rules.stream().map(StyleRule::embeddingText).toList());
    if (vectors.size() != rules.size()) {
      log.warn("Rule batch embedding failed, falling back to one request per rule");
      vectors = rules.stream().map(rule -> embeddingService.embed(rule.embeddingText())).toList();
    }
    int added = 0;
    for (int i = 0; i < rules.size(); i++) {
      if (addPrecomputed(rules.get(i), vectors.get(i))) {
        added++;
      }
    }
    log.info("Indexed {} of {} rules", added, rules.size());
    return added;
  }

  @Override
  public double distanceThreshold() {
    return distanceThreshold;
  }

  @Override
  public double confidence(double distance) {
    return Math.max(0.0, 1.0 - distance / distanceThreshold);
  }
}
