package com.flamingo.ai.stylecheck.service.index;

import java.time.Instant;

/**
 * A fully ingested style guide: both indexes are complete before a session is created, and no
 * further entries are added afterwards.
 *
 * @param sourceName file or label the guide came from
 * @param ruleIndex extracted rules
 * @param chunkIndex embedded guide chunks
 * @param ingestedAt when ingestion finished
 */
public record StyleGuideSession(
    String sourceName, StyleRuleIndex ruleIndex, StyleChunkIndex chunkIndex, Instant ingestedAt) {

  public int ruleCount() {
    return ruleIndex.size();
  }

  public int chunkCount() {
    return chunkIndex.size();
  }
}
