package com.flamingo.ai.stylecheck.service.rule;

import java.util.List;

/** Sentence boundary detection used to cut style-guide blocks into rule candidates. */
public interface SentenceTokenizer {

  /**
   * Splits a block of prose into sentences.
   *
   * @param text block of text without line-level structure
   * @return trimmed, non-blank sentences in order
   */
  List<String> sentences(String text);
}
