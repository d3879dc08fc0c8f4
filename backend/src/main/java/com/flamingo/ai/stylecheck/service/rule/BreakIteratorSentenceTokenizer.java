package com.flamingo.ai.stylecheck.service.rule;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** {@link SentenceTokenizer} backed by the JDK's locale-aware {@link BreakIterator}. */
@Component
public class BreakIteratorSentenceTokenizer implements SentenceTokenizer {

  @Override
  public List<String> sentences(String text) {
    List<String> sentences = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return sentences;
    }
    // BreakIterator instances are stateful, so one per call
    BreakIterator iterator = BreakIterator.getSentenceInstance(Locale.ENGLISH);
    iterator.setText(text);
    int start = iterator.first();
    for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
      String sentence = text.substring(start, end).trim();
      if (!sentence.isEmpty()) {
        sentences.add(sentence);
      }
    }
    return sentences;
  }
}
