package com.flamingo.ai.stylecheck.service.correction;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Inline markers around retrieval-based edits: {@code <change confidence=0.87>text</change>}. */
public final class ChangeMarkers {

  public static final Pattern MARKER =
      Pattern.compile("<change confidence=(\\d+(?:\\.\\d+)?)>(.*?)</change>", Pattern.DOTALL);

  private ChangeMarkers() {}

  public static String wrap(String text, double confidence) {
    return String.format(Locale.ROOT, "<change confidence=%.2f>%s</change>", confidence, text);
  }

  /** Removes all markers, keeping the text they enclose. */
  public static String strip(String text) {
    return MARKER.matcher(text).replaceAll(match -> Matcher.quoteReplacement(match.group(2)));
  }
}
