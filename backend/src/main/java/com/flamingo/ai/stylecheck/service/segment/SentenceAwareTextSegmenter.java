package com.flamingo.ai.stylecheck.service.segment;

import com.flamingo.ai.stylecheck.domain.model.DocumentSection;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link TextSegmenter} that never splits inside a sentence.
 *
 * <p>A sentence ends at a run of {@code .}, {@code !} or {@code ?} followed by whitespace or the
 * end of the text, so decimals ({@code 0.05}) and abbreviations glued to the next word stay
 * intact. Chunks are trimmed substrings of the input: joining them with single spaces reproduces
 * the text up to whitespace.
 *
 * <p>Section headings are recognised in three shapes:
 *
 * <ul>
 *   <li>Markdown: {@code ## Abbreviations}
 *   <li>all-caps followed by a colon: {@code GENERAL RULES: text}, the text after the colon
 *       belonging to the body
 *   <li>numbered: {@code 2.1 Abbreviations}, capitalised, short and free of sentence punctuation
 * </ul>
 */
@Service
@Slf4j
public class SentenceAwareTextSegmenter implements TextSegmenter {

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(?=\\s|$)");

  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s+(.+?)\\s*#*\\s*$");
  private static final Pattern CAPS_HEADING =
      Pattern.compile("^([A-Z][A-Z0-9 &/'\\-]{2,}):\\s*(.*)$");
  private static final Pattern NUMBERED_HEADING =
      Pattern.compile("^(\\d+(?:\\.\\d+)*)\\.?\\s+([A-Z][^.!?:\"“”→>=]*)$");
  private static final Pattern RULE_VERB =
      Pattern.compile("\\b(?:should|must|becomes|changes to)\\b", Pattern.CASE_INSENSITIVE);

  private static final int MAX_HEADING_LENGTH = 80;

  @Override
  public List<String> segmentIntoChunks(String text, int maxChunkSize) {
    if (maxChunkSize <= 0) {
      throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
    }
    List<String> chunks = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return chunks;
    }

    int chunkStart = -1;
    int chunkEnd = 0;
    for (int[] sentence : sentenceSpans(text)) {
      if (chunkStart < 0) {
        chunkStart = sentence[0];
        chunkEnd = sentence[1];
        continue;
      }
      String candidate = text.substring(chunkStart, sentence[1]).trim();
      if (candidate.length() > maxChunkSize) {
        addIfNotBlank(chunks, text.substring(chunkStart, chunkEnd));
        chunkStart = sentence[0];
      }
      chunkEnd = sentence[1];
    }
    if (chunkStart >= 0) {
      addIfNotBlank(chunks, text.substring(chunkStart, chunkEnd));
    }

    log.debug(
        "Segmented {} chars into {} chunks (max {})", text.length(), chunks.size(), maxChunkSize);
    return chunks;
  }

  /** Returns {@code [start, end)} offsets of every sentence, covering the whole text. */
  private List<int[]> sentenceSpans(String text) {
    List<int[]> spans = new ArrayList<>();
    Matcher matcher = SENTENCE_END.matcher(text);
    int start = 0;
    while (matcher.find()) {
      int end = matcher.end();
      if (!text.substring(start, end).isBlank()) {
        spans.add(new int[] {start, end});
      }
      start = end;
    }
    if (start < text.length() && !text.substring(start).isBlank()) {
      spans.add(new int[] {start, text.length()});
    }
    return spans;
  }

  private void addIfNotBlank(List<String> chunks, String chunk) {
    String trimmed = chunk.trim();
    if (!trimmed.isEmpty()) {
      chunks.add(trimmed);
    }
  }

  @Override
  public List<DocumentSection> extractSections(String text) {
    List<DocumentSection> sections = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return sections;
    }

    String currentTitle = "";
    StringBuilder body = new StringBuilder();

    for (String rawLine : text.split("\\r?\\n", -1)) {
      String line = rawLine.strip();
      String heading = null;
      String trailing = null;

      Matcher markdown = MARKDOWN_HEADING.matcher(line);
      Matcher caps = CAPS_HEADING.matcher(line);
      if (markdown.matches()) {
        heading = markdown.group(1);
      } else if (caps.matches()) {
        heading = caps.group(1).strip();
        trailing = caps.group(2);
      } else if (isNumberedHeading(line)) {
        heading = line;
      }

      if (heading == null) {
        body.append(rawLine).append('\n');
        continue;
      }

      flush(sections, currentTitle, body);
      currentTitle = heading;
      body.setLength(0);
      if (trailing != null && !trailing.isBlank()) {
        body.append(trailing).append('\n');
      }
    }
    flush(sections, currentTitle, body);

    log.debug("Extracted {} sections", sections.size());
    return sections;
  }

  private boolean isNumberedHeading(String line) {
    return line.length() <= MAX_HEADING_LENGTH
        && NUMBERED_HEADING.matcher(line).matches()
        && !RULE_VERB.matcher(line).find();
  }

  private void flush(List<DocumentSection> sections, String title, StringBuilder body) {
    String content = body.toString().strip();
    if (title.isEmpty() && content.isEmpty()) {
      return;
    }
    sections.add(new DocumentSection(title, content));
  }
}
