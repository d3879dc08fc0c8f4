package com.flamingo.ai.stylecheck.service.pipeline;

import com.flamingo.ai.stylecheck.domain.model.CorrectionResult;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything produced by correcting one document.
 *
 * @param documentName target document file name
 * @param styleGuideName name of the style guide the session came from
 * @param paragraphs per-paragraph results in document order
 * @param stats summary counts
 */
public record DocumentCorrectionReport(
    String documentName, String styleGuideName, List<ParagraphResult> paragraphs, Stats stats) {

  /**
   * Corrected chunks of one paragraph.
   *
   * @param index zero-based paragraph position
   * @param chunks results in chunk order
   */
  public record ParagraphResult(int index, List<CorrectionResult> chunks) {

    public String originalText() {
      return chunks.stream().map(CorrectionResult::originalText).collect(Collectors.joining(" "));
    }

    public String correctedText() {
      return chunks.stream().map(CorrectionResult::correctedText).collect(Collectors.joining(" "));
    }
  }

  /** Summary counts. */
  public record Stats(
      int paragraphs, int chunks, int changedChunks, int totalChanges, int retrievalChanges) {}

  public List<CorrectionResult> results() {
    return paragraphs.stream().flatMap(p -> p.chunks().stream()).toList();
  }

  public String correctedText() {
    return paragraphs.stream()
        .map(ParagraphResult::correctedText)
        .collect(Collectors.joining("\n\n"));
  }
}
