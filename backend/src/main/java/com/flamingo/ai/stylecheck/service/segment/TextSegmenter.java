package com.flamingo.ai.stylecheck.service.segment;

import com.flamingo.ai.stylecheck.domain.model.DocumentSection;
import java.util.List;

/**
 * Splits raw document text into bounded chunks and titled sections.
 *
 * <p>Implementations must be stateless, safe for concurrent use and must never fail on arbitrary
 * input text.
 */
public interface TextSegmenter {

  /**
   * Groups sentences into chunks of at most {@code maxChunkSize} characters. A sentence longer than
   * the limit is emitted as its own chunk rather than being cut.
   *
   * @param text raw text, may be {@code null}
   * @param maxChunkSize character budget per chunk
   * @return ordered, trimmed, non-blank chunks
   */
  List<String> segmentIntoChunks(String text, int maxChunkSize);

  /**
   * Splits text into titled sections using heading detection.
   *
   * @param text raw text, may be {@code null}
   * @return sections in document order; text before the first heading has an empty title
   */
  List<DocumentSection> extractSections(String text);
}
