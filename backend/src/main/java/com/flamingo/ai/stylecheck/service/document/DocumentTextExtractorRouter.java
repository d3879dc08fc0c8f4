package com.flamingo.ai.stylecheck.service.document;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Picks the {@link DocumentTextExtractor} for a file by its extension. */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentTextExtractorRouter {

  private final List<DocumentTextExtractor> extractors;

  /**
   * Returns the extractor for the format.
   *
   * @throws IllegalStateException if no extractor is registered for it
   */
  public DocumentTextExtractor route(DocumentFormat format) {
    for (DocumentTextExtractor extractor : extractors) {
      if (extractor.supports(format)) {
        log.debug("Routing {} to {}", format, extractor.getClass().getSimpleName());
        return extractor;
      }
    }
    throw new IllegalStateException("No text extractor registered for " + format);
  }
}
