package com.flamingo.ai.stylecheck.service.document;

import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/** {@link DocumentTextExtractor} for UTF-8 text files. */
@Component
public class PlainTextExtractor implements DocumentTextExtractor {

  @Override
  public String extractText(byte[] content, String fileName, PageProgressListener listener) {
    String text = new String(content, StandardCharsets.UTF_8);
    // strip a byte-order mark
    if (text.startsWith("\uFEFF")) {
      text = text.substring(1);
    }
    listener.onPage(1, 1);
    return text;
  }

  @Override
  public boolean supports(DocumentFormat format) {
    return format == DocumentFormat.TXT;
  }
}
