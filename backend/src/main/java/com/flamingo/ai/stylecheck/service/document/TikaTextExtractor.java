package com.flamingo.ai.stylecheck.service.document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * {@link DocumentTextExtractor} for Word documents using Apache Tika's {@link AutoDetectParser}.
 * Paragraphs and table cells come out in document order, one paragraph per block.
 */
@Component
@Slf4j
public class TikaTextExtractor implements DocumentTextExtractor {

  private static final Pattern LINE_BREAKS = Pattern.compile("[ \\t]*\\n[\\s]*");

  @Override
  public String extractText(byte[] content, String fileName, PageProgressListener listener) {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    try (InputStream in = new ByteArrayInputStream(content)) {
      parser.parse(in, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      log.warn("Could not read document {}: {}", fileName, e.getMessage());
      return "";
    }
    listener.onPage(1, 1);
    // Each Word paragraph is a line in Tika's output; make it a block of its own
    String text = LINE_BREAKS.matcher(handler.toString().strip()).replaceAll("\n\n");
    log.debug("Extracted {} chars from {}", text.length(), fileName);
    return text;
  }

  @Override
  public boolean supports(DocumentFormat format) {
    return format == DocumentFormat.DOCX;
  }
}
