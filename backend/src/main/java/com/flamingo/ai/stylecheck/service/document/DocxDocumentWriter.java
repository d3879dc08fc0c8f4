package com.flamingo.ai.stylecheck.service.document;

import com.flamingo.ai.stylecheck.exception.DocumentProcessingException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Component;

/** Writes ordered paragraphs into a DOCX container with Apache POI. */
@Component
@Slf4j
public class DocxDocumentWriter {

  private static final int BODY_FONT_SIZE = 11;

  public byte[] write(List<DocxParagraph> paragraphs) {
    try (XWPFDocument document = new XWPFDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      for (DocxParagraph paragraph : paragraphs) {
        XWPFRun run = document.createParagraph().createRun();
        if (paragraph.isHeading()) {
          run.setBold(true);
          run.setFontSize(headingFontSize(paragraph.headingLevel()));
        } else {
          run.setFontSize(BODY_FONT_SIZE);
        }
        writeLines(run, paragraph.text());
      }
      document.write(out);
      log.debug("Wrote DOCX with {} paragraphs", paragraphs.size());
      return out.toByteArray();
    } catch (IOException e) {
      throw new DocumentProcessingException(null, "Failed to write DOCX: " + e.getMessage(), e);
    }
  }

  private static int headingFontSize(int level) {
    return Math.max(BODY_FONT_SIZE + 1, 20 - 2 * level);
  }

  private static void writeLines(XWPFRun run, String text) {
    String[] lines = (text == null ? "" : text).split("\\r?\\n", -1);
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        run.addBreak();
      }
      run.setText(lines[i]);
    }
  }
}
