package com.flamingo.ai.stylecheck.service.document;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** {@link DocumentTextExtractor} for PDF files using Apache PDFBox, one page at a time. */
@Component
@Slf4j
public class PdfTextExtractor implements DocumentTextExtractor {

  @Override
  public String extractText(byte[] content, String fileName, PageProgressListener listener) {
    try (PDDocument pdfDoc = Loader.loadPDF(content)) {
      int totalPages = pdfDoc.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();
      StringBuilder text = new StringBuilder();
      for (int page = 1; page <= totalPages; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = stripper.getText(pdfDoc);
        if (!pageText.isBlank()) {
          text.append(pageText.strip()).append("\n\n");
        }
        listener.onPage(page, totalPages);
      }
      log.debug("Extracted {} chars from {} pages of {}", text.length(), totalPages, fileName);
      return text.toString().strip();
    } catch (IOException e) {
      log.warn("Could not read PDF {}: {}", fileName, e.getMessage());
      return "";
    }
  }

  @Override
  public boolean supports(DocumentFormat format) {
    return format == DocumentFormat.PDF;
  }
}
