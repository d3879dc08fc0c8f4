package com.flamingo.ai.stylecheck.service.document;

/**
 * A paragraph to write into a Word document.
 *
 * @param text paragraph text; line breaks are kept
 * @param headingLevel 0 for body text, 1 to 3 for headings
 */
public record DocxParagraph(String text, int headingLevel) {

  public static DocxParagraph body(String text) {
    return new DocxParagraph(text, 0);
  }

  public static DocxParagraph heading(String text, int level) {
    return new DocxParagraph(text, level);
  }

  public boolean isHeading() {
    return headingLevel > 0;
  }
}
