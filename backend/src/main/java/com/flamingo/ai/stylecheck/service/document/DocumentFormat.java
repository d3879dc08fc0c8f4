package com.flamingo.ai.stylecheck.service.document;

import com.flamingo.ai.stylecheck.exception.UnsupportedDocumentFormatException;
import java.util.Locale;

/** File formats accepted for style guides and target documents. */
public enum DocumentFormat {
  PDF("pdf"),
  DOCX("docx"),
  TXT("txt");

  private final String extension;

  DocumentFormat(String extension) {
    this.extension = extension;
  }

  public String getExtension() {
    return extension;
  }

  /**
   * Resolves the format from a file name's extension.
   *
   * @throws UnsupportedDocumentFormatException for any other extension
   */
  public static DocumentFormat fromFileName(String fileName) {
    if (fileName != null) {
      int dot = fileName.lastIndexOf('.');
      if (dot >= 0 && dot < fileName.length() - 1) {
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (DocumentFormat format : values()) {
          if (format.extension.equals(extension)) {
            return format;
          }
        }
      }
    }
    throw new UnsupportedDocumentFormatException(fileName);
  }
}
