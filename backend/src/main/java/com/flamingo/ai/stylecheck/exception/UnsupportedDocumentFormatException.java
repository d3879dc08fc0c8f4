package com.flamingo.ai.stylecheck.exception;

/** Exception thrown when a file is not a PDF, DOCX or plain-text document. */
public class UnsupportedDocumentFormatException extends DocumentProcessingException {

  public UnsupportedDocumentFormatException(String fileName) {
    super(
        fileName,
        "Unsupported document format: " + fileName,
        "Only PDF, DOCX and TXT files are supported");
  }
}
