package com.flamingo.ai.stylecheck.exception;

/** Exception thrown when a style guide or target document cannot be read or processed. */
public class DocumentProcessingException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public DocumentProcessingException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String fileName, String message, String userMessage) {
    super(message);
    this.fileName = fileName;
    this.userMessage = userMessage;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
