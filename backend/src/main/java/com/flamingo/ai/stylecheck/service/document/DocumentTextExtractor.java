package com.flamingo.ai.stylecheck.service.document;

/**
 * Extracts plain text from one document format.
 *
 * <p>Unreadable content yields an empty string rather than an exception; callers treat empty text
 * as a document without chunks.
 */
public interface DocumentTextExtractor {

  /**
   * Extracts the text in reading order.
   *
   * @param content raw file bytes
   * @param fileName original file name, used for logging and type detection
   * @param listener notified per page where the format has pages
   * @return extracted text, paragraphs separated by blank lines; empty if nothing could be read
   */
  String extractText(byte[] content, String fileName, PageProgressListener listener);

  boolean supports(DocumentFormat format);
}
