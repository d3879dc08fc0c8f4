package com.flamingo.ai.stylecheck.exception;

/** Exception thrown when a document is corrected before any style guide has been ingested. */
public class StyleGuideNotLoadedException extends RuntimeException {

  public StyleGuideNotLoadedException() {
    super("Style guide must be processed before correcting a document");
  }
}
