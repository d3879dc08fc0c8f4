package com.flamingo.ai.stylecheck.service.pipeline;

/**
 * A checkpoint reached while ingesting a style guide or correcting a document.
 *
 * @param stage {@link #STYLE_GUIDE} or {@link #DOCUMENT}
 * @param phase step within the stage, e.g. {@code reading} or {@code processing}
 * @param current items done so far
 * @param total items expected, or 0 if unknown
 * @param message human-readable description
 */
public record ProgressEvent(String stage, String phase, int current, int total, String message) {

  public static final String STYLE_GUIDE = "style_guide";
  public static final String DOCUMENT = "csr";

  public static final String READING = "reading";
  public static final String PROCESSING = "processing";
  public static final String INDEXING = "indexing";
  public static final String COMPLETE = "complete";

  /** Completed fraction in [0, 1]; 0 when the total is unknown. */
  public double fraction() {
    return total <= 0 ? 0.0 : Math.min(1.0, (double) current / total);
  }
}
