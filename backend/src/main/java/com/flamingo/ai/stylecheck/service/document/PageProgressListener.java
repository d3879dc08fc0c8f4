package com.flamingo.ai.stylecheck.service.document;

/** Receives a callback after each page of a paginated document has been read. */
@FunctionalInterface
public interface PageProgressListener {

  PageProgressListener NONE = (page, totalPages) -> {};

  void onPage(int page, int totalPages);
}
