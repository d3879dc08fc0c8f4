package com.flamingo.ai.stylecheck.service.index;

import com.flamingo.ai.stylecheck.domain.model.StyleGuideEntry;

/**
 * An indexed entry returned by a search.
 *
 * @param item the rule or chunk
 * @param distance squared L2 distance to the query
 * @param confidence score in [0, 1] derived from the distance by the owning index
 */
public record IndexHit<T extends StyleGuideEntry>(T item, double distance, double confidence) {}
