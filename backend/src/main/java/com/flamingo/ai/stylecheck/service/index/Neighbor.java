package com.flamingo.ai.stylecheck.service.index;

/**
 * Raw vector-store hit.
 *
 * @param position insertion position of the stored vector
 * @param distance squared L2 distance to the query
 */
public record Neighbor(int position, double distance) {}
