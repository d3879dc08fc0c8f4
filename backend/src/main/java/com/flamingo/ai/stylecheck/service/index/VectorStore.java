package com.flamingo.ai.stylecheck.service.index;

import java.util.List;

/**
 * Append-only nearest-neighbour store. Positions are assigned in insertion order starting at 0.
 *
 * <p>Not safe for concurrent mutation; concurrent searches are fine once insertion has finished.
 */
public interface VectorStore {

  /**
   * Stores a vector.
   *
   * @return position of the stored vector
   * @throws IllegalArgumentException if the vector dimension differs from the store's
   */
  int add(float[] vector);

  /**
   * Finds the nearest stored vectors.
   *
   * @return at most {@code min(k, size())} neighbours, ascending by distance
   */
  List<Neighbor> search(float[] query, int k);

  float[] vectorAt(int position);

  int size();

  int dimension();
}
