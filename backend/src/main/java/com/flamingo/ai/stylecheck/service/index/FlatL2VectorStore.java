package com.flamingo.ai.stylecheck.service.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/** Exact {@link VectorStore} that scans every stored vector using squared Euclidean distance. */
public class FlatL2VectorStore implements VectorStore {

  private final int dimension;
  private final List<float[]> vectors = new ArrayList<>();

  public FlatL2VectorStore(int dimension) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("Dimension must be positive: " + dimension);
    }
    this.dimension = dimension;
  }

  @Override
  public int add(float[] vector) {
    checkDimension(vector);
    vectors.add(Arrays.copyOf(vector, vector.length));
    return vectors.size() - 1;
  }

  @Override
  public List<Neighbor> search(float[] query, int k) {
    checkDimension(query);
    int limit = Math.min(k, vectors.size());
    if (limit <= 0) {
      return List.of();
    }
    List<Neighbor> all = new ArrayList<>(vectors.size());
    for (int i = 0; i < vectors.size(); i++) {
      all.add(new Neighbor(i, squaredDistance(query, vectors.get(i))));
    }
    // stable sort: equal distances keep insertion order
    all.sort(Comparator.comparingDouble(Neighbor::distance));
    return List.copyOf(all.subList(0, limit));
  }

  @Override
  public float[] vectorAt(int position) {
    return Arrays.copyOf(vectors.get(position), dimension);
  }

  @Override
  public int size() {
    return vectors.size();
  }

  @Override
  public int dimension() {
    return dimension;
  }

  private void checkDimension(float[] vector) {
    if (vector.length != dimension) {
      throw new IllegalArgumentException(
          String.format("Expected vector of dimension %d, got %d", dimension, vector.length));
    }
  }

  static double squaredDistance(float[] a, float[] b) {
    double sum = 0;
    for (int i = 0; i < a.length; i++) {
      double diff = a[i] - b[i];
      sum += diff * diff;
    }
    return sum;
  }
}
