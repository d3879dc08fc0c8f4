package com.flamingo.ai.stylecheck.service.index;

import com.flamingo.ai.stylecheck.domain.model.StyleGuideEntry;
import com.flamingo.ai.stylecheck.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Style-guide entries paired with their vectors in a {@link VectorStore}.
 *
 * <p>Position {@code i} of the store always refers to item {@code i}. Entries whose embedding
 * failed are dropped from both sides so the two stay aligned. The store is created lazily with the
 * dimension of the first vector.
 *
 * <p>Append-only. Callers must finish all insertions before searching from several threads.
 *
 * @param <T> entry type
 */
@Slf4j
public abstract class EmbeddingIndex<T extends StyleGuideEntry> {

  protected final EmbeddingService embeddingService;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final List<T> items = new ArrayList<>();
  private VectorStore store;

  protected EmbeddingIndex(
      EmbeddingService embeddingService, MeterRegistry meterRegistry, String indexName) {
    this.embeddingService = embeddingService;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
  }

  /** Squared-L2 distance below which a hit counts as a match. */
  public abstract double distanceThreshold();

  /** Maps a distance to a score in [0, 1]. */
  public abstract double confidence(double distance);

  /** Hook applied to every stored and query vector. */
  protected float[] prepareVector(float[] raw) {
    return raw;
  }

  /**
   * Stores an entry with an already computed vector, as when restoring a saved session. The vector
   * is stored as given.
   *
   * @return {@code true} if the entry was stored
   */
  public boolean addPrecomputed(T item, float[] vector) {
    if (vector == null || vector.length == 0) {
      log.warn("[{}] Skipping entry without embedding: {}", indexName, item.label());
      meterRegistry.counter("style.index.skipped", "index", indexName).increment();
      return false;
    }
    if (store == null) {
      store = new FlatL2VectorStore(vector.length);
    }
    int position = store.add(vector);
    if (position != items.size()) {
      throw new IllegalStateException(
          String.format(
              "[%s] Vector store position %d does not match item count %d",
              indexName, position, items.size()));
    }
    items.add(item);
    return true;
  }

  /**
   * Finds the entries nearest to the query text.
   *
   * @return at most {@code min(k, size())} hits, ascending by distance
   */
  public List<IndexHit<T>> search(String queryText, int k) {
    if (items.isEmpty() || k <= 0 || queryText == null || queryText.isBlank()) {
      return List.of();
    }
    float[] query = embeddingService.embed(queryText);
    if (query.length == 0) {
      log.warn("[{}] Query embedding failed, no hits returned", indexName);
      return List.of();
    }
    return searchVector(prepareVector(query), k);
  }

  /** Like {@link #search(String, int)}, keeping only hits under {@link #distanceThreshold()}. */
  public List<IndexHit<T>> searchAccepted(String queryText, int k) {
    double threshold = distanceThreshold();
    return search(queryText, k).stream().filter(hit -> hit.distance() < threshold).toList();
  }

  List<IndexHit<T>> searchVector(float[] query, int k) {
    if (query.length != store.dimension()) {
      log.warn(
          "[{}] Query dimension {} does not match index dimension {}",
          indexName,
          query.length,
          store.dimension());
      return List.of();
    }
    List<IndexHit<T>> hits = new ArrayList<>();
    for (Neighbor neighbor : store.search(query, k)) {
      if (neighbor.position() < 0 || neighbor.position() >= items.size()) {
        log.warn(
            "[{}] Dropping hit at position {}, index holds {} items",
            indexName,
            neighbor.position(),
            items.size());
        meterRegistry.counter("style.index.inconsistency", "index", indexName).increment();
        continue;
      }
      hits.add(
          new IndexHit<>(
              items.get(neighbor.position()),
              neighbor.distance(),
              confidence(neighbor.distance())));
    }
    return hits;
  }

  /** Uses the given store instead of creating one lazily. Only valid while the index is empty. */
  void useStore(VectorStore vectorStore) {
    if (!items.isEmpty()) {
      throw new IllegalStateException("Cannot replace the store of a populated index");
    }
    this.store = vectorStore;
  }

  /** Vector stored for the entry at the given position. */
  public float[] vectorAt(int position) {
    return store.vectorAt(position);
  }

  public List<T> entries() {
    return Collections.unmodifiableList(items);
  }

  public int size() {
    return items.size();
  }

  public String getIndexName() {
    return indexName;
  }
}
