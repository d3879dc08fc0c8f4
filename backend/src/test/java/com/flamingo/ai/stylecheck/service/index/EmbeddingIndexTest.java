package com.flamingo.ai.stylecheck.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.stylecheck.domain.model.StyleChunk;
import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import com.flamingo.ai.stylecheck.service.embedding.EmbeddingService;
import com.flamingo.ai.stylecheck.service.embedding.HashingEmbeddingModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingIndex Tests")
class EmbeddingIndexTest {

  private static final StyleRule PATIENT =
      StyleRule.builder().id("r1").pattern("patient").replacement("Subject").build();
  private static final StyleRule COLOUR =
      StyleRule.builder().id("r2").pattern("colour").replacement("color").build();
  private static final StyleRule UTILIZE =
      StyleRule.builder().id("r3").pattern("utilize").replacement("use").build();

  @Mock private EmbeddingService failingEmbeddingService;

  private SimpleMeterRegistry meterRegistry;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    embeddingService = new EmbeddingService(new HashingEmbeddingModel(), meterRegistry);
  }

  @Nested
  @DisplayName("StyleRuleIndex")
  class RuleIndex {

    private StyleRuleIndex index;

    @BeforeEach
    void setUp() {
      index = new StyleRuleIndex(embeddingService, meterRegistry, 100.0);
    }

    @Test
    @DisplayName("should store rules in order with one vector each")
    void shouldAddRulesInOrder() {
      int added = index.addRules(List.of(PATIENT, COLOUR, UTILIZE));

      assertThat(added).isEqualTo(3);
      assertThat(index.entries()).containsExactly(PATIENT, COLOUR, UTILIZE);
      assertThat(index.vectorAt(1))
          .containsExactly(HashingEmbeddingModel.vectorFor("colour color"));
    }

    @Test
    @DisplayName("should return at most k hits ascending by distance")
    void shouldSearchAscending_andBoundByK() {
      index.addRules(List.of(COLOUR, PATIENT, UTILIZE));

      List<IndexHit<StyleRule>> hits = index.search("patient", 2);

      assertThat(hits).hasSize(2);
      assertThat(hits.get(0).item()).isEqualTo(PATIENT);
      assertThat(hits.get(0).distance()).isEqualTo(1.0);
      assertThat(hits.get(1).item()).isEqualTo(COLOUR);
      assertThat(hits.get(1).distance()).isEqualTo(3.0);
      assertThat(index.search("patient", 10)).hasSize(3);
    }

    @Test
    @DisplayName("should derive confidence from distance and clamp it to [0, 1]")
    void shouldComputeConfidence() {
      assertThat(index.confidence(0.0)).isEqualTo(1.0);
      assertThat(index.confidence(50.0)).isEqualTo(0.5);
      assertThat(index.confidence(150.0)).isZero();
    }

    @Test
    @DisplayName("should keep only hits under the distance threshold")
    void shouldFilterAcceptedHits() {
      StyleRuleIndex strict = new StyleRuleIndex(embeddingService, meterRegistry, 3.0);
      strict.addRules(List.of(PATIENT));

      assertThat(strict.searchAccepted("The patient was enrolled.", 3)).isEmpty();
      assertThat(strict.searchAccepted("patient", 3)).hasSize(1);
    }

    @Test
    @DisplayName("should return no hits for an empty index or blank query")
    void shouldReturnEmpty_whenNothingToSearch() {
      assertThat(index.search("patient", 3)).isEmpty();

      index.addRules(List.of(PATIENT));
      assertThat(index.search(" ", 3)).isEmpty();
      assertThat(index.search("patient", 0)).isEmpty();
    }

    @Test
    @DisplayName("should skip rules whose embedding failed and keep items aligned")
    void shouldSkipFailedEmbeddings() {
      when(failingEmbeddingService.embedAll(anyList())).thenReturn(List.of());
      when(failingEmbeddingService.embed(anyString()))
          .thenReturn(new float[] {1f, 0f})
          .thenReturn(new float[0])
          .thenReturn(new float[] {0f, 1f});
      StyleRuleIndex failing = new StyleRuleIndex(failingEmbeddingService, meterRegistry, 100.0);

      int added = failing.addRules(List.of(PATIENT, COLOUR, UTILIZE));

      assertThat(added).isEqualTo(2);
      assertThat(failing.entries()).containsExactly(PATIENT, UTILIZE);
      assertThat(failing.vectorAt(1)).containsExactly(0f, 1f);
      assertThat(meterRegistry.counter("style.index.skipped", "index", "rules").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should drop hits whose position has no item and count them")
    void shouldDropInconsistentHits() {
      index.useStore(new MisalignedStore());
      index.addPrecomputed(PATIENT, new float[] {1f, 0f});

      List<IndexHit<StyleRule>> hits = index.searchVector(new float[] {1f, 0f}, 3);

      assertThat(hits).extracting(IndexHit::item).containsExactly(PATIENT);
      assertThat(meterRegistry.counter("style.index.inconsistency", "index", "rules").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return no hits for a query of another dimension")
    void shouldReturnEmpty_whenQueryDimensionDiffers() {
      index.addPrecomputed(PATIENT, new float[] {1f, 0f});

      assertThat(index.searchVector(new float[] {1f, 0f, 0f}, 3)).isEmpty();
    }

    @Test
    @DisplayName("should fail when the store position diverges from the item count")
    void shouldFail_whenStorePositionDiverges() {
      index.useStore(new MisalignedStore());
      index.addPrecomputed(PATIENT, new float[] {1f, 0f});

      assertThatThrownBy(() -> index.addPrecomputed(COLOUR, new float[] {0f, 1f}))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("does not match item count");
    }

    @Test
    @DisplayName("should refuse to replace the store of a populated index")
    void shouldRefuseStoreReplacement_whenPopulated() {
      index.addPrecomputed(PATIENT, new float[] {1f, 0f});

      assertThatThrownBy(() -> index.useStore(new MisalignedStore()))
          .isInstanceOf(IllegalStateException.class);
    }
  }

  @Nested
  @DisplayName("StyleChunkIndex")
  class ChunkIndex {

    @Test
    @DisplayName("should attach a unit-length embedding to the chunk")
    void shouldNormaliseAndAttachEmbedding() {
      StyleChunkIndex index = new StyleChunkIndex(embeddingService, meterRegistry, 1.5);
      StyleChunk chunk =
          StyleChunk.builder().content("Spell colour as color in the report").build();

      assertThat(index.addChunk(chunk)).isTrue();

      double norm = 0;
      for (float v : chunk.getEmbedding()) {
        norm += v * v;
      }
      assertThat(chunk.hasEmbedding()).isTrue();
      assertThat(norm).isCloseTo(1.0, within(1e-5));
      assertThat(index.vectorAt(0)).containsExactly(chunk.getEmbedding());
    }

    @Test
    @DisplayName("should find an identical chunk at distance zero with full confidence")
    void shouldMatchIdenticalText() {
      StyleChunkIndex index = new StyleChunkIndex(embeddingService, meterRegistry, 1.5);
      StyleChunk chunk = StyleChunk.builder().content("Always spell colour as color").build();
      index.addChunk(chunk);

      List<IndexHit<StyleChunk>> hits = index.searchAccepted("always spell colour as color", 3);

      assertThat(hits).hasSize(1);
      assertThat(hits.get(0).distance()).isCloseTo(0.0, within(1e-6));
      assertThat(hits.get(0).confidence()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("should not store a chunk whose embedding failed")
    void shouldSkipChunk_whenEmbeddingFails() {
      when(failingEmbeddingService.embed(anyString())).thenReturn(new float[0]);
      StyleChunkIndex index = new StyleChunkIndex(failingEmbeddingService, meterRegistry, 1.5);
      StyleChunk chunk = StyleChunk.builder().content("Unembeddable").build();

      assertThat(index.addChunk(chunk)).isFalse();
      assertThat(index.size()).isZero();
      assertThat(chunk.hasEmbedding()).isFalse();
    }
  }

  /** Returns position 0 for every insertion and reports one neighbour with no matching item. */
  private static final class MisalignedStore implements VectorStore {

    private int size;

    @Override
    public int add(float[] vector) {
      size++;
      return 0;
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
      return List.of(new Neighbor(0, 0.0), new Neighbor(7, 1.0));
    }

    @Override
    public float[] vectorAt(int position) {
      return new float[] {1f, 0f};
    }

    @Override
    public int size() {
      return size;
    }

    @Override
    public int dimension() {
      return 2;
    }
  }
}
