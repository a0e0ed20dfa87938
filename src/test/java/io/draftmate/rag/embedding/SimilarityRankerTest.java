package io.draftmate.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

class SimilarityRankerTest {

    private final Random random = new Random(42);

    @Test
    void vectorIsFullySimilarToItself() {
        for (int i = 0; i < 20; i++) {
            float[] a = randomVector(32);

            assertThat(SimilarityRanker.cosineSimilarity(a, a)).isCloseTo(1.0d, within(1e-6));
        }
    }

    @Test
    void similarityIsSymmetric() {
        for (int i = 0; i < 20; i++) {
            float[] a = randomVector(16);
            float[] b = randomVector(16);

            assertThat(SimilarityRanker.cosineSimilarity(a, b)).isEqualTo(SimilarityRanker.cosineSimilarity(b, a));
        }
    }

    @Test
    void zeroVectorHasZeroSimilarity() {
        float[] zero = new float[8];

        assertThat(SimilarityRanker.cosineSimilarity(zero, randomVector(8))).isZero();
        assertThat(SimilarityRanker.cosineSimilarity(randomVector(8), zero)).isZero();
        assertThat(SimilarityRanker.cosineSimilarity(zero, zero)).isZero().isNotNaN();
    }

    @Test
    void rejectsVectorsOfDifferentLength() {
        assertThatThrownBy(() -> SimilarityRanker.cosineSimilarity(new float[3], new float[4]))
                .isInstanceOf(DimensionMismatchException.class)
                .satisfies(ex -> {
                    DimensionMismatchException mismatch = (DimensionMismatchException) ex;
                    assertThat(mismatch.getExpected()).isEqualTo(3);
                    assertThat(mismatch.getActual()).isEqualTo(4);
                });
    }

    @Test
    void topKReturnsBestCandidatesInDescendingOrder() {
        float[] query = { 1.0f, 0.0f };
        List<float[]> candidates = List.of(
                new float[] { 0.0f, 1.0f },
                new float[] { 1.0f, 0.1f },
                new float[] { 1.0f, 1.0f },
                new float[] { -1.0f, 0.0f });

        List<SimilarityRanker.Ranked<float[]>> ranked = SimilarityRanker.topK(query, candidates, v -> v, 3);

        assertThat(ranked).hasSize(3);
        assertThat(ranked).extracting(SimilarityRanker.Ranked::item)
                .containsExactly(candidates.get(1), candidates.get(2), candidates.get(0));
        for (int i = 1; i < ranked.size(); i++) {
            assertThat(ranked.get(i).score()).isLessThanOrEqualTo(ranked.get(i - 1).score());
        }
    }

    @Test
    void topKNeverReturnsMoreThanK() {
        float[] query = randomVector(8);
        List<float[]> candidates = List.of(randomVector(8), randomVector(8));

        assertThat(SimilarityRanker.topK(query, candidates, v -> v, 5)).hasSize(2);
        assertThat(SimilarityRanker.topK(query, candidates, v -> v, 0)).isEmpty();
        assertThat(SimilarityRanker.topK(query, List.<float[]>of(), v -> v, 3)).isEmpty();
    }

    @Test
    void equalScoresKeepInputOrder() {
        float[] query = { 1.0f, 0.0f };
        List<String> candidates = List.of("first", "second", "third");

        List<SimilarityRanker.Ranked<String>> ranked = SimilarityRanker.topK(query, candidates,
                name -> new float[] { 2.0f, 0.0f }, 3);

        assertThat(ranked).extracting(SimilarityRanker.Ranked::item).containsExactly("first", "second", "third");
    }

    @Test
    void normalizeProducesUnitVectorsAndLeavesZeroVectorsAlone() {
        float[] vector = SimilarityRanker.normalize(new float[] { 3.0f, 4.0f });

        assertThat(vector).containsExactly(new float[] { 0.6f, 0.8f }, within(1e-6f));
        assertThat(SimilarityRanker.normalize(new float[] { 0.0f, 0.0f })).containsExactly(0.0f, 0.0f);
    }

    private float[] randomVector(int dimension) {
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = random.nextFloat() * 2.0f - 1.0f;
        }
        return vector;
    }
}
