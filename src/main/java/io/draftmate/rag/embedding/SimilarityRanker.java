package io.draftmate.rag.embedding;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Cosine similarity and top-K ranking over embedding vectors.
 */
public final class SimilarityRanker {

    private SimilarityRanker() {
    }

    /**
     * Computes the cosine similarity of two vectors.
     *
     * @return the similarity, or {@code 0} when either vector has zero magnitude
     * @throws DimensionMismatchException if the vectors differ in length
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }

        double dotProduct = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0.0d || normB == 0.0d) {
            return 0.0d;
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Ranks candidates by similarity to the query and keeps the best {@code k}.
     * Candidates with equal scores keep their input order.
     *
     * @param query      the query vector
     * @param candidates the candidates to rank
     * @param vectorOf   extracts the vector of a candidate
     * @param k          maximum number of results
     * @return at most {@code k} candidates, highest similarity first
     */
    public static <T> List<Ranked<T>> topK(float[] query, List<T> candidates, Function<T, float[]> vectorOf, int k) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(vectorOf, "vectorOf");
        if (k <= 0 || candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return candidates.stream()
                .map(candidate -> new Ranked<>(candidate, cosineSimilarity(query, vectorOf.apply(candidate))))
                .sorted(Comparator.comparingDouble(Ranked<T>::score).reversed())
                .limit(k)
                .toList();
    }

    /**
     * L2-normalises a vector in place. Zero vectors are left untouched.
     *
     * @return the same array
     */
    public static float[] normalize(float[] vector) {
        double norm = 0.0d;
        for (float value : vector) {
            norm += (double) value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0d) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    /**
     * A candidate together with its similarity to the query.
     */
    public record Ranked<T>(T item, double score) {
    }
}
