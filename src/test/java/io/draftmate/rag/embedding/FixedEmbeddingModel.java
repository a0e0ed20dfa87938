package io.draftmate.rag.embedding;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

/**
 * Embedding model returning registered vectors for known texts and
 * deterministic vectors for everything else. Keys are matched against the
 * normalized text the encoder hands over.
 */
public class FixedEmbeddingModel implements EmbeddingModel {

    private final Map<String, float[]> vectors = new HashMap<>();
    private final DeterministicEmbeddingModel fallback;
    private final int dimension;
    private final AtomicInteger calls = new AtomicInteger();

    public FixedEmbeddingModel(int dimension) {
        this.dimension = dimension;
        this.fallback = new DeterministicEmbeddingModel(dimension);
    }

    public FixedEmbeddingModel with(String normalizedText, float[] vector) {
        vectors.put(normalizedText, vector);
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
        calls.incrementAndGet();
        List<Embedding> embeddings = textSegments.stream()
                .map(segment -> vectors.containsKey(segment.text())
                        ? Embedding.from(vectors.get(segment.text()).clone())
                        : fallback.embed(segment.text()).content())
                .toList();
        return Response.from(embeddings);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    /**
     * Unit vector along one axis.
     */
    public static float[] axis(int dimension, int index) {
        float[] vector = new float[dimension];
        vector[index] = 1.0f;
        return vector;
    }
}
