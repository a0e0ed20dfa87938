package io.draftmate.rag.corpus;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import io.draftmate.rag.embedding.DimensionMismatchException;

/**
 * Shared argument checks and bookkeeping of the {@link EssayStore}
 * implementations.
 */
abstract class AbstractEssayStore implements EssayStore {

    private final int dimension;
    private final double defaultThreshold;
    private final Clock clock;

    protected AbstractEssayStore(int dimension, double defaultThreshold, Clock clock) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.defaultThreshold = defaultThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public final Essay insert(Essay essay) {
        Objects.requireNonNull(essay, "essay");
        if (essay.hasEmbedding()) {
            checkDimension(essay.embedding());
        }
        Instant now = clock.instant();
        UUID id = essay.id() != null ? essay.id() : UUID.randomUUID();
        return doInsert(essay.withStorageFields(id, now, now));
    }

    @Override
    public final List<ScoredEssay> query(float[] queryVector, EssayCategory category, double threshold, int limit) {
        Objects.requireNonNull(queryVector, "queryVector");
        checkDimension(queryVector);
        if (limit <= 0) {
            return List.of();
        }
        return doQuery(queryVector, category, threshold, limit);
    }

    @Override
    public final List<ScoredEssay> query(float[] queryVector, EssayCategory category, int limit) {
        return query(queryVector, category, defaultThreshold, limit);
    }

    @Override
    public final void updateEmbedding(UUID id, float[] embedding) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(embedding, "embedding");
        checkDimension(embedding);
        doUpdateEmbedding(id, embedding, clock.instant());
    }

    protected abstract Essay doInsert(Essay essay);

    protected abstract List<ScoredEssay> doQuery(float[] queryVector, EssayCategory category, double threshold,
            int limit);

    protected abstract void doUpdateEmbedding(UUID id, float[] embedding, Instant updatedAt);

    protected void checkDimension(float[] vector) {
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
    }

    protected int dimension() {
        return dimension;
    }

    protected double defaultThreshold() {
        return defaultThreshold;
    }
}
