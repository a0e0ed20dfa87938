package io.draftmate.rag.corpus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent collection of reference essays with nearest neighbour search over
 * their embeddings.
 * <p>
 * Read operations report failures by throwing; callers that must keep a
 * conversation going decide themselves whether to degrade to empty results.
 * Write operations always throw on failure.
 */
public interface EssayStore {

    /**
     * Stores a new essay. Assigns the identifier and both timestamps.
     *
     * @param essay the essay to store; its embedding, if present, must have the
     *              configured dimension
     * @return the stored essay
     */
    Essay insert(Essay essay);

    /**
     * Finds the essays most similar to the query vector.
     *
     * @param queryVector the query embedding
     * @param category    optional category filter applied before ranking, {@code null} for all
     * @param threshold   only essays with a similarity strictly greater than this value are returned
     * @param limit       maximum number of results
     * @return matches ordered by descending similarity
     */
    List<ScoredEssay> query(float[] queryVector, EssayCategory category, double threshold, int limit);

    /**
     * Same as {@link #query(float[], EssayCategory, double, int)} with the
     * configured default threshold.
     */
    List<ScoredEssay> query(float[] queryVector, EssayCategory category, int limit);

    Optional<Essay> findById(UUID id);

    /**
     * Lists essays tagged with the given topic.
     *
     * @param topic    the topic tag
     * @param category optional category filter, {@code null} for all
     * @param limit    maximum number of results
     */
    List<Essay> findByTopic(String topic, EssayCategory category, int limit);

    /**
     * Replaces the embedding of an existing essay.
     *
     * @throws EssayNotFoundException if no essay has the given id
     */
    void updateEmbedding(UUID id, float[] embedding);

    /**
     * @throws EssayNotFoundException if no essay has the given id
     */
    void delete(UUID id);

    EssayStats stats();
}
