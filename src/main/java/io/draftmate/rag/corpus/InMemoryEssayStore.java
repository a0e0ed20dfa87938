package io.draftmate.rag.corpus;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;

import io.draftmate.rag.embedding.SimilarityRanker;

/**
 * Map backed {@link EssayStore} used for local development and tests. The
 * similarity search is exhaustive.
 */
class InMemoryEssayStore extends AbstractEssayStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryEssayStore.class);

    private static final Comparator<Essay> INSERTION_ORDER = Comparator.comparing(Essay::createdAt)
            .thenComparing(Essay::id);

    private final Map<UUID, Essay> essays = new ConcurrentHashMap<>();

    InMemoryEssayStore(int dimension, double defaultThreshold, Clock clock) {
        super(dimension, defaultThreshold, clock);
    }

    @Override
    protected Essay doInsert(Essay essay) {
        if (essays.putIfAbsent(essay.id(), essay) != null) {
            throw new DuplicateKeyException("Essay " + essay.id() + " already exists");
        }
        LOGGER.debug("Stored essay {} ({})", essay.id(), essay.category().wireName());
        return essay;
    }

    @Override
    protected List<ScoredEssay> doQuery(float[] queryVector, EssayCategory category, double threshold, int limit) {
        List<Essay> candidates = essays.values().stream()
                .filter(Essay::hasEmbedding)
                .filter(essay -> category == null || essay.category() == category)
                .sorted(INSERTION_ORDER)
                .toList();

        return SimilarityRanker.topK(queryVector, candidates, Essay::embedding, candidates.size()).stream()
                .filter(ranked -> ranked.score() > threshold)
                .limit(limit)
                .map(ranked -> new ScoredEssay(ranked.item(), ranked.score()))
                .toList();
    }

    @Override
    public Optional<Essay> findById(UUID id) {
        return Optional.ofNullable(essays.get(id));
    }

    @Override
    public List<Essay> findByTopic(String topic, EssayCategory category, int limit) {
        return essays.values().stream()
                .filter(essay -> essay.hasTopic(topic))
                .filter(essay -> category == null || essay.category() == category)
                .sorted(INSERTION_ORDER)
                .limit(Math.max(limit, 0))
                .toList();
    }

    @Override
    protected void doUpdateEmbedding(UUID id, float[] embedding, Instant updatedAt) {
        Essay updated = essays.computeIfPresent(id, (key, essay) -> essay.withEmbedding(embedding)
                .withStorageFields(essay.id(), essay.createdAt(), updatedAt));
        if (updated == null) {
            throw new EssayNotFoundException(id);
        }
    }

    @Override
    public void delete(UUID id) {
        if (essays.remove(id) == null) {
            throw new EssayNotFoundException(id);
        }
    }

    @Override
    public EssayStats stats() {
        List<Essay> snapshot = List.copyOf(essays.values());
        Map<String, Long> byCategory = snapshot.stream()
                .collect(Collectors.groupingBy(essay -> essay.category().wireName(), TreeMap::new,
                        Collectors.counting()));
        Map<String, Long> byTopic = snapshot.stream()
                .flatMap(essay -> essay.topics().stream())
                .collect(Collectors.groupingBy(topic -> topic, TreeMap::new, Collectors.counting()));
        return new EssayStats(snapshot.size(), byCategory, byTopic);
    }
}
