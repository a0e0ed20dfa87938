package io.draftmate.rag.corpus;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Reference essay of the corpus together with its optional embedding.
 *
 * @param id         unique identifier, assigned by the store on insert
 * @param title      optional title
 * @param content    the essay text
 * @param category   kind of essay
 * @param college    optional college the essay was written for
 * @param prompt     optional prompt the essay answers
 * @param topics     topic tags
 * @param structure  optional structural analysis
 * @param metadata   free-form metadata
 * @param embedding  optional embedding of the content
 * @param createdAt  creation timestamp, assigned by the store
 * @param updatedAt  last modification timestamp, assigned by the store
 */
public record Essay(
        UUID id,
        String title,
        String content,
        EssayCategory category,
        String college,
        String prompt,
        Set<String> topics,
        StructureAnalysis structure,
        Map<String, Object> metadata,
        float[] embedding,
        Instant createdAt,
        Instant updatedAt) {

    public Essay {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(category, "category");
        topics = topics == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(topics));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        embedding = embedding == null ? null : embedding.clone();
    }

    /**
     * Returns a copy of the embedding, or {@code null} if the essay has none.
     */
    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    /**
     * Creates an essay that has not been stored yet.
     */
    public static Essay draft(String title, String content, EssayCategory category, String college, String prompt,
            Set<String> topics) {
        return new Essay(null, title, content, category, college, prompt, topics, null, null, null, null, null);
    }

    public Essay withEmbedding(float[] newEmbedding) {
        return new Essay(id, title, content, category, college, prompt, topics, structure, metadata, newEmbedding,
                createdAt, updatedAt);
    }

    Essay withStorageFields(UUID newId, Instant newCreatedAt, Instant newUpdatedAt) {
        return new Essay(newId, title, content, category, college, prompt, topics, structure, metadata, embedding,
                newCreatedAt, newUpdatedAt);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public boolean hasTopic(String topic) {
        return topics.contains(topic);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Essay that)) {
            return false;
        }
        return Objects.equals(id, that.id)
                && Objects.equals(title, that.title)
                && content.equals(that.content)
                && category == that.category
                && Objects.equals(college, that.college)
                && Objects.equals(prompt, that.prompt)
                && topics.equals(that.topics)
                && Objects.equals(structure, that.structure)
                && metadata.equals(that.metadata)
                && Arrays.equals(embedding, that.embedding)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, title, content, category, college, prompt, topics, structure, metadata,
                createdAt, updatedAt) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Essay[id=" + id + ", title=" + title + ", category=" + category
                + ", embedding=" + (embedding == null ? "none" : embedding.length + " dimensions") + "]";
    }
}
