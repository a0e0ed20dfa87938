package io.draftmate.rag.tool;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.draftmate.rag.corpus.EssayStore;
import io.draftmate.rag.embedding.TextEncoder;

/**
 * Runs validated tool invocations against the text analyzer, the encoder and
 * the essay store.
 *
 * <p>Store failures during a search are logged and reported to the model as an
 * empty result. Encoder failures, including a model that is not loaded yet,
 * propagate to the caller.
 */
public class ToolExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolExecutor.class);

    private final TextAnalyzer textAnalyzer;
    private final TextEncoder textEncoder;
    private final EssayStore essayStore;
    private final ObjectMapper objectMapper;
    private final int topicLimit;

    public ToolExecutor(TextAnalyzer textAnalyzer, TextEncoder textEncoder, EssayStore essayStore,
            ObjectMapper objectMapper, int topicLimit) {
        this.textAnalyzer = Objects.requireNonNull(textAnalyzer, "textAnalyzer");
        this.textEncoder = Objects.requireNonNull(textEncoder, "textEncoder");
        this.essayStore = Objects.requireNonNull(essayStore, "essayStore");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        if (topicLimit < 1) {
            throw new IllegalArgumentException("topicLimit must be positive");
        }
        this.topicLimit = topicLimit;
    }

    public ToolResult execute(ToolInvocation invocation) {
        Objects.requireNonNull(invocation, "invocation");
        Object payload;
        if (invocation instanceof ToolInvocation.AnalyzeText analyze) {
            payload = analyze(analyze);
        } else if (invocation instanceof ToolInvocation.SearchSimilar search) {
            payload = searchSimilar(search);
        } else if (invocation instanceof ToolInvocation.GetExamplesByTopic byTopic) {
            payload = examplesByTopic(byTopic);
        } else {
            throw new IllegalStateException("Unsupported invocation " + invocation.getClass().getName());
        }
        LOGGER.debug("Executed tool {} ({})", invocation.toolName(), invocation.id());
        return new ToolResult(invocation.id(), invocation.toolName(), payload, toJson(payload));
    }

    public TextAnalysis analyze(ToolInvocation.AnalyzeText analyze) {
        return textAnalyzer.analyze(analyze.text(), analyze.mode());
    }

    public List<EssaySummary> searchSimilar(ToolInvocation.SearchSimilar search) {
        float[] vector = textEncoder.encode(search.query());
        try {
            return essayStore.query(vector, search.category(), search.limit()).stream()
                    .map(EssaySummary::of)
                    .toList();
        } catch (RuntimeException ex) {
            LOGGER.warn("Similar essay search failed: {}", ex.getMessage(), ex);
            return List.of();
        }
    }

    public List<EssaySummary> examplesByTopic(ToolInvocation.GetExamplesByTopic byTopic) {
        try {
            return essayStore.findByTopic(byTopic.topic(), byTopic.category(), topicLimit).stream()
                    .map(EssaySummary::of)
                    .toList();
        } catch (RuntimeException ex) {
            LOGGER.warn("Topic lookup for '{}' failed: {}", byTopic.topic(), ex.getMessage(), ex);
            return List.of();
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize tool result", ex);
        }
    }
}
