package io.draftmate.rag.corpus;

import java.util.Map;
import java.util.Set;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Payload for adding an essay to the corpus.
 */
public record NewEssayRequest(
        String title,
        @NotBlank String content,
        @NotNull EssayCategory type,
        String college,
        String prompt,
        Set<String> topics,
        StructureAnalysis structureAnalysis,
        Map<String, Object> metadata) {

    Essay toEssay() {
        return new Essay(null, title, content, type, college, prompt, topics, structureAnalysis, metadata, null, null,
                null);
    }
}
