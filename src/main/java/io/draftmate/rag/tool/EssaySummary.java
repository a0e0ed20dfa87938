package io.draftmate.rag.tool;

import java.util.Set;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.draftmate.rag.corpus.Essay;
import io.draftmate.rag.corpus.EssayCategory;
import io.draftmate.rag.corpus.ScoredEssay;

/**
 * Essay as it is shown to the language model and to chat clients. The
 * embedding is left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EssaySummary(
        UUID id,
        String title,
        String content,
        EssayCategory type,
        String college,
        String prompt,
        Set<String> topics,
        Double similarity) {

    public static EssaySummary of(Essay essay) {
        return new EssaySummary(essay.id(), essay.title(), essay.content(), essay.category(), essay.college(),
                essay.prompt(), essay.topics(), null);
    }

    public static EssaySummary of(ScoredEssay scored) {
        Essay essay = scored.essay();
        return new EssaySummary(essay.id(), essay.title(), essay.content(), essay.category(), essay.college(),
                essay.prompt(), essay.topics(), scored.similarity());
    }
}
