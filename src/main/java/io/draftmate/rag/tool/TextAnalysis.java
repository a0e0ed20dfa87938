package io.draftmate.rag.tool;

import java.util.List;

import io.draftmate.rag.corpus.EssayCategory;
import io.draftmate.rag.corpus.StructureAnalysis;

/**
 * Result of {@code analyze_text}.
 */
public record TextAnalysis(
        AnalysisMode mode,
        EssayCategory category,
        StructureAnalysis structure,
        List<String> topics,
        List<String> strengths,
        List<String> weaknesses,
        List<String> suggestions) {

    public TextAnalysis {
        topics = List.copyOf(topics);
        strengths = List.copyOf(strengths);
        weaknesses = List.copyOf(weaknesses);
        suggestions = List.copyOf(suggestions);
    }
}
