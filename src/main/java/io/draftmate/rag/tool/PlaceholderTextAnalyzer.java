package io.draftmate.rag.tool;

import java.util.List;

import io.draftmate.rag.corpus.EssayCategory;
import io.draftmate.rag.corpus.StructureAnalysis;

/**
 * Fixed-shape analysis that only echoes the opening of the text as the hook.
 * All other fields are constant and the mode is ignored. Stands in until a
 * model-backed analyzer is wired.
 */
class PlaceholderTextAnalyzer implements TextAnalyzer {

    static final int HOOK_LENGTH = 100;

    @Override
    public TextAnalysis analyze(String text, AnalysisMode mode) {
        String source = text == null ? "" : text;
        String hook = source.substring(0, Math.min(HOOK_LENGTH, source.length())) + "...";
        StructureAnalysis structure = new StructureAnalysis(
                hook,
                "Analysis of exposition section...",
                "Analysis of conflict section...",
                "Analysis of learning/growth section...",
                "Analysis of conclusion...");
        return new TextAnalysis(
                mode,
                EssayCategory.PERSONAL_STATEMENT,
                structure,
                List.of("identity", "growth", "challenges"),
                List.of("Strong hook", "Clear narrative arc", "Personal voice"),
                List.of("Could use more specific examples", "Conclusion could be stronger"),
                List.of("Add more concrete details", "Strengthen the conclusion with future goals"));
    }
}
