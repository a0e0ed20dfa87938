package io.draftmate.rag.tool;

/**
 * Produces a structural and qualitative breakdown of a piece of writing.
 */
public interface TextAnalyzer {

    TextAnalysis analyze(String text, AnalysisMode mode);
}
