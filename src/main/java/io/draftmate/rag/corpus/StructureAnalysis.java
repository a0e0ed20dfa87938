package io.draftmate.rag.corpus;

/**
 * Section by section breakdown of an essay.
 */
public record StructureAnalysis(
        String hook,
        String setup,
        String conflict,
        String insight,
        String conclusion) {
}
