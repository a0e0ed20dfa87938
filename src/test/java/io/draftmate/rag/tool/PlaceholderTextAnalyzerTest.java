package io.draftmate.rag.tool;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.draftmate.rag.corpus.EssayCategory;
import io.draftmate.rag.corpus.StructureAnalysis;

class PlaceholderTextAnalyzerTest {

    private final PlaceholderTextAnalyzer analyzer = new PlaceholderTextAnalyzer();

    @Test
    void hookIsTheOpeningOfTheText() {
        String text = "a".repeat(150);

        TextAnalysis analysis = analyzer.analyze(text, AnalysisMode.QUICK_CHECK);

        assertThat(analysis.structure().hook()).isEqualTo("a".repeat(100) + "...");
        assertThat(analysis.mode()).isEqualTo(AnalysisMode.QUICK_CHECK);
    }

    @Test
    void shortTextIsUsedWhole() {
        TextAnalysis analysis = analyzer.analyze("Short.", AnalysisMode.DEEP_ANALYSIS);

        assertThat(analysis.structure().hook()).isEqualTo("Short....");
    }

    @Test
    void resultDoesNotDependOnModeBeyondEchoingIt() {
        TextAnalysis quick = analyzer.analyze("Same text", AnalysisMode.QUICK_CHECK);
        TextAnalysis deep = analyzer.analyze("Same text", AnalysisMode.DEEP_ANALYSIS);

        assertThat(quick.structure()).isEqualTo(deep.structure());
        assertThat(quick.topics()).containsExactly("identity", "growth", "challenges");
        assertThat(quick.suggestions()).isEqualTo(deep.suggestions());
    }

    @Test
    void fixedFieldsMatchReferenceHeuristic() {
        TextAnalysis analysis = analyzer.analyze("Opening line.", AnalysisMode.STRUCTURE_ANALYSIS);

        assertThat(analysis.category()).isEqualTo(EssayCategory.PERSONAL_STATEMENT);
        assertThat(analysis.structure()).isEqualTo(new StructureAnalysis(
                "Opening line....",
                "Analysis of exposition section...",
                "Analysis of conflict section...",
                "Analysis of learning/growth section...",
                "Analysis of conclusion..."));
        assertThat(analysis.strengths()).containsExactly("Strong hook", "Clear narrative arc", "Personal voice");
        assertThat(analysis.weaknesses())
                .containsExactly("Could use more specific examples", "Conclusion could be stronger");
        assertThat(analysis.suggestions())
                .containsExactly("Add more concrete details", "Strengthen the conclusion with future goals");
    }

    @Test
    void toleratesMissingText() {
        assertThat(analyzer.analyze(null, AnalysisMode.QUICK_CHECK).structure().hook()).isEqualTo("...");
    }
}
