package io.draftmate.rag.tool;

import io.draftmate.rag.corpus.EssayCategory;

/**
 * A validated tool call. There is one variant per registered tool, each
 * carrying its typed arguments and the identifier the language model assigned
 * to the call.
 */
public sealed interface ToolInvocation {

    String id();

    String toolName();

    /**
     * {@code analyze_text}.
     */
    record AnalyzeText(String id, String text, AnalysisMode mode) implements ToolInvocation {

        @Override
        public String toolName() {
            return ToolRegistry.ANALYZE_TEXT;
        }
    }

    /**
     * {@code search_similar}. A {@code null} category searches all categories.
     */
    record SearchSimilar(String id, String query, EssayCategory category, int limit) implements ToolInvocation {

        @Override
        public String toolName() {
            return ToolRegistry.SEARCH_SIMILAR;
        }
    }

    /**
     * {@code get_examples_by_topic}. A {@code null} category searches all categories.
     */
    record GetExamplesByTopic(String id, String topic, EssayCategory category) implements ToolInvocation {

        @Override
        public String toolName() {
            return ToolRegistry.GET_EXAMPLES_BY_TOPIC;
        }
    }
}
