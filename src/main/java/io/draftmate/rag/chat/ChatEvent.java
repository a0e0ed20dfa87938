package io.draftmate.rag.chat;

import java.time.Instant;
import java.util.List;

import io.draftmate.rag.tool.EssaySummary;
import io.draftmate.rag.tool.TextAnalysis;

/**
 * Outbound events of the conversational transport. Every event has a wire
 * name and a JSON payload.
 */
public sealed interface ChatEvent {

    String AGENT_TYPING = "agent_typing";
    String AGENT_MESSAGE = "agent_message";
    String ESSAY_ANALYSIS = "essay_analysis";
    String SIMILAR_ESSAYS = "similar_essays";
    String ERROR = "error";

    String name();

    record Typing(boolean typing) implements ChatEvent {

        @Override
        public String name() {
            return AGENT_TYPING;
        }
    }

    record AgentMessage(String message, Instant timestamp, String sessionId) implements ChatEvent {

        @Override
        public String name() {
            return AGENT_MESSAGE;
        }
    }

    record EssayAnalysis(TextAnalysis analysis, Instant timestamp, String sessionId) implements ChatEvent {

        @Override
        public String name() {
            return ESSAY_ANALYSIS;
        }
    }

    record SimilarEssays(List<EssaySummary> essays, String query, Instant timestamp, String sessionId)
            implements ChatEvent {

        @Override
        public String name() {
            return SIMILAR_ESSAYS;
        }
    }

    record Failure(String message) implements ChatEvent {

        @Override
        public String name() {
            return ERROR;
        }
    }
}
