package io.draftmate.rag.chat;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import io.draftmate.rag.tool.ToolRegistry;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * Anthropic API should not be contacted. Messages asking for similar or example
 * essays trigger {@code search_similar}, messages asking for feedback trigger
 * {@code analyze_text}, anything else gets a canned text answer.
 */
class MockLlmClient implements LlmClient {

    private final ObjectMapper objectMapper;

    MockLlmClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public AiMessage chat(List<ChatMessage> messages, List<ToolSpecification> tools) {
        ChatMessage last = messages.get(messages.size() - 1);
        if (last instanceof ToolExecutionResultMessage result) {
            return AiMessage.from("[mocked answer] Result of " + result.toolName() + ": " + result.text());
        }
        String question = lastUserText(messages);
        String lower = question.toLowerCase(Locale.ROOT);
        if (offers(tools, ToolRegistry.SEARCH_SIMILAR) && (lower.contains("similar") || lower.contains("example"))) {
            return AiMessage.from(request(ToolRegistry.SEARCH_SIMILAR, Map.of("query", question, "limit", 3)));
        }
        if (offers(tools, ToolRegistry.ANALYZE_TEXT) && (lower.contains("analy") || lower.contains("feedback"))) {
            return AiMessage.from(request(ToolRegistry.ANALYZE_TEXT,
                    Map.of("text", question, "analysis_type", "quick_check")));
        }
        return AiMessage.from("[mocked answer] Provide an API key to reach the real Anthropic service. "
                + "Question was: " + question);
    }

    private ToolExecutionRequest request(String tool, Map<String, Object> arguments) {
        try {
            return ToolExecutionRequest.builder()
                    .id("mock-" + UUID.randomUUID())
                    .name(tool)
                    .arguments(objectMapper.writeValueAsString(arguments))
                    .build();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to build mocked tool arguments", ex);
        }
    }

    private static boolean offers(List<ToolSpecification> tools, String name) {
        return tools.stream().anyMatch(tool -> tool.name().equals(name));
    }

    private static String lastUserText(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i) instanceof UserMessage user && user.hasSingleText()) {
                return user.singleText();
            }
        }
        return "";
    }
}
