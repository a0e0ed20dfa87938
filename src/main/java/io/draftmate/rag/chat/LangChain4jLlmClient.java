package io.draftmate.rag.chat;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

/**
 * {@link LlmClient} backed by a LangChain4j {@link ChatModel}, in production
 * the Anthropic model.
 */
class LangChain4jLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(LangChain4jLlmClient.class);

    private final ChatModel chatModel;

    LangChain4jLlmClient(ChatModel chatModel) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    public AiMessage chat(List<ChatMessage> messages, List<ToolSpecification> tools) {
        ChatRequest.Builder request = ChatRequest.builder().messages(messages);
        if (!tools.isEmpty()) {
            request.toolSpecifications(tools);
        }
        ChatResponse response = chatModel.chat(request.build());
        if (response.tokenUsage() != null) {
            LOGGER.debug("Model call used {} input and {} output tokens",
                    response.tokenUsage().inputTokenCount(), response.tokenUsage().outputTokenCount());
        }
        return response.aiMessage();
    }
}
