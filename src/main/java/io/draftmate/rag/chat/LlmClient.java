package io.draftmate.rag.chat;

import java.util.List;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real Anthropic API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Send one request to the language model.
     *
     * @param messages the conversation so far, system prompt first
     * @param tools    tool schemas the model may invoke, possibly empty
     * @return the model's reply, holding text, tool invocation requests or both
     */
    AiMessage chat(List<ChatMessage> messages, List<ToolSpecification> tools);
}
