package io.draftmate.rag.chat;

import java.time.Instant;
import java.util.Optional;

import io.draftmate.rag.tool.ToolResult;

/**
 * Outcome of one user message.
 *
 * @param sessionId  conversation the turn belongs to
 * @param answer     text shown to the user, either the model's answer or a fixed apology
 * @param toolResult result of the tool executed during the turn, or {@code null}
 * @param failed     whether the answer is an apology for a failed turn
 * @param timestamp  when the turn completed
 */
public record ConversationTurn(String sessionId, String answer, ToolResult toolResult, boolean failed,
        Instant timestamp) {

    public Optional<ToolResult> tool() {
        return Optional.ofNullable(toolResult);
    }
}
