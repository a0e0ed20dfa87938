package io.draftmate.rag.chat;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload of the {@code user_message} event.
 */
public record UserMessageRequest(@NotBlank String message, String sessionId) {
}
