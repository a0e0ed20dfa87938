package io.draftmate.rag.chat;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for a direct essay analysis. The analysis type defaults to
 * {@code deep_analysis}.
 */
public record AnalyzeTextRequest(@NotBlank String text, String analysisType, String sessionId) {
}
