package io.draftmate.rag.chat;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for a direct similar essay lookup.
 */
public record SimilarEssaysRequest(
        @NotBlank String query,
        String essayType,
        @Min(1) @Max(20) Integer limit,
        String sessionId) {
}
