package io.draftmate.rag.corpus;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Payload for a similarity search over the corpus. An {@code essayType} of
 * {@code all} or no type searches every category.
 */
public record EssaySearchRequest(
        @NotBlank String query,
        String essayType,
        @Min(1) @Max(20) Integer limit) {
}
