package io.draftmate.rag.corpus;

import java.util.UUID;

/**
 * Thrown by write operations that address an essay which does not exist.
 */
public class EssayNotFoundException extends RuntimeException {

    private final UUID essayId;

    public EssayNotFoundException(UUID essayId) {
        super("Essay not found: " + essayId);
        this.essayId = essayId;
    }

    public UUID getEssayId() {
        return essayId;
    }
}
