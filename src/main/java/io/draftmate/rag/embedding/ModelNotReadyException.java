package io.draftmate.rag.embedding;

/**
 * Raised when the sentence embedding model could not be loaded. The condition
 * is transient; callers should ask the user to try again shortly.
 */
public class ModelNotReadyException extends RuntimeException {

    public ModelNotReadyException(String message) {
        super(message);
    }

    public ModelNotReadyException(String message, Throwable cause) {
        super(message, cause);
    }
}
