package io.draftmate.rag.tool;

/**
 * A tool invocation requested by the language model does not match any
 * registered tool schema.
 */
public abstract class ToolValidationException extends RuntimeException {

    private final String toolName;

    protected ToolValidationException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
