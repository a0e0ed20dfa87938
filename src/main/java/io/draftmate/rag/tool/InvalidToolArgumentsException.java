package io.draftmate.rag.tool;

public class InvalidToolArgumentsException extends ToolValidationException {

    public InvalidToolArgumentsException(String toolName, String reason) {
        super(toolName, "Invalid arguments for tool " + toolName + ": " + reason);
    }
}
