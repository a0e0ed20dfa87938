package io.draftmate.rag.tool;

public class UnknownToolException extends ToolValidationException {

    public UnknownToolException(String toolName) {
        super(toolName, "Unknown tool: " + toolName);
    }
}
