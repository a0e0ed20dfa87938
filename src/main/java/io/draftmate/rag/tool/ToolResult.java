package io.draftmate.rag.tool;

/**
 * Outcome of one executed tool call.
 *
 * @param invocationId identifier the language model assigned to the call
 * @param toolName     name of the executed tool
 * @param payload      structured result, a {@link TextAnalysis} or a list of {@link EssaySummary}
 * @param json         the payload serialized as JSON, as returned to the language model
 */
public record ToolResult(String invocationId, String toolName, Object payload, String json) {
}
