package io.draftmate.rag.chat;

/**
 * States of a single conversational turn handled by {@link WritingAgent}.
 */
public enum TurnState {
    IDLE,
    AWAITING_MODEL_RESPONSE,
    TOOL_REQUESTED,
    ANSWERING,
    AWAITING_FOLLOW_UP,
    DONE
}
