package io.draftmate.rag.chat;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import io.draftmate.rag.embedding.ModelNotReadyException;
import io.draftmate.rag.tool.ToolExecutor;
import io.draftmate.rag.tool.ToolInvocation;
import io.draftmate.rag.tool.ToolRegistry;
import io.draftmate.rag.tool.ToolResult;
import io.draftmate.rag.tool.ToolValidationException;

/**
 * Answers one user message with the help of the language model and at most
 * one tool call.
 *
 * <p>Each turn walks the states of {@link TurnState}. The model receives the
 * message together with every registered tool schema. A reply without a tool
 * request is the answer. A reply with a tool request has its first request
 * validated and executed, and the result goes back to the model in exactly one
 * follow-up call whose text is the answer. The follow-up can only lead to
 * {@link TurnState#DONE}, so a second tool round trip never happens.
 *
 * <p>Failures never escape {@link #respond(String, String)}: they are logged
 * and turned into fixed apologies.
 */
public class WritingAgent {

    private static final Logger LOGGER = LoggerFactory.getLogger(WritingAgent.class);

    static final String SYSTEM_PROMPT = """
            You are an expert writing coach who helps students improve their college application essays.
            You give specific, constructive feedback on structure, voice and content, and you point to
            successful example essays when they help. Use the available tools to analyze the student's
            text or to look up example essays before answering when that makes your answer better.
            Be encouraging and keep the student's own voice intact.""";

    static final String NO_TEXT_FALLBACK = "I apologize, but I could not generate a response.";
    static final String TOOL_FALLBACK = "I processed your request using my tools.";
    static final String TOOL_REJECTED_APOLOGY =
            "I apologize, but I could not carry out the requested action. Please try rephrasing your request.";
    static final String MODEL_NOT_READY_APOLOGY =
            "I apologize, but the writing assistant is still warming up. Please try again shortly.";
    static final String FAILURE_APOLOGY =
            "I apologize, but I encountered an error processing your request. Please try again.";

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final Clock clock;

    public WritingAgent(LlmClient llmClient, ToolRegistry toolRegistry, ToolExecutor toolExecutor, Clock clock) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry");
        this.toolExecutor = Objects.requireNonNull(toolExecutor, "toolExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ConversationTurn respond(String message, String sessionId) {
        Objects.requireNonNull(message, "message");
        Turn turn = new Turn(message, sessionId);
        try {
            return turn.run();
        } catch (ToolValidationException ex) {
            LOGGER.warn("Rejected tool call in session {}: {}", sessionId, ex.getMessage());
            return turn.fail(TOOL_REJECTED_APOLOGY);
        } catch (ModelNotReadyException ex) {
            LOGGER.warn("Embedding model not ready for session {}: {}", sessionId, ex.getMessage());
            return turn.fail(MODEL_NOT_READY_APOLOGY);
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to process message in session {}: {}", sessionId, ex.getMessage(), ex);
            return turn.fail(FAILURE_APOLOGY);
        }
    }

    /**
     * Mutable state of one turn. Every transition checks the state it starts
     * from.
     */
    private final class Turn {

        private final String message;
        private final String sessionId;
        private final List<ToolSpecification> tools = toolRegistry.specifications();
        private TurnState state = TurnState.IDLE;
        private ToolResult toolResult;

        private Turn(String message, String sessionId) {
            this.message = message;
            this.sessionId = sessionId;
        }

        ConversationTurn run() {
            AiMessage reply = requestModel();
            if (!reply.hasToolExecutionRequests()) {
                return answer(reply);
            }
            ToolExecutionRequest request = reply.toolExecutionRequests().get(0);
            if (reply.toolExecutionRequests().size() > 1) {
                LOGGER.debug("Model requested {} tools, only {} is executed",
                        reply.toolExecutionRequests().size(), request.name());
            }
            ToolResult result = executeTool(request);
            return followUp(reply.text(), request, result);
        }

        private AiMessage requestModel() {
            transition(TurnState.IDLE, TurnState.AWAITING_MODEL_RESPONSE);
            return llmClient.chat(List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(message)), tools);
        }

        private ConversationTurn answer(AiMessage reply) {
            transition(TurnState.AWAITING_MODEL_RESPONSE, TurnState.ANSWERING);
            String text = hasText(reply) ? reply.text() : NO_TEXT_FALLBACK;
            transition(TurnState.ANSWERING, TurnState.DONE);
            return complete(text, false);
        }

        private ToolResult executeTool(ToolExecutionRequest request) {
            transition(TurnState.AWAITING_MODEL_RESPONSE, TurnState.TOOL_REQUESTED);
            ToolInvocation invocation = toolRegistry.validate(request);
            LOGGER.debug("Session {} invokes tool {}", sessionId, invocation.toolName());
            toolResult = toolExecutor.execute(invocation);
            return toolResult;
        }

        private ConversationTurn followUp(String priorText, ToolExecutionRequest request, ToolResult result) {
            transition(TurnState.TOOL_REQUESTED, TurnState.AWAITING_FOLLOW_UP);
            List<ChatMessage> messages = new ArrayList<>();
            messages.add(SystemMessage.from(SYSTEM_PROMPT));
            messages.add(UserMessage.from(message));
            messages.add(priorText == null || priorText.isBlank()
                    ? AiMessage.from(List.of(request))
                    : AiMessage.from(priorText, List.of(request)));
            messages.add(ToolExecutionResultMessage.from(request, result.json()));
            AiMessage reply = llmClient.chat(messages, tools);
            transition(TurnState.AWAITING_FOLLOW_UP, TurnState.DONE);
            return complete(hasText(reply) ? reply.text() : TOOL_FALLBACK, false);
        }

        ConversationTurn fail(String apology) {
            state = TurnState.DONE;
            return complete(apology, true);
        }

        private ConversationTurn complete(String answer, boolean failed) {
            return new ConversationTurn(sessionId, answer, toolResult, failed, clock.instant());
        }

        private void transition(TurnState from, TurnState to) {
            if (state != from) {
                throw new IllegalStateException("Cannot move from " + state + " to " + to);
            }
            state = to;
        }
    }

    private static boolean hasText(AiMessage reply) {
        return reply != null && reply.text() != null && !reply.text().isEmpty();
    }
}
