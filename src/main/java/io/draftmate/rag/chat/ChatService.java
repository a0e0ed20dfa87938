package io.draftmate.rag.chat;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.draftmate.rag.corpus.EssayCategory;
import io.draftmate.rag.embedding.ModelNotReadyException;
import io.draftmate.rag.tool.AnalysisMode;
import io.draftmate.rag.tool.EssaySummary;
import io.draftmate.rag.tool.TextAnalysis;
import io.draftmate.rag.tool.ToolExecutor;
import io.draftmate.rag.tool.ToolInvocation;

/**
 * Runs conversational requests on the chat executor and reports their outcome
 * as {@link ChatEvent}s. Each request is an independent task; requests of
 * different sessions are not ordered relative to each other.
 */
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    static final int DEFAULT_SIMILAR_LIMIT = 5;

    private final WritingAgent writingAgent;
    private final ToolExecutor toolExecutor;
    private final Executor chatExecutor;
    private final Clock clock;

    public ChatService(WritingAgent writingAgent, ToolExecutor toolExecutor, Executor chatExecutor, Clock clock) {
        this.writingAgent = Objects.requireNonNull(writingAgent, "writingAgent");
        this.toolExecutor = Objects.requireNonNull(toolExecutor, "toolExecutor");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Answer a user message. Emits {@code agent_typing(true)}, the
     * {@code agent_message} and {@code agent_typing(false)}.
     */
    public void handleUserMessage(String message, String sessionId, ChatEventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        chatExecutor.execute(() -> {
            try {
                handler.onEvent(new ChatEvent.Typing(true));
                ConversationTurn turn = writingAgent.respond(message, sessionId);
                handler.onEvent(new ChatEvent.AgentMessage(turn.answer(), turn.timestamp(), sessionId));
                handler.onEvent(new ChatEvent.Typing(false));
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to handle message of session {}: {}", sessionId, ex.getMessage(), ex);
                handler.onEvent(new ChatEvent.Typing(false));
                handler.onEvent(new ChatEvent.Failure("Failed to process message"));
            } finally {
                handler.onComplete();
            }
        });
    }

    /**
     * Analyze a text directly, without the language model.
     */
    public void analyzeText(String text, String analysisType, String sessionId, ChatEventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        chatExecutor.execute(() -> {
            try {
                Optional<AnalysisMode> mode = analysisType == null
                        ? Optional.of(AnalysisMode.DEEP_ANALYSIS)
                        : AnalysisMode.find(analysisType);
                if (mode.isEmpty()) {
                    handler.onEvent(new ChatEvent.Failure("Unknown analysis type: " + analysisType));
                    return;
                }
                TextAnalysis analysis = toolExecutor.analyze(
                        new ToolInvocation.AnalyzeText(newInvocationId(), text, mode.get()));
                handler.onEvent(new ChatEvent.EssayAnalysis(analysis, clock.instant(), sessionId));
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to analyze essay for session {}: {}", sessionId, ex.getMessage(), ex);
                handler.onEvent(new ChatEvent.Failure("Failed to analyze essay"));
            } finally {
                handler.onComplete();
            }
        });
    }

    /**
     * Look up essays similar to a query, without the language model. A
     * {@code null} or {@code all} essay type searches every category.
     */
    public void findSimilarEssays(String query, String essayType, Integer limit, String sessionId,
            ChatEventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        chatExecutor.execute(() -> {
            try {
                EssayCategory category = null;
                if (essayType != null && !"all".equalsIgnoreCase(essayType)) {
                    Optional<EssayCategory> requested = EssayCategory.find(essayType);
                    if (requested.isEmpty()) {
                        handler.onEvent(new ChatEvent.Failure("Unknown essay type: " + essayType));
                        return;
                    }
                    category = requested.get();
                }
                int count = limit == null ? DEFAULT_SIMILAR_LIMIT : limit;
                List<EssaySummary> essays = toolExecutor.searchSimilar(
                        new ToolInvocation.SearchSimilar(newInvocationId(), query, category, count));
                handler.onEvent(new ChatEvent.SimilarEssays(essays, query, clock.instant(), sessionId));
            } catch (ModelNotReadyException ex) {
                LOGGER.warn("Similar essay lookup before the embedding model was ready: {}", ex.getMessage());
                handler.onEvent(new ChatEvent.Failure("Embedding service not ready, please try again shortly"));
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to find similar essays for session {}: {}", sessionId, ex.getMessage(), ex);
                handler.onEvent(new ChatEvent.Failure("Failed to find similar essays"));
            } finally {
                handler.onComplete();
            }
        });
    }

    private static String newInvocationId() {
        return "direct-" + UUID.randomUUID();
    }

    /**
     * Callback API receiving the events of one request.
     */
    public interface ChatEventHandler {

        void onEvent(ChatEvent event);

        void onComplete();
    }
}
