package io.draftmate.rag.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.data.message.AiMessage;
import io.draftmate.rag.corpus.EssayCategory;
import io.draftmate.rag.corpus.EssayStore;
import io.draftmate.rag.corpus.StructureAnalysis;
import io.draftmate.rag.embedding.DeterministicEmbeddingModel;
import io.draftmate.rag.embedding.TextEncoder;
import io.draftmate.rag.tool.AnalysisMode;
import io.draftmate.rag.tool.TextAnalysis;
import io.draftmate.rag.tool.ToolExecutor;
import io.draftmate.rag.tool.ToolRegistry;

class ChatServiceTest {

    private static final Instant NOW = Instant.parse("2024-10-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final Executor directExecutor = Runnable::run;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EssayStore store = mock(EssayStore.class);

    @Test
    void answersUserMessageBetweenTypingIndicators() {
        WritingAgent agent = new WritingAgent((messages, tools) -> AiMessage.from("Try a vivid opening."),
                new ToolRegistry(objectMapper), executor(readyEncoder()), clock);
        ChatService chatService = new ChatService(agent, executor(readyEncoder()), directExecutor, clock);
        RecordingHandler handler = new RecordingHandler();

        chatService.handleUserMessage("How should I start?", "session-1", handler);

        assertThat(handler.events).containsExactly(
                new ChatEvent.Typing(true),
                new ChatEvent.AgentMessage("Try a vivid opening.", NOW, "session-1"),
                new ChatEvent.Typing(false));
        assertThat(handler.completed).isTrue();
    }

    @Test
    void reportsUnexpectedFailureAsErrorEvent() {
        WritingAgent agent = mock(WritingAgent.class);
        when(agent.respond(any(), any())).thenThrow(new IllegalStateException("boom"));
        ChatService chatService = new ChatService(agent, executor(readyEncoder()), directExecutor, clock);
        RecordingHandler handler = new RecordingHandler();

        chatService.handleUserMessage("Hello", "session-2", handler);

        assertThat(handler.events).containsExactly(
                new ChatEvent.Typing(true),
                new ChatEvent.Typing(false),
                new ChatEvent.Failure("Failed to process message"));
        assertThat(handler.completed).isTrue();
    }

    @Test
    void analyzesTextDirectly() {
        ChatService chatService = new ChatService(mock(WritingAgent.class), executor(readyEncoder()),
                directExecutor, clock);
        RecordingHandler handler = new RecordingHandler();

        chatService.analyzeText("My essay", "structure_analysis", "session-3", handler);

        assertThat(handler.events).singleElement().isInstanceOfSatisfying(ChatEvent.EssayAnalysis.class, event -> {
            assertThat(event.analysis().mode()).isEqualTo(AnalysisMode.STRUCTURE_ANALYSIS);
            assertThat(event.timestamp()).isEqualTo(NOW);
            assertThat(event.sessionId()).isEqualTo("session-3");
        });
        assertThat(handler.completed).isTrue();
    }

    @Test
    void rejectsUnknownAnalysisType() {
        ChatService chatService = new ChatService(mock(WritingAgent.class), executor(readyEncoder()),
                directExecutor, clock);
        RecordingHandler handler = new RecordingHandler();

        chatService.analyzeText("My essay", "grammar", "session-3", handler);

        assertThat(handler.events).containsExactly(new ChatEvent.Failure("Unknown analysis type: grammar"));
        assertThat(handler.completed).isTrue();
    }

    @Test
    void findsSimilarEssays() {
        ChatService chatService = new ChatService(mock(WritingAgent.class), executor(readyEncoder()),
                directExecutor, clock);
        RecordingHandler handler = new RecordingHandler();

        chatService.findSimilarEssays("leadership", "all", 3, "session-4", handler);

        assertThat(handler.events).containsExactly(
                new ChatEvent.SimilarEssays(List.of(), "leadership", NOW, "session-4"));
    }

    @Test
    void reportsEncoderNotReadyDuringSimilarSearch() {
        TextEncoder broken = new TextEncoder("broken", () -> {
            throw new IllegalStateException("no model");
        }, 384, 10, Duration.ZERO);
        ChatService chatService = new ChatService(mock(WritingAgent.class), executor(broken), directExecutor,
                clock);
        RecordingHandler handler = new RecordingHandler();

        chatService.findSimilarEssays("leadership", null, null, "session-5", handler);

        assertThat(handler.events).containsExactly(
                new ChatEvent.Failure("Embedding service not ready, please try again shortly"));
        assertThat(handler.completed).isTrue();
    }

    @Test
    void rejectsUnknownEssayType() {
        ChatService chatService = new ChatService(mock(WritingAgent.class), executor(readyEncoder()),
                directExecutor, clock);
        RecordingHandler handler = new RecordingHandler();

        chatService.findSimilarEssays("leadership", "poem", null, "session-6", handler);

        assertThat(handler.events).containsExactly(new ChatEvent.Failure("Unknown essay type: poem"));
    }

    private ToolExecutor executor(TextEncoder encoder) {
        return new ToolExecutor((text, mode) -> new TextAnalysis(mode, EssayCategory.PERSONAL_STATEMENT,
                new StructureAnalysis(text, "setup", "conflict", "insight", "conclusion"), List.of("identity"),
                List.of("voice"), List.of("detail"), List.of("add a scene")), encoder, store, objectMapper, 10);
    }

    private static TextEncoder readyEncoder() {
        return new TextEncoder("test", () -> new DeterministicEmbeddingModel(384), 384, 10, Duration.ZERO);
    }

    private static final class RecordingHandler implements ChatService.ChatEventHandler {

        private final List<ChatEvent> events = new ArrayList<>();
        private final AtomicBoolean completed = new AtomicBoolean();

        @Override
        public void onEvent(ChatEvent event) {
            events.add(event);
        }

        @Override
        public void onComplete() {
            completed.set(true);
        }
    }
}
