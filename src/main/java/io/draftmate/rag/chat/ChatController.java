package io.draftmate.rag.chat;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import jakarta.validation.Valid;

/**
 * Conversational transport over server sent events. Each request opens a
 * stream that carries the events of that request and is then closed.
 */
@RestController
@RequestMapping(path = "/api/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
@Validated
public class ChatController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatController.class);

    private final ChatService chatService;
    private final SseEmitterFactory emitterFactory;

    public ChatController(ChatService chatService, SseEmitterFactory emitterFactory) {
        this.chatService = chatService;
        this.emitterFactory = emitterFactory;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public SseEmitter userMessage(@Valid @RequestBody UserMessageRequest request) {
        SseEmitter emitter = emitterFactory.create();
        chatService.handleUserMessage(request.message(), sessionId(request.sessionId()), forward(emitter));
        return emitter;
    }

    @PostMapping(path = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SseEmitter analyzeText(@Valid @RequestBody AnalyzeTextRequest request) {
        SseEmitter emitter = emitterFactory.create();
        chatService.analyzeText(request.text(), request.analysisType(), sessionId(request.sessionId()),
                forward(emitter));
        return emitter;
    }

    @PostMapping(path = "/similar", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SseEmitter similarEssays(@Valid @RequestBody SimilarEssaysRequest request) {
        SseEmitter emitter = emitterFactory.create();
        chatService.findSimilarEssays(request.query(), request.essayType(), request.limit(),
                sessionId(request.sessionId()), forward(emitter));
        return emitter;
    }

    private static String sessionId(String requested) {
        return StringUtils.hasText(requested) ? requested : UUID.randomUUID().toString();
    }

    private static ChatService.ChatEventHandler forward(SseEmitter emitter) {
        return new ChatService.ChatEventHandler() {
            @Override
            public void onEvent(ChatEvent event) {
                try {
                    emitter.send(SseEmitter.event().name(event.name()).data(event, MediaType.APPLICATION_JSON));
                } catch (IOException ex) {
                    LOGGER.warn("Unable to send {} event: {}", event.name(), ex.getMessage());
                    emitter.completeWithError(ex);
                }
            }

            @Override
            public void onComplete() {
                emitter.complete();
            }
        };
    }
}
