package io.draftmate.rag.chat;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Creates the {@link SseEmitter} of each chat request. Lets tests record what
 * the controller emits.
 */
@FunctionalInterface
public interface SseEmitterFactory {

    SseEmitter create();
}
