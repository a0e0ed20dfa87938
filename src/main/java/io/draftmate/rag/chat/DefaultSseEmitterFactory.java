package io.draftmate.rag.chat;

import java.time.Duration;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Creates emitters that time out after a fixed duration, long enough for a
 * turn with two model calls.
 */
class DefaultSseEmitterFactory implements SseEmitterFactory {

    private final Duration timeout;

    DefaultSseEmitterFactory(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public SseEmitter create() {
        return new SseEmitter(timeout.toMillis());
    }
}
