package io.draftmate.rag.embedding;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;

/**
 * Loads and warms up the embedding model in the background once the
 * application has started. Requests arriving earlier trigger the load
 * themselves and wait for it.
 */
@Order(1)
public class EncoderWarmUp implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(EncoderWarmUp.class);

    private final TextEncoder textEncoder;

    public EncoderWarmUp(TextEncoder textEncoder) {
        this.textEncoder = Objects.requireNonNull(textEncoder, "textEncoder");
    }

    @Override
    public void run(ApplicationArguments args) {
        start();
    }

    CompletableFuture<Void> start() {
        return CompletableFuture.runAsync(() -> {
            textEncoder.initialize();
            textEncoder.warmUp();
        }).whenComplete((ignored, failure) -> {
            if (failure != null) {
                LOGGER.error("Embedding service could not be initialized: {}", failure.getMessage(), failure);
            } else {
                LOGGER.info("Embedding service initialized and warmed up");
            }
        });
    }
}
