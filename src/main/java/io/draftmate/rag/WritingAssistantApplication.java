package io.draftmate.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Writing assistant backed by a corpus of reference essays. Wires the encoder,
 * the essay store, the tool registry and the agent that answers chat turns.
 */
@SpringBootApplication
public class WritingAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(WritingAssistantApplication.class, args);
    }
}
