package io.draftmate.rag.corpus;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.draftmate.rag.embedding.DeterministicEmbeddingModel;
import io.draftmate.rag.embedding.TextEncoder;

class CorpusImportRunnerTest {

    private static final int DIMENSION = 16;

    @TempDir
    Path tempDir;

    private InMemoryEssayStore store;
    private TextEncoder encoder;

    @BeforeEach
    void setUp() {
        store = new InMemoryEssayStore(DIMENSION, 0.78d, new TickingClock(Instant.parse("2024-09-01T00:00:00Z")));
        encoder = new TextEncoder("test", () -> new DeterministicEmbeddingModel(DIMENSION), DIMENSION, 2,
                Duration.ZERO);
    }

    @Test
    void importsAndEmbedsEveryEssay() throws IOException {
        Path file = tempDir.resolve("essays.json");
        Files.writeString(file, """
                [
                  {"title": "The Kitchen", "content": "My grandmother's kitchen was my first classroom.",
                   "type": "personal_statement", "college": "Example College", "topics": ["identity", "family"]},
                  {"content": "Why our robotics team lost and what I learned.", "type": "supplemental",
                   "topics": ["failure"]},
                  {"content": "A summer spent translating for my parents.", "type": "something_else"}
                ]
                """);

        int stored = new CorpusImportRunner(file.toString(), encoder, store, new ObjectMapper()).importEssays();

        assertThat(stored).isEqualTo(3);
        List<Essay> essays = store.findByTopic("identity", null, 10);
        assertThat(essays).singleElement().satisfies(essay -> {
            assertThat(essay.title()).isEqualTo("The Kitchen");
            assertThat(essay.college()).isEqualTo("Example College");
            assertThat(essay.topics()).isEqualTo(Set.of("identity", "family"));
            assertThat(essay.embedding()).hasSize(DIMENSION);
        });
        EssayStats stats = store.stats();
        assertThat(stats.byCategory()).containsEntry("personal_statement", 2L).containsEntry("supplemental", 1L);
        assertThat(store.findByTopic("failure", null, 1)).singleElement()
                .satisfies(essay -> assertThat(essay.title()).isEqualTo("Essay 2"));
    }

    @Test
    void skipsEssaysThatCannotBeStored() throws IOException {
        Path file = tempDir.resolve("essays.json");
        Files.writeString(file, """
                [
                  {"title": "Empty"},
                  {"title": "Fine", "content": "This one has content."}
                ]
                """);

        int stored = new CorpusImportRunner(file.toString(), encoder, store, new ObjectMapper()).importEssays();

        assertThat(stored).isEqualTo(1);
        assertThat(store.stats().totalEssays()).isEqualTo(1);
    }

    @Test
    void missingFileImportsNothing() throws IOException {
        int stored = new CorpusImportRunner(tempDir.resolve("absent.json").toString(), encoder, store,
                new ObjectMapper()).importEssays();

        assertThat(stored).isZero();
        assertThat(encoder.isReady()).isFalse();
    }
}
