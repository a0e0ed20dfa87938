package io.draftmate.rag.corpus;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import io.draftmate.rag.embedding.DeterministicEmbeddingModel;
import io.draftmate.rag.embedding.ModelNotReadyException;
import io.draftmate.rag.embedding.TextEncoder;

class EssayControllerTest {

    private static final int DIMENSION = 128;

    private InMemoryEssayStore store;
    private TextEncoder encoder;
    private EssayController controller;

    @BeforeEach
    void setUp() {
        store = new InMemoryEssayStore(DIMENSION, 0.78d, new TickingClock(Instant.parse("2024-09-01T00:00:00Z")));
        encoder = new TextEncoder("test", () -> new DeterministicEmbeddingModel(DIMENSION), DIMENSION, 10,
                Duration.ZERO);
        controller = new EssayController(store, encoder, new CorpusProperties());
    }

    @Test
    void searchIsUnavailableUntilEncoderIsReady() {
        ResponseEntity<?> response = controller.search(new EssaySearchRequest("my story", null, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isEqualTo(Map.of("error", "Embedding service not ready"));
    }

    @Test
    void searchFindsEssayWithMatchingContent() {
        encoder.initialize();
        Essay stored = controller.add(request("Moving to a new country taught me patience.",
                EssayCategory.PERSONAL_STATEMENT));
        controller.add(request("Robotics club changed how I think about failure.", EssayCategory.SUPPLEMENTAL));

        ResponseEntity<?> response = controller.search(
                new EssaySearchRequest("Moving to a new country taught me patience.", "all", 3));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((List<?>) response.getBody()).singleElement()
                .isInstanceOfSatisfying(ScoredEssay.class, match -> assertThat(match.essay()).isEqualTo(stored));
    }

    @Test
    void searchFiltersByEssayType() {
        encoder.initialize();
        controller.add(request("Moving to a new country taught me patience.", EssayCategory.PERSONAL_STATEMENT));

        ResponseEntity<?> response = controller.search(
                new EssaySearchRequest("Moving to a new country taught me patience.", "supplemental", 3));

        assertThat((List<?>) response.getBody()).isEmpty();
    }

    @Test
    void searchRejectsUnknownEssayType() {
        encoder.initialize();

        ResponseEntity<?> response = controller.search(new EssaySearchRequest("anything", "poem", null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void addStoresEssayWithoutEmbeddingWhileEncoderIsLoading() {
        Essay stored = controller.add(request("Written before the model loaded.", EssayCategory.COMMON_APP));

        assertThat(stored.hasEmbedding()).isFalse();
        assertThat(store.findById(stored.id())).isPresent();
    }

    @Test
    void addEmbedsContentWhenEncoderIsReady() {
        encoder.initialize();

        Essay stored = controller.add(request("Written after the model loaded.", EssayCategory.COMMON_APP));

        assertThat(stored.embedding()).hasSize(DIMENSION);
    }

    @Test
    void getReturnsNotFoundForUnknownEssay() {
        assertThat(controller.get(UUID.randomUUID()).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void getReturnsStoredEssay() {
        Essay stored = controller.add(request("Find me.", EssayCategory.OTHER));

        ResponseEntity<Essay> response = controller.get(stored.id());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(stored);
    }

    @Test
    void statsReflectStoredEssays() {
        controller.add(request("One.", EssayCategory.PERSONAL_STATEMENT));
        controller.add(request("Two.", EssayCategory.PERSONAL_STATEMENT));

        EssayStats stats = controller.stats();

        assertThat(stats.totalEssays()).isEqualTo(2);
        assertThat(stats.byCategory()).containsEntry("personal_statement", 2L);
        assertThat(stats.byTopic()).containsEntry("growth", 2L);
    }

    @Test
    void mapsModelNotReadyToServiceUnavailable() {
        ResponseEntity<Map<String, String>> response = controller.encoderUnavailable(
                new ModelNotReadyException("still loading"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    private static NewEssayRequest request(String content, EssayCategory type) {
        return new NewEssayRequest(null, content, type, null, null, Set.of("growth"), null, null);
    }
}
