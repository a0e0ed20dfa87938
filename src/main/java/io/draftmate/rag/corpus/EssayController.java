package io.draftmate.rag.corpus;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.draftmate.rag.embedding.ModelNotReadyException;
import io.draftmate.rag.embedding.TextEncoder;
import jakarta.validation.Valid;

/**
 * Synchronous access to the essay corpus.
 */
@RestController
@RequestMapping(path = "/api/essays", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class EssayController {

    private static final Logger LOGGER = LoggerFactory.getLogger(EssayController.class);

    private final EssayStore essayStore;
    private final TextEncoder textEncoder;
    private final CorpusProperties properties;

    public EssayController(EssayStore essayStore, TextEncoder textEncoder, CorpusProperties properties) {
        this.essayStore = Objects.requireNonNull(essayStore, "essayStore");
        this.textEncoder = Objects.requireNonNull(textEncoder, "textEncoder");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @GetMapping("/stats")
    public EssayStats stats() {
        return essayStore.stats();
    }

    /**
     * Stores an essay. The content is embedded when the encoder is ready,
     * otherwise the essay is stored without an embedding.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Essay add(@Valid @RequestBody NewEssayRequest request) {
        Essay essay = request.toEssay();
        if (textEncoder.isReady()) {
            essay = essay.withEmbedding(textEncoder.encode(essay.content()));
        } else {
            LOGGER.info("Encoder not ready, storing essay without embedding");
        }
        return essayStore.insert(essay);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Essay> get(@PathVariable UUID id) {
        return essayStore.findById(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping(path = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> search(@Valid @RequestBody EssaySearchRequest request) {
        if (!textEncoder.isReady()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Embedding service not ready"));
        }
        EssayCategory category = null;
        if (request.essayType() != null && !"all".equalsIgnoreCase(request.essayType())) {
            Optional<EssayCategory> requested = EssayCategory.find(request.essayType());
            if (requested.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown essay type: " + request.essayType()));
            }
            category = requested.get();
        }
        int limit = request.limit() != null ? request.limit() : properties.getMatchCount();
        float[] queryVector = textEncoder.encode(request.query());
        List<ScoredEssay> matches = essayStore.query(queryVector, category, limit);
        return ResponseEntity.ok(matches);
    }

    @ExceptionHandler(ModelNotReadyException.class)
    ResponseEntity<Map<String, String>> encoderUnavailable(ModelNotReadyException ex) {
        LOGGER.warn("Embedding service unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Embedding service not ready"));
    }

    @ExceptionHandler(DataAccessException.class)
    ResponseEntity<Map<String, String>> storeFailure(DataAccessException ex) {
        LOGGER.error("Essay store failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Essay store unavailable"));
    }
}
