package io.draftmate.rag.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.draftmate.rag.embedding.TextEncoder;

/**
 * Imports a JSON array of essays on startup, embedding each one before it is
 * stored. Essays that fail to store are logged and skipped.
 */
@Order(2)
public class CorpusImportRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusImportRunner.class);

    private static final TypeReference<List<ImportedEssay>> ESSAY_LIST = new TypeReference<>() {
    };

    private final Path source;
    private final TextEncoder textEncoder;
    private final EssayStore essayStore;
    private final ObjectMapper objectMapper;

    public CorpusImportRunner(String source, TextEncoder textEncoder, EssayStore essayStore,
            ObjectMapper objectMapper) {
        this.source = Path.of(Objects.requireNonNull(source, "source"));
        this.textEncoder = Objects.requireNonNull(textEncoder, "textEncoder");
        this.essayStore = Objects.requireNonNull(essayStore, "essayStore");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        importEssays();
    }

    /**
     * @return the number of essays stored
     */
    int importEssays() throws IOException {
        if (!Files.isRegularFile(source)) {
            LOGGER.warn("Essay import file does not exist: {}", source);
            return 0;
        }
        List<ImportedEssay> imported = objectMapper.readValue(source.toFile(), ESSAY_LIST);
        LOGGER.info("Processing {} essays from {}", imported.size(), source);

        List<float[]> embeddings = textEncoder.encodeBatch(imported.stream().map(ImportedEssay::content).toList());

        int stored = 0;
        for (int i = 0; i < imported.size(); i++) {
            ImportedEssay essay = imported.get(i);
            try {
                essayStore.insert(essay.toEssay(i + 1).withEmbedding(embeddings.get(i)));
                stored++;
                LOGGER.debug("Processed essay {}/{}", i + 1, imported.size());
            } catch (RuntimeException ex) {
                LOGGER.error("Error processing essay {}: {}", i + 1, ex.getMessage(), ex);
            }
        }
        LOGGER.info("Imported {} of {} essays", stored, imported.size());
        return stored;
    }

    /**
     * Shape of an essay in the import file.
     */
    record ImportedEssay(String title, String content, String type, String college, String prompt,
            Set<String> topics) {

        Essay toEssay(int position) {
            String effectiveTitle = title == null || title.isBlank() ? "Essay " + position : title;
            EssayCategory category = EssayCategory.find(type).orElse(EssayCategory.PERSONAL_STATEMENT);
            return Essay.draft(effectiveTitle, content, category, college, prompt, topics);
        }
    }
}
