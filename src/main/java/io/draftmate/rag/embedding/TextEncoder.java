package io.draftmate.rag.embedding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;

/**
 * Turns free text into fixed-dimension, L2-normalised embedding vectors.
 * <p>
 * The underlying model is loaded once. Callers that arrive while a load is in
 * progress wait for that load instead of starting their own. A failed load is
 * not remembered, so a later call tries again.
 */
public class TextEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextEncoder.class);

    private static final String WARM_UP_SENTENCE = "This is a test sentence for warming up the model.";

    private final String modelName;
    private final Supplier<EmbeddingModel> modelLoader;
    private final int dimension;
    private final int batchSize;
    private final Duration batchPause;

    private final Object loadLock = new Object();
    private volatile EmbeddingModel model;
    private CompletableFuture<EmbeddingModel> inFlightLoad;

    public TextEncoder(String modelName, Supplier<EmbeddingModel> modelLoader, int dimension, int batchSize,
            Duration batchPause) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.modelLoader = Objects.requireNonNull(modelLoader, "modelLoader");
        this.dimension = dimension;
        this.batchSize = batchSize;
        this.batchPause = Objects.requireNonNull(batchPause, "batchPause");
    }

    /**
     * Loads the embedding model unless it is already loaded or being loaded.
     *
     * @throws ModelNotReadyException if loading fails
     */
    public void initialize() {
        if (model != null) {
            return;
        }
        CompletableFuture<EmbeddingModel> pending;
        boolean loader = false;
        synchronized (loadLock) {
            if (model != null) {
                return;
            }
            if (inFlightLoad == null) {
                inFlightLoad = new CompletableFuture<>();
                loader = true;
            }
            pending = inFlightLoad;
        }

        if (loader) {
            load(pending);
        } else {
            awaitLoad(pending);
        }
    }

    private void load(CompletableFuture<EmbeddingModel> pending) {
        LOGGER.info("Loading embedding model: {}", modelName);
        try {
            EmbeddingModel loaded = Objects.requireNonNull(modelLoader.get(), "loaded model");
            int loadedDimension = loaded.dimension();
            if (loadedDimension != dimension) {
                throw new DimensionMismatchException(dimension, loadedDimension);
            }
            model = loaded;
            pending.complete(loaded);
            LOGGER.info("Embedding model {} loaded ({} dimensions)", modelName, dimension);
        } catch (RuntimeException | LinkageError ex) {
            // native runtime failures surface as LinkageError
            LOGGER.error("Error loading embedding model {}: {}", modelName, ex.getMessage(), ex);
            ModelNotReadyException failure = new ModelNotReadyException(
                    "Failed to load embedding model " + modelName, ex);
            pending.completeExceptionally(failure);
            throw failure;
        } finally {
            if (!pending.isDone()) {
                pending.completeExceptionally(
                        new ModelNotReadyException("Loading of embedding model " + modelName + " aborted"));
            }
            synchronized (loadLock) {
                inFlightLoad = null;
            }
        }
    }

    private void awaitLoad(CompletableFuture<EmbeddingModel> pending) {
        try {
            pending.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof ModelNotReadyException notReady) {
                throw notReady;
            }
            throw new ModelNotReadyException("Embedding model " + modelName + " could not be loaded", ex.getCause());
        }
    }

    public boolean isReady() {
        return model != null;
    }

    /**
     * Encodes a single text. Loads the model first if needed.
     *
     * @param text the text to encode
     * @return a normalised vector of {@link #dimension()} entries, the zero
     *         vector if nothing is left of the text after normalisation
     * @throws ModelNotReadyException if the model cannot be loaded
     */
    public float[] encode(String text) {
        initialize();
        EmbeddingModel current = model;
        if (current == null) {
            throw new ModelNotReadyException("Embedding model " + modelName + " not initialized");
        }
        String normalized = TextNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return new float[dimension];
        }
        Embedding embedding = current.embed(normalized).content();
        float[] vector = embedding.vector().clone();
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
        return SimilarityRanker.normalize(vector);
    }

    /**
     * Encodes several texts in chunks of the configured batch size, pausing
     * between chunks. The result at index {@code i} equals
     * {@code encode(texts.get(i))}.
     */
    public List<float[]> encodeBatch(List<String> texts) {
        Objects.requireNonNull(texts, "texts");
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            int end = Math.min(start + batchSize, texts.size());
            for (String text : texts.subList(start, end)) {
                vectors.add(encode(text));
            }
            if (end < texts.size()) {
                pauseBetweenBatches();
            }
        }
        LOGGER.debug("Encoded {} texts in batches of {}", texts.size(), batchSize);
        return vectors;
    }

    private void pauseBetweenBatches() {
        if (batchPause.isZero() || batchPause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(batchPause.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while encoding batch", ex);
        }
    }

    /**
     * Runs one throw-away encoding so the first user request does not pay for
     * lazy initialisation inside the model runtime.
     */
    public void warmUp() {
        LOGGER.info("Warming up embedding model...");
        encode(WARM_UP_SENTENCE);
        LOGGER.info("Embedding model warmed up");
    }

    public int dimension() {
        return dimension;
    }

    public ModelInfo modelInfo() {
        return new ModelInfo(modelName, dimension, isReady());
    }

    /**
     * Descriptive snapshot of the encoder.
     */
    public record ModelInfo(String name, int dimension, boolean loaded) {
    }
}
