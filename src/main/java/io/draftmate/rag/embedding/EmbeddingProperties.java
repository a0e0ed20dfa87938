package io.draftmate.rag.embedding;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the sentence embedding model.
 */
@ConfigurationProperties(prefix = "writing.embedding")
public class EmbeddingProperties {

    /**
     * Use the deterministic hash based model instead of all-MiniLM-L6-v2.
     */
    private boolean mock = false;

    /**
     * Dimension of the produced vectors. Must match the model and the
     * {@code vector(n)} column of the essay table.
     */
    private int dimension = 384;

    /**
     * Number of texts encoded before the encoder pauses during batch encoding.
     */
    private int batchSize = 10;

    /**
     * Pause between two batches.
     */
    private Duration batchPause = Duration.ofMillis(100);

    /**
     * Load and warm up the model in the background when the application starts.
     */
    private boolean warmUpOnStartup = true;

    public boolean isMock() {
        return mock;
    }

    public void setMock(boolean mock) {
        this.mock = mock;
    }

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getBatchPause() {
        return batchPause;
    }

    public void setBatchPause(Duration batchPause) {
        this.batchPause = batchPause;
    }

    public boolean isWarmUpOnStartup() {
        return warmUpOnStartup;
    }

    public void setWarmUpOnStartup(boolean warmUpOnStartup) {
        this.warmUpOnStartup = warmUpOnStartup;
    }
}
