package io.draftmate.rag.corpus;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the essay corpus.
 */
@ConfigurationProperties(prefix = "writing.corpus")
public class CorpusProperties {

    /**
     * Keep the corpus in memory instead of PostgreSQL.
     */
    private boolean mockStore = true;

    /**
     * Similarity a match has to exceed to be returned by a similarity query.
     */
    private double matchThreshold = 0.78d;

    /**
     * Default number of matches returned by a similarity query.
     */
    private int matchCount = 5;

    /**
     * Maximum number of essays returned by a topic lookup.
     */
    private int topicLimit = 10;

    /**
     * Number of ivfflat lists probed per similarity query. Higher values find
     * more of the true nearest neighbours at the cost of latency; the index is
     * created with 100 lists.
     */
    private int ivfflatProbes = 10;

    /**
     * Table holding the essays.
     */
    private String table = "essays";

    /**
     * Optional JSON file with essays imported at startup.
     */
    private String importPath;

    public boolean isMockStore() {
        return mockStore;
    }

    public void setMockStore(boolean mockStore) {
        this.mockStore = mockStore;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public void setMatchThreshold(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public int getMatchCount() {
        return matchCount;
    }

    public void setMatchCount(int matchCount) {
        this.matchCount = matchCount;
    }

    public int getTopicLimit() {
        return topicLimit;
    }

    public void setTopicLimit(int topicLimit) {
        this.topicLimit = topicLimit;
    }

    public int getIvfflatProbes() {
        return ivfflatProbes;
    }

    public void setIvfflatProbes(int ivfflatProbes) {
        this.ivfflatProbes = ivfflatProbes;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getImportPath() {
        return importPath;
    }

    public void setImportPath(String importPath) {
        this.importPath = importPath;
    }
}
