package com.kbase.retrieval.rag;

/**
 * Settings of the enhanced retrieval pipeline.
 */
public class RetrievalConfig {

    public static final int DEFAULT_MAX_CANDIDATES = 50;
    public static final double DEFAULT_DIVERSITY_THRESHOLD = 0.8;

    private boolean queryExpansion = true;
    private boolean hybridSearch = true;
    private boolean diversityFilter = true;
    private boolean rerank = true;
    private int maxCandidates = DEFAULT_MAX_CANDIDATES;
    private double diversityThreshold = DEFAULT_DIVERSITY_THRESHOLD;

    public RetrievalConfig() {
    }

    public RetrievalConfig(RetrievalConfig other) {
        this.queryExpansion = other.queryExpansion;
        this.hybridSearch = other.hybridSearch;
        this.diversityFilter = other.diversityFilter;
        this.rerank = other.rerank;
        this.maxCandidates = other.maxCandidates;
        this.diversityThreshold = other.diversityThreshold;
    }

    /**
     * A configuration with every enhancement switched off, which makes the pipeline
     * behave exactly like a plain similarity search.
     */
    public static RetrievalConfig plain() {
        RetrievalConfig config = new RetrievalConfig();
        config.setQueryExpansion(false);
        config.setHybridSearch(false);
        config.setDiversityFilter(false);
        config.setRerank(false);
        return config;
    }

    public boolean isQueryExpansion() {
        return queryExpansion;
    }

    public void setQueryExpansion(boolean queryExpansion) {
        this.queryExpansion = queryExpansion;
    }

    public boolean isHybridSearch() {
        return hybridSearch;
    }

    public void setHybridSearch(boolean hybridSearch) {
        this.hybridSearch = hybridSearch;
    }

    public boolean isDiversityFilter() {
        return diversityFilter;
    }

    public void setDiversityFilter(boolean diversityFilter) {
        this.diversityFilter = diversityFilter;
    }

    public boolean isRerank() {
        return rerank;
    }

    public void setRerank(boolean rerank) {
        this.rerank = rerank;
    }

    /**
     * Size of the candidate pool taken from each vector search before the later stages.
     */
    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        if (maxCandidates <= 0) {
            throw new InvalidConfigException("maxCandidates must be positive, got " + maxCandidates);
        }
        this.maxCandidates = maxCandidates;
    }

    /**
     * Two results whose chunk vectors are at least this similar count as near-duplicates.
     */
    public double getDiversityThreshold() {
        return diversityThreshold;
    }

    public void setDiversityThreshold(double diversityThreshold) {
        this.diversityThreshold = diversityThreshold;
    }

    @Override
    public String toString() {
        return "RetrievalConfig{queryExpansion=" + queryExpansion + ", hybridSearch=" + hybridSearch
                + ", diversityFilter=" + diversityFilter + ", rerank=" + rerank
                + ", maxCandidates=" + maxCandidates + ", diversityThreshold=" + diversityThreshold + "}";
    }
}
