package com.kbase.retrieval.knowledge;

/**
 * Partial update of a knowledge base; only non-null fields are applied.
 */
public class UpdateKnowledgeBaseRequest {

    private String name;
    private String description;
    private String model;
    private Integer dimensions;
    private Integer documentCount;
    private Integer chunkSize;
    private Integer chunkOverlap;
    private Double threshold;

    public String getName() {
        return name;
    }

    public UpdateKnowledgeBaseRequest setName(String name) {
        this.name = name;
        return this;
    }

    public String getDescription() {
        return description;
    }

    public UpdateKnowledgeBaseRequest setDescription(String description) {
        this.description = description;
        return this;
    }

    public String getModel() {
        return model;
    }

    public UpdateKnowledgeBaseRequest setModel(String model) {
        this.model = model;
        return this;
    }

    public Integer getDimensions() {
        return dimensions;
    }

    public UpdateKnowledgeBaseRequest setDimensions(Integer dimensions) {
        this.dimensions = dimensions;
        return this;
    }

    public Integer getDocumentCount() {
        return documentCount;
    }

    public UpdateKnowledgeBaseRequest setDocumentCount(Integer documentCount) {
        this.documentCount = documentCount;
        return this;
    }

    public Integer getChunkSize() {
        return chunkSize;
    }

    public UpdateKnowledgeBaseRequest setChunkSize(Integer chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }

    public Integer getChunkOverlap() {
        return chunkOverlap;
    }

    public UpdateKnowledgeBaseRequest setChunkOverlap(Integer chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
        return this;
    }

    public Double getThreshold() {
        return threshold;
    }

    public UpdateKnowledgeBaseRequest setThreshold(Double threshold) {
        this.threshold = threshold;
        return this;
    }
}
