package com.kbase.retrieval.knowledge;

/**
 * Input for creating a knowledge base. Tunables left {@code null} take the configured defaults.
 */
public class CreateKnowledgeBaseRequest {

    private String name;
    private String description;
    private String model;
    private Integer dimensions;
    private Integer documentCount;
    private Integer chunkSize;
    private Integer chunkOverlap;
    private Double threshold;

    public CreateKnowledgeBaseRequest() {
    }

    public CreateKnowledgeBaseRequest(String name, String model) {
        this.name = name;
        this.model = model;
    }

    public String getName() {
        return name;
    }

    public CreateKnowledgeBaseRequest setName(String name) {
        this.name = name;
        return this;
    }

    public String getDescription() {
        return description;
    }

    public CreateKnowledgeBaseRequest setDescription(String description) {
        this.description = description;
        return this;
    }

    public String getModel() {
        return model;
    }

    public CreateKnowledgeBaseRequest setModel(String model) {
        this.model = model;
        return this;
    }

    /**
     * Vector width; when {@code null} it is asked from the embedding model.
     */
    public Integer getDimensions() {
        return dimensions;
    }

    public CreateKnowledgeBaseRequest setDimensions(Integer dimensions) {
        this.dimensions = dimensions;
        return this;
    }

    public Integer getDocumentCount() {
        return documentCount;
    }

    public CreateKnowledgeBaseRequest setDocumentCount(Integer documentCount) {
        this.documentCount = documentCount;
        return this;
    }

    public Integer getChunkSize() {
        return chunkSize;
    }

    public CreateKnowledgeBaseRequest setChunkSize(Integer chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }

    public Integer getChunkOverlap() {
        return chunkOverlap;
    }

    public CreateKnowledgeBaseRequest setChunkOverlap(Integer chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
        return this;
    }

    public Double getThreshold() {
        return threshold;
    }

    public CreateKnowledgeBaseRequest setThreshold(Double threshold) {
        this.threshold = threshold;
        return this;
    }
}
