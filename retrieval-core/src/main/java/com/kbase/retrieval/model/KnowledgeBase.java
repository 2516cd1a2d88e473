package com.kbase.retrieval.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A named retrieval collection. Every chunk stored under a knowledge base is
 * embedded with {@link #getModel()} and has exactly {@link #getDimensions()} components.
 */
public class KnowledgeBase {

    private String id;
    private String name;
    private String description;
    private String model;
    private int dimensions;
    private int documentCount;
    private int chunkSize;
    private int chunkOverlap;
    private double threshold;
    private Instant createdAt;
    private Instant updatedAt;

    public KnowledgeBase() {
    }

    /**
     * Copy constructor, used so that callers never share an instance with the repository.
     */
    public KnowledgeBase(KnowledgeBase other) {
        this.id = other.id;
        this.name = other.name;
        this.description = other.description;
        this.model = other.model;
        this.dimensions = other.dimensions;
        this.documentCount = other.documentCount;
        this.chunkSize = other.chunkSize;
        this.chunkOverlap = other.chunkOverlap;
        this.threshold = other.threshold;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    /**
     * Default number of results returned by a search when the caller gives no limit.
     */
    public int getDocumentCount() {
        return documentCount;
    }

    public void setDocumentCount(int documentCount) {
        this.documentCount = documentCount;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KnowledgeBase)) {
            return false;
        }
        KnowledgeBase that = (KnowledgeBase) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "KnowledgeBase{id='" + id + "', name='" + name + "', model='" + model
                + "', dimensions=" + dimensions + "}";
    }
}
