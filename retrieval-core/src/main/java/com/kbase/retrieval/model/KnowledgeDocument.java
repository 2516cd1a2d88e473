package com.kbase.retrieval.model;

import java.util.List;
import java.util.Objects;

/**
 * One embedded slice of a source document. Instances are immutable; a chunk is
 * replaced as a whole, never edited in place.
 */
public class KnowledgeDocument {

    private final String id;
    private final String knowledgeBaseId;
    private final String content;
    private final List<Float> vector;
    private final DocumentMetadata metadata;

    public KnowledgeDocument(String id, String knowledgeBaseId, String content,
                             List<Float> vector, DocumentMetadata metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.knowledgeBaseId = Objects.requireNonNull(knowledgeBaseId, "knowledgeBaseId");
        this.content = Objects.requireNonNull(content, "content");
        this.vector = List.copyOf(vector);
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public String getId() {
        return id;
    }

    public String getKnowledgeBaseId() {
        return knowledgeBaseId;
    }

    public String getContent() {
        return content;
    }

    public List<Float> getVector() {
        return vector;
    }

    public DocumentMetadata getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KnowledgeDocument)) {
            return false;
        }
        KnowledgeDocument that = (KnowledgeDocument) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "KnowledgeDocument{id='" + id + "', knowledgeBaseId='" + knowledgeBaseId
                + "', chunkIndex=" + metadata.getChunkIndex() + ", dimensions=" + vector.size() + "}";
    }
}
