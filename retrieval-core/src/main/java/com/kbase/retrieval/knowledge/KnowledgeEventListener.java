package com.kbase.retrieval.knowledge;

/**
 * Observer for knowledge base lifecycle and ingestion progress. All methods default
 * to doing nothing so implementations only override what they need.
 */
public interface KnowledgeEventListener {

    KnowledgeEventListener NONE = new KnowledgeEventListener() {
    };

    default void onKnowledgeBaseCreated(String knowledgeBaseId) {
    }

    default void onKnowledgeBaseUpdated(String knowledgeBaseId) {
    }

    /**
     * @param documentsRemoved Number of chunk records removed with the knowledge base
     */
    default void onKnowledgeBaseDeleted(String knowledgeBaseId, int documentsRemoved) {
    }

    /**
     * One chunk has been embedded and stored.
     *
     * @param current 1-based position of the chunk within its document
     * @param total Number of chunks of the document
     */
    default void onDocumentChunkProcessed(String chunkId, String knowledgeBaseId, int current, int total) {
    }

    default void onDocumentsAdded(String knowledgeBaseId, int count) {
    }

    default void onDocumentDeleted(String chunkId, String knowledgeBaseId) {
    }

    /**
     * A chunk was stored with a fallback vector because the embedding model failed.
     */
    default void onEmbeddingDegraded(String knowledgeBaseId, String chunkId, Throwable cause) {
    }
}
