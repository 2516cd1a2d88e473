package com.kbase.retrieval.knowledge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every knowledge event to the log. Degraded embeddings are logged as warnings.
 */
public class LoggingKnowledgeEventListener implements KnowledgeEventListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingKnowledgeEventListener.class);

    @Override
    public void onKnowledgeBaseCreated(String knowledgeBaseId) {
        logger.info("Knowledge base created: {}", knowledgeBaseId);
    }

    @Override
    public void onKnowledgeBaseUpdated(String knowledgeBaseId) {
        logger.info("Knowledge base updated: {}", knowledgeBaseId);
    }

    @Override
    public void onKnowledgeBaseDeleted(String knowledgeBaseId, int documentsRemoved) {
        logger.info("Knowledge base deleted: {} ({} chunks removed)", knowledgeBaseId, documentsRemoved);
    }

    @Override
    public void onDocumentChunkProcessed(String chunkId, String knowledgeBaseId, int current, int total) {
        logger.debug("Processed chunk {}/{} of knowledge base {}: {}", current, total, knowledgeBaseId, chunkId);
    }

    @Override
    public void onDocumentsAdded(String knowledgeBaseId, int count) {
        logger.info("Added {} chunks to knowledge base {}", count, knowledgeBaseId);
    }

    @Override
    public void onDocumentDeleted(String chunkId, String knowledgeBaseId) {
        logger.info("Deleted chunk {} from knowledge base {}", chunkId, knowledgeBaseId);
    }

    @Override
    public void onEmbeddingDegraded(String knowledgeBaseId, String chunkId, Throwable cause) {
        logger.warn("Chunk {} of knowledge base {} stored with a fallback vector, search relevance is reduced: {}",
                chunkId, knowledgeBaseId, cause.getMessage());
    }
}
