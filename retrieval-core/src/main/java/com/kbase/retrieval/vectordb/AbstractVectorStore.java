package com.kbase.retrieval.vectordb;

import com.kbase.retrieval.model.KnowledgeDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Abstract implementation of VectorStore providing availability tracking and
 * uniform error handling. Unlike a cache, the store is the source of truth, so
 * failures are propagated as {@link VectorStoreException} instead of being hidden.
 */
public abstract class AbstractVectorStore implements VectorStore {

    private static final Logger logger = LoggerFactory.getLogger(AbstractVectorStore.class);

    protected final AtomicBoolean available = new AtomicBoolean(false);

    protected AbstractVectorStore() {
        boolean initResult = initialize();
        available.set(initResult);
        if (initResult) {
            logger.info("Vector store initialized: {}", getClass().getSimpleName());
        } else {
            logger.warn("Vector store initialization failed: {}", getClass().getSimpleName());
        }
    }

    /**
     * Prepare the underlying storage.
     *
     * @return true if the store can be used
     */
    protected abstract boolean initialize();

    /**
     * Closes any resources used by the store.
     */
    protected abstract void closeResources();

    public void shutdown() {
        closeResources();
        available.set(false);
        logger.info("Vector store shut down: {}", getClass().getSimpleName());
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public void put(KnowledgeDocument document) {
        ensureAvailable("put");
        try {
            performPut(document);
        } catch (VectorStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error storing document {}: {}", document.getId(), e.getMessage(), e);
            throw new VectorStoreException("Failed to store document " + document.getId(), e);
        }
    }

    protected abstract void performPut(KnowledgeDocument document);

    @Override
    public int deleteByKnowledgeBase(String knowledgeBaseId) {
        ensureAvailable("deleteByKnowledgeBase");
        try {
            return performDeleteByKnowledgeBase(knowledgeBaseId);
        } catch (VectorStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error deleting documents of knowledge base {}: {}", knowledgeBaseId, e.getMessage(), e);
            throw new VectorStoreException("Failed to delete documents of knowledge base " + knowledgeBaseId, e);
        }
    }

    protected abstract int performDeleteByKnowledgeBase(String knowledgeBaseId);

    @Override
    public boolean deleteById(String documentId) {
        ensureAvailable("deleteById");
        try {
            return performDeleteById(documentId);
        } catch (VectorStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error deleting document {}: {}", documentId, e.getMessage(), e);
            throw new VectorStoreException("Failed to delete document " + documentId, e);
        }
    }

    protected abstract boolean performDeleteById(String documentId);

    @Override
    public List<KnowledgeDocument> listByKnowledgeBase(String knowledgeBaseId) {
        ensureAvailable("listByKnowledgeBase");
        try {
            return performListByKnowledgeBase(knowledgeBaseId);
        } catch (VectorStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error listing documents of knowledge base {}: {}", knowledgeBaseId, e.getMessage(), e);
            throw new VectorStoreException("Failed to list documents of knowledge base " + knowledgeBaseId, e);
        }
    }

    protected abstract List<KnowledgeDocument> performListByKnowledgeBase(String knowledgeBaseId);

    @Override
    public Optional<KnowledgeDocument> getById(String documentId) {
        ensureAvailable("getById");
        try {
            return performGetById(documentId);
        } catch (VectorStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error retrieving document {}: {}", documentId, e.getMessage(), e);
            throw new VectorStoreException("Failed to retrieve document " + documentId, e);
        }
    }

    protected abstract Optional<KnowledgeDocument> performGetById(String documentId);

    private void ensureAvailable(String operation) {
        if (!isAvailable()) {
            logger.warn("Vector store not available for {}: {}", operation, getClass().getSimpleName());
            throw new VectorStoreException("Vector store " + getClass().getSimpleName() + " is not available");
        }
    }
}
