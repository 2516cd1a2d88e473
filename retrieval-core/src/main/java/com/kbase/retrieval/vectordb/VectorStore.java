package com.kbase.retrieval.vectordb;

import com.kbase.retrieval.model.KnowledgeDocument;

import java.util.List;
import java.util.Optional;

/**
 * Narrow contract over the storage collaborator holding chunk records.
 * The store neither filters nor ranks; similarity is computed by the caller.
 */
public interface VectorStore {

    /**
     * Insert or replace a chunk record by its id.
     *
     * @throws VectorStoreException if the storage collaborator fails
     */
    void put(KnowledgeDocument document);

    /**
     * Remove every chunk record of a knowledge base.
     *
     * @return The number of records removed
     */
    int deleteByKnowledgeBase(String knowledgeBaseId);

    /**
     * @return true if a record with that id existed and was removed
     */
    boolean deleteById(String documentId);

    /**
     * Full scan of one knowledge base, in insertion order.
     */
    List<KnowledgeDocument> listByKnowledgeBase(String knowledgeBaseId);

    Optional<KnowledgeDocument> getById(String documentId);

    /**
     * Checks if the store is available for operations.
     */
    boolean isAvailable();
}
