package com.kbase.retrieval.vectordb;

import com.kbase.retrieval.KnowledgeException;

/**
 * Wraps a failure of the underlying storage collaborator.
 */
public class VectorStoreException extends KnowledgeException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
