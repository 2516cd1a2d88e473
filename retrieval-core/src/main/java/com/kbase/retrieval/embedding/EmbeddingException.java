package com.kbase.retrieval.embedding;

import com.kbase.retrieval.KnowledgeException;

/**
 * Raised when a vector could not be obtained from an embedding model:
 * network errors, non-success HTTP status, unparsable bodies or a model
 * that is missing its API key or endpoint.
 */
public class EmbeddingException extends KnowledgeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
