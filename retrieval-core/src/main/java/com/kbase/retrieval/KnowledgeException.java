package com.kbase.retrieval;

/**
 * Base class for every error raised by the knowledge retrieval core.
 */
public class KnowledgeException extends RuntimeException {

    public KnowledgeException(String message) {
        super(message);
    }

    public KnowledgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
