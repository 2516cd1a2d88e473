package com.kbase.retrieval.knowledge;

import com.kbase.retrieval.KnowledgeException;

/**
 * Raised for an unknown knowledge base or chunk identifier.
 */
public class NotFoundException extends KnowledgeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException knowledgeBase(String baseId) {
        return new NotFoundException("Knowledge base not found: " + baseId);
    }

    public static NotFoundException document(String chunkId) {
        return new NotFoundException("Document chunk not found: " + chunkId);
    }
}
