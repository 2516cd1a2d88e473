package com.kbase.retrieval.rag;

import com.kbase.retrieval.KnowledgeException;

/**
 * Raised when chunking or knowledge base tunables are inconsistent,
 * e.g. an overlap that is not smaller than the chunk size.
 */
public class InvalidConfigException extends KnowledgeException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
