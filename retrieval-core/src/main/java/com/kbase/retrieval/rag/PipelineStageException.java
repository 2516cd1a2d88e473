package com.kbase.retrieval.rag;

import com.kbase.retrieval.KnowledgeException;

/**
 * Failure of a single enhancement stage. Always recovered inside
 * {@link EnhancedRetrievalPipeline}; never reaches a caller.
 */
public class PipelineStageException extends KnowledgeException {

    private final String stage;

    public PipelineStageException(String stage, Throwable cause) {
        super("Retrieval stage '" + stage + "' failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
