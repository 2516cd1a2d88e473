package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;

import java.util.Optional;

/**
 * Boundary to the model-provider registry: turns a model id into a usable descriptor.
 */
public interface EmbeddingModelResolver {

    Optional<EmbeddingModel> resolve(String modelId);
}
