package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;

import java.util.List;

/**
 * Interface for services that turn text into vector embeddings.
 * These embeddings are used for semantic search over knowledge base chunks.
 */
public interface EmbeddingService {

    /**
     * Generate an embedding vector for a single text input.
     *
     * @param text The text to generate an embedding for
     * @param model The resolved model descriptor to embed with
     * @return The embedding vector, never empty
     * @throws EmbeddingException if the model could not produce a vector
     */
    List<Float> embed(String text, EmbeddingModel model);

    /**
     * Get the dimensionality of the vectors produced by a model.
     * Never throws: when the provider cannot be asked, a statically known width is returned.
     *
     * @param model The resolved model descriptor
     * @return The number of dimensions in the model's vectors
     */
    int dimensionsOf(EmbeddingModel model);
}
