package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;

import java.util.List;
import java.util.OptionalInt;

/**
 * One provider variant able to call an embedding model.
 */
public interface EmbeddingClient {

    /**
     * Call the model once, without caching.
     *
     * @throws EmbeddingException on any transport, status or parse failure
     */
    List<Float> embed(String text, EmbeddingModel model);

    /**
     * Vector width the provider reports for the model without embedding anything,
     * or empty when the width has to be found by a probe call.
     */
    default OptionalInt declaredDimensions(EmbeddingModel model) {
        return OptionalInt.empty();
    }
}
