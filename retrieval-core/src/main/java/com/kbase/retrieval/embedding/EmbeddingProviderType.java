package com.kbase.retrieval.embedding;

import java.util.Locale;

/**
 * The closed set of embedding client variants, selected by a model's provider tag.
 */
public enum EmbeddingProviderType {

    /**
     * Any endpoint implementing the OpenAI style {@code POST /embeddings} contract.
     */
    OPENAI_COMPATIBLE,

    /**
     * Google Gemini {@code models/{id}:embedContent}, a provider with its own request and response shape.
     */
    GEMINI;

    /**
     * Map a provider tag to its variant. Unknown tags use the generic HTTP contract.
     */
    public static EmbeddingProviderType fromTag(String provider) {
        if (provider == null) {
            return OPENAI_COMPATIBLE;
        }
        String tag = provider.trim().toLowerCase(Locale.ROOT);
        if ("gemini".equals(tag) || "google".equals(tag)) {
            return GEMINI;
        }
        return OPENAI_COMPATIBLE;
    }
}
