package com.kbase.retrieval.model;

import java.util.Objects;

/**
 * Resolved descriptor of an embedding model as handed over by the
 * model-provider registry.
 */
public class EmbeddingModel {

    private final String id;
    private final String provider;
    private final String apiKey;
    private final String baseUrl;
    private final Integer dimensions;

    public EmbeddingModel(String id, String provider, String apiKey, String baseUrl, Integer dimensions) {
        this.id = Objects.requireNonNull(id, "id");
        this.provider = provider;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.dimensions = dimensions;
    }

    public String getId() {
        return id;
    }

    /**
     * Provider tag, e.g. "openai" or "gemini". Selects the embedding client variant.
     */
    public String getProvider() {
        return provider;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Declared vector width, or {@code null} when the registry does not know it.
     */
    public Integer getDimensions() {
        return dimensions;
    }

    @Override
    public String toString() {
        // never print the api key
        return "EmbeddingModel{id='" + id + "', provider='" + provider + "', baseUrl='" + baseUrl + "'}";
    }
}
