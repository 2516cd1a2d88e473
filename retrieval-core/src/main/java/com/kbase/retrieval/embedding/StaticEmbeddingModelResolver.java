package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolver over a fixed set of descriptors, typically read from configuration.
 */
public class StaticEmbeddingModelResolver implements EmbeddingModelResolver {

    private final Map<String, EmbeddingModel> models = new LinkedHashMap<>();

    public StaticEmbeddingModelResolver(Collection<EmbeddingModel> models) {
        for (EmbeddingModel model : models) {
            this.models.put(model.getId(), model);
        }
    }

    @Override
    public Optional<EmbeddingModel> resolve(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public List<EmbeddingModel> getModels() {
        return List.copyOf(models.values());
    }
}
