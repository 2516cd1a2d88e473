package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementation of EmbeddingService that puts a bounded cache in front of the
 * provider specific clients and dispatches by the model's provider tag.
 */
public class CachingEmbeddingService implements EmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(CachingEmbeddingService.class);

    static final String PROBE_TEXT = "test";

    private final Map<EmbeddingProviderType, EmbeddingClient> clients;
    private final EmbeddingCache cache;
    private final Map<String, Integer> knownDimensions = new ConcurrentHashMap<>();

    /**
     * @param clients One client per provider variant; every variant must be covered
     * @param cache The cache shared by all variants
     */
    public CachingEmbeddingService(Map<EmbeddingProviderType, EmbeddingClient> clients, EmbeddingCache cache) {
        this.clients = new EnumMap<>(clients);
        for (EmbeddingProviderType type : EmbeddingProviderType.values()) {
            if (!this.clients.containsKey(type)) {
                throw new IllegalArgumentException("No embedding client registered for provider " + type);
            }
        }
        this.cache = cache;
    }

    @Override
    public List<Float> embed(String text, EmbeddingModel model) {
        if (text == null) {
            throw new EmbeddingException("Cannot embed null text");
        }
        List<Float> cached = cache.get(model.getId(), text);
        if (cached != null) {
            logger.trace("Embedding cache hit for model {}", model.getId());
            return cached;
        }

        EmbeddingClient client = clientFor(model);
        List<Float> vector;
        try {
            vector = client.embed(text, model);
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding with model " + model.getId() + " failed: " + e.getMessage(), e);
        }
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingException("Embedding model " + model.getId() + " returned an empty vector");
        }
        return cache.putIfAbsent(model.getId(), text, vector);
    }

    @Override
    public int dimensionsOf(EmbeddingModel model) {
        Integer known = knownDimensions.get(model.getId());
        if (known != null) {
            return known;
        }
        try {
            OptionalInt declared = clientFor(model).declaredDimensions(model);
            int dimensions = declared.isPresent() ? declared.getAsInt() : embed(PROBE_TEXT, model).size();
            knownDimensions.put(model.getId(), dimensions);
            logger.debug("Resolved {} dimensions for model {}", dimensions, model.getId());
            return dimensions;
        } catch (RuntimeException e) {
            int fallback = EmbeddingModelCatalog.dimensionsOf(model.getId());
            logger.warn("Could not determine dimensions of model {} ({}), using {}",
                    model.getId(), e.getMessage(), fallback);
            return fallback;
        }
    }

    public EmbeddingCache getCache() {
        return cache;
    }

    private EmbeddingClient clientFor(EmbeddingModel model) {
        return clients.get(EmbeddingProviderType.fromTag(model.getProvider()));
    }
}
