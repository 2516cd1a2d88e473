package com.kbase.retrieval.embedding;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Well-known embedding models and their vector widths. Used when a model's width cannot be
 * asked from the provider.
 */
public final class EmbeddingModelCatalog {

    public static final int DEFAULT_DIMENSIONS = 1536;
    public static final int DEFAULT_MAX_CONTEXT = 8191;

    private static final Pattern EMBEDDING_MODEL_PATTERN = Pattern.compile(
            "(?:^text-|embed|bge-|e5-|LLM2Vec|retrieval|uae-|gte-|jina-clip|jina-embeddings|voyage-|Doubao-embedding)",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Entry> MODELS = new LinkedHashMap<>();

    static {
        register("text-embedding-3-small", 1536, 8191, "openai");
        register("text-embedding-3-large", 3072, 8191, "openai");
        register("text-embedding-ada-002", 1536, 8191, "openai");
        register("Doubao-embedding", 1024, 4095, "doubao");
        register("Doubao-embedding-large", 1536, 4095, "doubao");
        register("BAAI/bge-large-zh-v1.5", 1024, 512, "huggingface");
        register("BAAI/bge-large-en-v1.5", 1024, 512, "huggingface");
        register("BAAI/bge-m3", 1024, 8191, "huggingface");
        register("jina-embeddings-v2-base-zh", 768, 8191, "jina");
        register("jina-embeddings-v2-base-en", 768, 8191, "jina");
        register("jina-embeddings-v3", 1024, 8191, "jina");
        register("text-embedding-v2", 1024, 2048, "generic");
        register("embedding-2", 1536, 1024, "generic");
        register("hunyuan-embedding", 1024, 1024, "tencent");
        register("text-embedding-004", 768, 2048, "gemini");
        register("gemini-embedding-001", 3072, 2048, "gemini");
    }

    private EmbeddingModelCatalog() {
    }

    private static void register(String id, int dimensions, int maxContext, String provider) {
        MODELS.put(id, new Entry(dimensions, maxContext, provider));
    }

    /**
     * @return The known width of the model, or {@link #DEFAULT_DIMENSIONS} for unknown models
     */
    public static int dimensionsOf(String modelId) {
        Entry entry = MODELS.get(modelId);
        return entry != null ? entry.dimensions : DEFAULT_DIMENSIONS;
    }

    public static int maxContextOf(String modelId) {
        Entry entry = MODELS.get(modelId);
        return entry != null ? entry.maxContext : DEFAULT_MAX_CONTEXT;
    }

    public static String providerOf(String modelId) {
        Entry entry = MODELS.get(modelId);
        return entry != null ? entry.provider : null;
    }

    public static boolean isKnown(String modelId) {
        return MODELS.containsKey(modelId);
    }

    /**
     * Heuristic check on a model id, for registries that mix chat and embedding models.
     */
    public static boolean isLikelyEmbeddingModel(String modelId) {
        return modelId != null && (isKnown(modelId) || EMBEDDING_MODEL_PATTERN.matcher(modelId).find());
    }

    private static final class Entry {
        final int dimensions;
        final int maxContext;
        final String provider;

        Entry(int dimensions, int maxContext, String provider) {
            this.dimensions = dimensions;
            this.maxContext = maxContext;
            this.provider = provider;
        }
    }
}
