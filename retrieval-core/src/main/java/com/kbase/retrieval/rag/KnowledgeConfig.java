package com.kbase.retrieval.rag;

import com.kbase.retrieval.model.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Configuration class for knowledge base defaults, embedding models and the retrieval pipeline.
 */
public class KnowledgeConfig {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeConfig.class);

    public static final String DEFAULT_RESOURCE = "KnowledgeConfig.properties";

    private int defaultDocumentCount = 5;
    private int defaultChunkSize = 1000;
    private int defaultChunkOverlap = 200;
    private double defaultThreshold = 0.7;
    private int contextMaxReferences = 5;
    private String defaultEmbeddingModel = "text-embedding-3-small";
    private int embeddingCacheSize = 100;
    private int embeddingConnectTimeoutSeconds = 10;
    private int embeddingRequestTimeoutSeconds = 30;
    private String openAiApiKey = "";
    private String openAiBaseUrl = "https://api.openai.com/v1";
    private List<EmbeddingModel> embeddingModels = new ArrayList<>();
    private RetrievalConfig retrieval = new RetrievalConfig();

    /**
     * Create a KnowledgeConfig from a Properties object.
     *
     * @param props The properties containing the settings
     * @return A configured KnowledgeConfig
     */
    public static KnowledgeConfig fromProperties(Properties props) {
        KnowledgeConfig config = new KnowledgeConfig();

        // Knowledge base defaults
        config.setDefaultDocumentCount(Integer.parseInt(props.getProperty("knowledge.defaults.documentCount", "5")));
        config.setDefaultChunkSize(Integer.parseInt(props.getProperty("knowledge.defaults.chunkSize", "1000")));
        config.setDefaultChunkOverlap(Integer.parseInt(props.getProperty("knowledge.defaults.chunkOverlap", "200")));
        config.setDefaultThreshold(Double.parseDouble(props.getProperty("knowledge.defaults.threshold", "0.7")));
        config.setContextMaxReferences(Integer.parseInt(props.getProperty("knowledge.context.maxReferences", "5")));

        // Embedding settings
        config.setDefaultEmbeddingModel(props.getProperty("embedding.defaultModel", "text-embedding-3-small"));
        config.setEmbeddingCacheSize(Integer.parseInt(props.getProperty("embedding.cacheSize", "100")));
        config.setEmbeddingConnectTimeoutSeconds(
                Integer.parseInt(props.getProperty("embedding.connectTimeoutSeconds", "10")));
        config.setEmbeddingRequestTimeoutSeconds(
                Integer.parseInt(props.getProperty("embedding.requestTimeoutSeconds", "30")));
        config.setOpenAiApiKey(props.getProperty("embedding.openai.apiKey", ""));
        config.setOpenAiBaseUrl(props.getProperty("embedding.openai.baseUrl", "https://api.openai.com/v1"));
        config.setEmbeddingModels(readModels(props, config));

        // Retrieval pipeline
        RetrievalConfig retrieval = new RetrievalConfig();
        retrieval.setQueryExpansion(Boolean.parseBoolean(props.getProperty("retrieval.queryExpansion", "true")));
        retrieval.setHybridSearch(Boolean.parseBoolean(props.getProperty("retrieval.hybridSearch", "true")));
        retrieval.setDiversityFilter(Boolean.parseBoolean(props.getProperty("retrieval.diversityFilter", "true")));
        retrieval.setRerank(Boolean.parseBoolean(props.getProperty("retrieval.rerank", "true")));
        retrieval.setMaxCandidates(Integer.parseInt(props.getProperty("retrieval.maxCandidates",
                String.valueOf(RetrievalConfig.DEFAULT_MAX_CANDIDATES))));
        retrieval.setDiversityThreshold(Double.parseDouble(props.getProperty("retrieval.diversityThreshold",
                String.valueOf(RetrievalConfig.DEFAULT_DIVERSITY_THRESHOLD))));
        config.setRetrieval(retrieval);

        DocumentChunker.validate(config.getDefaultChunkSize(), config.getDefaultChunkOverlap());
        return config;
    }

    private static List<EmbeddingModel> readModels(Properties props, KnowledgeConfig config) {
        List<EmbeddingModel> models = new ArrayList<>();
        String ids = props.getProperty("embedding.models", "").trim();
        if (ids.isEmpty()) {
            return models;
        }
        for (String id : ids.split("\\s*,\\s*")) {
            if (id.isEmpty()) {
                continue;
            }
            String prefix = "embedding.models." + id + ".";
            String provider = props.getProperty(prefix + "provider", "openai");
            String apiKey = props.getProperty(prefix + "apiKey", config.getOpenAiApiKey());
            String defaultUrl = "openai".equalsIgnoreCase(provider) ? config.getOpenAiBaseUrl() : "";
            String baseUrl = props.getProperty(prefix + "baseUrl", defaultUrl);
            String dims = props.getProperty(prefix + "dimensions", "").trim();
            Integer dimensions = null;
            if (!dims.isEmpty()) {
                try {
                    dimensions = Integer.parseInt(dims);
                } catch (NumberFormatException e) {
                    throw new InvalidConfigException("Invalid dimensions for embedding model " + id + ": " + dims);
                }
            }
            models.add(new EmbeddingModel(id, provider, apiKey, baseUrl.isEmpty() ? null : baseUrl, dimensions));
        }
        logger.debug("Configured {} embedding models", models.size());
        return models;
    }

    /**
     * Load configuration from a properties file.
     *
     * @param propertiesPath Path to the properties file
     * @return A configured KnowledgeConfig
     * @throws IOException If an I/O error occurs
     */
    public static KnowledgeConfig fromPropertiesFile(String propertiesPath) throws IOException {
        Properties props = new Properties();
        try (InputStream input = new FileInputStream(propertiesPath)) {
            props.load(input);
        }
        return fromProperties(props);
    }

    /**
     * Load configuration from a resource in the classpath.
     *
     * @param resourcePath Path to the resource
     * @return A configured KnowledgeConfig
     * @throws IOException If an I/O error occurs
     */
    public static KnowledgeConfig fromResource(String resourcePath) throws IOException {
        Properties props = new Properties();
        try (InputStream input = KnowledgeConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (input == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            props.load(input);
        }
        return fromProperties(props);
    }

    /**
     * Convert this configuration to a Properties object.
     *
     * @return A Properties object containing this configuration
     */
    public Properties toProperties() {
        Properties props = new Properties();

        props.setProperty("knowledge.defaults.documentCount", String.valueOf(defaultDocumentCount));
        props.setProperty("knowledge.defaults.chunkSize", String.valueOf(defaultChunkSize));
        props.setProperty("knowledge.defaults.chunkOverlap", String.valueOf(defaultChunkOverlap));
        props.setProperty("knowledge.defaults.threshold", String.valueOf(defaultThreshold));
        props.setProperty("knowledge.context.maxReferences", String.valueOf(contextMaxReferences));

        props.setProperty("embedding.defaultModel", defaultEmbeddingModel);
        props.setProperty("embedding.cacheSize", String.valueOf(embeddingCacheSize));
        props.setProperty("embedding.connectTimeoutSeconds", String.valueOf(embeddingConnectTimeoutSeconds));
        props.setProperty("embedding.requestTimeoutSeconds", String.valueOf(embeddingRequestTimeoutSeconds));
        props.setProperty("embedding.openai.apiKey", openAiApiKey);
        props.setProperty("embedding.openai.baseUrl", openAiBaseUrl);

        List<String> ids = new ArrayList<>();
        for (EmbeddingModel model : embeddingModels) {
            ids.add(model.getId());
            String prefix = "embedding.models." + model.getId() + ".";
            if (model.getProvider() != null) {
                props.setProperty(prefix + "provider", model.getProvider());
            }
            if (model.getApiKey() != null) {
                props.setProperty(prefix + "apiKey", model.getApiKey());
            }
            if (model.getBaseUrl() != null) {
                props.setProperty(prefix + "baseUrl", model.getBaseUrl());
            }
            if (model.getDimensions() != null) {
                props.setProperty(prefix + "dimensions", String.valueOf(model.getDimensions()));
            }
        }
        props.setProperty("embedding.models", String.join(",", ids));

        props.setProperty("retrieval.queryExpansion", String.valueOf(retrieval.isQueryExpansion()));
        props.setProperty("retrieval.hybridSearch", String.valueOf(retrieval.isHybridSearch()));
        props.setProperty("retrieval.diversityFilter", String.valueOf(retrieval.isDiversityFilter()));
        props.setProperty("retrieval.rerank", String.valueOf(retrieval.isRerank()));
        props.setProperty("retrieval.maxCandidates", String.valueOf(retrieval.getMaxCandidates()));
        props.setProperty("retrieval.diversityThreshold", String.valueOf(retrieval.getDiversityThreshold()));

        return props;
    }

    // Getters and setters

    public int getDefaultDocumentCount() {
        return defaultDocumentCount;
    }

    public void setDefaultDocumentCount(int defaultDocumentCount) {
        this.defaultDocumentCount = defaultDocumentCount;
    }

    public int getDefaultChunkSize() {
        return defaultChunkSize;
    }

    public void setDefaultChunkSize(int defaultChunkSize) {
        this.defaultChunkSize = defaultChunkSize;
    }

    public int getDefaultChunkOverlap() {
        return defaultChunkOverlap;
    }

    public void setDefaultChunkOverlap(int defaultChunkOverlap) {
        this.defaultChunkOverlap = defaultChunkOverlap;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public void setDefaultThreshold(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public int getContextMaxReferences() {
        return contextMaxReferences;
    }

    public void setContextMaxReferences(int contextMaxReferences) {
        this.contextMaxReferences = contextMaxReferences;
    }

    public String getDefaultEmbeddingModel() {
        return defaultEmbeddingModel;
    }

    public void setDefaultEmbeddingModel(String defaultEmbeddingModel) {
        this.defaultEmbeddingModel = defaultEmbeddingModel;
    }

    public int getEmbeddingCacheSize() {
        return embeddingCacheSize;
    }

    public void setEmbeddingCacheSize(int embeddingCacheSize) {
        this.embeddingCacheSize = embeddingCacheSize;
    }

    public int getEmbeddingConnectTimeoutSeconds() {
        return embeddingConnectTimeoutSeconds;
    }

    public void setEmbeddingConnectTimeoutSeconds(int embeddingConnectTimeoutSeconds) {
        this.embeddingConnectTimeoutSeconds = embeddingConnectTimeoutSeconds;
    }

    public int getEmbeddingRequestTimeoutSeconds() {
        return embeddingRequestTimeoutSeconds;
    }

    public void setEmbeddingRequestTimeoutSeconds(int embeddingRequestTimeoutSeconds) {
        this.embeddingRequestTimeoutSeconds = embeddingRequestTimeoutSeconds;
    }

    public String getOpenAiApiKey() {
        return openAiApiKey;
    }

    public void setOpenAiApiKey(String openAiApiKey) {
        this.openAiApiKey = openAiApiKey;
    }

    public String getOpenAiBaseUrl() {
        return openAiBaseUrl;
    }

    public void setOpenAiBaseUrl(String openAiBaseUrl) {
        this.openAiBaseUrl = openAiBaseUrl;
    }

    public List<EmbeddingModel> getEmbeddingModels() {
        return embeddingModels;
    }

    public void setEmbeddingModels(List<EmbeddingModel> embeddingModels) {
        this.embeddingModels = new ArrayList<>(embeddingModels);
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval;
    }
}
