package com.kbase.retrieval.rag;

import com.kbase.retrieval.embedding.CachingEmbeddingService;
import com.kbase.retrieval.embedding.EmbeddingCache;
import com.kbase.retrieval.embedding.EmbeddingClient;
import com.kbase.retrieval.embedding.EmbeddingModelResolver;
import com.kbase.retrieval.embedding.EmbeddingProviderType;
import com.kbase.retrieval.embedding.EmbeddingService;
import com.kbase.retrieval.embedding.FallbackVectorGenerator;
import com.kbase.retrieval.embedding.GeminiEmbeddingClient;
import com.kbase.retrieval.embedding.OpenAiCompatibleEmbeddingClient;
import com.kbase.retrieval.embedding.StaticEmbeddingModelResolver;
import com.kbase.retrieval.knowledge.InMemoryKnowledgeBaseRepository;
import com.kbase.retrieval.knowledge.KnowledgeBaseManager;
import com.kbase.retrieval.knowledge.KnowledgeContextService;
import com.kbase.retrieval.knowledge.KnowledgeEventListener;
import com.kbase.retrieval.knowledge.LoggingKnowledgeEventListener;
import com.kbase.retrieval.search.SimilarityEngine;
import com.kbase.retrieval.vectordb.InMemoryVectorStore;
import com.kbase.retrieval.vectordb.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Factory class for creating and wiring the knowledge retrieval components.
 */
public class RagFactory {

    private static final Logger logger = LoggerFactory.getLogger(RagFactory.class);

    private RagFactory() {
    }

    /**
     * Create an embedding service with one HTTP client per provider variant.
     *
     * @param config The configuration holding cache size and timeouts
     * @return A configured EmbeddingService
     */
    public static EmbeddingService createEmbeddingService(KnowledgeConfig config) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getEmbeddingConnectTimeoutSeconds()))
                .build();
        Duration requestTimeout = Duration.ofSeconds(config.getEmbeddingRequestTimeoutSeconds());

        Map<EmbeddingProviderType, EmbeddingClient> clients = new EnumMap<>(EmbeddingProviderType.class);
        clients.put(EmbeddingProviderType.OPENAI_COMPATIBLE,
                new OpenAiCompatibleEmbeddingClient(httpClient, requestTimeout));
        clients.put(EmbeddingProviderType.GEMINI, new GeminiEmbeddingClient(httpClient, requestTimeout));

        logger.info("Creating embedding service with cache size {}", config.getEmbeddingCacheSize());
        return new CachingEmbeddingService(clients, new EmbeddingCache(config.getEmbeddingCacheSize()));
    }

    /**
     * Create a resolver over the embedding models listed in the configuration.
     */
    public static EmbeddingModelResolver createModelResolver(KnowledgeConfig config) {
        if (config.getEmbeddingModels().isEmpty()) {
            logger.warn("No embedding models configured, every embedding will use fallback vectors");
        }
        return new StaticEmbeddingModelResolver(config.getEmbeddingModels());
    }

    public static VectorStore createVectorStore() {
        return new InMemoryVectorStore();
    }

    /**
     * Create a knowledge base manager with in-memory storage and logging events.
     */
    public static KnowledgeBaseManager createKnowledgeBaseManager(KnowledgeConfig config) {
        return createKnowledgeBaseManager(config, createEmbeddingService(config), createVectorStore(),
                new LoggingKnowledgeEventListener());
    }

    /**
     * Create a knowledge base manager around the given collaborators.
     *
     * @param config The configuration
     * @param embeddingService The embedding service to use
     * @param vectorStore The store for chunk records
     * @param listener Receives lifecycle and progress events
     * @return A configured KnowledgeBaseManager
     */
    public static KnowledgeBaseManager createKnowledgeBaseManager(KnowledgeConfig config,
                                                                  EmbeddingService embeddingService,
                                                                  VectorStore vectorStore,
                                                                  KnowledgeEventListener listener) {
        SimilarityEngine similarityEngine = new SimilarityEngine();
        EnhancedRetrievalPipeline pipeline = new EnhancedRetrievalPipeline(embeddingService, similarityEngine);
        return new KnowledgeBaseManager(
                new InMemoryKnowledgeBaseRepository(),
                vectorStore,
                embeddingService,
                createModelResolver(config),
                similarityEngine,
                pipeline,
                new FallbackVectorGenerator(),
                listener,
                config);
    }

    public static KnowledgeContextService createContextService(KnowledgeBaseManager manager, KnowledgeConfig config) {
        return new KnowledgeContextService(manager, config.getContextMaxReferences(), config.getDefaultThreshold());
    }

    public static DocumentProcessor createDocumentProcessor(KnowledgeBaseManager manager) {
        return new DocumentProcessor(manager);
    }
}
