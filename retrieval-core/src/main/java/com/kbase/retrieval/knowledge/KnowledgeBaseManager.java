package com.kbase.retrieval.knowledge;

import com.kbase.retrieval.embedding.EmbeddingException;
import com.kbase.retrieval.embedding.EmbeddingModelCatalog;
import com.kbase.retrieval.embedding.EmbeddingModelResolver;
import com.kbase.retrieval.embedding.EmbeddingService;
import com.kbase.retrieval.embedding.FallbackVectorGenerator;
import com.kbase.retrieval.model.DocumentMetadata;
import com.kbase.retrieval.model.EmbeddingModel;
import com.kbase.retrieval.model.KnowledgeBase;
import com.kbase.retrieval.model.KnowledgeDocument;
import com.kbase.retrieval.model.SearchResult;
import com.kbase.retrieval.model.SourceMetadata;
import com.kbase.retrieval.rag.DocumentChunker;
import com.kbase.retrieval.rag.EnhancedRetrievalPipeline;
import com.kbase.retrieval.rag.InvalidConfigException;
import com.kbase.retrieval.rag.KnowledgeConfig;
import com.kbase.retrieval.rag.RetrievalConfig;
import com.kbase.retrieval.search.DimensionMismatchException;
import com.kbase.retrieval.search.SimilarityEngine;
import com.kbase.retrieval.vectordb.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for managing knowledge bases: lifecycle, document ingestion and search.
 * <p>
 * Embedding failures never fail an operation. The affected chunk or query gets a fallback
 * vector of the knowledge base's width, the chunk is flagged as degraded and the listener
 * is told. Configuration errors, unknown ids and dimension mismatches are thrown.
 */
public class KnowledgeBaseManager {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseManager.class);

    private final KnowledgeBaseRepository repository;
    private final VectorStore vectorStore;
    private final EmbeddingService embeddingService;
    private final EmbeddingModelResolver modelResolver;
    private final SimilarityEngine similarityEngine;
    private final EnhancedRetrievalPipeline pipeline;
    private final FallbackVectorGenerator fallbackVectors;
    private final KnowledgeEventListener listener;
    private final KnowledgeConfig config;

    public KnowledgeBaseManager(KnowledgeBaseRepository repository,
                                VectorStore vectorStore,
                                EmbeddingService embeddingService,
                                EmbeddingModelResolver modelResolver,
                                SimilarityEngine similarityEngine,
                                EnhancedRetrievalPipeline pipeline,
                                FallbackVectorGenerator fallbackVectors,
                                KnowledgeEventListener listener,
                                KnowledgeConfig config) {
        this.repository = repository;
        this.vectorStore = vectorStore;
        this.embeddingService = embeddingService;
        this.modelResolver = modelResolver;
        this.similarityEngine = similarityEngine;
        this.pipeline = pipeline;
        this.fallbackVectors = fallbackVectors;
        this.listener = listener != null ? listener : KnowledgeEventListener.NONE;
        this.config = config;
    }

    /**
     * Create a knowledge base. Omitted tunables take the configured defaults; omitted
     * dimensions are asked from the embedding model.
     *
     * @throws InvalidConfigException if the request is incomplete or inconsistent
     */
    public KnowledgeBase createKnowledgeBase(CreateKnowledgeBaseRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new InvalidConfigException("Knowledge base name is required");
        }
        if (request.getModel() == null || request.getModel().isBlank()) {
            throw new InvalidConfigException("Knowledge base embedding model is required");
        }

        KnowledgeBase kb = new KnowledgeBase();
        kb.setId(UUID.randomUUID().toString());
        kb.setName(request.getName());
        kb.setDescription(request.getDescription());
        kb.setModel(request.getModel());
        kb.setDocumentCount(valueOr(request.getDocumentCount(), config.getDefaultDocumentCount()));
        kb.setChunkSize(valueOr(request.getChunkSize(), config.getDefaultChunkSize()));
        kb.setChunkOverlap(valueOr(request.getChunkOverlap(), config.getDefaultChunkOverlap()));
        kb.setThreshold(request.getThreshold() != null ? request.getThreshold() : config.getDefaultThreshold());
        kb.setDimensions(request.getDimensions() != null
                ? request.getDimensions()
                : resolveDimensions(request.getModel()));
        validate(kb);

        Instant now = Instant.now();
        kb.setCreatedAt(now);
        kb.setUpdatedAt(now);
        repository.save(kb);

        logger.info("Created knowledge base {} '{}' (model={}, dimensions={})",
                kb.getId(), kb.getName(), kb.getModel(), kb.getDimensions());
        listener.onKnowledgeBaseCreated(kb.getId());
        return kb;
    }

    /**
     * Apply a partial update. Model and dimensions can only change while the knowledge
     * base holds no chunks.
     *
     * @throws NotFoundException if the knowledge base does not exist
     * @throws InvalidConfigException if the patch is invalid or would change the width of a populated base
     */
    public KnowledgeBase updateKnowledgeBase(String id, UpdateKnowledgeBaseRequest patch) {
        KnowledgeBase kb = getKnowledgeBase(id);

        boolean modelChanged = patch.getModel() != null && !patch.getModel().equals(kb.getModel());
        boolean dimensionsChanged = patch.getDimensions() != null && patch.getDimensions() != kb.getDimensions();
        if ((modelChanged || dimensionsChanged) && !vectorStore.listByKnowledgeBase(id).isEmpty()) {
            throw new InvalidConfigException("Cannot change the embedding model or dimensions of knowledge base "
                    + id + " while it holds documents. Recreate the knowledge base instead.");
        }

        if (patch.getName() != null) {
            if (patch.getName().isBlank()) {
                throw new InvalidConfigException("Knowledge base name must not be blank");
            }
            kb.setName(patch.getName());
        }
        if (patch.getDescription() != null) {
            kb.setDescription(patch.getDescription());
        }
        if (modelChanged) {
            kb.setModel(patch.getModel());
            if (patch.getDimensions() == null) {
                kb.setDimensions(resolveDimensions(patch.getModel()));
            }
        }
        if (patch.getDimensions() != null) {
            kb.setDimensions(patch.getDimensions());
        }
        if (patch.getDocumentCount() != null) {
            kb.setDocumentCount(patch.getDocumentCount());
        }
        if (patch.getChunkSize() != null) {
            kb.setChunkSize(patch.getChunkSize());
        }
        if (patch.getChunkOverlap() != null) {
            kb.setChunkOverlap(patch.getChunkOverlap());
        }
        if (patch.getThreshold() != null) {
            kb.setThreshold(patch.getThreshold());
        }
        validate(kb);

        kb.setUpdatedAt(Instant.now());
        repository.save(kb);

        logger.info("Updated knowledge base {}", id);
        listener.onKnowledgeBaseUpdated(id);
        return kb;
    }

    /**
     * Delete a knowledge base together with all of its chunks.
     *
     * @return The number of chunk records removed
     * @throws NotFoundException if the knowledge base does not exist
     */
    public int deleteKnowledgeBase(String id) {
        getKnowledgeBase(id);
        int removed = vectorStore.deleteByKnowledgeBase(id);
        repository.delete(id);

        logger.info("Deleted knowledge base {} and {} chunks", id, removed);
        listener.onKnowledgeBaseDeleted(id, removed);
        return removed;
    }

    /**
     * @throws NotFoundException if the knowledge base does not exist
     */
    public KnowledgeBase getKnowledgeBase(String id) {
        return repository.findById(id).orElseThrow(() -> NotFoundException.knowledgeBase(id));
    }

    public List<KnowledgeBase> listKnowledgeBases() {
        return repository.findAll();
    }

    /**
     * Chunk, embed and store a document. Chunks are processed one after another, so
     * progress events arrive in order.
     *
     * @param knowledgeBaseId The target knowledge base
     * @param content The document text
     * @param source Where the document came from
     * @return The stored chunk records in document order
     * @throws NotFoundException if the knowledge base does not exist
     * @throws DimensionMismatchException if the model returns vectors of a different width than the base
     *                                    declares; chunks stored by this call are removed again
     */
    public List<KnowledgeDocument> addDocument(String knowledgeBaseId, String content, SourceMetadata source) {
        KnowledgeBase kb = getKnowledgeBase(knowledgeBaseId);
        Objects.requireNonNull(source, "source");

        List<String> chunks = DocumentChunker.chunk(content, kb.getChunkSize(), kb.getChunkOverlap());
        Optional<EmbeddingModel> model = modelResolver.resolve(kb.getModel());
        long timestamp = System.currentTimeMillis();

        List<KnowledgeDocument> documents = new ArrayList<>(chunks.size());
        int degraded = 0;
        try {
            for (int i = 0; i < chunks.size(); i++) {
                String chunkId = UUID.randomUUID().toString();
                String text = chunks.get(i);

                List<Float> vector;
                boolean fallback = false;
                try {
                    vector = embedForBase(kb, model, text);
                } catch (EmbeddingException e) {
                    vector = fallbackVectors.generate(text, kb.getDimensions());
                    fallback = true;
                    degraded++;
                    listener.onEmbeddingDegraded(knowledgeBaseId, chunkId, e);
                }

                KnowledgeDocument document = new KnowledgeDocument(chunkId, knowledgeBaseId, text, vector,
                        DocumentMetadata.forChunk(source, i, timestamp, fallback));
                vectorStore.put(document);
                documents.add(document);
                listener.onDocumentChunkProcessed(chunkId, knowledgeBaseId, i + 1, chunks.size());
            }
        } catch (DimensionMismatchException e) {
            rollback(knowledgeBaseId, documents);
            throw e;
        }

        if (degraded > 0) {
            logger.warn("{} of {} chunks of '{}' were stored with fallback vectors in knowledge base {}",
                    degraded, chunks.size(), source.getSource(), knowledgeBaseId);
        } else {
            logger.info("Added {} chunks of '{}' to knowledge base {}", chunks.size(), source.getSource(),
                    knowledgeBaseId);
        }
        listener.onDocumentsAdded(knowledgeBaseId, documents.size());
        return documents;
    }

    public List<SearchResult> search(String knowledgeBaseId, String query) {
        return search(knowledgeBaseId, query, null, null, null);
    }

    /**
     * Search a knowledge base.
     *
     * @param knowledgeBaseId The knowledge base to search
     * @param query The query text
     * @param threshold Minimum similarity, or {@code null} for the base's threshold
     * @param limit Maximum results, or {@code null} for the base's document count
     * @param useEnhanced {@code false} for a plain similarity search; otherwise the
     *                    enhanced pipeline runs and falls back to plain search if it fails
     * @throws NotFoundException if the knowledge base does not exist
     * @throws DimensionMismatchException if stored chunks differ in width from the query vector
     */
    public List<SearchResult> search(String knowledgeBaseId, String query, Double threshold, Integer limit,
                                     Boolean useEnhanced) {
        boolean enhanced = useEnhanced == null || useEnhanced;
        return doSearch(knowledgeBaseId, query, threshold, limit, enhanced ? config.getRetrieval() : null);
    }

    /**
     * Search with an explicit pipeline configuration.
     *
     * @param retrievalConfig Pipeline settings, or {@code null} for the configured ones
     */
    public List<SearchResult> enhancedSearch(String knowledgeBaseId, String query, Double threshold, Integer limit,
                                             RetrievalConfig retrievalConfig) {
        return doSearch(knowledgeBaseId, query, threshold, limit,
                retrievalConfig != null ? retrievalConfig : config.getRetrieval());
    }

    private List<SearchResult> doSearch(String knowledgeBaseId, String query, Double threshold, Integer limit,
                                        RetrievalConfig retrievalConfig) {
        KnowledgeBase kb = getKnowledgeBase(knowledgeBaseId);
        double effectiveThreshold = threshold != null ? threshold : kb.getThreshold();
        int effectiveLimit = limit != null ? limit : kb.getDocumentCount();

        Optional<EmbeddingModel> model = modelResolver.resolve(kb.getModel());
        List<Float> queryVector;
        try {
            queryVector = embedForBase(kb, model, query);
        } catch (EmbeddingException e) {
            logger.warn("Could not embed query for knowledge base {}, searching with a fallback vector: {}",
                    knowledgeBaseId, e.getMessage());
            queryVector = fallbackVectors.generate(query, kb.getDimensions());
        }

        List<KnowledgeDocument> candidates = vectorStore.listByKnowledgeBase(knowledgeBaseId);
        checkDimensions(knowledgeBaseId, queryVector, candidates);

        if (retrievalConfig != null) {
            try {
                return pipeline.search(query, queryVector, candidates, model.orElse(null),
                        effectiveThreshold, effectiveLimit, retrievalConfig);
            } catch (DimensionMismatchException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.error("Enhanced search failed for knowledge base {}, using plain search: {}",
                        knowledgeBaseId, e.getMessage(), e);
            }
        }
        return similarityEngine.search(queryVector, candidates, effectiveThreshold, effectiveLimit);
    }

    /**
     * All chunks of a knowledge base in insertion order.
     */
    public List<KnowledgeDocument> listDocuments(String knowledgeBaseId) {
        getKnowledgeBase(knowledgeBaseId);
        return vectorStore.listByKnowledgeBase(knowledgeBaseId);
    }

    /**
     * Delete a single chunk.
     *
     * @throws NotFoundException if no chunk has that id
     */
    public void deleteDocument(String chunkId) {
        KnowledgeDocument document = vectorStore.getById(chunkId)
                .orElseThrow(() -> NotFoundException.document(chunkId));
        if (!vectorStore.deleteById(chunkId)) {
            throw NotFoundException.document(chunkId);
        }
        listener.onDocumentDeleted(chunkId, document.getKnowledgeBaseId());
    }

    /**
     * Chunks stored with a fallback vector instead of a real embedding.
     */
    public List<KnowledgeDocument> listDegradedDocuments(String knowledgeBaseId) {
        List<KnowledgeDocument> degraded = new ArrayList<>();
        for (KnowledgeDocument document : listDocuments(knowledgeBaseId)) {
            if (document.getMetadata().isDegraded()) {
                degraded.add(document);
            }
        }
        return degraded;
    }

    /**
     * Retry embedding every degraded chunk of a knowledge base. Chunks the model can now
     * embed are replaced under the same id; the others stay degraded.
     *
     * @return The number of chunks that were repaired
     */
    public int reembedDegradedDocuments(String knowledgeBaseId) {
        KnowledgeBase kb = getKnowledgeBase(knowledgeBaseId);
        List<KnowledgeDocument> degraded = listDegradedDocuments(knowledgeBaseId);
        if (degraded.isEmpty()) {
            return 0;
        }

        Optional<EmbeddingModel> model = modelResolver.resolve(kb.getModel());
        int repaired = 0;
        for (KnowledgeDocument document : degraded) {
            try {
                List<Float> vector = embedForBase(kb, model, document.getContent());
                vectorStore.put(new KnowledgeDocument(document.getId(), knowledgeBaseId, document.getContent(),
                        vector, document.getMetadata().withDegraded(false)));
                repaired++;
            } catch (EmbeddingException e) {
                logger.debug("Chunk {} is still degraded: {}", document.getId(), e.getMessage());
            }
        }
        logger.info("Re-embedded {} of {} degraded chunks in knowledge base {}",
                repaired, degraded.size(), knowledgeBaseId);
        return repaired;
    }

    /**
     * Remove the chunks a failed {@link #addDocument} call already stored, so a document is
     * either added completely or not at all.
     */
    private void rollback(String knowledgeBaseId, List<KnowledgeDocument> written) {
        for (KnowledgeDocument document : written) {
            vectorStore.deleteById(document.getId());
        }
        if (!written.isEmpty()) {
            logger.warn("Removed {} chunks already stored in knowledge base {} after a failed add",
                    written.size(), knowledgeBaseId);
        }
    }

    private List<Float> embedForBase(KnowledgeBase kb, Optional<EmbeddingModel> model, String text) {
        if (model.isEmpty()) {
            throw new EmbeddingException("Embedding model " + kb.getModel() + " is not configured");
        }
        List<Float> vector = embeddingService.embed(text, model.get());
        if (vector.size() != kb.getDimensions()) {
            throw new DimensionMismatchException(kb.getDimensions(), vector.size(),
                    "embedding model mismatch: model " + kb.getModel() + " returned " + vector.size()
                            + "-dimensional vectors but knowledge base " + kb.getId() + " declares "
                            + kb.getDimensions() + ". Fix the declared dimensions or recreate the knowledge base.");
        }
        return vector;
    }

    private void checkDimensions(String knowledgeBaseId, List<Float> queryVector, List<KnowledgeDocument> candidates) {
        for (KnowledgeDocument candidate : candidates) {
            if (candidate.getVector().size() != queryVector.size()) {
                throw DimensionMismatchException.forKnowledgeBase(knowledgeBaseId, queryVector.size(),
                        candidate.getVector().size());
            }
        }
    }

    private int resolveDimensions(String modelId) {
        Optional<EmbeddingModel> model = modelResolver.resolve(modelId);
        if (model.isPresent()) {
            return embeddingService.dimensionsOf(model.get());
        }
        logger.warn("Embedding model {} is not configured, using catalog dimensions", modelId);
        return EmbeddingModelCatalog.dimensionsOf(modelId);
    }

    private static void validate(KnowledgeBase kb) {
        DocumentChunker.validate(kb.getChunkSize(), kb.getChunkOverlap());
        if (kb.getDimensions() <= 0) {
            throw new InvalidConfigException("Dimensions must be positive, got " + kb.getDimensions());
        }
        if (kb.getDocumentCount() <= 0) {
            throw new InvalidConfigException("Document count must be positive, got " + kb.getDocumentCount());
        }
        if (kb.getThreshold() < -1.0 || kb.getThreshold() > 1.0) {
            throw new InvalidConfigException("Similarity threshold must be within [-1, 1], got " + kb.getThreshold());
        }
    }

    private static int valueOr(Integer value, int defaultValue) {
        return value != null ? value : defaultValue;
    }
}
