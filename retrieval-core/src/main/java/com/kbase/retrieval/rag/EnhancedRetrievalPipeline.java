package com.kbase.retrieval.rag;

import com.kbase.retrieval.embedding.EmbeddingException;
import com.kbase.retrieval.embedding.EmbeddingService;
import com.kbase.retrieval.model.EmbeddingModel;
import com.kbase.retrieval.model.KnowledgeDocument;
import com.kbase.retrieval.model.SearchResult;
import com.kbase.retrieval.search.DimensionMismatchException;
import com.kbase.retrieval.search.ScoredDocument;
import com.kbase.retrieval.search.SimilarityEngine;
import com.kbase.retrieval.search.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Multi-stage retrieval on top of plain similarity search: query expansion, hybrid
 * lexical and vector scoring, a diversity filter and a rerank pass.
 * <p>
 * Each enhancement stage runs behind its own guard. When a stage fails the failure is
 * logged and the output of the previous stage is used instead, so with every stage
 * disabled or failing the result equals a plain {@link SimilarityEngine} search.
 * A {@link DimensionMismatchException} is a data problem, not a stage failure, and is
 * always propagated.
 */
public class EnhancedRetrievalPipeline {

    private static final Logger logger = LoggerFactory.getLogger(EnhancedRetrievalPipeline.class);

    static final double VECTOR_WEIGHT = 0.7;
    static final double LEXICAL_WEIGHT = 0.3;
    static final int MAX_QUERY_VARIANTS = 4;

    private final EmbeddingService embeddingService;
    private final SimilarityEngine similarityEngine;
    private final QueryExpander queryExpander;
    private final LexicalScorer lexicalScorer;
    private final Reranker reranker;

    public EnhancedRetrievalPipeline(EmbeddingService embeddingService, SimilarityEngine similarityEngine) {
        this(embeddingService, similarityEngine, new QueryExpander(), new LexicalScorer(), new Reranker());
    }

    public EnhancedRetrievalPipeline(EmbeddingService embeddingService, SimilarityEngine similarityEngine,
                                     QueryExpander queryExpander, LexicalScorer lexicalScorer, Reranker reranker) {
        this.embeddingService = embeddingService;
        this.similarityEngine = similarityEngine;
        this.queryExpander = queryExpander;
        this.lexicalScorer = lexicalScorer;
        this.reranker = reranker;
    }

    /**
     * Run the pipeline over the chunks of one knowledge base.
     *
     * @param query The query text
     * @param queryVector The embedding of the query text
     * @param candidates Every chunk of the knowledge base, in insertion order
     * @param model The model used to embed query variants, or {@code null} to skip expansion
     * @param threshold Minimum cosine similarity for a chunk to become a candidate
     * @param limit Maximum number of results
     * @param config Stage switches and tunables
     * @return At most {@code limit} results, best first
     * @throws DimensionMismatchException if a chunk differs in width from the query vector
     */
    public List<SearchResult> search(String query, List<Float> queryVector, List<KnowledgeDocument> candidates,
                                     EmbeddingModel model, double threshold, int limit, RetrievalConfig config) {
        if (limit <= 0 || candidates.isEmpty()) {
            return Collections.emptyList();
        }
        int pool = Math.max(config.getMaxCandidates(), limit);

        List<ScoredDocument> ranked = similarityEngine.rank(queryVector, candidates, threshold, pool);

        QueryExpansion expansion = null;
        if (config.isQueryExpansion() && model != null) {
            expansion = expand(query, candidates);
        }
        if (expansion != null) {
            QueryExpansion found = expansion;
            List<ScoredDocument> base = ranked;
            ranked = runStage("query-expansion", base,
                    () -> mergeVariants(found, queryVector, candidates, model, threshold, pool, base));
        }

        if (config.isHybridSearch()) {
            List<String> extraTerms = expansion != null ? expansion.getLexicalTerms() : List.of();
            List<ScoredDocument> base = ranked;
            ranked = runStage("hybrid-search", base, () -> blendLexical(query, extraTerms, base));
        }

        if (config.isDiversityFilter()) {
            List<ScoredDocument> base = ranked;
            ranked = runStage("diversity-filter", base,
                    () -> diversify(base, config.getDiversityThreshold()));
        }

        if (config.isRerank()) {
            List<ScoredDocument> base = ranked;
            ranked = runStage("rerank", base, () -> reranker.rerank(query, base));
        }

        List<SearchResult> results = new ArrayList<>(Math.min(limit, ranked.size()));
        for (ScoredDocument doc : ranked) {
            if (results.size() >= limit) {
                break;
            }
            results.add(doc.toResult());
        }
        logger.debug("Enhanced search returned {} of {} candidates ({})", results.size(), ranked.size(), config);
        return results;
    }

    private QueryExpansion expand(String query, List<KnowledgeDocument> candidates) {
        try {
            return queryExpander.expand(query, candidates);
        } catch (DimensionMismatchException e) {
            throw e;
        } catch (RuntimeException e) {
            PipelineStageException failure = new PipelineStageException("query-expansion", e);
            logger.warn("{}, searching with the original query only", failure.getMessage(), failure);
            return null;
        }
    }

    /**
     * Search with every query variant and keep the best score per chunk. A variant that
     * cannot be embedded is skipped; the others still contribute.
     */
    private List<ScoredDocument> mergeVariants(QueryExpansion expansion, List<Float> queryVector,
                                               List<KnowledgeDocument> candidates, EmbeddingModel model,
                                               double threshold, int pool, List<ScoredDocument> base) {
        List<String> variants = expansion.variants(MAX_QUERY_VARIANTS);
        if (variants.isEmpty()) {
            return base;
        }

        Map<String, ScoredDocument> best = new LinkedHashMap<>();
        for (ScoredDocument doc : base) {
            best.put(doc.getDocument().getId(), doc);
        }
        int searched = 0;
        for (String variant : variants) {
            List<Float> variantVector;
            try {
                variantVector = embeddingService.embed(variant, model);
            } catch (EmbeddingException e) {
                logger.warn("Skipping query variant '{}': {}", variant, e.getMessage());
                continue;
            }
            if (variantVector.size() != queryVector.size()) {
                throw new DimensionMismatchException(queryVector.size(), variantVector.size(),
                        "embedding model mismatch: query variant '" + variant + "' has " + variantVector.size()
                                + " dimensions but the query has " + queryVector.size());
            }
            for (ScoredDocument doc : similarityEngine.rank(variantVector, candidates, threshold, pool)) {
                ScoredDocument existing = best.get(doc.getDocument().getId());
                if (existing == null || doc.getScore() > existing.getScore()) {
                    best.put(doc.getDocument().getId(), doc);
                }
            }
            searched++;
        }
        logger.debug("Query expansion searched {} of {} variants, {} distinct candidates",
                searched, variants.size(), best.size());

        List<ScoredDocument> merged = new ArrayList<>(best.values());
        merged.sort(ScoredDocument.BY_SCORE);
        return merged;
    }

    private List<ScoredDocument> blendLexical(String query, List<String> extraTerms,
                                              List<ScoredDocument> candidates) {
        List<ScoredDocument> blended = new ArrayList<>(candidates.size());
        for (ScoredDocument doc : candidates) {
            double lexical = lexicalScorer.score(query, extraTerms, doc.getDocument().getContent());
            blended.add(doc.withScore(VECTOR_WEIGHT * doc.getScore() + LEXICAL_WEIGHT * lexical));
        }
        blended.sort(ScoredDocument.BY_SCORE);
        return blended;
    }

    /**
     * Greedy walk in score order, keeping a candidate only if its vector is less similar
     * than the threshold to every candidate kept so far.
     */
    private List<ScoredDocument> diversify(List<ScoredDocument> candidates, double diversityThreshold) {
        List<ScoredDocument> accepted = new ArrayList<>();
        for (ScoredDocument candidate : candidates) {
            boolean distinct = true;
            for (ScoredDocument kept : accepted) {
                double similarity = VectorMath.cosineSimilarity(
                        candidate.getDocument().getVector(), kept.getDocument().getVector());
                if (similarity >= diversityThreshold) {
                    distinct = false;
                    break;
                }
            }
            if (distinct) {
                accepted.add(candidate);
            }
        }
        if (accepted.size() < candidates.size()) {
            logger.debug("Diversity filter dropped {} near-duplicate candidates", candidates.size() - accepted.size());
        }
        return accepted;
    }

    private List<ScoredDocument> runStage(String stage, List<ScoredDocument> previous,
                                          Supplier<List<ScoredDocument>> action) {
        try {
            return action.get();
        } catch (DimensionMismatchException e) {
            throw e;
        } catch (RuntimeException e) {
            PipelineStageException failure = new PipelineStageException(stage, e);
            logger.warn("{}, keeping previous results", failure.getMessage(), failure);
            return previous;
        }
    }
}
