package com.kbase.retrieval.search;

import com.kbase.retrieval.model.KnowledgeDocument;
import com.kbase.retrieval.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Plain cosine similarity search over a candidate list. Stateless and thread-safe.
 */
public class SimilarityEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityEngine.class);

    /**
     * Score every candidate against the query, drop those below the threshold and
     * return the best ones, highest first. Candidates with equal scores keep their
     * input order.
     *
     * @param queryVector The query embedding
     * @param candidates Chunk records, typically a full scan of one knowledge base
     * @param threshold Minimum cosine similarity to keep a candidate
     * @param limit Maximum number of results
     * @return At most {@code limit} results
     * @throws DimensionMismatchException if any candidate differs in width from the query
     */
    public List<SearchResult> search(List<Float> queryVector, List<KnowledgeDocument> candidates,
                                     double threshold, int limit) {
        List<ScoredDocument> scored = rank(queryVector, candidates, threshold, limit);
        List<SearchResult> results = new ArrayList<>(scored.size());
        for (ScoredDocument doc : scored) {
            results.add(doc.toResult());
        }
        return results;
    }

    /**
     * Same as {@link #search} but keeps the scored records, for callers that still
     * need the chunk vectors.
     */
    public List<ScoredDocument> rank(List<Float> queryVector, List<KnowledgeDocument> candidates,
                                     double threshold, int limit) {
        if (limit <= 0 || candidates.isEmpty()) {
            return Collections.emptyList();
        }
        List<ScoredDocument> scored = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            KnowledgeDocument candidate = candidates.get(i);
            double score = VectorMath.cosineSimilarity(queryVector, candidate.getVector());
            if (score >= threshold) {
                scored.add(new ScoredDocument(candidate, score, i));
            }
        }
        scored.sort(ScoredDocument.BY_SCORE);
        logger.debug("{} of {} candidates passed threshold {}", scored.size(), candidates.size(), threshold);
        return scored.size() > limit ? new ArrayList<>(scored.subList(0, limit)) : scored;
    }
}
