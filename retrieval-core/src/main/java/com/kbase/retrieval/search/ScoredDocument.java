package com.kbase.retrieval.search;

import com.kbase.retrieval.model.KnowledgeDocument;
import com.kbase.retrieval.model.SearchResult;

import java.util.Comparator;

/**
 * A candidate chunk with its current score. The rank records the order in which the
 * candidate was first seen and breaks score ties, which keeps every ordering stable.
 */
public class ScoredDocument {

    /**
     * Descending score, ascending rank.
     */
    public static final Comparator<ScoredDocument> BY_SCORE =
            Comparator.comparingDouble(ScoredDocument::getScore).reversed()
                    .thenComparingInt(ScoredDocument::getRank);

    private final KnowledgeDocument document;
    private final double score;
    private final int rank;

    public ScoredDocument(KnowledgeDocument document, double score, int rank) {
        this.document = document;
        this.score = score;
        this.rank = rank;
    }

    public KnowledgeDocument getDocument() {
        return document;
    }

    public double getScore() {
        return score;
    }

    public int getRank() {
        return rank;
    }

    public ScoredDocument withScore(double newScore) {
        return new ScoredDocument(document, newScore, rank);
    }

    public SearchResult toResult() {
        return SearchResult.of(document, score);
    }
}
