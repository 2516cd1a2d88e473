package com.kbase.retrieval.rag;

import com.kbase.retrieval.search.ScoredDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Second-pass ordering that mixes the candidate's score with a cheap relevance estimate.
 */
public class Reranker {

    static final double SCORE_WEIGHT = 0.7;
    static final double RELEVANCE_WEIGHT = 0.3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Re-score and re-sort the candidates. Never adds or removes any.
     */
    public List<ScoredDocument> rerank(String query, List<ScoredDocument> candidates) {
        List<ScoredDocument> reranked = new ArrayList<>(candidates.size());
        for (ScoredDocument candidate : candidates) {
            double relevance = relevance(query, candidate.getDocument().getContent());
            reranked.add(candidate.withScore(SCORE_WEIGHT * candidate.getScore() + RELEVANCE_WEIGHT * relevance));
        }
        reranked.sort(ScoredDocument.BY_SCORE);
        return reranked;
    }

    /**
     * Fraction of query words that appear inside, or contain, some word of the content.
     */
    double relevance(String query, String content) {
        String[] queryWords = WHITESPACE.split(query.toLowerCase(Locale.ROOT).trim());
        String[] contentWords = WHITESPACE.split(content.toLowerCase(Locale.ROOT).trim());
        if (queryWords.length == 0 || queryWords[0].isEmpty()) {
            return 0.0;
        }
        int matches = 0;
        for (String queryWord : queryWords) {
            for (String contentWord : contentWords) {
                if (!contentWord.isEmpty() && (contentWord.contains(queryWord) || queryWord.contains(contentWord))) {
                    matches++;
                    break;
                }
            }
        }
        return (double) matches / queryWords.length;
    }
}
