package com.kbase.retrieval.rag;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The alternative phrasings found for one query.
 */
public class QueryExpansion {

    private final String originalQuery;
    private final List<String> decomposedQueries;
    private final List<String> synonyms;
    private final List<String> relatedTerms;
    private final List<String> expandedQueries;

    public QueryExpansion(String originalQuery, List<String> decomposedQueries, List<String> synonyms,
                          List<String> relatedTerms, List<String> expandedQueries) {
        this.originalQuery = originalQuery;
        this.decomposedQueries = List.copyOf(decomposedQueries);
        this.synonyms = List.copyOf(synonyms);
        this.relatedTerms = List.copyOf(relatedTerms);
        this.expandedQueries = List.copyOf(expandedQueries);
    }

    public String getOriginalQuery() {
        return originalQuery;
    }

    public List<String> getDecomposedQueries() {
        return decomposedQueries;
    }

    public List<String> getSynonyms() {
        return synonyms;
    }

    public List<String> getRelatedTerms() {
        return relatedTerms;
    }

    public List<String> getExpandedQueries() {
        return expandedQueries;
    }

    /**
     * Synonyms and related terms, used as extra keywords by lexical scoring.
     */
    public List<String> getLexicalTerms() {
        List<String> terms = new ArrayList<>(synonyms);
        terms.addAll(relatedTerms);
        return terms;
    }

    /**
     * Distinct query texts to search with besides the original, in the order they were found.
     */
    public List<String> variants(int max) {
        Set<String> variants = new LinkedHashSet<>();
        variants.addAll(decomposedQueries);
        variants.addAll(expandedQueries);
        variants.remove(originalQuery);
        List<String> result = new ArrayList<>(variants);
        return result.size() > max ? result.subList(0, max) : result;
    }
}
