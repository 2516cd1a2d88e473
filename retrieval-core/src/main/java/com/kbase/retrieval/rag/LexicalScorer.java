package com.kbase.retrieval.rag;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword overlap between a query and a chunk: the share of distinct query tokens that
 * also occur as tokens of the chunk. Tokens are lower-cased runs of letters or digits,
 * at least two characters long.
 */
public class LexicalScorer {

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 2;

    /**
     * @return A score in [0, 1]; 0 when the query has no usable tokens
     */
    public double score(String query, String content) {
        return score(query, Collections.emptyList(), content);
    }

    /**
     * Score with additional keywords, such as synonyms found by query expansion. Extra
     * tokens count only when the chunk contains them, so they can raise the score of a
     * chunk but never lower it, and only a chunk holding every query token scores 1.
     *
     * @param extraTerms Additional keywords; tokens already in the query are ignored
     * @return A score in [0, 1]; 0 when the query has no usable tokens
     */
    public double score(String query, Collection<String> extraTerms, String content) {
        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> contentTokens = tokenize(content);
        int matches = 0;
        for (String token : queryTokens) {
            if (contentTokens.contains(token)) {
                matches++;
            }
        }

        Set<String> extraTokens = new LinkedHashSet<>();
        for (String term : extraTerms) {
            extraTokens.addAll(tokenize(term));
        }
        extraTokens.removeAll(queryTokens);
        int extraMatches = 0;
        for (String token : extraTokens) {
            if (contentTokens.contains(token)) {
                extraMatches++;
            }
        }
        return (double) (matches + extraMatches) / (queryTokens.size() + extraMatches);
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
