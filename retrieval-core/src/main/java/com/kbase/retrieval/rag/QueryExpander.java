package com.kbase.retrieval.rag;

import com.kbase.retrieval.model.KnowledgeDocument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Derives alternative phrasings of a query: sub-queries split on conjunctions and commas,
 * synonyms from a fixed table, and terms harvested from the knowledge base's own chunks.
 */
public class QueryExpander {

    private static final Pattern CONJUNCTION = Pattern.compile("\\s+(?:and|和)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMA = Pattern.compile("[,，]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FIRST_WORD = Pattern.compile("\\S+");

    static final int SAMPLE_DOCUMENTS = 10;
    static final int MAX_RELATED_TERMS = 5;
    static final int MIN_RELATED_TERM_LENGTH = 4;

    private static final Map<String, List<String>> DEFAULT_SYNONYMS = new LinkedHashMap<>();

    static {
        DEFAULT_SYNONYMS.put("problem", List.of("issue", "question", "difficulty"));
        DEFAULT_SYNONYMS.put("method", List.of("approach", "way", "technique"));
        DEFAULT_SYNONYMS.put("solve", List.of("resolve", "fix", "handle"));
        DEFAULT_SYNONYMS.put("how", List.of("in what way", "by what means"));
        DEFAULT_SYNONYMS.put("what", List.of("which", "what is"));
        DEFAULT_SYNONYMS.put("问题", List.of("疑问", "困惑", "难题"));
        DEFAULT_SYNONYMS.put("方法", List.of("方式", "途径", "手段"));
        DEFAULT_SYNONYMS.put("解决", List.of("处理", "解答", "应对"));
        DEFAULT_SYNONYMS.put("如何", List.of("怎样", "怎么", "如何才能"));
        DEFAULT_SYNONYMS.put("什么", List.of("啥", "什么是", "何为"));
    }

    private final Map<String, List<String>> synonymTable;

    public QueryExpander() {
        this(DEFAULT_SYNONYMS);
    }

    public QueryExpander(Map<String, List<String>> synonymTable) {
        this.synonymTable = new LinkedHashMap<>(synonymTable);
    }

    /**
     * Expand a query against the chunks of the knowledge base being searched.
     *
     * @param query The user's query
     * @param documents Chunks of the knowledge base; only the first few are sampled
     */
    public QueryExpansion expand(String query, List<KnowledgeDocument> documents) {
        List<String> decomposed = decompose(query);
        List<String> synonyms = synonymsOf(query);
        List<String> related = relatedTerms(query, documents);

        List<String> expanded = new ArrayList<>();
        if (!synonyms.isEmpty()) {
            expanded.add(FIRST_WORD.matcher(query).replaceFirst(synonyms.get(0)));
        }
        if (!related.isEmpty()) {
            expanded.add(query + " " + related.get(0));
        }
        return new QueryExpansion(query, decomposed, synonyms, related, expanded);
    }

    List<String> decompose(String query) {
        List<String> parts = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return parts;
        }
        if (CONJUNCTION.matcher(query).find()) {
            addTrimmed(parts, CONJUNCTION.split(query));
        }
        if (COMMA.matcher(query).find()) {
            addTrimmed(parts, COMMA.split(query));
        }
        return parts;
    }

    List<String> synonymsOf(String query) {
        List<String> synonyms = new ArrayList<>();
        String lower = query.toLowerCase(Locale.ROOT);
        List<String> words = Arrays.asList(WHITESPACE.split(lower));
        for (Map.Entry<String, List<String>> entry : synonymTable.entrySet()) {
            String word = entry.getKey();
            // whole words for space separated scripts, substrings otherwise
            boolean present = isAscii(word) ? words.contains(word) : lower.contains(word);
            if (present) {
                synonyms.addAll(entry.getValue());
            }
        }
        return synonyms;
    }

    List<String> relatedTerms(String query, List<KnowledgeDocument> documents) {
        List<String> related = new ArrayList<>();
        List<String> queryWords = Arrays.asList(WHITESPACE.split(query.toLowerCase(Locale.ROOT).trim()));
        int sampled = Math.min(SAMPLE_DOCUMENTS, documents.size());
        for (int i = 0; i < sampled && related.size() < MAX_RELATED_TERMS; i++) {
            for (String word : WHITESPACE.split(documents.get(i).getContent().toLowerCase(Locale.ROOT))) {
                if (word.length() < MIN_RELATED_TERM_LENGTH || queryWords.contains(word) || related.contains(word)) {
                    continue;
                }
                if (isRelated(word, queryWords)) {
                    related.add(word);
                    if (related.size() >= MAX_RELATED_TERMS) {
                        break;
                    }
                }
            }
        }
        return related;
    }

    private static boolean isRelated(String word, List<String> queryWords) {
        for (String queryWord : queryWords) {
            if (!queryWord.isEmpty() && (word.contains(queryWord) || queryWord.contains(word))) {
                return true;
            }
        }
        return false;
    }

    private static void addTrimmed(List<String> target, String[] parts) {
        for (String part : parts) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                target.add(trimmed);
            }
        }
    }

    private static boolean isAscii(String s) {
        return s.chars().allMatch(c -> c < 128);
    }
}
