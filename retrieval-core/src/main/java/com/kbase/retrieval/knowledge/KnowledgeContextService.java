package com.kbase.retrieval.knowledge;

import com.kbase.retrieval.KnowledgeException;
import com.kbase.retrieval.model.KnowledgeBase;
import com.kbase.retrieval.model.SearchResult;
import com.kbase.retrieval.search.DimensionMismatchException;
import org.json.JSONArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Service that looks up passages from several knowledge bases for one question and
 * turns them into prompt context.
 */
public class KnowledgeContextService {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeContextService.class);

    private static final String UNKNOWN_KNOWLEDGE_BASE = "Unknown knowledge base";

    private final KnowledgeBaseManager manager;
    private final int maxReferences;
    private final double threshold;

    public KnowledgeContextService(KnowledgeBaseManager manager, int maxReferences, double threshold) {
        this.manager = manager;
        this.maxReferences = maxReferences;
        this.threshold = threshold;
    }

    /**
     * Search every listed knowledge base and merge the hits. References are numbered from 1
     * in the order they were found, then sorted by score and cut to {@code limit}. A knowledge
     * base that does not exist or cannot be searched is logged and skipped.
     *
     * @throws DimensionMismatchException if a knowledge base holds vectors of another width than its query
     */
    public List<KnowledgeReference> searchKnowledge(String query, List<String> knowledgeBaseIds,
                                                    int limit, double threshold) {
        List<KnowledgeReference> references = new ArrayList<>();
        int referenceId = 1;

        for (String knowledgeBaseId : knowledgeBaseIds) {
            try {
                KnowledgeBase kb = manager.getKnowledgeBase(knowledgeBaseId);
                String name = kb.getName() != null ? kb.getName() : UNKNOWN_KNOWLEDGE_BASE;
                List<SearchResult> results = manager.search(knowledgeBaseId, query, threshold, limit, null);
                for (SearchResult result : results) {
                    references.add(new KnowledgeReference(referenceId++, result.getContent(), result.getScore(),
                            knowledgeBaseId, name, result.getDocumentId()));
                }
            } catch (NotFoundException e) {
                logger.error("Skipping knowledge base {}: {}", knowledgeBaseId, e.getMessage());
            } catch (DimensionMismatchException e) {
                throw e;
            } catch (KnowledgeException e) {
                logger.error("Error searching knowledge base {}: {}", knowledgeBaseId, e.getMessage(), e);
            }
        }

        references.sort(Comparator.comparingDouble(KnowledgeReference::getScore).reversed());
        int max = Math.max(0, limit);
        List<KnowledgeReference> top = references.size() > max
                ? new ArrayList<>(references.subList(0, max))
                : references;
        logger.info("Found {} knowledge references in {} knowledge bases", top.size(), knowledgeBaseIds.size());
        return top;
    }

    /**
     * Render references as a plain text block grouped by knowledge base name.
     *
     * @return The context block, or an empty string when there are no references
     */
    public String formatReferencesAsContext(List<KnowledgeReference> references) {
        if (references.isEmpty()) {
            return "";
        }

        Map<String, List<KnowledgeReference>> byKnowledgeBase = new LinkedHashMap<>();
        for (KnowledgeReference reference : references) {
            byKnowledgeBase.computeIfAbsent(reference.getKnowledgeBaseName(), k -> new ArrayList<>()).add(reference);
        }

        StringBuilder context = new StringBuilder("\n\n--- Knowledge base references ---\n");
        for (Map.Entry<String, List<KnowledgeReference>> group : byKnowledgeBase.entrySet()) {
            context.append("\n[").append(group.getKey()).append("]:\n");
            int index = 1;
            for (KnowledgeReference reference : group.getValue()) {
                context.append(index++).append(". ").append(reference.getContent())
                        .append(String.format(Locale.ROOT, " (similarity: %.1f%%)", reference.getScore() * 100))
                        .append('\n');
            }
        }
        context.append("\n--- Answer based on the knowledge base content above ---\n");
        return context.toString();
    }

    /**
     * Render references as a JSON array.
     *
     * @return Pretty printed JSON, or an empty string when there are no references
     */
    public String formatReferencesAsJson(List<KnowledgeReference> references) {
        if (references.isEmpty()) {
            return "";
        }
        JSONArray array = new JSONArray();
        for (KnowledgeReference reference : references) {
            array.put(reference.toJson());
        }
        return array.toString(2);
    }

    /**
     * Enhance a prompt with relevant passages from the given knowledge bases.
     *
     * @param originalPrompt The prompt to enhance
     * @param query The question to find context for
     * @param knowledgeBaseIds Knowledge bases to search
     * @return The enhanced prompt, or the original one when nothing relevant was found
     */
    public String enhancePromptWithContext(String originalPrompt, String query, List<String> knowledgeBaseIds) {
        List<KnowledgeReference> references = searchKnowledge(query, knowledgeBaseIds, maxReferences, threshold);
        if (references.isEmpty()) {
            logger.debug("No relevant knowledge found, returning original prompt");
            return originalPrompt;
        }
        return originalPrompt + formatReferencesAsContext(references);
    }
}
