package com.kbase.retrieval.model;

/**
 * A ranked passage returned by a search. Carries copies of the chunk's
 * content and metadata, never a reference back to the store.
 */
public class SearchResult {

    private final String documentId;
    private final String content;
    private final double score;
    private final DocumentMetadata metadata;

    public SearchResult(String documentId, String content, double score, DocumentMetadata metadata) {
        this.documentId = documentId;
        this.content = content;
        this.score = score;
        this.metadata = metadata;
    }

    public static SearchResult of(KnowledgeDocument document, double score) {
        return new SearchResult(document.getId(), document.getContent(), score, document.getMetadata());
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getContent() {
        return content;
    }

    /**
     * Cosine similarity for plain searches; blended or reranked score for enhanced searches.
     */
    public double getScore() {
        return score;
    }

    public DocumentMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "SearchResult{documentId='" + documentId + "', score=" + score + "}";
    }
}
