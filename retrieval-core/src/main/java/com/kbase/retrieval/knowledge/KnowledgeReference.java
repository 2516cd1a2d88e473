package com.kbase.retrieval.knowledge;

import org.json.JSONObject;

/**
 * A numbered passage cited as context for a prompt.
 */
public class KnowledgeReference {

    private final int id;
    private final String content;
    private final double score;
    private final String knowledgeBaseId;
    private final String knowledgeBaseName;
    private final String documentId;

    public KnowledgeReference(int id, String content, double score, String knowledgeBaseId,
                              String knowledgeBaseName, String documentId) {
        this.id = id;
        this.content = content;
        this.score = score;
        this.knowledgeBaseId = knowledgeBaseId;
        this.knowledgeBaseName = knowledgeBaseName;
        this.documentId = documentId;
    }

    public int getId() {
        return id;
    }

    public String getContent() {
        return content;
    }

    public double getScore() {
        return score;
    }

    public String getKnowledgeBaseId() {
        return knowledgeBaseId;
    }

    public String getKnowledgeBaseName() {
        return knowledgeBaseName;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getSourceUrl() {
        return "knowledge://" + knowledgeBaseId + "/" + documentId;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("id", id);
        json.put("content", content);
        json.put("type", "file");
        json.put("similarity", score);
        json.put("knowledgeBaseId", knowledgeBaseId);
        json.put("knowledgeBaseName", knowledgeBaseName);
        json.put("sourceUrl", getSourceUrl());
        return json;
    }
}
