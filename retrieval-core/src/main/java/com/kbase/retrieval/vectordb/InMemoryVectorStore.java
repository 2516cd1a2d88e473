package com.kbase.retrieval.vectordb;

import com.kbase.retrieval.model.KnowledgeDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of VectorStore. Records are kept in insertion order;
 * replacing a record keeps its original position.
 */
public class InMemoryVectorStore extends AbstractVectorStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorStore.class);

    // guarded by itself
    private final Map<String, KnowledgeDocument> documents = new LinkedHashMap<>();

    @Override
    protected boolean initialize() {
        logger.info("Initializing in-memory vector store");
        return true;
    }

    @Override
    protected void closeResources() {
        clear();
    }

    @Override
    protected void performPut(KnowledgeDocument document) {
        synchronized (documents) {
            documents.put(document.getId(), document);
        }
        logger.debug("Stored document {} in knowledge base {}", document.getId(), document.getKnowledgeBaseId());
    }

    @Override
    protected int performDeleteByKnowledgeBase(String knowledgeBaseId) {
        int removed = 0;
        synchronized (documents) {
            Iterator<KnowledgeDocument> it = documents.values().iterator();
            while (it.hasNext()) {
                if (it.next().getKnowledgeBaseId().equals(knowledgeBaseId)) {
                    it.remove();
                    removed++;
                }
            }
        }
        logger.debug("Deleted {} documents of knowledge base {}", removed, knowledgeBaseId);
        return removed;
    }

    @Override
    protected boolean performDeleteById(String documentId) {
        KnowledgeDocument removed;
        synchronized (documents) {
            removed = documents.remove(documentId);
        }
        if (removed == null) {
            logger.debug("Document not found for deletion, ID: {}", documentId);
        }
        return removed != null;
    }

    @Override
    protected List<KnowledgeDocument> performListByKnowledgeBase(String knowledgeBaseId) {
        List<KnowledgeDocument> result = new ArrayList<>();
        synchronized (documents) {
            for (KnowledgeDocument document : documents.values()) {
                if (document.getKnowledgeBaseId().equals(knowledgeBaseId)) {
                    result.add(document);
                }
            }
        }
        return result;
    }

    @Override
    protected Optional<KnowledgeDocument> performGetById(String documentId) {
        synchronized (documents) {
            return Optional.ofNullable(documents.get(documentId));
        }
    }

    /**
     * Returns the number of records across all knowledge bases.
     */
    public int getDocumentCount() {
        synchronized (documents) {
            return documents.size();
        }
    }

    public void clear() {
        synchronized (documents) {
            documents.clear();
        }
        logger.info("In-memory vector store cleared");
    }
}
