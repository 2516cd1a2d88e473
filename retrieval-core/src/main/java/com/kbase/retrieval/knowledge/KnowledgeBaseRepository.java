package com.kbase.retrieval.knowledge;

import com.kbase.retrieval.model.KnowledgeBase;

import java.util.List;
import java.util.Optional;

/**
 * Keyed collection of knowledge base records.
 */
public interface KnowledgeBaseRepository {

    /**
     * Insert or replace a knowledge base by id.
     */
    void save(KnowledgeBase knowledgeBase);

    Optional<KnowledgeBase> findById(String id);

    List<KnowledgeBase> findAll();

    /**
     * @return true if the record existed
     */
    boolean delete(String id);
}
