package com.kbase.retrieval.knowledge;

import com.kbase.retrieval.model.KnowledgeBase;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory repository. Stores and hands out copies, so callers cannot change a
 * stored record without going through {@link #save}.
 */
public class InMemoryKnowledgeBaseRepository implements KnowledgeBaseRepository {

    private final Map<String, KnowledgeBase> knowledgeBases = new ConcurrentHashMap<>();

    @Override
    public void save(KnowledgeBase knowledgeBase) {
        knowledgeBases.put(knowledgeBase.getId(), new KnowledgeBase(knowledgeBase));
    }

    @Override
    public Optional<KnowledgeBase> findById(String id) {
        KnowledgeBase stored = knowledgeBases.get(id);
        return stored != null ? Optional.of(new KnowledgeBase(stored)) : Optional.empty();
    }

    @Override
    public List<KnowledgeBase> findAll() {
        List<KnowledgeBase> result = new ArrayList<>();
        for (KnowledgeBase stored : knowledgeBases.values()) {
            result.add(new KnowledgeBase(stored));
        }
        result.sort((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()));
        return result;
    }

    @Override
    public boolean delete(String id) {
        return knowledgeBases.remove(id) != null;
    }
}
