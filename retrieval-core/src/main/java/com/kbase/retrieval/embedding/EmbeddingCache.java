package com.kbase.retrieval.embedding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded, process-local cache of embedding vectors keyed by (model id, exact text).
 * Entries are written once per key and evicted oldest-first when the capacity is exceeded.
 */
public class EmbeddingCache {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Map<Key, List<Float>> entries;

    public EmbeddingCache() {
        this(DEFAULT_CAPACITY);
    }

    public EmbeddingCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, List<Float>> eldest) {
                return size() > EmbeddingCache.this.capacity;
            }
        };
    }

    /**
     * @return The cached vector, or {@code null} on a miss
     */
    public synchronized List<Float> get(String modelId, String text) {
        return entries.get(new Key(modelId, text));
    }

    /**
     * Store a vector unless the key is already present.
     *
     * @return The vector now held for the key, which is the earlier one if a concurrent caller won
     */
    public synchronized List<Float> putIfAbsent(String modelId, String text, List<Float> vector) {
        Key key = new Key(modelId, text);
        List<Float> existing = entries.get(key);
        if (existing != null) {
            return existing;
        }
        List<Float> stored = List.copyOf(vector);
        entries.put(key, stored);
        return stored;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized void clear() {
        entries.clear();
    }

    private static final class Key {
        private final String modelId;
        private final String text;

        Key(String modelId, String text) {
            this.modelId = Objects.requireNonNull(modelId, "modelId");
            this.text = Objects.requireNonNull(text, "text");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key key = (Key) o;
            return modelId.equals(key.modelId) && text.equals(key.text);
        }

        @Override
        public int hashCode() {
            return 31 * modelId.hashCode() + text.hashCode();
        }
    }
}
