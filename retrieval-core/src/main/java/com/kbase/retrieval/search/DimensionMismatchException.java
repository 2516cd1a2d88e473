package com.kbase.retrieval.search;

import com.kbase.retrieval.KnowledgeException;

/**
 * Two vectors of different length were compared. Inside a knowledge base
 * this means it was populated with more than one embedding model.
 */
public class DimensionMismatchException extends KnowledgeException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        this(expected, actual, "vector dimension mismatch: expected " + expected + " but got " + actual);
    }

    public DimensionMismatchException(int expected, int actual, String message) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Mismatch between a query vector and the vectors stored in a knowledge base.
     */
    public static DimensionMismatchException forKnowledgeBase(String baseId, int queryDimensions, int storedDimensions) {
        return new DimensionMismatchException(storedDimensions, queryDimensions,
                "embedding model mismatch: query vector has " + queryDimensions
                        + " dimensions but knowledge base " + baseId + " stores " + storedDimensions
                        + "-dimensional vectors. Use the same embedding model or recreate the knowledge base.");
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
