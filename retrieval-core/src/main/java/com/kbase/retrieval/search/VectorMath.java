package com.kbase.retrieval.search;

import java.util.List;

/**
 * Vector arithmetic shared by the search components.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Calculates the cosine similarity between two vectors.
     *
     * @return A score in [-1, 1], or 0 when either vector has zero magnitude
     * @throws DimensionMismatchException if the vectors differ in length
     */
    public static double cosineSimilarity(List<Float> v1, List<Float> v2) {
        if (v1.size() != v2.size()) {
            throw new DimensionMismatchException(v1.size(), v2.size());
        }

        double dot = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < v1.size(); i++) {
            double a = v1.get(i);
            double b = v2.get(i);
            dot += a * b;
            norm1 += a * a;
            norm2 += b * b;
        }

        if (norm1 == 0 || norm2 == 0) {
            return 0.0;
        }

        double similarity = dot / (Math.sqrt(norm1) * Math.sqrt(norm2));
        // rounding can push identical vectors slightly past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }
}
