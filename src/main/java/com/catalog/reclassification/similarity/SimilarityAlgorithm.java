package com.catalog.reclassification.similarity;

/**
 * Computes how alike two labels are.
 * All implementations return a score between 0.0 (nothing in common) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
