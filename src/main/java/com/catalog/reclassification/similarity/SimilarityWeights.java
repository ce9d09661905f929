package com.catalog.reclassification.similarity;

/**
 * Weights of the algorithms combined by {@link WeightedLabelScorer}.
 */
public record SimilarityWeights(
        double levenshteinWeight,
        double jaroWinklerWeight,
        double tokenOverlapWeight
) {
    public SimilarityWeights {
        if (levenshteinWeight < 0 || jaroWinklerWeight < 0 || tokenOverlapWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = levenshteinWeight + jaroWinklerWeight + tokenOverlapWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.33, 0.34, 0.33);
    }

    /**
     * Favors shared words, which suits multi-word subcategory labels typed in a different order.
     */
    public static SimilarityWeights tokenFocused() {
        return new SimilarityWeights(0.2, 0.3, 0.5);
    }
}
