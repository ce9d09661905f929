package com.catalog.reclassification.similarity;

import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Fuzzy label similarity: a weighted blend of normalized Levenshtein similarity,
 * Jaro-Winkler similarity and word-set overlap (Jaccard).
 * Inputs are expected to be normalized already.
 */
public class WeightedLabelScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(WeightedLabelScorer.class);

    private final LevenshteinDistance levenshtein = LevenshteinDistance.getDefaultInstance();
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final SimilarityWeights weights;

    public WeightedLabelScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public WeightedLabelScorer(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        double levScore = 1.0 - (double) levenshtein.apply(s1, s2) / Math.max(s1.length(), s2.length());
        double jwScore = jaroWinkler.apply(s1, s2);
        double tokenScore = tokenOverlap(s1, s2);

        double score = weights.levenshteinWeight() * levScore
                + weights.jaroWinklerWeight() * jwScore
                + weights.tokenOverlapWeight() * tokenScore;

        log.trace("Label similarity '{}' vs '{}': levenshtein={} jaroWinkler={} tokens={} score={}",
                s1, s2, levScore, jwScore, tokenScore, score);
        return Math.min(1.0, Math.max(0.0, score));
    }

    @Override
    public String getName() {
        return "WeightedLabel";
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    private static double tokenOverlap(String s1, String s2) {
        Set<String> tokens1 = tokens(s1);
        Set<String> tokens2 = tokens(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                shared++;
            }
        }
        return (double) shared / (tokens1.size() + tokens2.size() - shared);
    }

    private static Set<String> tokens(String s) {
        Set<String> tokens = new HashSet<>();
        for (String token : s.split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
