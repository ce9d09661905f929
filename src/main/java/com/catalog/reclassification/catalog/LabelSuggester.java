package com.catalog.reclassification.catalog;

import com.catalog.reclassification.rules.NormalizationEngine;
import com.catalog.reclassification.similarity.SimilarityAlgorithm;
import com.catalog.reclassification.similarity.WeightedLabelScorer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks catalog canonical labels by fuzzy affinity to a raw subcategory, so a curator can
 * map a pending label onto an existing canonical one instead of inventing a new label.
 */
public class LabelSuggester {

    private final CatalogIndex index;
    private final SimilarityAlgorithm scorer;

    public LabelSuggester(CatalogIndex index) {
        this(index, new WeightedLabelScorer());
    }

    public LabelSuggester(CatalogIndex index, SimilarityAlgorithm scorer) {
        this.index = index;
        this.scorer = scorer;
    }

    /**
     * Returns at most {@code limit} suggestions, best first. Ties keep catalog order.
     */
    public List<LabelSuggestion> suggest(String query, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        NormalizationEngine engine = index.getNormalizationEngine();
        String normalizedQuery = engine.normalizeLabel(query);
        if (normalizedQuery.isEmpty()) {
            return List.of();
        }

        List<LabelSuggestion> scored = new ArrayList<>();
        for (String label : index.canonicalLabels()) {
            double score = scorer.compute(normalizedQuery, engine.normalize(label));
            if (score > 0.0) {
                scored.add(new LabelSuggestion(label, Math.round(score * 1000.0) / 10.0));
            }
        }
        scored.sort(Comparator.comparingDouble(LabelSuggestion::score).reversed());
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : List.copyOf(scored);
    }
}
