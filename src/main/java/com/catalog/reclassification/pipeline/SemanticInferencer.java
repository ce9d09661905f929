package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.catalog.CatalogIndex;
import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.Record;
import com.catalog.reclassification.core.model.RecordAction;
import com.catalog.reclassification.rules.NormalizationEngine;
import com.catalog.reclassification.semantic.SemanticMatch;
import com.catalog.reclassification.semantic.TfIdfIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Stage 3: last-resort classification of every record still undecided.
 *
 * <p>The record's name, address and category are matched against the canonical labels;
 * the name counts twice when the record has no usable subcategory. A match at or above the
 * low threshold is applied as an inference; otherwise the record is kept as is, and the
 * low similarity is preserved as its confidence. A record that arrived with the exclusion
 * sentinel and finds no match stays excluded.</p>
 */
public class SemanticInferencer extends RecordStage {
    private static final Logger log = LoggerFactory.getLogger(SemanticInferencer.class);
    private static final Set<String> PLACEHOLDERS = Set.of("", "nan", "none", "null");

    private final CatalogIndex index;
    private final TfIdfIndex canonicalLabelIndex;
    private final GuardRail guardRail;
    private final NormalizationEngine engine;
    private final double threshold;

    public SemanticInferencer(CatalogIndex index, TfIdfIndex canonicalLabelIndex, GuardRail guardRail,
                              PipelineOptions options) {
        this.index = index;
        this.canonicalLabelIndex = canonicalLabelIndex;
        this.guardRail = guardRail;
        this.engine = index.getNormalizationEngine();
        this.threshold = options.getLoThreshold();
    }

    @Override
    public String getName() {
        return "semantic";
    }

    @Override
    protected boolean accepts(Record record) {
        return !record.isDecided();
    }

    @Override
    protected boolean process(Record record) {
        String name = record.getName();
        String bag = isPlaceholder(record.getCurrentSubcategory())
                ? String.join(" ", name, name, record.getAddress(), record.getCurrentCategory())
                : String.join(" ", name, record.getAddress(), record.getCurrentCategory());

        SemanticMatch match = canonicalLabelIndex.query(engine.normalize(bag));
        if (match.hasMatch() && match.similarity() >= threshold) {
            Optional<String> label = index.canonicalLabel(match.term());
            if (label.isPresent()) {
                RecordAction action = CatalogEntry.isExclusionLabel(label.get())
                        ? RecordAction.EXCLUDE : RecordAction.INFER;
                record.applyDecision(label.get(), action, DecisionSource.SEMANTIC,
                        roundConfidence(match.similarity()));
                guardRail.apply(record, match.term());
                log.debug("semantic.inferred id='{}' -> '{}' similarity={}",
                        record.getId(), label.get(), match.similarity());
                return true;
            }
        }

        // an input row that already carries the sentinel stays excluded
        RecordAction fallback = record.isExcluded() ? RecordAction.EXCLUDE : RecordAction.KEEP;
        record.decide(fallback, DecisionSource.NONE, roundConfidence(match.similarity()));
        return true;
    }

    static boolean isPlaceholder(String subcategory) {
        return subcategory == null || PLACEHOLDERS.contains(subcategory.strip().toLowerCase(Locale.ROOT));
    }
}
