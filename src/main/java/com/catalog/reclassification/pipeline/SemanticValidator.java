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

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Stage 2.1: second-guesses the catalog stages.
 *
 * <p>The record's name is matched against the catalog's original labels. When the best
 * original label maps to a different canonical label with enough similarity, the record is
 * corrected. Problematic canonical labels, known to be over-assigned by the catalog, are
 * overridden at a lowered threshold; below that bar the record is flagged for verification
 * and keeps its subcategory.</p>
 */
public class SemanticValidator extends RecordStage {
    private static final Logger log = LoggerFactory.getLogger(SemanticValidator.class);

    private final CatalogIndex index;
    private final TfIdfIndex originalLabelIndex;
    private final GuardRail guardRail;
    private final NormalizationEngine engine;
    private final double threshold;
    private final double problematicThreshold;
    private final Set<String> problematicKeys;

    public SemanticValidator(CatalogIndex index, TfIdfIndex originalLabelIndex, GuardRail guardRail,
                             PipelineOptions options) {
        this.index = index;
        this.originalLabelIndex = originalLabelIndex;
        this.guardRail = guardRail;
        this.engine = index.getNormalizationEngine();
        this.threshold = options.getLoThreshold();
        this.problematicThreshold = options.getProblematicThreshold();
        this.problematicKeys = new HashSet<>();
        for (String label : options.getProblematicLabels()) {
            problematicKeys.add(engine.normalize(label));
        }
    }

    @Override
    public String getName() {
        return "semantic-validator";
    }

    @Override
    protected boolean accepts(Record record) {
        return record.getSource() != null && record.getSource().isCatalog();
    }

    @Override
    protected boolean process(Record record) {
        String currentKey = engine.normalize(record.getCurrentSubcategory());
        boolean problematic = problematicKeys.contains(currentKey);
        double bar = problematic ? problematicThreshold : threshold;

        SemanticMatch match = originalLabelIndex.query(engine.normalize(record.getName()));
        if (match.hasMatch() && match.similarity() >= bar) {
            Optional<String> predictedKey = index.canonicalKeyForOriginal(match.term());
            if (predictedKey.isPresent() && !predictedKey.get().equals(currentKey)) {
                String label = index.canonicalLabel(predictedKey.get())
                        .orElseGet(() -> index.canonicalForOriginal(match.term()).orElseThrow());
                RecordAction action = CatalogEntry.isExclusionLabel(label) ? RecordAction.EXCLUDE : RecordAction.CORRECT;
                String previous = record.getCurrentSubcategory();
                record.applyDecision(label, action, DecisionSource.SEMANTIC_VALIDATOR,
                        roundConfidence(match.similarity()));
                guardRail.apply(record, predictedKey.get());
                log.debug("semantic.validator.override id='{}' '{}' -> '{}' similarity={}",
                        record.getId(), previous, label, match.similarity());
                return true;
            }
            return false;
        }

        if (problematic && !record.isExcluded()) {
            record.flagForVerification();
            log.debug("semantic.validator.verify id='{}' subcategory='{}' similarity={}",
                    record.getId(), record.getCurrentSubcategory(), match.similarity());
            return true;
        }
        return false;
    }
}
