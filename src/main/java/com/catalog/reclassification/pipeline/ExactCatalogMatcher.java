package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.catalog.CatalogIndex;
import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.Record;
import com.catalog.reclassification.core.model.RecordAction;
import com.catalog.reclassification.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Stage 1: looks the record's subcategory up among the catalog's original labels.
 * The plain normalized label is tried first, then the label without its store prefix.
 */
public class ExactCatalogMatcher extends RecordStage {
    private static final Logger log = LoggerFactory.getLogger(ExactCatalogMatcher.class);

    static final double CONFIDENCE = 0.99;

    private final CatalogIndex index;
    private final GuardRail guardRail;
    private final NormalizationEngine engine;

    public ExactCatalogMatcher(CatalogIndex index, GuardRail guardRail) {
        this.index = index;
        this.guardRail = guardRail;
        this.engine = index.getNormalizationEngine();
    }

    @Override
    public String getName() {
        return "catalog-exact";
    }

    @Override
    protected boolean accepts(Record record) {
        return !record.isDecided();
    }

    @Override
    protected boolean process(Record record) {
        String subcategory = record.getCurrentSubcategory();
        String key = engine.normalize(subcategory);
        if (key.isEmpty()) {
            return false;
        }

        Optional<String> canonical = index.canonicalForOriginal(key);
        if (canonical.isEmpty()) {
            String strippedKey = engine.normalizeLabel(subcategory);
            if (!strippedKey.isEmpty() && !strippedKey.equals(key)) {
                canonical = index.canonicalForOriginal(strippedKey);
            }
        }
        if (canonical.isEmpty()) {
            return false;
        }

        String label = canonical.get();
        RecordAction action = CatalogEntry.isExclusionLabel(label) ? RecordAction.EXCLUDE : RecordAction.CORRECT;
        record.applyDecision(label, action, DecisionSource.CATALOG, CONFIDENCE);
        guardRail.apply(record, engine.normalize(label));
        log.debug("catalog.exact id='{}' '{}' -> '{}' category='{}'",
                record.getId(), subcategory, label, record.getCurrentCategory());
        return true;
    }
}
