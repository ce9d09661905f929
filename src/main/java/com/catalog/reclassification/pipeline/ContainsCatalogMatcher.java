package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.catalog.CatalogIndex;
import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.Record;
import com.catalog.reclassification.core.model.RecordAction;
import com.catalog.reclassification.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage 2: for records still undecided, searches the record's name (and optionally its
 * address) for any catalog original label. The first label in catalog order that occurs
 * as a substring wins; labels shorter than two characters are ignored.
 */
public class ContainsCatalogMatcher extends RecordStage {
    private static final Logger log = LoggerFactory.getLogger(ContainsCatalogMatcher.class);

    static final double CONFIDENCE = 0.92;
    private static final int MIN_KEY_LENGTH = 2;

    private final CatalogIndex index;
    private final GuardRail guardRail;
    private final NormalizationEngine engine;
    private final boolean useAddress;
    private final List<String> keys;

    public ContainsCatalogMatcher(CatalogIndex index, GuardRail guardRail, boolean useAddress) {
        this.index = index;
        this.guardRail = guardRail;
        this.engine = index.getNormalizationEngine();
        this.useAddress = useAddress;
        this.keys = new ArrayList<>();
        for (String key : index.originalKeys()) {
            if (key.length() >= MIN_KEY_LENGTH) {
                keys.add(key);
            }
        }
    }

    @Override
    public String getName() {
        return "catalog-contains";
    }

    @Override
    protected boolean accepts(Record record) {
        return !record.isDecided();
    }

    @Override
    protected boolean process(Record record) {
        String haystack = useAddress ? record.getName() + " " + record.getAddress() : record.getName();
        String normalized = engine.normalize(haystack);
        if (normalized.isEmpty()) {
            return false;
        }

        for (String key : keys) {
            if (normalized.contains(key)) {
                String label = index.canonicalForOriginal(key).orElseThrow();
                RecordAction action = CatalogEntry.isExclusionLabel(label) ? RecordAction.EXCLUDE : RecordAction.CORRECT;
                record.applyDecision(label, action, DecisionSource.CATALOG_CONTAINS, CONFIDENCE);
                guardRail.apply(record, engine.normalize(label));
                log.debug("catalog.contains id='{}' key='{}' -> '{}'", record.getId(), key, label);
                return true;
            }
        }
        return false;
    }
}
