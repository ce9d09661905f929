package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.catalog.CatalogIndex;
import com.catalog.reclassification.core.model.Record;

import java.util.Optional;

/**
 * Keeps a record's category equal to the owning category of its subcategory.
 * Called right after every subcategory assignment made from the catalog vocabulary.
 */
public final class GuardRail {

    private final CatalogIndex index;

    public GuardRail(CatalogIndex index) {
        this.index = index;
    }

    /**
     * Sets the record's category to the owner of {@code kCanonical}, if the catalog knows one.
     *
     * @return true if the category was set
     */
    public boolean apply(Record record, String kCanonical) {
        if (kCanonical == null || kCanonical.isEmpty()) {
            return false;
        }
        Optional<String> category = index.owningCategory(kCanonical);
        category.ifPresent(record::setCurrentCategory);
        return category.isPresent();
    }
}
