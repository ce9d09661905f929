package com.catalog.reclassification.catalog;

/**
 * A canonical label proposed for a pending subcategory.
 *
 * @param label canonical label, pretty form
 * @param score affinity from 0 to 100, one decimal
 */
public record LabelSuggestion(String label, double score) {}
