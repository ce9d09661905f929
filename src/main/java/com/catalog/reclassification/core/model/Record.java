package com.catalog.reclassification.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A business record whose subcategory is being reclassified.
 * Created from one input row and mutated only by the pipeline run that owns it.
 *
 * <p>The original category and subcategory are captured at construction time and never
 * change; the current values evolve as the stages decide. Input columns the pipeline does not
 * interpret are carried along as ordered attributes.</p>
 */
public class Record {
    private final String id;
    private final String name;
    private final String address;
    private final String originalCategory;
    private final String originalSubcategory;
    private final Map<String, String> attributes;
    private String currentCategory;
    private String currentSubcategory;
    private RecordAction action;
    private DecisionSource source;
    private double confidence;
    private String intermediateSubcategory;
    private String preExclusionSubcategory;

    private Record(Builder builder) {
        this.id = nullToEmpty(builder.id);
        this.name = nullToEmpty(builder.name);
        this.address = nullToEmpty(builder.address);
        this.originalCategory = nullToEmpty(builder.category);
        this.originalSubcategory = nullToEmpty(builder.subcategory);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.currentCategory = this.originalCategory;
        this.currentSubcategory = this.originalSubcategory;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }

    public String getOriginalCategory() {
        return originalCategory;
    }

    public String getOriginalSubcategory() {
        return originalSubcategory;
    }

    /**
     * Extra input columns by header, in input order.
     */
    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getCurrentCategory() {
        return currentCategory;
    }

    public void setCurrentCategory(String currentCategory) {
        this.currentCategory = nullToEmpty(currentCategory);
    }

    public String getCurrentSubcategory() {
        return currentSubcategory;
    }

    public RecordAction getAction() {
        return action;
    }

    public DecisionSource getSource() {
        return source;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getIntermediateSubcategory() {
        return intermediateSubcategory;
    }

    public void setIntermediateSubcategory(String intermediateSubcategory) {
        this.intermediateSubcategory = intermediateSubcategory;
    }

    /**
     * Subcategory held just before the record was assigned the exclusion sentinel,
     * or {@code null} if it never was.
     */
    public String getPreExclusionSubcategory() {
        return preExclusionSubcategory;
    }

    /**
     * Assigns a new subcategory together with the decision that produced it.
     */
    public void applyDecision(String subcategory, RecordAction action, DecisionSource source, double confidence) {
        Objects.requireNonNull(subcategory, "subcategory is required");
        if (CatalogEntry.isExclusionLabel(subcategory) && !isExcluded()) {
            this.preExclusionSubcategory = currentSubcategory;
        }
        this.currentSubcategory = subcategory;
        decide(action, source, confidence);
    }

    /**
     * Records a decision without touching the subcategory.
     */
    public void decide(RecordAction action, DecisionSource source, double confidence) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
        this.action = Objects.requireNonNull(action, "action is required");
        this.source = Objects.requireNonNull(source, "source is required");
        this.confidence = confidence;
    }

    /**
     * Flags the record for human review, keeping subcategory, source and confidence.
     */
    public void flagForVerification() {
        this.action = RecordAction.VERIFY;
    }

    /**
     * Returns true once any stage has decided this record.
     */
    public boolean isDecided() {
        return action != null;
    }

    public boolean isExcluded() {
        return CatalogEntry.isExclusionLabel(currentSubcategory);
    }

    /**
     * Returns a new undecided record built from this record's original values,
     * so a batch can be reprocessed without aliasing an earlier run.
     */
    public Record pristineCopy() {
        return builder()
                .id(id)
                .name(name)
                .address(address)
                .category(originalCategory)
                .subcategory(originalSubcategory)
                .attributes(attributes)
                .build();
    }

    /**
     * Columns two records must share to be considered duplicates in the final output.
     */
    public List<Object> deduplicationKey() {
        return Arrays.asList(id, name, address, currentCategory, currentSubcategory,
                originalCategory, originalSubcategory, intermediateSubcategory,
                action, source, confidence, attributes);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    @Override
    public String toString() {
        return "Record{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", category='" + currentCategory + '\'' +
                ", subcategory='" + currentSubcategory + '\'' +
                ", action=" + action +
                ", source=" + source +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String address;
        private String category;
        private String subcategory;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder subcategory(String subcategory) {
            this.subcategory = subcategory;
            return this;
        }

        public Builder attribute(String column, String value) {
            Objects.requireNonNull(column, "column is required");
            this.attributes.put(column, nullToEmpty(value));
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            attributes.forEach(this::attribute);
            return this;
        }

        public Record build() {
            Objects.requireNonNull(name, "name is required");
            return new Record(this);
        }
    }
}
