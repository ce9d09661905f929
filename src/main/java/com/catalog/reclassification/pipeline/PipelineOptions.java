package com.catalog.reclassification.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Options for a reclassification run.
 * Configures the semantic thresholds, the validator's problematic labels,
 * the address exclusion keywords and the deliverable policy.
 */
public class PipelineOptions {

    public static final String PROPERTY_PREFIX = "reclassification.";

    private static final double DEFAULT_HI_THRESHOLD = 0.90;
    private static final double DEFAULT_LO_THRESHOLD = 0.70;
    private static final double DEFAULT_PROBLEMATIC_THRESHOLD = 0.35;
    private static final List<String> DEFAULT_ADDRESS_KEYWORDS =
            List.of("shopping", "loja", "lj", "quiosque", "box", "galeria", "mall");

    private final double hiThreshold;
    private final double loThreshold;
    private final double problematicThreshold;
    private final Set<String> problematicLabels;
    private final List<String> addressKeywords;
    private final boolean containsUsesAddress;
    private final ExclusionPolicy exclusionPolicy;

    private PipelineOptions(Builder builder) {
        this.hiThreshold = builder.hiThreshold;
        this.loThreshold = builder.loThreshold;
        this.problematicThreshold = builder.problematicThreshold;
        this.problematicLabels = Set.copyOf(builder.problematicLabels);
        this.addressKeywords = List.copyOf(builder.addressKeywords);
        this.containsUsesAddress = builder.containsUsesAddress;
        this.exclusionPolicy = builder.exclusionPolicy;
    }

    /**
     * Similarity at or above which a semantic inference is trusted without review.
     */
    public double getHiThreshold() {
        return hiThreshold;
    }

    /**
     * Minimum similarity for the semantic stages to apply a label.
     */
    public double getLoThreshold() {
        return loThreshold;
    }

    /**
     * Lowered override threshold for problematic labels; never above {@link #getLoThreshold()}.
     */
    public double getProblematicThreshold() {
        return Math.min(problematicThreshold, loThreshold);
    }

    public Set<String> getProblematicLabels() {
        return problematicLabels;
    }

    public List<String> getAddressKeywords() {
        return addressKeywords;
    }

    public boolean isContainsUsesAddress() {
        return containsUsesAddress;
    }

    public ExclusionPolicy getExclusionPolicy() {
        return exclusionPolicy;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from properties under the {@value #PROPERTY_PREFIX} prefix.
     * Absent keys keep their defaults; list values are comma separated.
     */
    public static PipelineOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = property(properties, "hi-threshold")) != null) {
            builder.hiThreshold(parseDouble("hi-threshold", value));
        }
        if ((value = property(properties, "lo-threshold")) != null) {
            builder.loThreshold(parseDouble("lo-threshold", value));
        }
        if ((value = property(properties, "problematic-threshold")) != null) {
            builder.problematicThreshold(parseDouble("problematic-threshold", value));
        }
        if ((value = property(properties, "problematic-labels")) != null) {
            builder.problematicLabels(splitList(value));
        }
        if ((value = property(properties, "address-keywords")) != null) {
            builder.addressKeywords(splitList(value));
        }
        if ((value = property(properties, "contains-uses-address")) != null) {
            builder.containsUsesAddress(Boolean.parseBoolean(value));
        }
        if ((value = property(properties, "exclusion-policy")) != null) {
            builder.exclusionPolicy(ExclusionPolicy.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_')));
        }
        return builder.build();
    }

    /**
     * Reads options from a properties file on the classpath.
     */
    public static PipelineOptions load(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = PipelineOptions.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Options resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read options resource " + resource, e);
        }
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        return value != null && !value.isBlank() ? value.strip() : null;
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.strip());
            }
        }
        return items;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double hiThreshold = DEFAULT_HI_THRESHOLD;
        private double loThreshold = DEFAULT_LO_THRESHOLD;
        private double problematicThreshold = DEFAULT_PROBLEMATIC_THRESHOLD;
        private Set<String> problematicLabels = new LinkedHashSet<>();
        private List<String> addressKeywords = new ArrayList<>(DEFAULT_ADDRESS_KEYWORDS);
        private boolean containsUsesAddress = true;
        private ExclusionPolicy exclusionPolicy = ExclusionPolicy.RETAIN_FLAGGED;

        public Builder hiThreshold(double hiThreshold) {
            validateThreshold(hiThreshold, "hiThreshold");
            this.hiThreshold = hiThreshold;
            return this;
        }

        public Builder loThreshold(double loThreshold) {
            validateThreshold(loThreshold, "loThreshold");
            this.loThreshold = loThreshold;
            return this;
        }

        public Builder problematicThreshold(double problematicThreshold) {
            validateThreshold(problematicThreshold, "problematicThreshold");
            this.problematicThreshold = problematicThreshold;
            return this;
        }

        public Builder problematicLabels(Iterable<String> labels) {
            this.problematicLabels = new LinkedHashSet<>();
            labels.forEach(this.problematicLabels::add);
            return this;
        }

        public Builder problematicLabels(String... labels) {
            return problematicLabels(List.of(labels));
        }

        public Builder addressKeywords(Iterable<String> keywords) {
            this.addressKeywords = new ArrayList<>();
            keywords.forEach(this.addressKeywords::add);
            return this;
        }

        public Builder addressKeywords(String... keywords) {
            return addressKeywords(List.of(keywords));
        }

        public Builder containsUsesAddress(boolean containsUsesAddress) {
            this.containsUsesAddress = containsUsesAddress;
            return this;
        }

        public Builder exclusionPolicy(ExclusionPolicy exclusionPolicy) {
            if (exclusionPolicy == null) {
                throw new IllegalArgumentException("exclusionPolicy is required");
            }
            this.exclusionPolicy = exclusionPolicy;
            return this;
        }

        public PipelineOptions build() {
            if (loThreshold > hiThreshold) {
                throw new IllegalArgumentException("loThreshold must be <= hiThreshold");
            }
            return new PipelineOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value <= 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be greater than 0.0 and at most 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "PipelineOptions{" +
                "hiThreshold=" + hiThreshold +
                ", loThreshold=" + loThreshold +
                ", problematicThreshold=" + problematicThreshold +
                ", problematicLabels=" + problematicLabels +
                ", addressKeywords=" + addressKeywords +
                ", containsUsesAddress=" + containsUsesAddress +
                ", exclusionPolicy=" + exclusionPolicy +
                '}';
    }
}
