package com.catalog.reclassification.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One regex rewrite of a label or name, applied by {@link NormalizationEngine} in ascending
 * priority. Patterns are compiled case-insensitive and Unicode-aware, so {@code \w} and
 * {@code \s} cover accented letters and non-ASCII whitespace.
 *
 * @param name        identifier used to remove the rule and in trace logs
 * @param pattern     the compiled pattern
 * @param replacement replacement text, may refer to groups of the pattern
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String regex;
        private String replacement;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(regex, "pattern is required");
            return new NormalizationRule(name, Pattern.compile(regex, FLAGS), replacement, priority);
        }
    }
}
