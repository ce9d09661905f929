package com.catalog.reclassification.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes free text for matching.
 *
 * <p>{@link #normalize(Object)} strips diacritics, lower-cases and then applies the
 * text rules in priority order (lower priority number = applied first). Prefix rules
 * are kept apart and only used by {@link #stripStorePrefix(String)}, which removes
 * "store of" style prefixes from subcategory labels before they are normalized.</p>
 *
 * <p>The engine is total: {@code null}, NaN and blank input all normalize to the empty string.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<NormalizationRule> rules;
    private final List<NormalizationRule> prefixRules;

    public NormalizationEngine() {
        this(List.of(), List.of());
    }

    public NormalizationEngine(List<NormalizationRule> rules, List<NormalizationRule> prefixRules) {
        this.rules = new ArrayList<>(rules);
        this.prefixRules = new ArrayList<>(prefixRules);
        sortRules();
    }

    /**
     * Adds a text rule to the engine.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds a prefix rule used by {@link #stripStorePrefix(String)}.
     */
    public void addPrefixRule(NormalizationRule rule) {
        prefixRules.add(rule);
        sortRules();
    }

    /**
     * Removes a text or prefix rule by name.
     */
    public boolean removeRule(String ruleName) {
        boolean removed = rules.removeIf(r -> r.name().equals(ruleName));
        return prefixRules.removeIf(r -> r.name().equals(ruleName)) || removed;
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public List<NormalizationRule> getPrefixRules() {
        return List.copyOf(prefixRules);
    }

    /**
     * Normalizes any value, coercing it to its string form first.
     */
    public String normalize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d && d.isNaN()) {
            return "";
        }
        if (value instanceof Float f && f.isNaN()) {
            return "";
        }
        return normalize(value.toString());
    }

    /**
     * Normalizes text: no diacritics, lower case, rules applied, whitespace collapsed and trimmed.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = stripAccents(text).toLowerCase(Locale.ROOT);
        // lower-casing can reintroduce combining marks (e.g. dotted capital I)
        result = COMBINING_MARKS.matcher(result).replaceAll("");

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return WHITESPACE.matcher(result).replaceAll(" ").strip();
    }

    /**
     * Removes a leading "store of" style prefix from a subcategory label.
     * The label is returned unchanged when nothing would remain after the prefix.
     */
    public String stripStorePrefix(String label) {
        if (label == null || label.isBlank()) {
            return "";
        }
        String result = label.strip();
        for (NormalizationRule rule : prefixRules) {
            result = rule.apply(result);
        }
        return result.isBlank() ? label.strip() : result.strip();
    }

    /**
     * Normalizes a subcategory label after removing its store prefix.
     */
    public String normalizeLabel(String label) {
        return normalize(stripStorePrefix(label));
    }

    /**
     * Checks if two texts are equivalent after normalization.
     */
    public boolean areEquivalent(String text1, String text2) {
        return normalize(text1).equals(normalize(text2));
    }

    /**
     * Decomposes the text and drops combining marks, leaving base letters.
     */
    public static String stripAccents(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::priority));
        prefixRules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }
}
