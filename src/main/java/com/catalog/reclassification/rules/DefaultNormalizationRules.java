package com.catalog.reclassification.rules;

import java.util.List;

/**
 * Built-in normalization rules for catalog and record text.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with the default text and prefix rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getTextRules(), getStorePrefixRules());
    }

    /**
     * Rules applied to every normalized text.
     */
    public static List<NormalizationRule> getTextRules() {
        return List.of(
                // Anything but word characters, whitespace, comma, period and hyphen
                NormalizationRule.builder()
                        .name("text-special-chars")
                        .pattern("[^\\w\\s,.-]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("text-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    /**
     * Rules removing "store of" style prefixes, e.g. "Loja de Roupas" becomes "Roupas".
     * The lookahead keeps the prefix when no label would follow it.
     */
    public static List<NormalizationRule> getStorePrefixRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("prefix-store-of")
                        .pattern("^(lojas?|com[eé]rcio|store|shop)\\s+((de|da|do|das|dos|of)\\s+)?(?=\\S)")
                        .replacement("")
                        .priority(10)
                        .build()
        );
    }
}
