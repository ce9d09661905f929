package com.catalog.reclassification.catalog;

import com.catalog.reclassification.rules.NormalizationEngine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accepted header spellings per logical field of a table.
 *
 * <p>Headers are compared on a loose key (no accents, lower case, letters and digits only),
 * so "SubCat Original", "SubCat_Original" and "subcat-original" all resolve to the same field.
 * Aliases are tried in declaration order; the first header that matches wins.</p>
 *
 * @param <F> the enum of logical fields
 */
public final class HeaderAliases<F extends Enum<F>> {

    private final Class<F> fieldType;
    private final Map<F, List<String>> aliases;
    private final Set<F> required;

    private HeaderAliases(Builder<F> builder) {
        this.fieldType = builder.fieldType;
        EnumMap<F, List<String>> copy = new EnumMap<>(fieldType);
        builder.aliases.forEach((field, names) -> copy.put(field, List.copyOf(names)));
        this.aliases = Collections.unmodifiableMap(copy);
        this.required = builder.required.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(fieldType))
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.required));
    }

    public List<String> aliasesOf(F field) {
        return aliases.getOrDefault(field, List.of());
    }

    public Set<F> getRequired() {
        return required;
    }

    /**
     * Maps each logical field to the actual header naming it. Fields without a matching
     * header are absent from the result.
     */
    public Map<F, String> resolve(Collection<String> headers) {
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String header : headers) {
            if (header != null) {
                byKey.putIfAbsent(headerKey(header), header);
            }
        }

        Map<F, String> resolved = new EnumMap<>(fieldType);
        for (Map.Entry<F, List<String>> entry : aliases.entrySet()) {
            for (String alias : entry.getValue()) {
                String header = byKey.get(headerKey(alias));
                if (header != null) {
                    resolved.put(entry.getKey(), header);
                    break;
                }
            }
        }
        return resolved;
    }

    /**
     * Returns the required fields missing from a resolution, in declaration order.
     */
    public List<F> missingRequired(Map<F, String> resolved) {
        List<F> missing = new ArrayList<>();
        for (F field : fieldType.getEnumConstants()) {
            if (required.contains(field) && !resolved.containsKey(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    /**
     * Loose comparison key for a header.
     */
    public static String headerKey(String header) {
        return NormalizationEngine.stripAccents(header)
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]", "");
    }

    /**
     * Default aliases for catalog tables. All three fields are required.
     */
    public static HeaderAliases<CatalogField> catalogDefaults() {
        return builder(CatalogField.class)
                .alias(CatalogField.ORIGINAL_LABEL, "SubCat Original", "Subcategoria Original",
                        "Original Subcategory", "Original Label")
                .alias(CatalogField.CANONICAL_LABEL, "Nova SubCat", "Nova Subcategoria",
                        "New Subcategory", "Canonical Label")
                .alias(CatalogField.OWNING_CATEGORY, "categoria_oficial", "Categoria Oficial",
                        "Categoria", "Category", "Owning Category")
                .required(CatalogField.ORIGINAL_LABEL, CatalogField.CANONICAL_LABEL,
                        CatalogField.OWNING_CATEGORY)
                .build();
    }

    public static <F extends Enum<F>> Builder<F> builder(Class<F> fieldType) {
        return new Builder<>(fieldType);
    }

    public static class Builder<F extends Enum<F>> {
        private final Class<F> fieldType;
        private final Map<F, List<String>> aliases;
        private final Set<F> required;

        private Builder(Class<F> fieldType) {
            this.fieldType = Objects.requireNonNull(fieldType, "fieldType is required");
            this.aliases = new EnumMap<>(fieldType);
            this.required = EnumSet.noneOf(fieldType);
        }

        public Builder<F> alias(F field, String... names) {
            aliases.computeIfAbsent(field, f -> new ArrayList<>()).addAll(List.of(names));
            return this;
        }

        @SafeVarargs
        public final Builder<F> required(F... fields) {
            required.addAll(List.of(fields));
            return this;
        }

        public HeaderAliases<F> build() {
            for (F field : required) {
                if (!aliases.containsKey(field)) {
                    throw new IllegalArgumentException("Required field " + field + " has no alias");
                }
            }
            return new HeaderAliases<>(this);
        }
    }
}
