package com.catalog.reclassification.bulk;

import com.catalog.reclassification.catalog.HeaderAliases;

/**
 * Logical columns of an input table. Only {@link #NAME} is required; the others default
 * to empty strings when the table lacks them.
 */
public enum InputField {
    ID,
    NAME,
    CATEGORY,
    SUBCATEGORY,
    ADDRESS;

    public static HeaderAliases<InputField> defaultAliases() {
        return HeaderAliases.builder(InputField.class)
                .alias(ID, "ID", "Id Registro", "Record Id")
                .alias(NAME, "Nome", "Name", "Nome Fantasia")
                .alias(CATEGORY, "Categoria", "Category")
                .alias(SUBCATEGORY, "Sub-Categoria", "Subcategoria", "Subcategory", "Sub Category")
                .alias(ADDRESS, "Endereço", "Endereco", "Address")
                .required(NAME)
                .build();
    }
}
