package com.catalog.reclassification.pipeline;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

class SemanticInferencerTest {

    @ParameterizedTest
    @DisplayName("Should recognize placeholder subcategories")
    @CsvSource(value = {
            "'',true",
            "nan,true",
            "NaN,true",
            "None,true",
            "null,true",
            "Padaria,false",
            "nada,false"
    })
    void testIsPlaceholder(String subcategory, boolean expected) {
        assertEquals(expected, SemanticInferencer.isPlaceholder(subcategory));
    }
}
