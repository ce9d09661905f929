package com.catalog.reclassification.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOptionsTest {

    @Test
    @DisplayName("Should have sensible defaults")
    void testDefaults() {
        PipelineOptions options = PipelineOptions.defaults();

        assertEquals(0.90, options.getHiThreshold());
        assertEquals(0.70, options.getLoThreshold());
        assertEquals(0.35, options.getProblematicThreshold());
        assertTrue(options.getProblematicLabels().isEmpty());
        assertEquals(List.of("shopping", "loja", "lj", "quiosque", "box", "galeria", "mall"),
                options.getAddressKeywords());
        assertTrue(options.isContainsUsesAddress());
        assertEquals(ExclusionPolicy.RETAIN_FLAGGED, options.getExclusionPolicy());
    }

    @ParameterizedTest
    @DisplayName("Should reject thresholds outside (0, 1]")
    @ValueSource(doubles = {0.0, -0.1, 1.01})
    void testInvalidThresholds(double value) {
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().hiThreshold(value));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().loThreshold(value));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().problematicThreshold(value));
    }

    @Test
    @DisplayName("Should reject a low threshold above the high threshold")
    void testLoAboveHi() {
        assertThrows(IllegalArgumentException.class,
                () -> PipelineOptions.builder().hiThreshold(0.6).loThreshold(0.7).build());
        assertDoesNotThrow(() -> PipelineOptions.builder().hiThreshold(0.7).loThreshold(0.7).build());
    }

    @Test
    @DisplayName("The problematic threshold should never exceed the low threshold")
    void testProblematicCappedByLo() {
        PipelineOptions options = PipelineOptions.builder()
                .loThreshold(0.3)
                .problematicThreshold(0.5)
                .build();

        assertEquals(0.3, options.getProblematicThreshold());
    }

    @Test
    @DisplayName("Should read prefixed properties and keep defaults for absent keys")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("reclassification.lo-threshold", "0.65");
        properties.setProperty("reclassification.problematic-labels", "Mercado, Salão de Beleza ,");
        properties.setProperty("reclassification.exclusion-policy", "drop");

        PipelineOptions options = PipelineOptions.fromProperties(properties);

        assertEquals(0.90, options.getHiThreshold());
        assertEquals(0.65, options.getLoThreshold());
        assertEquals(Set.of("Mercado", "Salão de Beleza"), options.getProblematicLabels());
        assertEquals(ExclusionPolicy.DROP, options.getExclusionPolicy());
    }

    @Test
    @DisplayName("Should fail on a non-numeric threshold property")
    void testInvalidProperty() {
        Properties properties = new Properties();
        properties.setProperty("reclassification.hi-threshold", "high");

        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.fromProperties(properties));
    }

    @Test
    @DisplayName("Should load options from a classpath resource")
    void testLoad() {
        PipelineOptions options = PipelineOptions.load("reclassification-test.properties");

        assertEquals(0.95, options.getHiThreshold());
        assertEquals(0.60, options.getLoThreshold());
        assertEquals(0.30, options.getProblematicThreshold());
        assertEquals(List.of("shopping", "galeria"), options.getAddressKeywords());
        assertFalse(options.isContainsUsesAddress());
        assertEquals(ExclusionPolicy.DROP, options.getExclusionPolicy());
        assertTrue(options.getProblematicLabels().contains("Salão de Beleza"));

        assertEquals(PipelineOptions.defaults().toString(),
                PipelineOptions.load("reclassification.properties").toString());
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.load("missing.properties"));
    }
}
