package com.catalog.reclassification.catalog;

import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.rules.DefaultNormalizationRules;
import com.catalog.reclassification.rules.NormalizationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LabelSuggesterTest {

    private final NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
    private LabelSuggester suggester;

    @BeforeEach
    void setUp() {
        Catalog catalog = Catalog.of(List.of(
                CatalogEntry.of("Cabeleireiro", "Salão de Beleza", "Serviços", engine),
                CatalogEntry.of("Padaria", "Padaria", "Alimentação", engine),
                CatalogEntry.of("Confeitaria", "Padaria", "Alimentação", engine),
                CatalogEntry.of("Mercearia", "Mercado", "Alimentação", engine)));
        suggester = new LabelSuggester(CatalogIndex.build(catalog, engine));
    }

    @Test
    @DisplayName("An exact label, even behind a store prefix, should score 100")
    void testExactMatch() {
        List<LabelSuggestion> suggestions = suggester.suggest("Loja de Padaria", 3);

        assertEquals("Padaria", suggestions.get(0).label());
        assertEquals(100.0, suggestions.get(0).score());
    }

    @Test
    @DisplayName("Suggestions should be distinct, best first and capped at the limit")
    void testRankingAndLimit() {
        List<LabelSuggestion> suggestions = suggester.suggest("padarias", 2);

        assertEquals(2, suggestions.size());
        assertEquals("Padaria", suggestions.get(0).label());
        assertTrue(suggestions.get(0).score() >= suggestions.get(1).score());
        for (LabelSuggestion suggestion : suggestions) {
            assertTrue(suggestion.score() > 0.0 && suggestion.score() <= 100.0);
            assertEquals(suggestion.score(), Math.round(suggestion.score() * 10.0) / 10.0);
        }
    }

    @Test
    @DisplayName("Blank queries should yield no suggestion and a non-positive limit should fail")
    void testEdgeCases() {
        assertTrue(suggester.suggest("  ", 5).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> suggester.suggest("padaria", 0));
    }
}
