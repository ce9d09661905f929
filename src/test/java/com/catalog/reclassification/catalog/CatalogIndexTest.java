package com.catalog.reclassification.catalog;

import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.rules.DefaultNormalizationRules;
import com.catalog.reclassification.rules.NormalizationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CatalogIndexTest {

    private final NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
    private CatalogIndex index;

    @BeforeEach
    void setUp() {
        Catalog catalog = Catalog.of(List.of(
                CatalogEntry.of("Cabeleireiro", "Salão de Beleza", "Serviços", engine),
                CatalogEntry.of("Barbearia", "Salão de Beleza", "Serviços", engine),
                CatalogEntry.of("Padaria", "Padaria", "Alimentação", engine),
                CatalogEntry.of("Tabacaria", "Excluir", "Outros", engine)));
        index = CatalogIndex.build(catalog, engine);
    }

    @Test
    @DisplayName("Should map normalized original labels to canonical labels")
    void testOriginalLookups() {
        assertEquals(Optional.of("Salão de Beleza"), index.canonicalForOriginal("cabeleireiro"));
        assertEquals(Optional.of("salao de beleza"), index.canonicalKeyForOriginal("barbearia"));
        assertEquals(Optional.empty(), index.canonicalForOriginal("Cabeleireiro"));
    }

    @Test
    @DisplayName("Should map canonical keys to owning category and pretty label")
    void testCanonicalLookups() {
        assertEquals(Optional.of("Serviços"), index.owningCategory("salao de beleza"));
        assertEquals(Optional.of("Salão de Beleza"), index.canonicalLabel("salao de beleza"));
        assertEquals(Optional.of("Alimentação"), index.owningCategoryOf("PADARIA"));
        assertTrue(index.owningCategoryOf("Floricultura").isEmpty());
    }

    @Test
    @DisplayName("Should list keys and labels in catalog order without duplicates")
    void testOrderedViews() {
        assertEquals(List.of("cabeleireiro", "barbearia", "padaria", "tabacaria"), index.originalKeys());
        assertEquals(List.of("salao de beleza", "padaria", "excluir"), index.canonicalKeys());
        assertEquals(List.of("Salão de Beleza", "Padaria", "Excluir"), index.canonicalLabels());
        assertEquals(List.of("Serviços", "Alimentação", "Outros"), index.categories());
    }

    @Test
    @DisplayName("A later entry should override an earlier mapping of the same original label")
    void testLastWriteWins() {
        Catalog catalog = Catalog.of(List.of(
                CatalogEntry.of("Bar", "Bar", "Alimentação", engine),
                CatalogEntry.of("Bar", "Restaurante", "Alimentação", engine)));
        CatalogIndex overridden = CatalogIndex.build(catalog, engine);

        assertEquals(Optional.of("Restaurante"), overridden.canonicalForOriginal("bar"));
        assertEquals(List.of("bar"), overridden.originalKeys());
    }

    @Test
    @DisplayName("An empty catalog should produce an empty index")
    void testEmptyCatalog() {
        CatalogIndex empty = CatalogIndex.build(Catalog.empty(), engine);
        assertTrue(empty.isEmpty());
        assertTrue(empty.originalKeys().isEmpty());
    }
}
