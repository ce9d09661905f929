package com.catalog.reclassification.catalog;

import com.catalog.reclassification.core.model.CatalogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.Reader;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvCatalogLoaderTest {

    private CsvCatalogLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CsvCatalogLoader();
    }

    @Test
    @DisplayName("Should load a single table with an owning category column")
    void testLoadSingleTable() {
        String csv = """
                SubCat Original,Nova SubCat,categoria_oficial
                Cabeleireiro,Salão de Beleza,Serviços
                "Padaria, Confeitaria",Padaria,Alimentação

                Tabacaria,Excluir,Outros
                """;

        Catalog catalog = loader.load(new StringReader(csv));

        assertEquals(3, catalog.size());
        CatalogEntry quoted = catalog.entries().get(1);
        assertEquals("Padaria, Confeitaria", quoted.originalLabel());
        assertEquals("padaria, confeitaria", quoted.kOriginal());
        assertTrue(catalog.entries().get(2).isExclusion());
    }

    @Test
    @DisplayName("Should fail when the table lacks a required column")
    void testMissingColumn() {
        String csv = """
                SubCat Original,categoria_oficial
                Cabeleireiro,Serviços
                """;

        assertThrows(CatalogFormatException.class, () -> loader.load(new StringReader(csv)));
    }

    @Test
    @DisplayName("Should load per-category tables and concatenate them in order")
    void testLoadCategoryTables() {
        Map<String, Reader> tables = new LinkedHashMap<>();
        tables.put("Alimentação", new StringReader("""
                SubCat_Original,Nova_SubCat
                Padaria,Padaria
                Mercearia,Mercado
                """));
        tables.put("Serviços", new StringReader("""
                SubCat_Original,Nova_SubCat
                Cabeleireiro,Salão de Beleza
                """));

        Catalog catalog = loader.loadCategoryTables(tables);

        assertEquals(3, catalog.size());
        assertEquals(List.of("Alimentação", "Alimentação", "Serviços"),
                catalog.entries().stream().map(CatalogEntry::owningCategory).toList());
    }
}
