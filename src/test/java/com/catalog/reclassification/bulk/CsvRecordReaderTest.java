package com.catalog.reclassification.bulk;

import com.catalog.reclassification.core.model.Record;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvRecordReaderTest {

    private CsvRecordReader reader;

    @BeforeEach
    void setUp() {
        reader = new CsvRecordReader();
    }

    @Test
    @DisplayName("Should read every known column")
    void testReadAllColumns() {
        String csv = """
                ID,Nome,Categoria,Sub-Categoria,Endereço
                1,Studio Bella,Outros,Cabeleireiro,Rua A 10
                2,"Padaria Pão Quente",,,"Loja 12, Shopping Center"
                """;

        ReadResult result = reader.read(new StringReader(csv));

        assertEquals(2, result.records().size());
        assertTrue(result.extraColumns().isEmpty());
        Record first = result.records().get(0);
        assertEquals("1", first.getId());
        assertEquals("Studio Bella", first.getName());
        assertEquals("Outros", first.getOriginalCategory());
        assertEquals("Cabeleireiro", first.getOriginalSubcategory());
        assertEquals("Loja 12, Shopping Center", result.records().get(1).getAddress());
        assertEquals("", result.records().get(1).getOriginalSubcategory());
    }

    @Test
    @DisplayName("Missing optional columns should default to empty strings")
    void testOptionalColumns() {
        ReadResult result = reader.read(new ByteArrayInputStream(
                "Name\nStudio Bella\n".getBytes(StandardCharsets.UTF_8)));

        Record record = result.records().get(0);
        assertEquals("Studio Bella", record.getName());
        assertEquals("", record.getId());
        assertEquals("", record.getAddress());
        assertEquals("", record.getOriginalCategory());
    }

    @Test
    @DisplayName("Rows with a blank name should still be read")
    void testBlankName() {
        String csv = """
                ID,Nome,Sub-Categoria
                1,Studio Bella,Cabeleireiro
                2,,Padaria
                """;

        ReadResult result = reader.read(new StringReader(csv));

        assertEquals(2, result.records().size());
        Record blank = result.records().get(1);
        assertEquals("2", blank.getId());
        assertEquals("", blank.getName());
        assertEquals("Padaria", blank.getOriginalSubcategory());
    }

    @Test
    @DisplayName("Unknown columns should be kept as attributes in table order")
    void testExtraColumns() {
        String csv = """
                Nome,Ativo,Sub-Categoria,Porte,Latitude
                Studio Bella,Sim,Cabeleireiro,Pequeno,-23.55
                Padaria Central,Não,Padaria,,
                """;

        ReadResult result = reader.read(new StringReader(csv));

        assertEquals(List.of("Ativo", "Porte", "Latitude"), result.extraColumns());
        Record first = result.records().get(0);
        assertEquals(List.of("Ativo", "Porte", "Latitude"), List.copyOf(first.getAttributes().keySet()));
        assertEquals("Sim", first.getAttributes().get("Ativo"));
        assertEquals("-23.55", first.getAttributes().get("Latitude"));
        assertEquals("", result.records().get(1).getAttributes().get("Porte"));
        assertFalse(first.getAttributes().containsKey("Nome"));
    }

    @Test
    @DisplayName("A table without a name column should be rejected")
    void testMissingNameColumn() {
        String csv = """
                ID,Categoria
                1,Outros
                """;

        InputFormatException e = assertThrows(InputFormatException.class,
                () -> reader.read(new StringReader(csv)));
        assertTrue(e.getMessage().contains("NAME"));
    }
}
