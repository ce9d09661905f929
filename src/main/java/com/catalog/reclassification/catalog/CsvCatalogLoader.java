package com.catalog.reclassification.catalog;

import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.logging.LogContext;
import com.catalog.reclassification.rules.DefaultNormalizationRules;
import com.catalog.reclassification.rules.NormalizationEngine;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads catalog snapshots from CSV.
 *
 * <p>Two layouts are accepted:</p>
 * <pre>
 * SubCat Original,Nova SubCat,categoria_oficial
 * Cabeleireiro,Salão de Beleza,Serviços
 * </pre>
 * <p>or one table per category, where the caller names the category and the table only
 * carries the label columns:</p>
 * <pre>
 * SubCat_Original,Nova_SubCat
 * Cabeleireiro,Salão de Beleza
 * </pre>
 * <p>Headers are resolved through {@link HeaderAliases}; a table lacking a required column
 * fails with {@link CatalogFormatException}.</p>
 */
public class CsvCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvCatalogLoader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final HeaderAliases<CatalogField> aliases;
    private final NormalizationEngine engine;

    public CsvCatalogLoader() {
        this(HeaderAliases.catalogDefaults(), DefaultNormalizationRules.createDefaultEngine());
    }

    public CsvCatalogLoader(HeaderAliases<CatalogField> aliases, NormalizationEngine engine) {
        this.aliases = aliases;
        this.engine = engine;
    }

    /**
     * Loads a table that carries the owning category as a column.
     */
    public Catalog load(Reader reader) {
        try (LogContext ctx = LogContext.forCatalogLoad("csv")) {
            Table table = read(reader);
            Catalog catalog = Catalog.fromRows(table.headers(), table.rows(), aliases, engine);
            log.info("catalog.loaded entries={}", catalog.size());
            return catalog;
        }
    }

    /**
     * Loads a single-category table.
     */
    public Catalog loadCategoryTable(String category, Reader reader) {
        try (LogContext ctx = LogContext.forCatalogLoad(category)) {
            Table table = read(reader);
            Catalog catalog = Catalog.fromCategoryRows(category, table.headers(), table.rows(), aliases, engine);
            log.info("catalog.loaded category='{}' entries={}", category, catalog.size());
            return catalog;
        }
    }

    /**
     * Loads several single-category tables, concatenated in the map's iteration order.
     */
    public Catalog loadCategoryTables(Map<String, Reader> tables) {
        List<CatalogEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Reader> table : tables.entrySet()) {
            entries.addAll(loadCategoryTable(table.getKey(), table.getValue()).entries());
        }
        return Catalog.of(entries);
    }

    private Table read(Reader reader) {
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                for (String header : headers) {
                    row.put(header, record.isSet(header) ? record.get(header) : "");
                }
                rows.add(row);
            }
            return new Table(headers, rows);
        } catch (IOException e) {
            log.error("catalog.read.failed error={}", e.getMessage());
            throw new UncheckedIOException("Failed to read catalog table", e);
        } catch (IllegalArgumentException e) {
            throw new CatalogFormatException("Malformed catalog table: " + e.getMessage(), e);
        }
    }

    private record Table(List<String> headers, List<Map<String, String>> rows) {}
}
