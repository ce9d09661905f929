package com.catalog.reclassification.bulk;

import com.catalog.reclassification.catalog.HeaderAliases;
import com.catalog.reclassification.core.model.Record;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the records to classify from CSV.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * ID,Nome,Categoria,Sub-Categoria,Endereço
 * 1,Salão Bella,Serviços,Cabeleireiro,Rua A 10
 * </pre>
 *
 * <p>Headers are resolved through {@link HeaderAliases}; only the name column is required.
 * A row with a blank name is still read, since the catalog can correct it from its
 * subcategory. Any other column is kept on the record as an attribute.</p>
 */
public class CsvRecordReader {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final HeaderAliases<InputField> aliases;

    public CsvRecordReader() {
        this(InputField.defaultAliases());
    }

    public CsvRecordReader(HeaderAliases<InputField> aliases) {
        this.aliases = aliases;
    }

    public ReadResult read(InputStream input) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    /**
     * @throws InputFormatException if the table has no name column
     */
    public ReadResult read(Reader reader) {
        List<Record> records = new ArrayList<>();
        List<String> extraColumns = new ArrayList<>();

        try (CSVParser parser = FORMAT.parse(reader)) {
            Map<InputField, String> columns = aliases.resolve(parser.getHeaderNames());
            List<InputField> missing = aliases.missingRequired(columns);
            if (!missing.isEmpty()) {
                throw new InputFormatException("Input table is missing required columns " + missing
                        + "; found headers " + parser.getHeaderNames());
            }

            Set<String> known = new HashSet<>(columns.values());
            for (String header : parser.getHeaderNames()) {
                if (header != null && !header.isBlank() && !known.contains(header)
                        && !extraColumns.contains(header)) {
                    extraColumns.add(header);
                }
            }

            for (CSVRecord row : parser) {
                Record.Builder builder = Record.builder()
                        .id(cell(row, columns.get(InputField.ID)))
                        .name(cell(row, columns.get(InputField.NAME)))
                        .category(cell(row, columns.get(InputField.CATEGORY)))
                        .subcategory(cell(row, columns.get(InputField.SUBCATEGORY)))
                        .address(cell(row, columns.get(InputField.ADDRESS)));
                for (String column : extraColumns) {
                    builder.attribute(column, cell(row, column));
                }
                records.add(builder.build());
            }
        } catch (IOException e) {
            log.error("input.read.failed error={}", e.getMessage());
            throw new UncheckedIOException("Failed to read input table", e);
        } catch (IllegalArgumentException e) {
            throw new InputFormatException("Malformed input table: " + e.getMessage(), e);
        }

        ReadResult result = new ReadResult(records, extraColumns);
        log.info("input.read result={}", result);
        return result;
    }

    private static String cell(CSVRecord row, String header) {
        if (header == null || !row.isSet(header)) {
            return "";
        }
        String value = row.get(header);
        return value != null ? value : "";
    }
}
