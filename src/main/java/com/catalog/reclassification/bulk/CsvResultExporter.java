package com.catalog.reclassification.bulk;

import com.catalog.reclassification.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Writes a result view as CSV in the deliverable column order.
 *
 * <p>Output format:</p>
 * <pre>
 * Nome,Cat Original,SubCat Original,Sub-Categoria,Categoria,fonte,acao,Endereço,confianca,SubCat Intermediaria,ID
 * Salão Bella,Serviços,Cabeleireiro,Salão de Beleza,Serviços,catalog,Correct,Rua A 10,0.9900,,1
 * </pre>
 *
 * <p>Record attributes follow as extra columns, in order of first appearance. An attribute
 * named like a deliverable column is not repeated.</p>
 */
public class CsvResultExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvResultExporter.class);

    static final String HEADER = "Nome,Cat Original,SubCat Original,Sub-Categoria,Categoria,"
            + "fonte,acao,Endereço,confianca,SubCat Intermediaria,ID";
    private static final Set<String> HEADER_COLUMNS = Set.copyOf(Arrays.asList(HEADER.split(",")));

    public ExportResult export(List<Record> records, OutputStream output) {
        return export(records, new OutputStreamWriter(output, StandardCharsets.UTF_8));
    }

    public ExportResult export(List<Record> records, Writer writer) {
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        long rows = 0;

        List<String> extraColumns = extraColumns(records);
        StringBuilder header = new StringBuilder(HEADER);
        for (String column : extraColumns) {
            header.append(',').append(csvEscape(column));
        }
        pw.println(header);

        for (Record record : records) {
            pw.printf(Locale.ROOT, "%s,%s,%s,%s,%s,%s,%s,%s,%.4f,%s,%s",
                    csvEscape(record.getName()),
                    csvEscape(record.getOriginalCategory()),
                    csvEscape(record.getOriginalSubcategory()),
                    csvEscape(record.getCurrentSubcategory()),
                    csvEscape(record.getCurrentCategory()),
                    csvEscape(record.getSource() != null ? record.getSource().getLabel() : null),
                    csvEscape(record.getAction() != null ? record.getAction().getLabel() : null),
                    csvEscape(record.getAddress()),
                    record.getConfidence(),
                    csvEscape(record.getIntermediateSubcategory()),
                    csvEscape(record.getId()));
            for (String column : extraColumns) {
                pw.print(',');
                pw.print(csvEscape(record.getAttributes().get(column)));
            }
            pw.println();
            rows++;
        }
        pw.flush();

        ExportResult result = new ExportResult(rows);
        log.info("export.completed result={}", result);
        return result;
    }

    private static List<String> extraColumns(List<Record> records) {
        Set<String> columns = new LinkedHashSet<>();
        for (Record record : records) {
            for (String column : record.getAttributes().keySet()) {
                if (!HEADER_COLUMNS.contains(column)) {
                    columns.add(column);
                }
            }
        }
        return new ArrayList<>(columns);
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
