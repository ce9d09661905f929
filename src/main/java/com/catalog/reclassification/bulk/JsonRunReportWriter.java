package com.catalog.reclassification.bulk;

import com.catalog.reclassification.pipeline.KeepBacklog;
import com.catalog.reclassification.pipeline.ReclassificationResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Writes a JSON report of a run: the aggregate counts, the per-source and per-action
 * breakdowns and the Keep backlog for curators.
 */
public class JsonRunReportWriter {
    private static final Logger log = LoggerFactory.getLogger(JsonRunReportWriter.class);

    private final ObjectMapper objectMapper;

    public JsonRunReportWriter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(ReclassificationResult result, Writer writer) {
        try {
            objectMapper.writeValue(writer, toReport(result));
        } catch (IOException e) {
            log.error("report.write.failed runId={} error={}", result.runId(), e.getMessage());
            throw new UncheckedIOException("Failed to write run report", e);
        }
    }

    public void write(ReclassificationResult result, OutputStream output) {
        try {
            objectMapper.writeValue(output, toReport(result));
        } catch (IOException e) {
            log.error("report.write.failed runId={} error={}", result.runId(), e.getMessage());
            throw new UncheckedIOException("Failed to write run report", e);
        }
    }

    public String writeAsString(ReclassificationResult result) {
        try {
            return objectMapper.writeValueAsString(toReport(result));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize run report", e);
        }
    }

    static RunReport toReport(ReclassificationResult result) {
        return new RunReport(
                result.runId(),
                result.metrics().toMap(),
                result.metrics().bySource(),
                result.metrics().byAction(),
                KeepBacklog.summarize(result.full()));
    }

    public record RunReport(
            @JsonProperty("runId") String runId,
            @JsonProperty("metrics") Map<String, Long> metrics,
            @JsonProperty("bySource") Map<String, Long> bySource,
            @JsonProperty("byAction") Map<String, Long> byAction,
            @JsonProperty("keepBacklog") List<KeepBacklog.Entry> keepBacklog
    ) {}
}
