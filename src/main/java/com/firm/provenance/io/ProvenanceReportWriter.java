package com.firm.provenance.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serialises {@link ProvenanceReport}s to JSON. Reports are write-only; there
 * is no reader.
 */
public final class ProvenanceReportWriter {
    private final ObjectWriter writer;

    public ProvenanceReportWriter() {
        this(true);
    }

    public ProvenanceReportWriter(boolean pretty) {
        ObjectMapper mapper = new ObjectMapper();
        this.writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    public String toJson(ProvenanceReport report) {
        try {
            return writer.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise report for " + report.getTargetResult(), e);
        }
    }

    /** Writes to {@code file}, creating parent directories. */
    public Path writeTo(ProvenanceReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        writer.writeValue(file.toFile(), report);
        return file;
    }
}
