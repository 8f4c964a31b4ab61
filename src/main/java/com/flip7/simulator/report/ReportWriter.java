package com.flip7.simulator.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes simulation reports and match traces as pretty-printed JSON.
 */
public class ReportWriter {
    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serialize any report object (a {@link SimulationReport} or a match trace) to a file.
     * Parent directories are created as needed.
     */
    public void write(Path path, Object report) throws ReportException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), report);
        } catch (IOException e) {
            throw new ReportException("Failed to write report to " + path + ": " + e.getMessage(), e);
        }
    }

    public String toJson(Object report) throws ReportException {
        try {
            return mapper.writeValueAsString(report);
        } catch (IOException e) {
            throw new ReportException("Failed to serialize report: " + e.getMessage(), e);
        }
    }
}
