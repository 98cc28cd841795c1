package io.codeforesight.report;

import io.codeforesight.model.GateDecision;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Interface for gate report formatters.
 */
public interface Reporter {

    /**
     * Returns the format name ("console", "json", "html").
     */
    String format();

    /**
     * Writes the report to the given writer.
     */
    void write(GateDecision decision, Writer writer) throws IOException;

    /**
     * Writes the report to the given file path.
     */
    default void write(GateDecision decision, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(decision, writer);
        }
    }

    /**
     * Returns the report as a string.
     */
    default String toString(GateDecision decision) {
        try {
            StringWriter writer = new StringWriter();
            write(decision, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate report", e);
        }
    }
}
