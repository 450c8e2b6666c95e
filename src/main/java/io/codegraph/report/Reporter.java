package io.codegraph.report;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Interface for query result output formatters.
 */
public interface Reporter {

    /**
     * Returns the format name (e.g., "console", "json").
     */
    String format();

    /**
     * Writes a query result to the given writer.
     *
     * @throws IllegalArgumentException if the result type is not supported
     */
    void write(Object result, Writer writer) throws IOException;

    /**
     * Writes a query result to the given file path.
     */
    default void write(Object result, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(result, writer);
        }
    }

    /**
     * Returns the rendered result as a string.
     */
    default String toString(Object result) {
        try {
            StringWriter writer = new StringWriter();
            write(result, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render result", e);
        }
    }
}
