package io.codegraph.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.codegraph.io.GraphJson;

import java.io.IOException;
import java.io.Writer;

/**
 * Formats query results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.mapper = GraphJson.createMapper(prettyPrint);
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(Object result, Writer writer) throws IOException {
        mapper.writeValue(writer, result);
        writer.write(System.lineSeparator());
        writer.flush();
    }
}
