package io.codegraph.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes graph snapshots as JSON.
 * <p>
 * The format is the data model as is: {@code {"nodes": [...], "edges": [...], "issues": [...]}}
 * with lowercase node and edge kinds. Unknown properties are ignored so newer crawlers can add
 * fields.
 */
public class GraphJson {

    private static final Logger log = LoggerFactory.getLogger(GraphJson.class);

    private final ObjectMapper mapper;

    public GraphJson() {
        this(true);
    }

    public GraphJson(boolean prettyPrint) {
        this.mapper = createMapper(prettyPrint);
    }

    /**
     * Mapper shared by snapshot files and JSON reports.
     */
    public static ObjectMapper createMapper(boolean prettyPrint) {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // Callers own the writers they pass in
        m.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    public GraphSnapshot read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid graph snapshot " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    public GraphSnapshot read(InputStream is) throws IOException {
        GraphSnapshot snapshot = mapper.readValue(is, GraphSnapshot.class);
        if (snapshot == null) {
            return new GraphSnapshot(null, null, null);
        }
        return snapshot;
    }

    /**
     * Reads a snapshot file and replaces the store's contents with it.
     */
    public void load(Path path, GraphStore store) throws IOException {
        GraphSnapshot snapshot = read(path);
        store.restore(snapshot);
        log.info("Loaded {} nodes, {} edges, {} issues from {}",
                snapshot.nodes().size(), snapshot.edges().size(), snapshot.issues().size(), path);
    }

    public void write(GraphSnapshot snapshot, Writer writer) throws IOException {
        mapper.writeValue(writer, snapshot);
    }

    public void write(GraphSnapshot snapshot, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(snapshot, writer);
        }
    }

    public String toJson(GraphSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph snapshot", e);
        }
    }
}
