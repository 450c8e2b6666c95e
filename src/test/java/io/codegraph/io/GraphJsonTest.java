package io.codegraph.io;

import io.codegraph.graph.GraphStore;
import io.codegraph.model.Confidence;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.GraphSnapshot;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import io.codegraph.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphJsonTest {

    private static final String MINIMAL = """
            {
              "nodes": [
                {"id": "file:src/a.ts", "kind": "file", "path": "src/a.ts", "meta": {"exports": ["foo", "bar"]}},
                {"id": "file:src/b.ts", "kind": "file", "path": "src/b.ts", "crawlerVersion": 7}
              ],
              "edges": [
                {"id": "e1", "from": "file:src/a.ts", "to": "file:src/b.ts", "kind": "imports", "confidence": "medium"}
              ],
              "issues": [
                {"id": "i1", "kind": "ORPHAN_EXPORT", "severity": "warning", "nodeId": "file:src/a.ts",
                 "title": "Unused export foo", "meta": {"filePath": "src/a.ts", "symbol": "foo"}}
              ]
            }
            """;

    @TempDir
    Path tempDir;

    private GraphJson json;

    @BeforeEach
    void setUp() {
        json = new GraphJson();
    }

    @Test
    void read_parsesLowercaseKindsAndLabels() throws IOException {
        Path file = write("graph.json", MINIMAL);

        GraphSnapshot snapshot = json.read(file);

        assertThat(snapshot.nodes()).hasSize(2);
        GraphNode a = snapshot.nodes().get(0);
        assertThat(a.kind()).isEqualTo(NodeKind.FILE);
        assertThat(a.name()).isEqualTo("a.ts");
        assertThat(a.exports()).contains(List.of("foo", "bar"));

        GraphEdge edge = snapshot.edges().get(0);
        assertThat(edge.kind()).isEqualTo(EdgeKind.IMPORTS);
        assertThat(edge.confidence()).isEqualTo(Confidence.MEDIUM);

        GraphIssue issue = snapshot.issues().get(0);
        assertThat(issue.kind()).isEqualTo(IssueKind.ORPHAN_EXPORT);
        assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
        assertThat(issue.filePath()).isEqualTo("src/a.ts");
    }

    @Test
    void read_ignoresUnknownPropertiesAndMissingSections() throws IOException {
        Path file = write("graph.json", "{\"nodes\": [], \"generator\": \"crawler\"}");

        GraphSnapshot snapshot = json.read(file);

        assertThat(snapshot.nodes()).isEmpty();
        assertThat(snapshot.edges()).isEmpty();
        assertThat(snapshot.issues()).isEmpty();
    }

    @Test
    void read_invalidJson_throwsIOException() throws IOException {
        Path file = write("broken.json", "{\"nodes\": [");

        assertThatThrownBy(() -> json.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid graph snapshot");
    }

    @Test
    void read_unknownEdgeKind_isRejected() throws IOException {
        Path file = write("graph.json",
                "{\"edges\": [{\"id\": \"e\", \"from\": \"file:a\", \"to\": \"file:b\", \"kind\": \"teleports\"}]}");

        assertThatThrownBy(() -> json.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid graph snapshot");
    }

    @Test
    void load_replacesStoreContents() throws IOException {
        GraphStore store = new GraphStore();
        store.addNode(GraphNode.file("src/stale.ts"));
        Path file = write("graph.json", MINIMAL);

        json.load(file, store);

        assertThat(store.hasNode("file:src/stale.ts")).isFalse();
        assertThat(store.nodeCount()).isEqualTo(2);
        assertThat(store.edgeCount()).isEqualTo(1);
        assertThat(store.getEdgesTo("file:src/b.ts")).hasSize(1);
        assertThat(store.getIssuesByKind(IssueKind.ORPHAN_EXPORT)).hasSize(1);
    }

    @Test
    void write_thenRead_preservesSnapshot() throws IOException {
        GraphSnapshot snapshot = new GraphSnapshot(
                List.of(GraphNode.file("src/a.ts", List.of("foo")), GraphNode.entrypoint("src/api.ts", "route")),
                List.of(GraphEdge.reexports("src/index.ts", "src/a.ts")),
                List.of(GraphIssue.builder()
                        .id("orphan:src/a.ts:foo")
                        .kind(IssueKind.ORPHAN_EXPORT)
                        .title("Unused export foo")
                        .filePath("src/a.ts")
                        .symbol("foo")
                        .build()));
        Path file = tempDir.resolve("out.json");

        json.write(snapshot, file);

        assertThat(json.read(file)).isEqualTo(snapshot);
    }

    @Test
    void toJson_usesLowercaseKinds() {
        GraphSnapshot snapshot = new GraphSnapshot(
                List.of(GraphNode.file("src/a.ts")),
                List.of(GraphEdge.imports("src/a.ts", "src/b.ts")),
                null);

        String text = json.toJson(snapshot);

        assertThat(text).contains("\"kind\" : \"file\"", "\"kind\" : \"imports\"");
    }

    @Test
    void write_doesNotCloseCallerWriter() throws IOException {
        StringWriter writer = new StringWriter();

        json.write(new GraphSnapshot(null, null, null), writer);
        writer.write("\n");

        assertThat(writer.toString()).contains("\"nodes\"").endsWith("\n");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
