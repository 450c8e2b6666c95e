package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UnreachableHandlerDetectorTest {

    private UnreachableHandlerDetector detector;
    private GraphStore store;
    private GraphConfig config;

    @BeforeEach
    void setUp() {
        detector = new UnreachableHandlerDetector();
        store = new GraphStore();
        config = GraphConfig.loadDefault();
    }

    @Test
    void id_returnsUnreachableHandler() {
        assertThat(detector.id()).isEqualTo("unreachable-handler");
    }

    @Test
    void detect_flagsExportingFileOutsideEntrypointClosure() {
        store.addNode(GraphNode.entrypoint("src/server.ts", "server"));
        store.addNode(GraphNode.file("src/server.ts", List.of("start")));
        store.addNode(GraphNode.file("src/routes.ts", List.of("router")));
        store.addNode(GraphNode.file("src/legacy.ts", List.of("a", "b", "c", "d")));
        store.addEdge(GraphEdge.imports("src/server.ts", "src/routes.ts"));

        List<GraphIssue> issues = detector.detect(store, config);

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.HANDLER_UNREACHABLE);
            assertThat(issue.filePath()).isEqualTo("src/legacy.ts");
            assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
            assertThat(issue.evidence().get(0)).isEqualTo("File exports 4 symbol(s): a, b, c...");
        });
    }

    @Test
    void detect_withoutEntrypoints_reportsNothing() {
        store.addNode(GraphNode.file("src/legacy.ts", List.of("a")));

        assertThat(detector.detect(store, config)).isEmpty();
    }

    @Test
    void detect_skipsTestsAndFilesWithoutExports() {
        store.addNode(GraphNode.entrypoint("src/main.ts", "cli"));
        store.addNode(GraphNode.file("src/main.test.ts", List.of("suite")));
        store.addNode(GraphNode.file("src/side-effect.ts"));

        assertThat(detector.detect(store, config)).isEmpty();
    }

    @Test
    void severityFor_scalesWithExportCount() {
        assertThat(UnreachableHandlerDetector.severityFor(1)).isEqualTo(IssueSeverity.INFO);
        assertThat(UnreachableHandlerDetector.severityFor(3)).isEqualTo(IssueSeverity.WARNING);
        assertThat(UnreachableHandlerDetector.severityFor(6)).isEqualTo(IssueSeverity.ERROR);
    }
}
