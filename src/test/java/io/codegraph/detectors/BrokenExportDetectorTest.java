package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BrokenExportDetectorTest {

    private final BrokenExportDetector detector = new BrokenExportDetector();

    @Test
    void detect_flagsReexportToMissingNode() {
        GraphStore store = new GraphStore();
        store.addNode(GraphNode.file("src/index.ts"));
        store.addNode(GraphNode.file("src/user.ts"));
        store.addEdge(GraphEdge.reexports("src/index.ts", "src/user.ts"));
        store.addEdge(GraphEdge.reexports("src/index.ts", "src/gone.ts"));
        store.addEdge(GraphEdge.imports("src/index.ts", "src/also-gone.ts"));

        assertThat(detector.detect(store, GraphConfig.empty())).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.BROKEN_EXPORT_CHAIN);
            assertThat(issue.severity()).isEqualTo(IssueSeverity.ERROR);
            assertThat(issue.title()).isEqualTo("Broken export in index.ts");
            assertThat(issue.symbol()).isEqualTo("file:src/gone.ts");
        });
    }
}
