package io.codegraph.detectors;

import io.codegraph.barrel.BarrelAnalyzer;
import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CircularReexportDetectorTest {

    private GraphStore store;
    private CircularReexportDetector detector;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
        detector = new CircularReexportDetector(new BarrelAnalyzer(store));
        store.addNode(GraphNode.file("src/a/index.ts"));
        store.addNode(GraphNode.file("src/b/index.ts"));
    }

    @Test
    void detect_reportsBarrelLoopOnce() {
        store.addEdge(GraphEdge.reexports("src/a/index.ts", "src/b/index.ts"));
        store.addEdge(GraphEdge.reexports("src/b/index.ts", "src/a/index.ts"));

        assertThat(detector.detect(store, GraphConfig.empty()))
                .singleElement()
                .satisfies(issue -> assertThat(issue.kind()).isEqualTo(IssueKind.CIRCULAR_REEXPORT));
    }

    @Test
    void detect_ignoresImportLoops() {
        store.addEdge(GraphEdge.imports("src/a/index.ts", "src/b/index.ts"));
        store.addEdge(GraphEdge.imports("src/b/index.ts", "src/a/index.ts"));

        assertThat(detector.detect(store, GraphConfig.empty())).isEmpty();
    }
}
