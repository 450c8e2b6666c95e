package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.Confidence;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DynamicEdgeDetectorTest {

    private DynamicEdgeDetector detector;
    private GraphStore store;

    @BeforeEach
    void setUp() {
        detector = new DynamicEdgeDetector();
        store = new GraphStore();
    }

    @Test
    void detect_reportsDynamicKindAndFlaggedImports() {
        store.addNode(GraphNode.file("src/loader.ts"));
        store.addEdge(GraphEdge.of("file:src/loader.ts", "file:src/plugins", EdgeKind.DYNAMIC, Confidence.LOW)
                .withReason("import(`./plugins/${name}`)")
                .withMeta(Map.of(GraphEdge.META_LINE, 12)));
        store.addEdge(GraphEdge.imports("src/app.ts", "src/lazy.ts")
                .withMeta(Map.of(GraphEdge.META_IS_DYNAMIC, true)));
        store.addEdge(GraphEdge.imports("src/app.ts", "src/static.ts"));

        List<GraphIssue> issues = detector.detect(store, GraphConfig.empty());

        assertThat(issues).hasSize(2).allSatisfy(issue ->
                assertThat(issue.kind()).isEqualTo(IssueKind.DYNAMIC_EDGE_UNKNOWN));
        GraphIssue first = issues.get(0);
        assertThat(first.title()).isEqualTo("Dynamic import in loader.ts");
        assertThat(first.filePath()).isEqualTo("src/loader.ts");
        assertThat(first.line()).isEqualTo(12);
        assertThat(first.evidence().get(0)).contains("import(`./plugins/${name}`)");
        assertThat(issues.get(1).filePath()).isNull();
    }
}
