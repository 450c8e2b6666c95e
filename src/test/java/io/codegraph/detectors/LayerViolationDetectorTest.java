package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LayerViolationDetectorTest {

    private LayerViolationDetector detector;
    private GraphStore store;
    private GraphConfig config;

    @BeforeEach
    void setUp() {
        detector = new LayerViolationDetector();
        store = new GraphStore();
        String yaml = """
                layerRules:
                  - name: UI cannot import DB
                    from: "src/ui/**"
                    cannotImport: "src/db/**"
                    severity: warning
                    description: UI layer should not directly access database layer
                """;
        config = GraphConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void detect_flagsForbiddenImport() {
        store.addEdge(GraphEdge.imports("src/ui/page.tsx", "src/db/client.ts")
                .withMeta(Map.of(GraphEdge.META_LINE, 3)));
        store.addEdge(GraphEdge.imports("src/ui/page.tsx", "src/api/client.ts"));

        List<GraphIssue> issues = detector.detect(store, config);

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.LAYER_VIOLATION);
            assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
            assertThat(issue.message()).isEqualTo("UI layer should not directly access database layer");
            assertThat(issue.evidence()).contains("Source: src/ui/page.tsx:3", "Target: src/db/client.ts");
            assertThat(issue.line()).isEqualTo(3);
        });
    }

    @Test
    void detect_withoutRules_reportsNothing() {
        store.addEdge(GraphEdge.imports("src/ui/page.tsx", "src/db/client.ts"));

        assertThat(detector.detect(store, GraphConfig.empty())).isEmpty();
    }

    @Test
    void detect_ignoresReexports() {
        store.addEdge(GraphEdge.reexports("src/ui/index.ts", "src/db/client.ts"));

        assertThat(detector.detect(store, config)).isEmpty();
    }
}
