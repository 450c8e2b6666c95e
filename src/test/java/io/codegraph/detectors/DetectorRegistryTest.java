package io.codegraph.detectors;

import io.codegraph.barrel.BarrelAnalyzer;
import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DetectorRegistryTest {

    private GraphStore store;
    private DetectorRegistry registry;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
        registry = DetectorRegistry.createDefault(new BarrelAnalyzer(store));

        store.addNode(GraphNode.file("src/a/index.ts"));
        store.addNode(GraphNode.file("src/b/index.ts"));
        store.addEdge(GraphEdge.reexports("src/a/index.ts", "src/b/index.ts"));
        store.addEdge(GraphEdge.reexports("src/b/index.ts", "src/a/index.ts"));
        store.addEdge(GraphEdge.reexports("src/a/index.ts", "src/missing.ts"));
        store.addEdge(GraphEdge.imports("src/x.ts", "src/y.ts"));
        store.addEdge(GraphEdge.imports("src/y.ts", "src/x.ts"));
    }

    @Test
    void createDefault_registersAllDetectors() {
        assertThat(registry.allDetectors()).extracting(Detector::id).containsExactly(
                "unreachable-handler", "dynamic-edge", "broken-export",
                "circular-dependency", "circular-reexport", "layer-violation");
        assertThat(registry.getById("broken-export")).isPresent();
        assertThat(registry.getById("nope")).isEmpty();
    }

    @Test
    void analyze_replacesStoreIssues() {
        store.setIssues(List.of(GraphIssue.builder().id("stale").kind(IssueKind.CYCLE_RISK).build()));

        List<GraphIssue> issues = registry.analyze(store, GraphConfig.empty());

        assertThat(issues).extracting(GraphIssue::kind).containsExactlyInAnyOrder(
                IssueKind.BROKEN_EXPORT_CHAIN, IssueKind.CIRCULAR_DEPENDENCY, IssueKind.CIRCULAR_REEXPORT);
        assertThat(store.getIssues()).isEqualTo(issues);
    }

    @Test
    void runAll_skipsDisabledDetectors() {
        GraphConfig config = GraphConfig.load(new ByteArrayInputStream(
                "disabledDetectors: [circular-dependency]".getBytes(StandardCharsets.UTF_8)));

        assertThat(registry.runAll(store, config)).extracting(GraphIssue::kind)
                .doesNotContain(IssueKind.CIRCULAR_DEPENDENCY);
    }

    @Test
    void run_selectsById() {
        assertThat(registry.run(store, GraphConfig.empty(), Set.of("circular-reexport")))
                .extracting(GraphIssue::kind).containsOnly(IssueKind.CIRCULAR_REEXPORT);
    }

    @Test
    void analyze_deduplicatesById() {
        DetectorRegistry doubled = DetectorRegistry.of(new BrokenExportDetector(), new BrokenExportDetector());

        assertThat(doubled.analyze(store, GraphConfig.empty())).hasSize(1);
    }
}
