package io.codegraph.graph;

import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

class ReachabilityAnalyzerTest {

    private GraphStore store;
    private ReachabilityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
        analyzer = new ReachabilityAnalyzer(store, EnumSet.of(EdgeKind.IMPORTS, EdgeKind.REEXPORTS));
        store.addEdge(GraphEdge.imports("routes.ts", "service.ts"));
        store.addEdge(GraphEdge.reexports("service.ts", "db.ts"));
        store.addEdge(GraphEdge.imports("worker.ts", "db.ts"));
        store.addEdge(GraphEdge.of("file:db.ts", "file:plugin.ts", EdgeKind.DYNAMIC, null));
    }

    @Test
    void reachableFrom_includesRootsAndFollowsConfiguredKinds() {
        assertThat(analyzer.reachableFrom(List.of("file:routes.ts")))
                .containsExactly("file:routes.ts", "file:service.ts", "file:db.ts");
    }

    @Test
    void dependentsByDepth_groupsByDistance() {
        SortedMap<Integer, List<String>> levels = analyzer.dependentsByDepth("file:db.ts", 5);

        assertThat(levels).containsExactly(
                Map.entry(1, List.of("file:service.ts", "file:worker.ts")),
                Map.entry(2, List.of("file:routes.ts")));
    }

    @Test
    void dependentsByDepth_respectsDepthBound() {
        assertThat(analyzer.dependentsByDepth("file:db.ts", 1)).containsOnlyKeys(1);
    }

    @Test
    void dependentsByDepth_unknownTarget_isEmpty() {
        assertThat(analyzer.dependentsByDepth("file:nope.ts", 3)).isEmpty();
    }
}
