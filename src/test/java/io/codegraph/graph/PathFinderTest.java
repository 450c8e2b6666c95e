package io.codegraph.graph;

import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathFinderTest {

    private GraphStore store;
    private PathFinder finder;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
        finder = new PathFinder(store);
    }

    @Test
    void findPaths_returnsShortestFirst() {
        // a -> b -> c -> d and a shortcut a -> d
        store.addEdge(GraphEdge.imports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.imports("b.ts", "c.ts"));
        store.addEdge(GraphEdge.imports("c.ts", "d.ts"));
        store.addEdge(GraphEdge.imports("a.ts", "d.ts"));

        PathFinder.Result result = finder.findPaths("file:a.ts", "file:d.ts", 5, 10);

        assertThat(result.paths()).extracting(PathFinder.FoundPath::length).containsExactly(1, 3);
        assertThat(result.paths().get(1).nodeIds())
                .containsExactly("file:a.ts", "file:b.ts", "file:c.ts", "file:d.ts");
        assertThat(result.truncated()).isFalse();
    }

    @Test
    void findPaths_depthBoundCutsLongerRoutes() {
        store.addEdge(GraphEdge.imports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.imports("b.ts", "c.ts"));
        store.addEdge(GraphEdge.imports("c.ts", "d.ts"));

        PathFinder.Result result = finder.findPaths("file:a.ts", "file:d.ts", 2, 10);

        assertThat(result.paths()).isEmpty();
        assertThat(result.maxDepthReached()).isTrue();
    }

    @Test
    void findPaths_stopsAtPathBudget() {
        store.addEdge(GraphEdge.imports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.imports("a.ts", "c.ts"));
        store.addEdge(GraphEdge.imports("b.ts", "d.ts"));
        store.addEdge(GraphEdge.imports("c.ts", "d.ts"));

        PathFinder.Result result = finder.findPaths("file:a.ts", "file:d.ts", 5, 1);

        assertThat(result.paths()).hasSize(1);
        assertThat(result.truncated()).isTrue();
    }

    @Test
    void findPaths_ignoresCyclesAndOtherEdgeKinds() {
        store.addEdge(GraphEdge.imports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.imports("b.ts", "a.ts"));
        store.addEdge(GraphEdge.reexports("b.ts", "c.ts"));

        assertThat(finder.findPaths("file:a.ts", "file:c.ts", 5, 5).paths()).isEmpty();

        PathFinder withReexports = new PathFinder(store, EnumSet.of(EdgeKind.IMPORTS, EdgeKind.REEXPORTS));
        assertThat(withReexports.findPaths("file:a.ts", "file:c.ts", 5, 5).paths()).hasSize(1);
    }

    @Test
    void findPaths_sameNodeIsZeroLengthPath() {
        PathFinder.Result result = finder.findPaths("file:a.ts", "file:a.ts", 3, 3);

        assertThat(result.paths()).singleElement()
                .satisfies(path -> assertThat(path.length()).isZero());
    }

    @Test
    void findPaths_rejectsNonPositiveBounds() {
        assertThatThrownBy(() -> finder.findPaths("file:a.ts", "file:b.ts", 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> finder.findPaths("file:a.ts", "file:b.ts", 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
