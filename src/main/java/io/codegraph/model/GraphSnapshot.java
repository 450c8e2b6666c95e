package io.codegraph.model;

import java.util.List;

/**
 * Serializable view of a graph: everything needed to rebuild a store.
 */
public record GraphSnapshot(
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        List<GraphIssue> issues
) {
    public GraphSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
