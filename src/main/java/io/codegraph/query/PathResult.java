package io.codegraph.query;

import java.util.List;

/**
 * Outcome of a path query.
 *
 * @param from         Source reference as given
 * @param to           Target reference as given
 * @param connected    True when at least one path was found within the depth bound
 * @param shortestPath Hop count of the shortest path, null when not connected
 * @param paths        Paths ordered by length ascending
 * @param meta         Cost and truncation signal
 */
public record PathResult(
        String from,
        String to,
        boolean connected,
        Integer shortestPath,
        List<Path> paths,
        QueryMeta meta
) {
    public PathResult {
        paths = List.copyOf(paths);
    }

    /**
     * One path between the endpoints.
     *
     * @param nodes  Node paths from source to target
     * @param edges  Edge ids, one fewer than nodes
     * @param length Number of hops
     */
    public record Path(List<String> nodes, List<String> edges, int length) {
        public Path {
            nodes = List.copyOf(nodes);
            edges = List.copyOf(edges);
        }
    }

    static PathResult disconnected(String from, String to, QueryMeta meta) {
        return new PathResult(from, to, false, null, List.of(), meta);
    }

    PathResult withMeta(QueryMeta newMeta) {
        return new PathResult(from, to, connected, shortestPath, paths, newMeta);
    }
}
