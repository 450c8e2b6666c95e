package io.codegraph.graph;

import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;

import java.util.*;

/**
 * Finds simple directed paths between two nodes.
 * <p>
 * The finder runs a breadth-first search from the source, following only edges of the
 * configured kinds. Visited state is tracked per path rather than globally so that several
 * distinct routes to the target can be reported. Because the frontier is expanded level by
 * level, paths are discovered in non-decreasing length order.
 */
public class PathFinder {

    /**
     * Upper bound on dequeued states, keeps dense graphs from running away.
     */
    static final int MAX_EXPANSIONS = 200_000;

    private final GraphStore store;
    private final Set<EdgeKind> followKinds;

    /**
     * A path found by the search.
     *
     * @param nodeIds Node ids from source to target
     * @param edgeIds Edge ids, one fewer than nodes
     */
    public record FoundPath(List<String> nodeIds, List<String> edgeIds) {
        public FoundPath {
            nodeIds = List.copyOf(nodeIds);
            edgeIds = List.copyOf(edgeIds);
        }

        /**
         * Number of hops.
         */
        public int length() {
            return edgeIds.size();
        }
    }

    /**
     * Search outcome.
     *
     * @param paths           Paths ordered by length ascending
     * @param truncated       True when the search stopped because the path budget was used up
     * @param maxDepthReached True when at least one branch was cut by the depth bound
     */
    public record Result(List<FoundPath> paths, boolean truncated, boolean maxDepthReached) {
        public Result {
            paths = List.copyOf(paths);
        }
    }

    public PathFinder(GraphStore store) {
        this(store, EnumSet.of(EdgeKind.IMPORTS));
    }

    public PathFinder(GraphStore store, Set<EdgeKind> followKinds) {
        this.store = store;
        this.followKinds = followKinds.isEmpty() ? EnumSet.noneOf(EdgeKind.class) : EnumSet.copyOf(followKinds);
    }

    /**
     * Finds up to {@code maxPaths} simple paths of at most {@code maxDepth} hops.
     *
     * @param fromId   Source node id
     * @param toId     Target node id
     * @param maxDepth Maximum hops per path, at least 1
     * @param maxPaths Maximum number of paths, at least 1
     */
    public Result findPaths(String fromId, String toId, int maxDepth, int maxPaths) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        if (maxPaths < 1) {
            throw new IllegalArgumentException("maxPaths must be at least 1, got " + maxPaths);
        }
        record TraversalState(String node, List<String> nodes, List<String> edges, Set<String> onPath) {}

        List<FoundPath> found = new ArrayList<>();
        if (fromId.equals(toId)) {
            found.add(new FoundPath(List.of(fromId), List.of()));
            return new Result(found, false, false);
        }

        Queue<TraversalState> queue = new LinkedList<>();
        queue.add(new TraversalState(fromId, List.of(fromId), List.of(), Set.of(fromId)));
        boolean depthCut = false;
        boolean truncated = false;
        int expansions = 0;

        while (!queue.isEmpty()) {
            if (++expansions > MAX_EXPANSIONS) {
                truncated = true;
                break;
            }
            TraversalState state = queue.poll();
            int depth = state.edges().size();

            for (GraphEdge edge : store.getEdgesFrom(state.node())) {
                if (!followKinds.contains(edge.kind())) {
                    continue;
                }
                String next = edge.to();
                if (state.onPath().contains(next)) {
                    continue;
                }
                if (depth + 1 > maxDepth) {
                    depthCut = true;
                    continue;
                }

                List<String> nodes = append(state.nodes(), next);
                List<String> edges = append(state.edges(), edge.id());

                if (next.equals(toId)) {
                    found.add(new FoundPath(nodes, edges));
                    if (found.size() >= maxPaths) {
                        return new Result(found, true, depthCut);
                    }
                    continue;
                }

                Set<String> onPath = new HashSet<>(state.onPath());
                onPath.add(next);
                queue.add(new TraversalState(next, nodes, edges, onPath));
            }
        }

        return new Result(found, truncated, depthCut);
    }

    private static List<String> append(List<String> base, String value) {
        List<String> copy = new ArrayList<>(base.size() + 1);
        copy.addAll(base);
        copy.add(value);
        return copy;
    }
}
