package io.codegraph.graph;

import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;

import java.util.*;

/**
 * Breadth-first reachability over selected edge kinds, forwards or backwards.
 */
public class ReachabilityAnalyzer {

    private final GraphStore store;
    private final Set<EdgeKind> followKinds;

    public ReachabilityAnalyzer(GraphStore store, Set<EdgeKind> followKinds) {
        this.store = store;
        this.followKinds = EnumSet.copyOf(followKinds);
    }

    /**
     * Returns every node id reachable from the roots by following edges forwards.
     * The roots themselves are included.
     */
    public Set<String> reachableFrom(Collection<String> roots) {
        Set<String> reachable = new LinkedHashSet<>();
        Queue<String> workQueue = new LinkedList<>();

        for (String root : roots) {
            if (reachable.add(root)) {
                workQueue.add(root);
            }
        }

        while (!workQueue.isEmpty()) {
            String current = workQueue.poll();
            for (GraphEdge edge : store.getEdgesFrom(current)) {
                if (followKinds.contains(edge.kind()) && reachable.add(edge.to())) {
                    workQueue.add(edge.to());
                }
            }
        }

        return reachable;
    }

    /**
     * Walks edges backwards from the target and groups the nodes that depend on it by
     * distance. Level 1 holds direct dependents. The target is never included.
     *
     * @param targetId Node to start from
     * @param maxDepth Maximum distance to explore
     * @return Dependents per distance, in discovery order; empty levels are omitted
     */
    public SortedMap<Integer, List<String>> dependentsByDepth(String targetId, int maxDepth) {
        SortedMap<Integer, List<String>> levels = new TreeMap<>();
        Set<String> seen = new HashSet<>();
        seen.add(targetId);
        List<String> frontier = List.of(targetId);

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            List<String> next = new ArrayList<>();
            for (String node : frontier) {
                for (GraphEdge edge : store.getEdgesTo(node)) {
                    if (followKinds.contains(edge.kind()) && seen.add(edge.from())) {
                        next.add(edge.from());
                    }
                }
            }
            if (!next.isEmpty()) {
                levels.put(depth, List.copyOf(next));
            }
            frontier = next;
        }

        return levels;
    }
}
