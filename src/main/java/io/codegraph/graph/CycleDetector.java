package io.codegraph.graph;

import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;

import java.util.*;
import java.util.function.Function;

/**
 * Finds dependency cycles using Tarjan's strongly connected components algorithm.
 * <p>
 * Every component with more than one node is a cycle, as is a single node with an edge to
 * itself.
 */
public class CycleDetector {

    private final GraphStore store;
    private final Set<EdgeKind> followKinds;
    private final Function<String, List<String>> successorLookup;

    private int index;
    private final Map<String, Integer> indices = new HashMap<>();
    private final Map<String, Integer> lowLinks = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<List<String>> components = new ArrayList<>();

    /**
     * A detected cycle.
     *
     * @param nodeIds     Members of the strongly connected component
     * @param breakPoints Members with the most dependencies leaving the cycle, best
     *                    candidates for cutting it
     */
    public record Cycle(List<String> nodeIds, List<String> breakPoints) {
        public Cycle {
            nodeIds = List.copyOf(nodeIds);
            breakPoints = List.copyOf(breakPoints);
        }

        public int size() {
            return nodeIds.size();
        }
    }

    public CycleDetector(GraphStore store, Set<EdgeKind> followKinds) {
        this.store = store;
        this.followKinds = EnumSet.copyOf(followKinds);
        this.successorLookup = this::successors;
    }

    private CycleDetector(Function<String, List<String>> successors) {
        this.store = null;
        this.followKinds = EnumSet.noneOf(EdgeKind.class);
        this.successorLookup = successors;
    }

    /**
     * Returns the strongly connected components reachable from {@code nodes} in an arbitrary
     * graph, single-node components included.
     */
    public static List<List<String>> components(Collection<String> nodes, Function<String, List<String>> successors) {
        CycleDetector detector = new CycleDetector(successors);
        for (String node : nodes) {
            if (!detector.indices.containsKey(node)) {
                detector.strongConnect(node);
            }
        }
        return List.copyOf(detector.components);
    }

    /**
     * Returns every cycle in the graph. Node order inside a cycle follows the search.
     */
    public List<Cycle> findCycles() {
        index = 0;
        indices.clear();
        lowLinks.clear();
        stack.clear();
        onStack.clear();
        components.clear();

        for (GraphEdge edge : store.getAllEdges()) {
            if (followKinds.contains(edge.kind()) && !indices.containsKey(edge.from())) {
                strongConnect(edge.from());
            }
        }

        List<Cycle> cycles = new ArrayList<>();
        for (List<String> component : components) {
            if (component.size() > 1 || hasSelfLoop(component.get(0))) {
                cycles.add(new Cycle(component, breakPoints(component)));
            }
        }
        return cycles;
    }

    private void strongConnect(String start) {
        // Iterative form; deep import chains would overflow the call stack
        record Frame(String node, Iterator<String> successors) {}

        Deque<Frame> callStack = new ArrayDeque<>();
        visit(start);
        callStack.push(new Frame(start, successorLookup.apply(start).iterator()));

        while (!callStack.isEmpty()) {
            Frame frame = callStack.peek();
            if (frame.successors().hasNext()) {
                String next = frame.successors().next();
                if (!indices.containsKey(next)) {
                    visit(next);
                    callStack.push(new Frame(next, successorLookup.apply(next).iterator()));
                } else if (onStack.contains(next)) {
                    lowLinks.put(frame.node(), Math.min(lowLinks.get(frame.node()), indices.get(next)));
                }
                continue;
            }

            callStack.pop();
            String node = frame.node();
            if (!callStack.isEmpty()) {
                String parent = callStack.peek().node();
                lowLinks.put(parent, Math.min(lowLinks.get(parent), lowLinks.get(node)));
            }
            if (lowLinks.get(node).equals(indices.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                Collections.reverse(component);
                components.add(component);
            }
        }
    }

    private void visit(String node) {
        indices.put(node, index);
        lowLinks.put(node, index);
        index++;
        stack.push(node);
        onStack.add(node);
    }

    private List<String> successors(String node) {
        List<String> result = new ArrayList<>();
        for (GraphEdge edge : store.getEdgesFrom(node)) {
            if (followKinds.contains(edge.kind())) {
                result.add(edge.to());
            }
        }
        return result;
    }

    private boolean hasSelfLoop(String node) {
        return successors(node).contains(node);
    }

    private List<String> breakPoints(List<String> component) {
        Set<String> members = new HashSet<>(component);
        return component.stream()
                .sorted(Comparator.comparingLong((String node) -> successors(node).stream()
                        .filter(target -> !members.contains(target))
                        .count()).reversed())
                .limit(3)
                .toList();
    }
}
