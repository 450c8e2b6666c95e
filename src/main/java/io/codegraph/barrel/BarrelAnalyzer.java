package io.codegraph.barrel;

import io.codegraph.graph.CycleDetector;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.Confidence;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import io.codegraph.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Detects barrel files and checks the integrity of re-exports.
 * <p>
 * Per-file analyses are cached by path and content. The cache is a disposable view: the
 * {@link GraphStore} stays authoritative for re-export edges, and callers invalidate the cache
 * explicitly with {@link #clearCache()} or {@link #clearFileCache(String)}.
 */
public class BarrelAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BarrelAnalyzer.class);

    static final int DEFAULT_MAX_DEPTH = 10;

    static final List<String> INDEX_EXTENSIONS = List.of("ts", "tsx", "js", "jsx", "mjs", "cjs");

    private static final int AVAILABLE_EXPORTS_SHOWN = 5;

    /**
     * Upper bound on reported re-export cycles; dense components have exponentially many.
     */
    public static final int MAX_REEXPORT_CYCLES = 1000;

    private record CacheEntry(String content, BarrelAnalysis analysis) {}

    private final GraphStore store;
    private final Map<String, CacheEntry> cache = new LinkedHashMap<>();

    public BarrelAnalyzer(GraphStore store) {
        this.store = store;
    }

    /**
     * Parses the re-export statements of one file.
     * <p>
     * Calling again with an equal content string returns the same instance. Different content
     * for the same path produces a fresh analysis which replaces the cached one.
     */
    public BarrelAnalysis analyzeFile(String path, String content) {
        CacheEntry cached = cache.get(path);
        if (cached != null && cached.content().equals(content)) {
            log.debug("Barrel cache hit for {}", path);
            return cached.analysis();
        }

        List<ReexportEntry> reexports = ReexportParser.parse(content);
        BarrelAnalysis analysis = new BarrelAnalysis(path, isIndexFile(path) && !reexports.isEmpty(), reexports);
        cache.put(path, new CacheEntry(content, analysis));
        return analysis;
    }

    /**
     * Returns true if the basename is {@code index} with a JavaScript or TypeScript extension.
     */
    public static boolean isIndexFile(String path) {
        String name = GraphNode.basename(path);
        if (name == null) {
            return false;
        }
        for (String extension : INDEX_EXTENSIONS) {
            if (name.equals("index." + extension)) {
                return true;
            }
        }
        return false;
    }

    // ---- chain tracing ----

    public ReexportChain traceReexportChain(String startPath, String symbol) {
        return traceReexportChain(startPath, symbol, DEFAULT_MAX_DEPTH);
    }

    /**
     * Follows re-export edges from {@code startPath} towards the file that defines {@code symbol}.
     * <p>
     * When the cached analysis of a file names the symbol, the edge for that statement is
     * preferred; otherwise the first re-export edge is taken. The walk stops at a file without
     * re-export edges, at a target missing from the graph, at {@code maxDepth}, or when a file
     * repeats.
     *
     * @param symbol Symbol to trace, {@code *} for any
     * @throws IllegalArgumentException if {@code symbol} is blank or {@code maxDepth < 1}
     */
    public ReexportChain traceReexportChain(String startPath, String symbol, int maxDepth) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }

        List<String> chain = new ArrayList<>();
        chain.add(startPath);
        Set<String> visited = new HashSet<>();
        visited.add(startPath);
        String current = startPath;
        int depth = 0;

        while (depth < maxDepth) {
            Optional<GraphNode> node = store.getNodeByPath(current);
            if (node.isEmpty()) {
                break;
            }
            Optional<GraphEdge> next = selectReexportEdge(node.get(), symbol);
            if (next.isEmpty()) {
                break;
            }
            Optional<GraphNode> target = store.getNode(next.get().to());
            if (target.isEmpty() || target.get().path() == null) {
                break;
            }

            String targetPath = target.get().path();
            chain.add(targetPath);
            depth++;
            if (!visited.add(targetPath)) {
                return new ReexportChain(startPath, symbol, chain, depth, true);
            }
            current = targetPath;
        }

        return new ReexportChain(startPath, symbol, chain, depth, false);
    }

    private Optional<GraphEdge> selectReexportEdge(GraphNode node, String symbol) {
        List<GraphEdge> reexportEdges = store.getEdgesFrom(node.id()).stream()
                .filter(e -> e.kind() == EdgeKind.REEXPORTS)
                .toList();
        if (reexportEdges.isEmpty()) {
            return Optional.empty();
        }

        CacheEntry cached = cache.get(node.path());
        if (cached != null && !"*".equals(symbol)) {
            List<String> sources = new ArrayList<>();
            // named statements first, they are the precise answer
            cached.analysis().reexports().stream()
                    .filter(r -> !r.wildcard() && r.symbols().contains(symbol))
                    .forEach(r -> sources.add(r.source()));
            cached.analysis().reexports().stream()
                    .filter(ReexportEntry::wildcard)
                    .forEach(r -> sources.add(r.source()));
            for (String source : sources) {
                for (GraphEdge edge : reexportEdges) {
                    if (source.equals(edge.importPath())) {
                        return Optional.of(edge);
                    }
                }
            }
        }
        return Optional.of(reexportEdges.get(0));
    }

    // ---- validation ----

    /**
     * Checks every named re-export of a file against the graph.
     * <p>
     * A source that cannot be resolved yields one issue. A resolved source with a known export
     * list yields one issue per re-exported symbol it lacks. Wildcards are never reported, and
     * non-relative (package) specifiers are only checked when a module node exists for them.
     */
    public List<GraphIssue> validateReexports(String path, String content) {
        BarrelAnalysis analysis = analyzeFile(path, content);
        List<GraphIssue> issues = new ArrayList<>();
        String nodeId = GraphNode.idFor(NodeKind.FILE, path);

        for (ReexportEntry reexport : analysis.reexports()) {
            if (reexport.wildcard()) {
                continue;
            }

            Optional<GraphNode> sourceNode = resolveSource(path, reexport.source());
            if (sourceNode.isEmpty()) {
                if (!isRelative(reexport.source())) {
                    log.debug("Skipping package re-export {} in {}", reexport.source(), path);
                    continue;
                }
                issues.add(GraphIssue.builder()
                        .id("issue:broken-reexport:" + path + ":" + reexport.source())
                        .kind(IssueKind.BROKEN_EXPORT_CHAIN)
                        .severity(IssueSeverity.ERROR)
                        .nodeId(nodeId)
                        .title("Re-export source not found: " + reexport.source())
                        .evidence(List.of(
                                "Barrel file re-exports from '" + reexport.source() + "'",
                                "Source file could not be resolved"))
                        .suggestedFix("Check that the source file exists and the import path is correct")
                        .filePath(path)
                        .symbol(reexport.source())
                        .line(reexport.line())
                        .build());
                continue;
            }

            Optional<List<String>> knownExports = sourceNode.get().exports();
            if (knownExports.isEmpty()) {
                continue;
            }
            List<String> available = knownExports.get();
            for (String symbol : reexport.symbols()) {
                if (!available.contains(symbol)) {
                    issues.add(missingExport(path, nodeId, reexport, symbol, sourceNode.get().path(), available));
                }
            }
        }

        return issues;
    }

    private static GraphIssue missingExport(String path, String nodeId, ReexportEntry reexport, String symbol,
                                            String sourcePath, List<String> available) {
        String shown = String.join(", ", available.subList(0, Math.min(AVAILABLE_EXPORTS_SHOWN, available.size())));
        if (available.size() > AVAILABLE_EXPORTS_SHOWN) {
            shown += "...";
        }
        return GraphIssue.builder()
                .id("issue:missing-export:" + path + ":" + symbol)
                .kind(IssueKind.BROKEN_EXPORT_CHAIN)
                .severity(IssueSeverity.ERROR)
                .nodeId(nodeId)
                .title("Re-exported symbol '" + symbol + "' not found in source")
                .evidence(List.of(
                        "Barrel re-exports '" + symbol + "' from '" + reexport.source() + "'",
                        "Source file does not export '" + symbol + "'",
                        "Available exports: " + shown))
                .suggestedFix("Add 'export { " + symbol + " }' to the source file or fix the name in the re-export")
                .filePath(path)
                .symbol(symbol)
                .line(reexport.line())
                .meta(GraphIssue.META_TARGET_PATH, sourcePath)
                .build();
    }

    /**
     * Finds the node a re-export specifier points at: first through an existing re-export edge
     * recorded with the same specifier, then by resolving the relative path against the graph.
     */
    Optional<GraphNode> resolveSource(String fromPath, String specifier) {
        Optional<GraphNode> fromNode = store.getNodeByPath(fromPath);
        if (fromNode.isPresent()) {
            for (GraphEdge edge : store.getEdgesFrom(fromNode.get().id())) {
                if (edge.kind() == EdgeKind.REEXPORTS && specifier.equals(edge.importPath())) {
                    Optional<GraphNode> target = store.getNode(edge.to());
                    if (target.isPresent()) {
                        return target;
                    }
                }
            }
        }

        if (!isRelative(specifier)) {
            return store.getNode(GraphNode.idFor(NodeKind.MODULE, specifier));
        }

        String base = resolveRelative(fromPath, specifier);
        for (String candidate : candidates(base)) {
            Optional<GraphNode> node = store.getNode(GraphNode.idFor(NodeKind.FILE, candidate));
            if (node.isPresent()) {
                return node;
            }
        }
        return Optional.empty();
    }

    private static List<String> candidates(String base) {
        List<String> candidates = new ArrayList<>();
        candidates.add(base);
        for (String extension : INDEX_EXTENSIONS) {
            candidates.add(base + "." + extension);
        }
        for (String extension : INDEX_EXTENSIONS) {
            candidates.add(base + "/index." + extension);
        }
        return candidates;
    }

    static boolean isRelative(String specifier) {
        return specifier.startsWith("./") || specifier.startsWith("../") || specifier.equals(".")
                || specifier.equals("..");
    }

    /**
     * Resolves a relative specifier against the directory of {@code fromPath}, normalizing
     * {@code .} and {@code ..} segments.
     */
    static String resolveRelative(String fromPath, String specifier) {
        Deque<String> segments = new ArrayDeque<>();
        String normalizedFrom = fromPath.replace('\\', '/');
        int slash = normalizedFrom.lastIndexOf('/');
        if (slash > 0) {
            for (String part : normalizedFrom.substring(0, slash).split("/")) {
                if (!part.isEmpty()) {
                    segments.addLast(part);
                }
            }
        }
        for (String part : specifier.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                if (!segments.isEmpty()) {
                    segments.removeLast();
                }
            } else {
                segments.addLast(part);
            }
        }
        return String.join("/", segments);
    }

    // ---- cycles ----

    /**
     * Finds cycles of files re-exporting each other, across the whole graph.
     * <p>
     * Strongly connected components over re-export edges come from {@link CycleDetector}; the
     * elementary cycles inside each component are enumerated with Johnson's algorithm, so every
     * distinct cycle is reported once whatever the edge order. A file re-exporting itself is a
     * cycle of one. Enumeration stops after {@link #MAX_REEXPORT_CYCLES} cycles.
     */
    public List<GraphIssue> detectCircularReexports() {
        Set<List<String>> cycles = new LinkedHashSet<>();
        for (CycleDetector.Cycle component : new CycleDetector(store, EnumSet.of(EdgeKind.REEXPORTS)).findCycles()) {
            if (!elementaryCycles(component.nodeIds(), cycles)) {
                log.warn("Stopped after {} circular re-export chains", MAX_REEXPORT_CYCLES);
                break;
            }
        }

        List<GraphIssue> issues = new ArrayList<>();
        for (List<String> cycle : cycles) {
            issues.add(circularIssue(cycle));
        }
        if (!issues.isEmpty()) {
            log.info("Found {} circular re-export chain(s)", issues.size());
        }
        return issues;
    }

    /**
     * Adds the elementary cycles of one component to {@code found}, each starting at its
     * smallest member. After the cycles through the smallest member are collected, that member
     * is dropped and the rest is split into components again. Returns false once the cycle cap
     * is reached.
     */
    private boolean elementaryCycles(List<String> members, Set<List<String>> found) {
        Set<String> memberSet = new HashSet<>(members);
        Map<String, List<String>> adjacency = new HashMap<>();
        for (String member : members) {
            Set<String> targets = new LinkedHashSet<>();
            for (GraphEdge edge : store.getEdgesFrom(member)) {
                if (edge.kind() == EdgeKind.REEXPORTS && memberSet.contains(edge.to())) {
                    targets.add(edge.to());
                }
            }
            adjacency.put(member, List.copyOf(targets));
        }

        Deque<List<String>> pending = new ArrayDeque<>();
        pending.push(members);
        while (!pending.isEmpty()) {
            List<String> component = pending.pop();
            Set<String> allowed = new HashSet<>(component);
            String start = Collections.min(component);
            if (!circuitsFrom(start, allowed, adjacency, found)) {
                return false;
            }
            if (component.size() == 1) {
                continue;
            }

            allowed.remove(start);
            List<String> rest = component.stream().filter(allowed::contains).toList();
            List<List<String>> subComponents = CycleDetector.components(rest,
                    node -> adjacency.get(node).stream().filter(allowed::contains).toList());
            for (List<String> sub : subComponents) {
                if (sub.size() > 1 || adjacency.get(sub.get(0)).contains(sub.get(0))) {
                    pending.push(sub);
                }
            }
        }
        return true;
    }

    private static final class Frame {
        final String node;
        final Iterator<String> successors;
        boolean closesCycle;

        Frame(String node, Iterator<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }

    // Iterative form; long re-export chains would overflow the call stack
    private boolean circuitsFrom(String start, Set<String> allowed, Map<String, List<String>> adjacency,
                                 Set<List<String>> found) {
        Set<String> blocked = new HashSet<>();
        Map<String, Set<String>> blockedBy = new HashMap<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> callStack = new ArrayDeque<>();

        blocked.add(start);
        path.add(start);
        callStack.push(new Frame(start, adjacency.get(start).iterator()));

        while (!callStack.isEmpty()) {
            Frame frame = callStack.peek();
            if (frame.successors.hasNext()) {
                String next = frame.successors.next();
                if (!allowed.contains(next)) {
                    continue;
                }
                if (next.equals(start)) {
                    frame.closesCycle = true;
                    if (found.add(List.copyOf(path)) && found.size() >= MAX_REEXPORT_CYCLES) {
                        return false;
                    }
                } else if (!blocked.contains(next)) {
                    blocked.add(next);
                    path.add(next);
                    callStack.push(new Frame(next, adjacency.get(next).iterator()));
                }
                continue;
            }

            callStack.pop();
            path.remove(path.size() - 1);
            if (frame.closesCycle) {
                unblock(frame.node, blocked, blockedBy);
                if (!callStack.isEmpty()) {
                    callStack.peek().closesCycle = true;
                }
            } else {
                for (String next : adjacency.get(frame.node)) {
                    if (allowed.contains(next)) {
                        blockedBy.computeIfAbsent(next, k -> new HashSet<>()).add(frame.node);
                    }
                }
            }
        }
        return true;
    }

    private static void unblock(String node, Set<String> blocked, Map<String, Set<String>> blockedBy) {
        Deque<String> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            blocked.remove(current);
            Set<String> waiting = blockedBy.remove(current);
            if (waiting != null) {
                for (String other : waiting) {
                    if (blocked.contains(other)) {
                        pending.push(other);
                    }
                }
            }
        }
    }

    private GraphIssue circularIssue(List<String> cycle) {
        List<String> paths = cycle.stream().map(this::pathOf).toList();
        List<String> closed = new ArrayList<>(paths);
        closed.add(paths.get(0));
        String first = paths.get(0);

        return GraphIssue.builder()
                .id("issue:circular-reexport:" + String.join("|", paths))
                .kind(IssueKind.CIRCULAR_REEXPORT)
                .severity(IssueSeverity.WARNING)
                .nodeId(cycle.get(0))
                .title("Circular re-export chain detected")
                .message(paths.size() == 1
                        ? first + " re-exports from itself"
                        : paths.size() + " files re-export from each other")
                .evidence(List.of(
                        "Re-export chain: " + String.join(" → ", closed),
                        "Chain length: " + paths.size()))
                .suggestedFix("Move the shared exports into a separate module that neither barrel re-exports")
                .filePath(first)
                .meta("affectedCount", paths.size())
                .meta("cycle", paths)
                .build();
    }

    private String pathOf(String nodeId) {
        return store.getNode(nodeId)
                .map(n -> n.path() != null ? n.path() : n.id())
                .orElseGet(() -> GraphNode.stripKindPrefix(nodeId));
    }

    // ---- edges and cache ----

    /**
     * Turns the re-export statements of a file into graph edges, one per re-exported source.
     * Statements naming the same source share an edge, placed at the first statement's line and
     * marked wildcard if any of them is. Targets resolve to existing nodes when possible,
     * otherwise to the normalized file id.
     */
    public List<GraphEdge> createBarrelEdges(String path, String content) {
        BarrelAnalysis analysis = analyzeFile(path, content);
        Map<String, List<ReexportEntry>> bySource = new LinkedHashMap<>();
        for (ReexportEntry reexport : analysis.reexports()) {
            bySource.computeIfAbsent(reexport.source(), k -> new ArrayList<>()).add(reexport);
        }

        List<GraphEdge> edges = new ArrayList<>(bySource.size());
        String fromId = GraphNode.idFor(NodeKind.FILE, path);

        for (Map.Entry<String, List<ReexportEntry>> entry : bySource.entrySet()) {
            String source = entry.getKey();
            List<ReexportEntry> statements = entry.getValue();
            boolean wildcard = statements.stream().anyMatch(ReexportEntry::wildcard);
            String toId = resolveSource(path, source)
                    .map(GraphNode::id)
                    .orElseGet(() -> GraphNode.idFor(NodeKind.FILE, isRelative(source)
                            ? resolveRelative(path, source)
                            : source));

            edges.add(new GraphEdge(
                    "edge:" + path + ":" + EdgeKind.REEXPORTS.label() + ":" + source,
                    fromId,
                    toId,
                    EdgeKind.REEXPORTS,
                    Confidence.HIGH,
                    wildcard ? "wildcard re-export" : "named re-export",
                    Map.of(GraphEdge.META_IMPORT_PATH, source, GraphEdge.META_LINE, statements.get(0).line())
            ));
        }
        return edges;
    }

    /**
     * Returns every cached analysis that is a barrel.
     */
    public List<BarrelAnalysis> getAllBarrels() {
        return cache.values().stream()
                .map(CacheEntry::analysis)
                .filter(BarrelAnalysis::barrel)
                .toList();
    }

    public void clearCache() {
        cache.clear();
    }

    public void clearFileCache(String path) {
        cache.remove(path);
    }
}
