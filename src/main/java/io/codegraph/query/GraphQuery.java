package io.codegraph.query;

import io.codegraph.graph.GraphStore;
import io.codegraph.graph.PathFinder;
import io.codegraph.graph.ReachabilityAnalyzer;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import io.codegraph.model.NodeKind;

import java.util.*;

/**
 * Read-only analytical queries over a {@link GraphStore}.
 * <p>
 * Every query resolves its arguments leniently (bare path, {@code kind:path} or node id) and
 * degrades to an empty or disconnected result when something is missing. Nothing here throws
 * for "not found". Each result carries a token estimate so callers can decide whether to
 * hand it to a language model as is.
 */
public class GraphQuery {

    /**
     * Minimum number of importers for a file to count as a hotspot.
     */
    public static final int HOTSPOT_THRESHOLD = 5;

    static final int ENTRYPOINT_GROUP_CAP = 5;
    static final int AFFECTED_ENTRYPOINT_CAP = 10;

    private static final Set<EdgeKind> IMPORTS_ONLY = EnumSet.of(EdgeKind.IMPORTS);

    private final GraphStore store;

    public GraphQuery(GraphStore store) {
        this.store = store;
    }

    // ---- path ----

    public PathResult path(String from, String to) {
        return path(from, to, PathOptions.defaults());
    }

    /**
     * Finds simple import paths between two files, shortest first.
     */
    public PathResult path(String from, String to, PathOptions options) {
        PathOptions bounds = options.clamped();
        Map<String, Integer> limits = Map.of("maxDepth", bounds.maxDepth(), "maxPaths", bounds.maxPaths());

        Optional<GraphNode> fromNode = store.getNodeByPath(from);
        Optional<GraphNode> toNode = store.getNodeByPath(to);
        if (fromNode.isEmpty() || toNode.isEmpty()) {
            PathResult empty = PathResult.disconnected(from, to, QueryMeta.of(false, limits).withMaxDepthReached(false));
            return empty.withMeta(empty.meta().withTokensEstimate(TokenEstimator.estimate(empty)));
        }

        PathFinder.Result found = new PathFinder(store, IMPORTS_ONLY)
                .findPaths(fromNode.get().id(), toNode.get().id(), bounds.maxDepth(), bounds.maxPaths());

        List<PathResult.Path> paths = found.paths().stream()
                .sorted(Comparator.comparingInt(PathFinder.FoundPath::length))
                .map(p -> new PathResult.Path(p.nodeIds().stream().map(this::displayPath).toList(),
                        p.edgeIds(), p.length()))
                .toList();

        boolean connected = !paths.isEmpty();
        QueryMeta meta = QueryMeta.of(found.truncated(), limits).withMaxDepthReached(found.maxDepthReached());
        PathResult result = new PathResult(from, to, connected, connected ? paths.get(0).length() : null, paths, meta);
        return result.withMeta(meta.withTokensEstimate(TokenEstimator.estimate(result)));
    }

    // ---- module ----

    /**
     * Returns the dossier for one file. Only import edges count towards imports and importers.
     */
    public ModuleResult module(String path) {
        Optional<GraphNode> resolved = store.getNodeByPath(path);
        if (resolved.isEmpty()) {
            ModuleResult empty = ModuleResult.notFound(path);
            return empty.withMeta(empty.meta().withTokensEstimate(TokenEstimator.estimate(empty)));
        }
        GraphNode node = resolved.get();

        List<String> imports = new ArrayList<>();
        List<String> reexports = new ArrayList<>();
        for (GraphEdge edge : store.getEdgesFrom(node.id())) {
            if (edge.kind() == EdgeKind.IMPORTS) {
                imports.add(displayPath(edge.to()));
            } else if (edge.kind() == EdgeKind.REEXPORTS) {
                reexports.add(displayPath(edge.to()));
            }
        }

        List<String> importedBy = new ArrayList<>();
        for (GraphEdge edge : store.getEdgesTo(node.id())) {
            if (edge.kind() == EdgeKind.IMPORTS) {
                importedBy.add(displayPath(edge.from()));
            }
        }

        List<EntrypointRef> entrypoints = new ArrayList<>();
        for (GraphNode entrypoint : store.getNodesByKind(NodeKind.ENTRYPOINT)) {
            if (Objects.equals(entrypoint.path(), node.path())) {
                entrypoints.add(toEntrypointRef(entrypoint));
            }
        }

        boolean barrel = !reexports.isEmpty()
                || node.entrypointType().filter("barrel"::equals).isPresent();

        ModuleResult result = new ModuleResult(
                path,
                true,
                imports,
                importedBy,
                node.exports().orElse(List.of()),
                reexports,
                barrel,
                entrypoints,
                node.framework().orElse(null),
                QueryMeta.of(false, null)
        );
        return result.withMeta(result.meta().withTokensEstimate(TokenEstimator.estimate(result)));
    }

    // ---- digest ----

    public DigestResult digest() {
        return digest(DigestOptions.defaults());
    }

    /**
     * Summarizes the repository, or the sub-tree under {@code options.scope()}.
     */
    public DigestResult digest(DigestOptions options) {
        String scope = options.scope();
        List<GraphNode> nodes = store.getAllNodes().stream()
                .filter(n -> inScope(n.path(), scope))
                .toList();

        List<GraphNode> files = nodes.stream().filter(n -> n.kind() == NodeKind.FILE).toList();
        List<GraphNode> entrypoints = nodes.stream().filter(n -> n.kind() == NodeKind.ENTRYPOINT).toList();
        int directories = (int) nodes.stream().filter(n -> n.kind() == NodeKind.DIRECTORY).count();
        int modules = (int) nodes.stream().filter(n -> n.kind() == NodeKind.MODULE).count();

        int edges;
        if (scope == null) {
            edges = store.edgeCount();
        } else {
            Set<String> ids = new HashSet<>();
            nodes.forEach(n -> ids.add(n.id()));
            edges = (int) store.getAllEdges().stream().filter(e -> ids.contains(e.from())).count();
        }

        Map<String, List<String>> groups = new TreeMap<>();
        for (GraphNode entrypoint : entrypoints) {
            List<String> group = groups.computeIfAbsent(entrypoint.entrypointType().orElse("unknown"),
                    k -> new ArrayList<>());
            if (group.size() < ENTRYPOINT_GROUP_CAP) {
                group.add(entrypoint.name());
            }
        }

        List<DigestResult.Hotspot> hotspots = new ArrayList<>();
        for (GraphNode file : files) {
            int importers = countImporters(file.id());
            if (importers >= HOTSPOT_THRESHOLD) {
                hotspots.add(new DigestResult.Hotspot(file.path(), importers,
                        file.exports().map(List::size).orElse(0)));
            }
        }
        hotspots.sort(Comparator.comparingInt(DigestResult.Hotspot::importers).reversed()
                .thenComparing(DigestResult.Hotspot::path));
        boolean truncated = hotspots.size() > options.limit();
        List<DigestResult.Hotspot> limited = List.copyOf(hotspots.subList(0, Math.min(options.limit(), hotspots.size())));

        Map<IssueKind, Integer> issueCounts = zeroFilled();
        for (GraphIssue issue : store.getIssues()) {
            if (scope == null || inScope(issue.filePath(), scope)) {
                issueCounts.merge(issue.kind(), 1, Integer::sum);
            }
        }

        QueryMeta meta = QueryMeta.of(truncated, Map.of("limit", options.limit())).withScope(scope);
        DigestResult result = new DigestResult(
                new DigestResult.Summary(files.size(), directories, modules, entrypoints.size(), edges),
                groups,
                limited,
                issueCounts,
                store.getMeta().lastIndexed(),
                meta
        );
        return result.withMeta(meta.withTokensEstimate(TokenEstimator.estimate(result)));
    }

    private int countImporters(String nodeId) {
        int count = 0;
        for (GraphEdge edge : store.getEdgesTo(nodeId)) {
            if (edge.kind() == EdgeKind.IMPORTS) {
                count++;
            }
        }
        return count;
    }

    // ---- impact ----

    public ImpactResult impact(String target) {
        return impact(target, ImpactOptions.defaults());
    }

    /**
     * Computes who depends on {@code target}, how far away, and how risky a change is.
     */
    public ImpactResult impact(String target, ImpactOptions options) {
        ImpactOptions bounds = options.clamped();
        Optional<GraphNode> resolved = store.getNodeByPath(target);
        if (resolved.isEmpty()) {
            ImpactResult empty = ImpactResult.notFound(target);
            return empty.withMeta(empty.meta().withTokensEstimate(TokenEstimator.estimate(empty)));
        }
        GraphNode node = resolved.get();

        ReachabilityAnalyzer reachability = new ReachabilityAnalyzer(store, IMPORTS_ONLY);
        SortedMap<Integer, List<String>> levels = reachability.dependentsByDepth(node.id(), bounds.depth());

        Set<String> closure = new LinkedHashSet<>();
        SortedMap<Integer, Integer> countsByDepth = new TreeMap<>();
        for (int depth = 1; depth <= bounds.depth(); depth++) {
            List<String> level = levels.getOrDefault(depth, List.of());
            countsByDepth.put(depth, level.size());
            closure.addAll(level);
        }

        List<String> direct = levels.getOrDefault(1, List.of()).stream()
                .map(this::displayPath)
                .limit(bounds.limit())
                .toList();

        List<EntrypointRef> affected = affectedEntrypoints(node, closure, reachability);
        ImpactResult.RiskAssessment risk = assessRisk(closure.size(), affected.size());

        Map<String, Integer> limits = Map.of("depth", bounds.depth(), "limit", bounds.limit());
        QueryMeta meta = QueryMeta.of(closure.size() > bounds.limit(), limits);
        ImpactResult result = new ImpactResult(
                target,
                true,
                direct,
                countsByDepth,
                closure.size(),
                affected.stream().limit(AFFECTED_ENTRYPOINT_CAP).toList(),
                risk,
                bounds.depth(),
                meta
        );
        return result.withMeta(meta.withTokensEstimate(TokenEstimator.estimate(result)));
    }

    private List<EntrypointRef> affectedEntrypoints(GraphNode target, Set<String> closure,
                                                    ReachabilityAnalyzer reachability) {
        Set<String> impacted = new HashSet<>(closure);
        impacted.add(target.id());
        Set<String> impactedPaths = new HashSet<>();
        for (String id : impacted) {
            impactedPaths.add(displayPath(id));
        }

        List<EntrypointRef> affected = new ArrayList<>();
        for (GraphNode entrypoint : store.getNodesByKind(NodeKind.ENTRYPOINT)) {
            boolean hit = impacted.contains(entrypoint.id())
                    || impactedPaths.contains(entrypoint.path())
                    || reachesAny(reachability, entrypoint.id(), impacted);
            if (hit) {
                affected.add(toEntrypointRef(entrypoint));
            }
        }
        return affected;
    }

    private static boolean reachesAny(ReachabilityAnalyzer reachability, String start, Set<String> targets) {
        for (String reached : reachability.reachableFrom(List.of(start))) {
            if (targets.contains(reached)) {
                return true;
            }
        }
        return false;
    }

    static ImpactResult.RiskAssessment assessRisk(int dependents, int entrypoints) {
        List<String> factors = new ArrayList<>();
        RiskLevel level = RiskLevel.LOW;

        if (dependents > 20) {
            factors.add(dependents + " files affected transitively");
            level = RiskLevel.HIGH;
        } else if (dependents > 10) {
            factors.add(dependents + " files affected");
            level = RiskLevel.MEDIUM;
        }

        if (entrypoints > 3) {
            factors.add(entrypoints + " entrypoints depend on this");
            level = RiskLevel.HIGH;
        } else if (entrypoints > 0) {
            factors.add(entrypoints + " entrypoint(s) affected");
        }

        if (dependents > 30 && entrypoints > 5) {
            level = RiskLevel.CRITICAL;
        }

        return new ImpactResult.RiskAssessment(level, level.reason(), factors);
    }

    // ---- issues ----

    public IssueListResult issues() {
        return issues(IssueQueryOptions.defaults());
    }

    /**
     * Lists stored issues after filtering by kind, minimum severity and scope.
     */
    public IssueListResult issues(IssueQueryOptions options) {
        int limit = Math.min(options.limit(), IssueQueryOptions.MAX_LIMIT);

        List<GraphIssue> filtered = store.getIssues().stream()
                .filter(i -> options.kind() == null || i.kind() == options.kind())
                .filter(i -> options.minSeverity() == null || i.severity().isAtLeast(options.minSeverity()))
                .filter(i -> options.scope() == null || inScope(i.filePath(), options.scope()))
                .toList();

        Map<IssueKind, Integer> byKind = new EnumMap<>(IssueKind.class);
        Map<IssueSeverity, Integer> bySeverity = new EnumMap<>(IssueSeverity.class);
        for (GraphIssue issue : filtered) {
            byKind.merge(issue.kind(), 1, Integer::sum);
            bySeverity.merge(issue.severity(), 1, Integer::sum);
        }

        List<IssueListResult.IssueSummary> returned = filtered.stream()
                .limit(limit)
                .map(i -> new IssueListResult.IssueSummary(
                        i.id(),
                        i.kind(),
                        i.severity(),
                        i.filePath() != null ? i.filePath() : "unknown",
                        i.title(),
                        i.evidence(),
                        i.suggestedFix()))
                .toList();

        boolean truncated = filtered.size() > limit;
        QueryMeta meta = QueryMeta.of(truncated, Map.of("limit", limit)).withScope(options.scope());
        if (truncated) {
            meta = meta.withSuggestion("Use scope or kind filter to narrow results");
        }
        IssueListResult result = new IssueListResult(
                returned,
                new IssueListResult.Stats(filtered.size(), returned.size(), byKind, bySeverity),
                meta
        );
        return result.withMeta(meta.withTokensEstimate(TokenEstimator.estimate(result)));
    }

    // ---- helpers ----

    private String displayPath(String nodeId) {
        return store.getNode(nodeId)
                .map(n -> n.path() != null ? n.path() : n.id())
                .orElseGet(() -> GraphNode.stripKindPrefix(nodeId));
    }

    private static EntrypointRef toEntrypointRef(GraphNode entrypoint) {
        return new EntrypointRef(entrypoint.name(), entrypoint.path(), entrypoint.entrypointType().orElse("unknown"));
    }

    private static boolean inScope(String path, String scope) {
        return scope == null || (path != null && path.startsWith(scope));
    }

    private static Map<IssueKind, Integer> zeroFilled() {
        Map<IssueKind, Integer> counts = new EnumMap<>(IssueKind.class);
        for (IssueKind kind : IssueKind.values()) {
            counts.put(kind, 0);
        }
        return counts;
    }
}
