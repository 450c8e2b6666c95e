package io.codegraph.graph;

import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphMeta;
import io.codegraph.model.GraphNode;
import io.codegraph.model.GraphSnapshot;
import io.codegraph.model.IssueKind;
import io.codegraph.model.NodeKind;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * In-memory directed graph of files, directories, modules and entrypoints.
 * <p>
 * The store is a plain substrate: it upserts by id, keeps adjacency indices current and
 * never raises for absent lookups. Referential integrity is not checked, so edges may point
 * at nodes that were never added.
 * <p>
 * Not thread-safe. One writer (the indexing pipeline) is assumed; readers must not run
 * concurrently with mutation.
 */
public class GraphStore {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<String>> edgesFrom = new HashMap<>();
    private final Map<String, Set<String>> edgesTo = new HashMap<>();
    private final Map<NodeKind, Set<String>> nodesByKind = new EnumMap<>(NodeKind.class);
    private final Map<NodeKind, Map<String, String>> idsByPath = new EnumMap<>(NodeKind.class);
    private List<GraphIssue> issues = List.of();

    private Instant lastIndexed;
    private Duration indexDuration;

    // ---- nodes ----

    /**
     * Inserts or replaces a node. Last write wins.
     */
    public void addNode(GraphNode node) {
        Objects.requireNonNull(node, "node");
        GraphNode previous = nodes.put(node.id(), node);
        if (previous != null) {
            unindexNode(previous);
        }
        nodesByKind.computeIfAbsent(node.kind(), k -> new LinkedHashSet<>()).add(node.id());
        if (node.path() != null) {
            idsByPath.computeIfAbsent(node.kind(), k -> new HashMap<>()).put(node.path(), node.id());
        }
    }

    public Optional<GraphNode> getNode(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Resolves a node from a bare path or a {@code kind:path} reference.
     * A bare path prefers the file node, then any other kind.
     */
    public Optional<GraphNode> getNodeByPath(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        GraphNode direct = nodes.get(reference);
        if (direct != null) {
            return Optional.of(direct);
        }
        String bare = GraphNode.stripKindPrefix(reference);
        Optional<GraphNode> file = lookupPath(NodeKind.FILE, bare);
        if (file.isPresent()) {
            return file;
        }
        for (NodeKind kind : NodeKind.values()) {
            Optional<GraphNode> found = lookupPath(kind, bare);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<GraphNode> lookupPath(NodeKind kind, String path) {
        Map<String, String> byPath = idsByPath.get(kind);
        if (byPath == null) {
            return Optional.empty();
        }
        String id = byPath.get(path);
        return id != null ? Optional.ofNullable(nodes.get(id)) : Optional.empty();
    }

    public List<GraphNode> getNodesByKind(NodeKind kind) {
        Set<String> ids = nodesByKind.get(kind);
        if (ids == null) {
            return List.of();
        }
        List<GraphNode> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(nodes.get(id));
        }
        return result;
    }

    public List<GraphNode> getAllNodes() {
        return List.copyOf(nodes.values());
    }

    public boolean hasNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Removes a node together with every edge that touches it.
     *
     * @return true if the node existed
     */
    public boolean removeNode(String id) {
        GraphNode removed = nodes.remove(id);
        if (removed == null) {
            return false;
        }
        unindexNode(removed);
        removeEdgesForNode(id);
        return true;
    }

    private void unindexNode(GraphNode node) {
        Set<String> ids = nodesByKind.get(node.kind());
        if (ids != null) {
            ids.remove(node.id());
        }
        Map<String, String> byPath = idsByPath.get(node.kind());
        if (byPath != null && node.path() != null && node.id().equals(byPath.get(node.path()))) {
            byPath.remove(node.path());
        }
    }

    // ---- edges ----

    /**
     * Inserts or replaces an edge and updates both adjacency indices.
     */
    public void addEdge(GraphEdge edge) {
        Objects.requireNonNull(edge, "edge");
        GraphEdge previous = edges.put(edge.id(), edge);
        if (previous != null) {
            unindexEdge(previous);
        }
        edgesFrom.computeIfAbsent(edge.from(), k -> new LinkedHashSet<>()).add(edge.id());
        edgesTo.computeIfAbsent(edge.to(), k -> new LinkedHashSet<>()).add(edge.id());
    }

    public Optional<GraphEdge> getEdge(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(edges.get(id));
    }

    /**
     * Returns every outgoing edge of a node, regardless of kind.
     */
    public List<GraphEdge> getEdgesFrom(String nodeId) {
        return collect(edgesFrom.get(nodeId));
    }

    /**
     * Returns every incoming edge of a node, regardless of kind.
     */
    public List<GraphEdge> getEdgesTo(String nodeId) {
        return collect(edgesTo.get(nodeId));
    }

    public List<GraphEdge> getAllEdges() {
        return List.copyOf(edges.values());
    }

    public boolean removeEdge(String id) {
        GraphEdge removed = edges.remove(id);
        if (removed == null) {
            return false;
        }
        unindexEdge(removed);
        return true;
    }

    /**
     * Removes every edge that starts or ends at the given node.
     *
     * @return number of edges removed
     */
    public int removeEdgesForNode(String nodeId) {
        Set<String> incident = new LinkedHashSet<>();
        incident.addAll(edgesFrom.getOrDefault(nodeId, Set.of()));
        incident.addAll(edgesTo.getOrDefault(nodeId, Set.of()));
        int removed = 0;
        for (String edgeId : incident) {
            if (removeEdge(edgeId)) {
                removed++;
            }
        }
        return removed;
    }

    private void unindexEdge(GraphEdge edge) {
        Set<String> out = edgesFrom.get(edge.from());
        if (out != null) {
            out.remove(edge.id());
            if (out.isEmpty()) {
                edgesFrom.remove(edge.from());
            }
        }
        Set<String> in = edgesTo.get(edge.to());
        if (in != null) {
            in.remove(edge.id());
            if (in.isEmpty()) {
                edgesTo.remove(edge.to());
            }
        }
    }

    private List<GraphEdge> collect(Set<String> edgeIds) {
        if (edgeIds == null || edgeIds.isEmpty()) {
            return List.of();
        }
        List<GraphEdge> result = new ArrayList<>(edgeIds.size());
        for (String id : edgeIds) {
            GraphEdge edge = edges.get(id);
            if (edge != null) {
                result.add(edge);
            }
        }
        return result;
    }

    // ---- issues ----

    public List<GraphIssue> getIssues() {
        return issues;
    }

    public List<GraphIssue> getIssuesByKind(IssueKind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).toList();
    }

    /**
     * Replaces the whole issue set. Each analysis pass discards the previous one.
     */
    public void setIssues(List<GraphIssue> newIssues) {
        this.issues = newIssues == null ? List.of() : List.copyOf(newIssues);
    }

    /**
     * Appends one issue, replacing any existing issue with the same id.
     */
    public void addIssue(GraphIssue issue) {
        List<GraphIssue> updated = new ArrayList<>(issues.size() + 1);
        for (GraphIssue existing : issues) {
            if (!existing.id().equals(issue.id())) {
                updated.add(existing);
            }
        }
        updated.add(issue);
        this.issues = List.copyOf(updated);
    }

    public void clearIssues() {
        this.issues = List.of();
    }

    // ---- bulk operations ----

    /**
     * Replaces the data for one file: the old file node and its incident edges are dropped,
     * then the given nodes and edges are added.
     */
    public void updateFile(String path, Collection<GraphNode> newNodes, Collection<GraphEdge> newEdges) {
        removeNode(GraphNode.idFor(NodeKind.FILE, path));
        newNodes.forEach(this::addNode);
        newEdges.forEach(this::addEdge);
    }

    public void markIndexed(Instant when, Duration duration) {
        this.lastIndexed = when;
        this.indexDuration = duration;
    }

    public GraphMeta getMeta() {
        return new GraphMeta(
                GraphMeta.CURRENT_VERSION,
                lastIndexed,
                indexDuration,
                nodesByKind.getOrDefault(NodeKind.FILE, Set.of()).size(),
                nodes.size(),
                edges.size(),
                issues.size()
        );
    }

    public GraphSnapshot toSnapshot() {
        return new GraphSnapshot(getAllNodes(), getAllEdges(), issues);
    }

    /**
     * Clears the store and loads a snapshot into it.
     */
    public void restore(GraphSnapshot snapshot) {
        clear();
        snapshot.nodes().forEach(this::addNode);
        snapshot.edges().forEach(this::addEdge);
        setIssues(snapshot.issues());
    }

    public void clear() {
        nodes.clear();
        edges.clear();
        edgesFrom.clear();
        edgesTo.clear();
        nodesByKind.clear();
        idsByPath.clear();
        issues = List.of();
        lastIndexed = null;
        indexDuration = null;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public int issueCount() {
        return issues.size();
    }
}
