package io.codegraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed relationship between two nodes.
 * <p>
 * Endpoints need not exist as nodes: a dangling edge represents a broken reference.
 * Edges are never mutated in place; replace them by remove + add.
 *
 * @param id         Unique key
 * @param from       Source node id
 * @param to         Target node id
 * @param kind       Relationship type
 * @param confidence How the edge was derived
 * @param reason     Free-form explanation (optional)
 * @param meta       Extra attributes such as {@code importPath}, {@code isDynamic}, {@code line}
 */
public record GraphEdge(
        String id,
        String from,
        String to,
        EdgeKind kind,
        Confidence confidence,
        String reason,
        Map<String, Object> meta
) {
    public static final String META_IMPORT_PATH = "importPath";
    public static final String META_IS_DYNAMIC = "isDynamic";
    public static final String META_LINE = "line";

    /**
     * Compact constructor with validation.
     */
    public GraphEdge {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (confidence == null) {
            confidence = Confidence.HIGH;
        }
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /**
     * Creates an edge with a derived id.
     */
    public static GraphEdge of(String from, String to, EdgeKind kind, Confidence confidence) {
        return new GraphEdge(idFor(from, to, kind), from, to, kind, confidence, null, Map.of());
    }

    /**
     * Creates a statically certain import edge between two file paths.
     */
    public static GraphEdge imports(String fromPath, String toPath) {
        return of(GraphNode.idFor(NodeKind.FILE, fromPath), GraphNode.idFor(NodeKind.FILE, toPath),
                EdgeKind.IMPORTS, Confidence.HIGH);
    }

    /**
     * Creates a statically certain re-export edge between two file paths.
     */
    public static GraphEdge reexports(String fromPath, String toPath) {
        return of(GraphNode.idFor(NodeKind.FILE, fromPath), GraphNode.idFor(NodeKind.FILE, toPath),
                EdgeKind.REEXPORTS, Confidence.HIGH);
    }

    /**
     * Derives the conventional edge id {@code edge:<from>:<kind>:<to>}.
     */
    public static String idFor(String from, String to, EdgeKind kind) {
        return "edge:" + from + ":" + kind.label() + ":" + to;
    }

    /**
     * Returns true if the crawler flagged this edge as dynamic.
     */
    public boolean dynamic() {
        return kind == EdgeKind.DYNAMIC || Boolean.TRUE.equals(meta.get(META_IS_DYNAMIC));
    }

    /**
     * Returns the raw import specifier, or null.
     */
    public String importPath() {
        Object value = meta.get(META_IMPORT_PATH);
        return value != null ? value.toString() : null;
    }

    public GraphEdge withReason(String newReason) {
        return new GraphEdge(id, from, to, kind, confidence, newReason, meta);
    }

    public GraphEdge withMeta(Map<String, Object> newMeta) {
        return new GraphEdge(id, from, to, kind, confidence, reason, newMeta);
    }
}
