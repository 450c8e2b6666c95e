package io.codegraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A file, directory, external module or entrypoint in the code graph.
 *
 * @param id   Stable key, always {@code <kind prefix>:<path>}
 * @param kind Node kind
 * @param name Display name (basename of the path)
 * @param path Repository-relative path, unique within the kind namespace
 * @param meta Open, kind-specific attributes ({@code exports}, {@code framework},
 *             {@code entrypointType}, ...). An absent key means "unknown", never "empty".
 */
public record GraphNode(
        String id,
        NodeKind kind,
        String name,
        String path,
        Map<String, Object> meta
) {
    public static final String META_EXPORTS = "exports";
    public static final String META_FRAMEWORK = "framework";
    public static final String META_ENTRYPOINT_TYPE = "entrypointType";

    /**
     * Compact constructor with validation.
     */
    public GraphNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null) {
            name = path != null ? basename(path) : id;
        }
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /**
     * Derives the node id for a kind and path.
     * A path that already carries a kind prefix is normalized first.
     */
    public static String idFor(NodeKind kind, String path) {
        return kind.prefix() + ":" + stripKindPrefix(path);
    }

    /**
     * Creates a node with a derived id and name and no metadata.
     */
    public static GraphNode of(NodeKind kind, String path) {
        return of(kind, path, Map.of());
    }

    /**
     * Creates a node with a derived id and name.
     */
    public static GraphNode of(NodeKind kind, String path, Map<String, Object> meta) {
        String bare = stripKindPrefix(path);
        return new GraphNode(idFor(kind, bare), kind, basename(bare), bare, meta);
    }

    /**
     * Shorthand for a file node.
     */
    public static GraphNode file(String path) {
        return of(NodeKind.FILE, path);
    }

    /**
     * Shorthand for a file node with known exports.
     */
    public static GraphNode file(String path, List<String> exports) {
        return of(NodeKind.FILE, path, Map.of(META_EXPORTS, List.copyOf(exports)));
    }

    /**
     * Shorthand for an entrypoint node of the given type.
     */
    public static GraphNode entrypoint(String path, String entrypointType) {
        return of(NodeKind.ENTRYPOINT, path, Map.of(META_ENTRYPOINT_TYPE, entrypointType));
    }

    /**
     * Removes a leading {@code kind:} prefix from a node reference, if present.
     */
    public static String stripKindPrefix(String reference) {
        if (reference == null) {
            return null;
        }
        int colon = reference.indexOf(':');
        if (colon > 0) {
            String prefix = reference.substring(0, colon);
            for (NodeKind kind : NodeKind.values()) {
                if (kind.prefix().equals(prefix)) {
                    return reference.substring(colon + 1);
                }
            }
        }
        return reference;
    }

    /**
     * Returns the last segment of a slash-separated path.
     */
    public static String basename(String path) {
        if (path == null) {
            return null;
        }
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    /**
     * Returns the exported symbol names if the crawler recorded them.
     * Empty optional means the export list is unknown.
     */
    public Optional<List<String>> exports() {
        Object value = meta.get(META_EXPORTS);
        if (value instanceof List<?> list) {
            List<String> names = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    names.add(item.toString());
                }
            }
            return Optional.of(List.copyOf(names));
        }
        return Optional.empty();
    }

    public Optional<String> entrypointType() {
        return stringMeta(META_ENTRYPOINT_TYPE);
    }

    public Optional<String> framework() {
        return stringMeta(META_FRAMEWORK);
    }

    private Optional<String> stringMeta(String key) {
        Object value = meta.get(key);
        return value != null ? Optional.of(value.toString()) : Optional.empty();
    }

    /**
     * Returns a copy of this node with the metadata replaced.
     */
    public GraphNode withMeta(Map<String, Object> newMeta) {
        return new GraphNode(id, kind, name, path, newMeta);
    }
}
