package io.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of nodes in the code graph.
 * Each kind owns an id namespace: a node id is always {@code <prefix>:<path>}.
 */
public enum NodeKind {
    /**
     * A source file in the repository.
     */
    FILE("file"),

    /**
     * A directory grouping files.
     */
    DIRECTORY("directory"),

    /**
     * An external package reference (e.g. {@code module:react}).
     */
    MODULE("module"),

    /**
     * An externally reachable unit: route handler, CLI command, page, background job.
     */
    ENTRYPOINT("entrypoint");

    private final String prefix;

    NodeKind(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Returns the id prefix for this kind, without the trailing colon.
     */
    @JsonValue
    public String prefix() {
        return prefix;
    }

    /**
     * Parses a kind from its prefix (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is not a known kind
     */
    @JsonCreator
    public static NodeKind fromPrefix(String value) {
        for (NodeKind kind : values()) {
            if (kind.prefix.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + value);
    }
}
