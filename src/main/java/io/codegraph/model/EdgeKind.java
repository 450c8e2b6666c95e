package io.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relationship types between graph nodes.
 */
public enum EdgeKind {
    IMPORTS("imports"),
    REEXPORTS("reexports"),
    DYNAMIC("dynamic"),
    CALLS("calls"),
    REGISTERS("registers");

    private final String label;

    EdgeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static EdgeKind fromLabel(String value) {
        for (EdgeKind kind : values()) {
            if (kind.label.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown edge kind: " + value);
    }
}
