package io.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a detected issue.
 */
public enum IssueSeverity {
    INFO(1, "info"),
    WARNING(2, "warning"),
    ERROR(3, "error");

    private final int rank;
    private final String label;

    IssueSeverity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(IssueSeverity threshold) {
        return this.rank >= threshold.rank;
    }

    @JsonCreator
    public static IssueSeverity fromLabel(String value) {
        for (IssueSeverity severity : values()) {
            if (severity.label.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
