package io.codegraph.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How risky a change to a file is, judged by how much depends on it.
 */
public enum RiskLevel {
    /**
     * Few dependents, no entrypoints at stake.
     */
    LOW(1, "low", "Limited impact, safe to modify"),

    /**
     * Enough dependents that they should be reviewed.
     */
    MEDIUM(2, "medium", "Moderate impact, review dependents"),

    /**
     * Many dependents or several entrypoints.
     */
    HIGH(3, "high", "Wide impact, careful review needed"),

    /**
     * Both a large dependent set and many entrypoints.
     */
    CRITICAL(4, "critical", "Critical module, extensive testing required");

    private final int severity;
    private final String label;
    private final String reason;

    RiskLevel(int severity, String label, String reason) {
        this.severity = severity;
        this.label = label;
        this.reason = reason;
    }

    public int severity() {
        return severity;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Canned explanation shown next to the level.
     */
    public String reason() {
        return reason;
    }

    /**
     * Returns true if this risk level is at least as severe as the given threshold.
     */
    public boolean isAtLeast(RiskLevel threshold) {
        return this.severity >= threshold.severity;
    }
}
