package io.codegraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much a structural fact can be trusted.
 * Static parses are {@link #HIGH}; heuristics are {@link #MEDIUM} or {@link #LOW}.
 */
public enum Confidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Confidence fromLabel(String value) {
        for (Confidence confidence : values()) {
            if (confidence.label.equalsIgnoreCase(value)) {
                return confidence;
            }
        }
        // "unknown" from older crawlers
        return LOW;
    }
}
