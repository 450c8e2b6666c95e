package io.codegraph.lsp;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of an editor diagnostic.
 */
public enum DiagnosticSeverity {
    ERROR(1, "error"),
    WARNING(2, "warning"),
    INFO(3, "info"),
    HINT(4, "hint");

    private final int lspValue;
    private final String label;

    DiagnosticSeverity(int lspValue, String label) {
        this.lspValue = lspValue;
        this.label = label;
    }

    public int lspValue() {
        return lspValue;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Maps a protocol severity number; anything unrecognized is {@link #INFO}.
     */
    public static DiagnosticSeverity fromLspValue(int value) {
        for (DiagnosticSeverity severity : values()) {
            if (severity.lspValue == value) {
                return severity;
            }
        }
        return INFO;
    }
}
