package io.codegraph.lsp;

/**
 * A problem reported by the editor for a file.
 *
 * @param severity Severity
 * @param message  Human-readable message
 * @param range    Affected span, 1-indexed; the start of the file when the server sent none
 * @param source   Tool that produced it, e.g. {@code ts} or {@code eslint} (optional)
 * @param code     Tool-specific code (optional)
 */
public record Diagnostic(
        DiagnosticSeverity severity,
        String message,
        SourceRange range,
        String source,
        String code
) {
    public Diagnostic {
        if (severity == null) {
            severity = DiagnosticSeverity.INFO;
        }
        if (message == null) {
            message = "";
        }
        if (range == null) {
            range = SourceRange.at(1, 1);
        }
    }

    public int line() {
        return range.startLine();
    }

    public int column() {
        return range.startColumn();
    }
}
