package io.codegraph.lsp;

/**
 * A span of source text. Lines and columns are 1-indexed.
 */
public record SourceRange(int startLine, int startColumn, int endLine, int endColumn) {
    public SourceRange {
        if (startLine < 1 || startColumn < 1) {
            throw new IllegalArgumentException("positions are 1-indexed, got " + startLine + ":" + startColumn);
        }
    }

    public static SourceRange at(int line, int column) {
        return new SourceRange(line, column, line, column);
    }
}
