package io.codegraph.lsp;

/**
 * Where a symbol is defined. Positions are 1-indexed.
 */
public record DefinitionInfo(
        String path,
        int line,
        int column,
        int endLine,
        int endColumn,
        String lineText
) {
}
