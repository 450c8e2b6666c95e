package io.codegraph.lsp;

/**
 * A function or method taking part in a call hierarchy.
 * {@code line} and {@code column} point at the name, 1-indexed.
 */
public record CallHierarchyItem(
        String name,
        SymbolKind kind,
        String path,
        int line,
        int column,
        String detail
) {
}
