package io.codegraph.lsp;

import java.util.List;

/**
 * A symbol declared in a document, with its nested symbols.
 *
 * @param name           Symbol name
 * @param kind           Symbol kind
 * @param range          Full extent of the declaration
 * @param selectionRange Extent of the name, where references are looked up
 * @param detail         Extra text such as a signature (optional)
 * @param children       Nested symbols
 */
public record SymbolInfo(
        String name,
        SymbolKind kind,
        SourceRange range,
        SourceRange selectionRange,
        String detail,
        List<SymbolInfo> children
) {
    public SymbolInfo {
        if (kind == null) {
            kind = SymbolKind.UNKNOWN;
        }
        if (selectionRange == null) {
            selectionRange = range;
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static SymbolInfo of(String name, SymbolKind kind, int line, int column) {
        SourceRange at = SourceRange.at(line, column);
        return new SymbolInfo(name, kind, at, at, null, List.of());
    }
}
