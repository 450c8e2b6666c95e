package io.codegraph.lsp;

/**
 * A symbol found by a workspace-wide search.
 */
public record WorkspaceSymbolInfo(
        String name,
        SymbolKind kind,
        String containerName,
        String path,
        int line,
        int column
) {
}
