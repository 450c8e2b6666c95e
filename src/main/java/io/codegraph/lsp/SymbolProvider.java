package io.codegraph.lsp;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Precise symbol information from a language server.
 * <p>
 * All results are asynchronous and may complete exceptionally, for instance when no server
 * is running for the file. Paths are repository-relative; lines and columns are 1-indexed.
 * Implementations do no caching of their own.
 */
public interface SymbolProvider {

    /**
     * Symbol tree of one document.
     */
    CompletableFuture<List<SymbolInfo>> documentSymbols(String path);

    /**
     * Symbols across the workspace whose names match the query.
     */
    CompletableFuture<List<WorkspaceSymbolInfo>> workspaceSymbols(String query);

    /**
     * References to the symbol at a position.
     */
    CompletableFuture<List<ReferenceInfo>> findReferences(String path, int line, int column, ReferenceOptions options);

    /**
     * Definitions of the symbol at a position. There can be more than one.
     */
    CompletableFuture<List<DefinitionInfo>> definitions(String path, int line, int column);

    /**
     * Callers and callees of the function at a position, empty when there is none.
     */
    CompletableFuture<Optional<CallHierarchyResult>> callHierarchy(String path, int line, int column);

    /**
     * Whether a language server can answer requests for the file.
     */
    CompletableFuture<Boolean> isAvailable(String path);
}
