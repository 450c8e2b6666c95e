package io.codegraph.enhance;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.codegraph.lsp.Diagnostic;
import io.codegraph.lsp.SymbolInfo;

import java.time.Instant;
import java.util.List;

/**
 * What the graph and the language server know about one file.
 *
 * @param path  File path
 * @param graph Structural facts
 * @param lsp   Language server facts
 */
public record EnhancedNodeInfo(String path, GraphInfo graph, LspInfo lsp) {

    /**
     * Structural facts from the graph store.
     */
    public record GraphInfo(
            List<String> imports,
            List<String> importedBy,
            List<String> exports,
            @JsonProperty("isEntrypoint") boolean entrypoint,
            @JsonProperty("isHotspot") boolean hotspot,
            int issueCount
    ) {
        public GraphInfo {
            imports = List.copyOf(imports);
            importedBy = List.copyOf(importedBy);
            exports = List.copyOf(exports);
        }
    }

    /**
     * Facts from the language server.
     *
     * @param available   False when the server could not answer for the file
     * @param symbols     Document symbols, empty when unavailable
     * @param diagnostics Latest published diagnostics for the file
     * @param lastUpdated When the symbols were fetched, null when unavailable
     */
    public record LspInfo(
            boolean available,
            List<SymbolInfo> symbols,
            List<Diagnostic> diagnostics,
            Instant lastUpdated
    ) {
        public LspInfo {
            symbols = List.copyOf(symbols);
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
