package io.codegraph.enhance;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.codegraph.lsp.ReferenceInfo;
import io.codegraph.lsp.SymbolKind;

import java.util.List;

/**
 * References to one exported symbol of a file.
 *
 * @param symbol     Symbol name
 * @param kind       Symbol kind
 * @param line       1-indexed declaration line
 * @param references References outside the declaration
 * @param exported   Whether the symbol looks exported
 * @param unused     True when nothing references it
 */
public record SymbolReferences(
        String symbol,
        SymbolKind kind,
        int line,
        List<ReferenceInfo> references,
        @JsonProperty("isExported") boolean exported,
        @JsonProperty("isUnused") boolean unused
) {
    public SymbolReferences {
        references = List.copyOf(references);
    }
}
