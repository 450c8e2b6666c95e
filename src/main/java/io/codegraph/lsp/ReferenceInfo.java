package io.codegraph.lsp;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One place a symbol is referenced.
 *
 * @param path       File containing the reference
 * @param line       1-indexed line
 * @param column     1-indexed column
 * @param lineText   Text of the line, null when not available
 * @param definition True when the location is the declaration itself
 */
public record ReferenceInfo(
        String path,
        int line,
        int column,
        String lineText,
        @JsonProperty("isDefinition") boolean definition
) {
}
