package io.codegraph.lsp;

/**
 * Position of one call expression, 1-indexed.
 */
public record CallSite(int line, int column) {
}
