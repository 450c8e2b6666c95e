package io.codegraph.barrel;

import java.util.List;

/**
 * One re-export statement.
 *
 * @param source    Import specifier exactly as written ({@code ./user})
 * @param symbols   Source-side names for a named re-export, empty for wildcards
 * @param wildcard  True for {@code export * from} and {@code export * as ns from}
 * @param namespace Namespace name of {@code export * as ns from}, null otherwise
 * @param line      1-indexed line the statement starts on
 */
public record ReexportEntry(
        String source,
        List<String> symbols,
        boolean wildcard,
        String namespace,
        int line
) {
    public ReexportEntry {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    public static ReexportEntry all(String source, int line) {
        return new ReexportEntry(source, List.of(), true, null, line);
    }

    public static ReexportEntry namespace(String source, String namespace, int line) {
        return new ReexportEntry(source, List.of(), true, namespace, line);
    }

    public static ReexportEntry named(String source, List<String> symbols, int line) {
        return new ReexportEntry(source, symbols, false, null, line);
    }

    /**
     * Returns true if this statement could re-export the given symbol.
     * Wildcards match anything.
     */
    public boolean covers(String symbol) {
        return wildcard || symbols.contains(symbol);
    }
}
