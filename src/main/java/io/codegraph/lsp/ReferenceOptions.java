package io.codegraph.lsp;

/**
 * Options for a find-references request.
 *
 * @param includeDeclaration Whether the declaration itself is returned
 * @param limit              Maximum number of references
 */
public record ReferenceOptions(boolean includeDeclaration, int limit) {
    public static final int DEFAULT_LIMIT = 50;

    public ReferenceOptions {
        if (limit < 1) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static ReferenceOptions defaults() {
        return new ReferenceOptions(true, DEFAULT_LIMIT);
    }

    public static ReferenceOptions excludingDeclaration(int limit) {
        return new ReferenceOptions(false, limit);
    }
}
