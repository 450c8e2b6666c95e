package io.codegraph.query;

/**
 * Options for a digest query.
 *
 * @param scope Path prefix to restrict the summary to, or null for the whole repository
 * @param limit Maximum number of hotspots
 */
public record DigestOptions(String scope, int limit) {
    public static final int DEFAULT_LIMIT = 10;

    public DigestOptions {
        if (scope != null && scope.isBlank()) {
            scope = null;
        }
        if (limit < 1) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static DigestOptions defaults() {
        return new DigestOptions(null, DEFAULT_LIMIT);
    }

    public static DigestOptions scoped(String scope) {
        return new DigestOptions(scope, DEFAULT_LIMIT);
    }
}
