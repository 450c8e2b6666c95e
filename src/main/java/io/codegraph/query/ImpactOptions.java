package io.codegraph.query;

/**
 * Options for an impact query. Values above the caps are clamped by the query engine.
 *
 * @param depth How many levels of dependents to follow
 * @param limit Maximum number of direct dependents listed
 */
public record ImpactOptions(int depth, int limit) {
    public static final int DEFAULT_DEPTH = 3;
    public static final int MAX_DEPTH = 4;
    public static final int DEFAULT_LIMIT = 30;
    public static final int MAX_LIMIT = 100;

    public ImpactOptions {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1, got " + depth);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
    }

    public static ImpactOptions defaults() {
        return new ImpactOptions(DEFAULT_DEPTH, DEFAULT_LIMIT);
    }

    ImpactOptions clamped() {
        return new ImpactOptions(Math.min(depth, MAX_DEPTH), Math.min(limit, MAX_LIMIT));
    }
}
