package io.codegraph.query;

/**
 * Bounds for a path query. Values above the caps are clamped by the query engine.
 */
public record PathOptions(int maxDepth, int maxPaths) {
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_PATHS = 5;
    public static final int MAX_DEPTH_CAP = 20;
    public static final int MAX_PATHS_CAP = 20;

    public PathOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        if (maxPaths < 1) {
            throw new IllegalArgumentException("maxPaths must be at least 1, got " + maxPaths);
        }
    }

    public static PathOptions defaults() {
        return new PathOptions(DEFAULT_MAX_DEPTH, DEFAULT_MAX_PATHS);
    }

    public static PathOptions maxDepth(int maxDepth) {
        return new PathOptions(maxDepth, DEFAULT_MAX_PATHS);
    }

    PathOptions clamped() {
        return new PathOptions(Math.min(maxDepth, MAX_DEPTH_CAP), Math.min(maxPaths, MAX_PATHS_CAP));
    }
}
