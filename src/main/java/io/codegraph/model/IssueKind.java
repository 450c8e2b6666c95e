package io.codegraph.model;

/**
 * Closed set of structural problems the analyzers can report.
 */
public enum IssueKind {
    /**
     * A file with exports that no entrypoint can reach.
     */
    HANDLER_UNREACHABLE,

    /**
     * An import that cannot be resolved statically.
     */
    DYNAMIC_EDGE_UNKNOWN,

    /**
     * A re-export pointing at a missing file or symbol.
     */
    BROKEN_EXPORT_CHAIN,

    /**
     * Barrel files re-exporting each other in a loop.
     */
    CIRCULAR_REEXPORT,

    /**
     * Files importing each other in a loop.
     */
    CIRCULAR_DEPENDENCY,

    /**
     * An exported symbol never referenced elsewhere.
     */
    ORPHAN_EXPORT,

    /**
     * A framework entrypoint without its handler.
     */
    ENTRY_MISSING_HANDLER,

    /**
     * A handler that is never registered with its framework.
     */
    NOT_REGISTERED,

    /**
     * A dependency arrangement likely to turn into a cycle.
     */
    CYCLE_RISK,

    /**
     * An import crossing a forbidden architectural boundary.
     */
    LAYER_VIOLATION
}
