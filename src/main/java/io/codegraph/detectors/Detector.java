package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphIssue;

import java.util.List;

/**
 * Base interface for all structural issue detectors.
 * Each detector inspects the graph for one family of problems.
 */
public interface Detector {

    /**
     * Returns a unique identifier for this detector.
     */
    String id();

    /**
     * Returns a human-readable description of what this detector finds.
     */
    String description();

    /**
     * Inspects the graph and returns the issues found. Must not modify the store.
     *
     * @param store  The graph to analyze
     * @param config Detector settings (skip patterns, layer rules)
     * @return Issues from this detector
     */
    List<GraphIssue> detect(GraphStore store, GraphConfig config);

    /**
     * Returns true if this detector is enabled by default.
     */
    default boolean enabledByDefault() {
        return true;
    }
}
