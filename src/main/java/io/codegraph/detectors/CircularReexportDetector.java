package io.codegraph.detectors;

import io.codegraph.barrel.BarrelAnalyzer;
import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphIssue;

import java.util.List;

/**
 * Detects barrel files re-exporting each other in a loop.
 * The analyzer must be bound to the store being analyzed.
 */
public class CircularReexportDetector implements Detector {

    private final BarrelAnalyzer barrelAnalyzer;

    public CircularReexportDetector(BarrelAnalyzer barrelAnalyzer) {
        this.barrelAnalyzer = barrelAnalyzer;
    }

    @Override
    public String id() {
        return "circular-reexport";
    }

    @Override
    public String description() {
        return "Detects circular re-export chains between barrel files";
    }

    @Override
    public List<GraphIssue> detect(GraphStore store, GraphConfig config) {
        return barrelAnalyzer.detectCircularReexports();
    }
}
