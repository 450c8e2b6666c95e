package io.codegraph.detectors;

import io.codegraph.barrel.BarrelAnalyzer;
import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Registry of all available detectors.
 * Manages detector execution and result aggregation.
 */
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final List<Detector> detectors;

    private DetectorRegistry(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Creates a registry with all default detectors.
     *
     * @param barrelAnalyzer Analyzer over the same store, used for circular re-export detection
     */
    public static DetectorRegistry createDefault(BarrelAnalyzer barrelAnalyzer) {
        return new DetectorRegistry(List.of(
                new UnreachableHandlerDetector(),
                new DynamicEdgeDetector(),
                new BrokenExportDetector(),
                new CircularDependencyDetector(),
                new CircularReexportDetector(barrelAnalyzer),
                new LayerViolationDetector()
        ));
    }

    /**
     * Creates a registry with specific detectors.
     */
    public static DetectorRegistry of(Detector... detectors) {
        return new DetectorRegistry(Arrays.asList(detectors));
    }

    /**
     * Runs all enabled detectors that the configuration does not disable.
     *
     * @return All issues from all detectors, in detector order
     */
    public List<GraphIssue> runAll(GraphStore store, GraphConfig config) {
        List<GraphIssue> allIssues = new ArrayList<>();
        for (Detector detector : detectors) {
            if (detector.enabledByDefault() && !config.isDetectorDisabled(detector.id())) {
                allIssues.addAll(runOne(detector, store, config));
            }
        }
        return allIssues;
    }

    /**
     * Runs specific detectors by ID.
     *
     * @return All issues from the specified detectors
     */
    public List<GraphIssue> run(GraphStore store, GraphConfig config, Set<String> detectorIds) {
        List<GraphIssue> allIssues = new ArrayList<>();
        for (Detector detector : detectors) {
            if (detectorIds.contains(detector.id())) {
                allIssues.addAll(runOne(detector, store, config));
            }
        }
        return allIssues;
    }

    /**
     * Runs every enabled detector and replaces the store's issue set with the result.
     * Issues sharing an id are reported once.
     *
     * @return The new issue set
     */
    public List<GraphIssue> analyze(GraphStore store, GraphConfig config) {
        Map<String, GraphIssue> byId = new LinkedHashMap<>();
        for (GraphIssue issue : runAll(store, config)) {
            byId.putIfAbsent(issue.id(), issue);
        }
        List<GraphIssue> issues = List.copyOf(byId.values());
        store.setIssues(issues);
        log.info("Analysis found {} issue(s) across {} node(s)", issues.size(), store.nodeCount());
        return issues;
    }

    private static List<GraphIssue> runOne(Detector detector, GraphStore store, GraphConfig config) {
        List<GraphIssue> issues = detector.detect(store, config);
        log.debug("Detector {} reported {} issue(s)", detector.id(), issues.size());
        return issues;
    }

    /**
     * Returns all registered detectors.
     */
    public List<Detector> allDetectors() {
        return detectors;
    }

    /**
     * Returns a detector by ID, if present.
     */
    public Optional<Detector> getById(String id) {
        return detectors.stream()
                .filter(d -> d.id().equals(id))
                .findFirst();
    }
}
