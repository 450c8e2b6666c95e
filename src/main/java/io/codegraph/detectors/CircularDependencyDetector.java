package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.CycleDetector;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Detects import cycles, one issue per strongly connected component.
 * Cycles longer than three files, and files importing themselves, are errors.
 */
public class CircularDependencyDetector implements Detector {

    @Override
    public String id() {
        return "circular-dependency";
    }

    @Override
    public String description() {
        return "Detects files that import each other in a loop";
    }

    @Override
    public List<GraphIssue> detect(GraphStore store, GraphConfig config) {
        List<CycleDetector.Cycle> cycles = new CycleDetector(store, EnumSet.of(EdgeKind.IMPORTS)).findCycles();
        List<GraphIssue> issues = new ArrayList<>();

        for (CycleDetector.Cycle cycle : cycles) {
            List<String> paths = cycle.nodeIds().stream().map(id -> pathOf(store, id)).toList();
            List<String> breakPoints = cycle.breakPoints().stream().map(id -> pathOf(store, id)).toList();
            boolean selfImport = cycle.size() == 1;
            IssueSeverity severity = cycle.size() > 3 || selfImport ? IssueSeverity.ERROR : IssueSeverity.WARNING;

            issues.add(GraphIssue.builder()
                    .id("issue:cycle:" + String.join("|", paths.stream().sorted().toList()))
                    .kind(IssueKind.CIRCULAR_DEPENDENCY)
                    .severity(severity)
                    .nodeId(cycle.nodeIds().get(0))
                    .title("Circular dependency detected (" + cycle.size() + " files)")
                    .message(selfImport
                            ? "Self-referencing import in " + paths.get(0)
                            : "Import cycle: " + String.join(" → ", paths) + " → " + paths.get(0))
                    .evidence(paths)
                    .suggestedFix("Break the cycle at one of: " + String.join(", ", breakPoints)
                            + ", or extract the shared code to a separate module")
                    .filePath(paths.get(0))
                    .meta("affectedCount", cycle.size())
                    .meta("breakPoints", breakPoints)
                    .meta("detectorId", id())
                    .build());
        }
        return issues;
    }

    private static String pathOf(GraphStore store, String nodeId) {
        return store.getNode(nodeId)
                .map(n -> n.path() != null ? n.path() : n.id())
                .orElseGet(() -> GraphNode.stripKindPrefix(nodeId));
    }
}
