package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.graph.ReachabilityAnalyzer;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import io.codegraph.model.NodeKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Detects files with exports that no entrypoint reaches.
 * <p>
 * Reachability follows imports and re-exports from every entrypoint node. A graph without
 * entrypoints produces nothing, since every file would be flagged. Files with unknown or
 * empty export lists, and files matching the configured skip patterns (tests, configs,
 * declaration files), are never reported.
 */
public class UnreachableHandlerDetector implements Detector {

    private static final int EXPORTS_SHOWN = 3;

    @Override
    public String id() {
        return "unreachable-handler";
    }

    @Override
    public String description() {
        return "Detects exporting files that no entrypoint can reach";
    }

    @Override
    public List<GraphIssue> detect(GraphStore store, GraphConfig config) {
        List<GraphNode> entrypoints = store.getNodesByKind(NodeKind.ENTRYPOINT);
        if (entrypoints.isEmpty()) {
            return List.of();
        }

        List<String> roots = new ArrayList<>();
        for (GraphNode entrypoint : entrypoints) {
            roots.add(entrypoint.id());
            // an entrypoint stands for the file at the same path
            roots.add(GraphNode.idFor(NodeKind.FILE, entrypoint.path()));
        }
        Set<String> reachable = new ReachabilityAnalyzer(store, EnumSet.of(EdgeKind.IMPORTS, EdgeKind.REEXPORTS))
                .reachableFrom(roots);

        List<GraphIssue> issues = new ArrayList<>();
        for (GraphNode file : store.getNodesByKind(NodeKind.FILE)) {
            if (reachable.contains(file.id()) || file.path() == null || config.isUnreachableSkipped(file.path())) {
                continue;
            }
            List<String> exports = file.exports().orElse(List.of());
            if (exports.isEmpty()) {
                continue;
            }
            issues.add(createIssue(file, exports));
        }
        return issues;
    }

    private GraphIssue createIssue(GraphNode file, List<String> exports) {
        String shown = String.join(", ", exports.subList(0, Math.min(EXPORTS_SHOWN, exports.size())));
        if (exports.size() > EXPORTS_SHOWN) {
            shown += "...";
        }
        return GraphIssue.builder()
                .id("issue:unreachable:" + file.id())
                .kind(IssueKind.HANDLER_UNREACHABLE)
                .severity(severityFor(exports.size()))
                .nodeId(file.id())
                .title("Unreachable file: " + file.name())
                .evidence(List.of(
                        "File exports " + exports.size() + " symbol(s): " + shown,
                        "Not imported by any file reachable from entrypoints"))
                .suggestedFix("Import this file from a reachable module, register it as an entrypoint, or remove it")
                .filePath(file.path())
                .meta("affectedCount", exports.size())
                .meta("detectorId", id())
                .build();
    }

    static IssueSeverity severityFor(int exportCount) {
        if (exportCount > 5) {
            return IssueSeverity.ERROR;
        }
        if (exportCount > 2) {
            return IssueSeverity.WARNING;
        }
        return IssueSeverity.INFO;
    }
}
