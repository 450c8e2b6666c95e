package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects re-export edges whose target is not in the graph.
 */
public class BrokenExportDetector implements Detector {

    @Override
    public String id() {
        return "broken-export";
    }

    @Override
    public String description() {
        return "Detects re-exports pointing at files missing from the graph";
    }

    @Override
    public List<GraphIssue> detect(GraphStore store, GraphConfig config) {
        List<GraphIssue> issues = new ArrayList<>();
        for (GraphEdge edge : store.getAllEdges()) {
            if (edge.kind() != EdgeKind.REEXPORTS || store.hasNode(edge.to())) {
                continue;
            }
            Optional<GraphNode> from = store.getNode(edge.from());
            issues.add(GraphIssue.builder()
                    .id("issue:broken:" + edge.id())
                    .kind(IssueKind.BROKEN_EXPORT_CHAIN)
                    .severity(IssueSeverity.ERROR)
                    .nodeId(edge.from())
                    .title("Broken export in " + from.map(GraphNode::name).orElse(edge.from()))
                    .evidence(List.of(
                            "Export target not found: " + edge.to(),
                            "This may cause runtime errors"))
                    .suggestedFix("Verify the export path and that the target file exists")
                    .filePath(from.map(GraphNode::path).orElse(null))
                    .symbol(edge.importPath() != null ? edge.importPath() : edge.to())
                    .meta("detectorId", id())
                    .build());
        }
        return issues;
    }
}
