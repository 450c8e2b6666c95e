package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects imports whose target cannot be verified statically.
 */
public class DynamicEdgeDetector implements Detector {

    @Override
    public String id() {
        return "dynamic-edge";
    }

    @Override
    public String description() {
        return "Detects dynamic imports that cannot be statically resolved";
    }

    @Override
    public List<GraphIssue> detect(GraphStore store, GraphConfig config) {
        List<GraphIssue> issues = new ArrayList<>();
        for (GraphEdge edge : store.getAllEdges()) {
            if (!edge.dynamic()) {
                continue;
            }
            Optional<GraphNode> from = store.getNode(edge.from());
            GraphIssue.Builder builder = GraphIssue.builder()
                    .id("issue:dynamic:" + edge.id())
                    .kind(IssueKind.DYNAMIC_EDGE_UNKNOWN)
                    .severity(IssueSeverity.WARNING)
                    .nodeId(edge.from())
                    .title("Dynamic import in " + from.map(GraphNode::name).orElse(edge.from()))
                    .evidence(List.of(
                            "Dynamic import detected: " + (edge.reason() != null ? edge.reason() : "unknown reason"),
                            "Target: " + edge.to(),
                            "Cannot statically verify this connection"))
                    .suggestedFix("Use a static import if possible")
                    .filePath(from.map(GraphNode::path).orElse(null))
                    .meta("detectorId", id());
            Object line = edge.meta().get(GraphEdge.META_LINE);
            if (line instanceof Number number) {
                builder.line(number.intValue());
            }
            issues.add(builder.build());
        }
        return issues;
    }
}
