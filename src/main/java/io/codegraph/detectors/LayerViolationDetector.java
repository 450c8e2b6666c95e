package io.codegraph.detectors;

import io.codegraph.config.GraphConfig;
import io.codegraph.config.LayerRule;
import io.codegraph.graph.GraphStore;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks import edges against the configured layer rules.
 */
public class LayerViolationDetector implements Detector {

    @Override
    public String id() {
        return "layer-violation";
    }

    @Override
    public String description() {
        return "Detects imports that cross forbidden architectural boundaries";
    }

    @Override
    public List<GraphIssue> detect(GraphStore store, GraphConfig config) {
        List<LayerRule> rules = config.layerRules();
        if (rules.isEmpty()) {
            return List.of();
        }

        List<GraphIssue> issues = new ArrayList<>();
        for (GraphEdge edge : store.getAllEdges()) {
            if (edge.kind() != EdgeKind.IMPORTS) {
                continue;
            }
            String source = GraphNode.stripKindPrefix(edge.from());
            String target = GraphNode.stripKindPrefix(edge.to());
            for (LayerRule rule : rules) {
                if (rule.isViolatedBy(source, target)) {
                    issues.add(createIssue(rule, edge, source, target));
                }
            }
        }
        return issues;
    }

    private GraphIssue createIssue(LayerRule rule, GraphEdge edge, String source, String target) {
        Object line = edge.meta().get(GraphEdge.META_LINE);
        String location = line != null ? source + ":" + line : source;
        GraphIssue.Builder builder = GraphIssue.builder()
                .id("issue:layer:" + rule.name() + ":" + source + ":" + target)
                .kind(IssueKind.LAYER_VIOLATION)
                .severity(rule.severity())
                .nodeId(edge.from())
                .title("Layer violation: " + rule.name())
                .message(rule.description() != null ? rule.description() : source + " should not import " + target)
                .evidence(List.of(
                        "Source: " + location,
                        "Target: " + target,
                        "Rule: " + rule.from() + " cannot import " + rule.cannotImport()))
                .suggestedFix("Move the shared code to a common module or invert the dependency")
                .filePath(source)
                .meta("ruleName", rule.name())
                .meta("targetFile", target)
                .meta("detectorId", id());
        if (line instanceof Number number) {
            builder.line(number.intValue());
        }
        return builder.build();
    }
}
