package io.codegraph.report;

import io.codegraph.graph.GraphStore;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import io.codegraph.query.GraphQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsoleReporterTest {

    private GraphStore store;
    private GraphQuery query;
    private ConsoleReporter reporter;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
        store.addNode(GraphNode.file("src/index.ts"));
        store.addNode(GraphNode.file("src/user.ts", List.of("getUser")));
        store.addNode(GraphNode.file("src/app.ts"));
        store.addNode(GraphNode.entrypoint("src/app.ts", "route"));
        store.addEdge(GraphEdge.reexports("src/index.ts", "src/user.ts"));
        store.addEdge(GraphEdge.imports("src/app.ts", "src/user.ts"));
        query = new GraphQuery(store);
        reporter = new ConsoleReporter(false);
    }

    @Test
    void digest_printsSectionsWithoutAnsiCodes() {
        String output = reporter.toString(query.digest());

        assertThat(output).contains("REPOSITORY DIGEST", "SUMMARY", "ENTRYPOINTS", "No issues recorded.");
        assertThat(output).doesNotContain("\u001B[");
    }

    @Test
    void digest_withColors_emitsAnsiCodes() {
        String output = new ConsoleReporter(true).toString(query.digest());

        assertThat(output).contains("\u001B[1m");
    }

    @Test
    void module_listsImportsAndDependentsAsTree() {
        String output = reporter.toString(query.module("src/user.ts"));

        assertThat(output).contains("MODULE", "IMPORTED BY (1)", "└── src/app.ts", "getUser");
    }

    @Test
    void module_barrelIsFlagged() {
        String output = reporter.toString(query.module("src/index.ts"));

        assertThat(output).contains("Barrel file", "RE-EXPORTS (1)");
    }

    @Test
    void module_notFound() {
        String output = reporter.toString(query.module("src/missing.ts"));

        assertThat(output).contains("Module not found in graph.");
    }

    @Test
    void path_notConnected() {
        String output = reporter.toString(query.path("src/user.ts", "src/app.ts"));

        assertThat(output).contains("DEPENDENCY PATH", "Not connected within the depth limit.");
    }

    @Test
    void path_connectedShowsHops() {
        String output = reporter.toString(query.path("src/app.ts", "src/user.ts"));

        assertThat(output).contains("Connected", "shortest path 1 hop(s)");
    }

    @Test
    void impact_printsRiskAndDependents() {
        String output = reporter.toString(query.impact("src/user.ts"));

        assertThat(output).contains("CHANGE IMPACT", "Risk:", "DEPENDENTS");
    }

    @Test
    void issues_emptyList() {
        String output = reporter.toString(query.issues());

        assertThat(output).contains("ISSUES", "Showing 0 of 0", "No issues found.");
    }

    @Test
    void issues_printsEvidenceAndFix() {
        store.addIssue(GraphIssue.builder()
                .id("orphan:src/user.ts:getUser")
                .kind(IssueKind.ORPHAN_EXPORT)
                .severity(IssueSeverity.ERROR)
                .title("Unused export getUser")
                .evidence(List.of("No importers"))
                .suggestedFix("Remove the export")
                .filePath("src/user.ts")
                .build());

        String output = reporter.toString(query.issues());

        assertThat(output).contains("[ERR]", "Unused export getUser", "ORPHAN_EXPORT",
                "File: src/user.ts", "- No importers", "Fix: Remove the export", "1 error");
    }

    @Test
    void write_unsupportedType_throws() {
        assertThatThrownBy(() -> reporter.toString("plain text"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported result type: String");
    }
}
