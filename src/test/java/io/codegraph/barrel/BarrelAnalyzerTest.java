package io.codegraph.barrel;

import io.codegraph.graph.GraphStore;
import io.codegraph.model.EdgeKind;
import io.codegraph.model.GraphEdge;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BarrelAnalyzerTest {

    private static final String INDEX = "export * from './user';\nexport { auth } from './auth';";

    private GraphStore store;
    private BarrelAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
        analyzer = new BarrelAnalyzer(store);
    }

    @Test
    void analyzeFile_indexWithReexports_isBarrel() {
        BarrelAnalysis analysis = analyzer.analyzeFile("src/index.ts", INDEX);

        assertThat(analysis.barrel()).isTrue();
        assertThat(analysis.reexports()).hasSize(2);
        assertThat(analysis.reexports().get(0).wildcard()).isTrue();
        assertThat(analysis.reexports().get(1).symbols()).containsExactly("auth");
    }

    @Test
    void analyzeFile_nonIndexOrNoReexports_isNotBarrel() {
        assertThat(analyzer.analyzeFile("src/users.ts", INDEX).barrel()).isFalse();
        assertThat(analyzer.analyzeFile("src/index.ts", "export const a = 1;").barrel()).isFalse();
    }

    @Test
    void analyzeFile_sameContent_returnsCachedInstance() {
        BarrelAnalysis first = analyzer.analyzeFile("src/index.ts", INDEX);
        BarrelAnalysis second = analyzer.analyzeFile("src/index.ts", INDEX);
        BarrelAnalysis changed = analyzer.analyzeFile("src/index.ts", INDEX + "\nexport * from './extra';");

        assertThat(second).isSameAs(first);
        assertThat(changed).isNotSameAs(first);
        assertThat(changed.reexports()).hasSize(3);
    }

    @Test
    void clearFileCache_forcesFreshAnalysis() {
        BarrelAnalysis first = analyzer.analyzeFile("src/index.ts", INDEX);
        analyzer.clearFileCache("src/index.ts");

        assertThat(analyzer.analyzeFile("src/index.ts", INDEX)).isNotSameAs(first).isEqualTo(first);
    }

    @Test
    void getAllBarrels_listsOnlyBarrels() {
        analyzer.analyzeFile("src/index.ts", INDEX);
        analyzer.analyzeFile("src/util.ts", INDEX);

        assertThat(analyzer.getAllBarrels()).extracting(BarrelAnalysis::path).containsExactly("src/index.ts");

        analyzer.clearCache();
        assertThat(analyzer.getAllBarrels()).isEmpty();
    }

    @Test
    void isIndexFile_matchesScriptExtensionsOnly() {
        assertThat(BarrelAnalyzer.isIndexFile("src/index.ts")).isTrue();
        assertThat(BarrelAnalyzer.isIndexFile("index.mjs")).isTrue();
        assertThat(BarrelAnalyzer.isIndexFile("src/index.css")).isFalse();
        assertThat(BarrelAnalyzer.isIndexFile("src/reindex.ts")).isFalse();
    }

    @Test
    void createBarrelEdges_resolvesRelativeSources() {
        store.addNode(GraphNode.file("src/user.ts"));
        store.addNode(GraphNode.file("src/auth/index.ts"));

        List<GraphEdge> edges = analyzer.createBarrelEdges("src/index.ts", INDEX);

        assertThat(edges).extracting(GraphEdge::to).containsExactly("file:src/user.ts", "file:src/auth/index.ts");
        assertThat(edges).allSatisfy(edge -> {
            assertThat(edge.kind()).isEqualTo(EdgeKind.REEXPORTS);
            assertThat(edge.from()).isEqualTo("file:src/index.ts");
        });
        assertThat(edges.get(1).importPath()).isEqualTo("./auth");
    }

    @Test
    void createBarrelEdges_statementsWithSameSource_shareOneEdge() {
        store.addNode(GraphNode.file("src/x.ts"));
        String content = "export { a } from './x';\nexport { b } from './x';\nexport * from './x';\n";

        List<GraphEdge> edges = analyzer.createBarrelEdges("src/index.ts", content);

        assertThat(edges).singleElement().satisfies(edge -> {
            assertThat(edge.to()).isEqualTo("file:src/x.ts");
            assertThat(edge.reason()).isEqualTo("wildcard re-export");
            assertThat(edge.meta()).containsEntry(GraphEdge.META_LINE, 1);
        });
        edges.forEach(store::addEdge);
        assertThat(store.getEdgesFrom("file:src/index.ts")).hasSize(1);
    }

    @Test
    void validateReexports_missingSourceFile_isBrokenChain() {
        store.addNode(GraphNode.file("src/index.ts"));
        store.addNode(GraphNode.file("src/user.ts"));

        List<GraphIssue> issues = analyzer.validateReexports("src/index.ts", INDEX);

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.BROKEN_EXPORT_CHAIN);
            assertThat(issue.severity()).isEqualTo(IssueSeverity.ERROR);
            assertThat(issue.symbol()).isEqualTo("./auth");
            assertThat(issue.line()).isEqualTo(2);
        });
    }

    @Test
    void validateReexports_missingSymbol_recordsTargetPath() {
        store.addNode(GraphNode.file("src/user.ts"));
        store.addNode(GraphNode.file("src/auth.ts", List.of("login", "logout")));

        List<GraphIssue> issues = analyzer.validateReexports("src/index.ts", INDEX);

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.title()).contains("'auth'");
            assertThat(issue.targetPath()).isEqualTo("src/auth.ts");
            assertThat(issue.evidence()).contains("Available exports: login, logout");
        });
    }

    @Test
    void validateReexports_wildcardsAndPackagesAreNotReported() {
        String content = "export * from './nowhere';\nexport { useState } from 'react';";

        assertThat(analyzer.validateReexports("src/index.ts", content)).isEmpty();
    }

    @Test
    void validateReexports_unknownExportList_isTrusted() {
        store.addNode(GraphNode.file("src/auth.ts"));

        assertThat(analyzer.validateReexports("src/index.ts", "export { auth } from './auth';")).isEmpty();
    }

    @Test
    void detectCircularReexports_reportsCycleOnce() {
        store.addNode(GraphNode.file("src/a/index.ts"));
        store.addNode(GraphNode.file("src/b/index.ts"));
        store.addEdge(GraphEdge.reexports("src/a/index.ts", "src/b/index.ts"));
        store.addEdge(GraphEdge.reexports("src/b/index.ts", "src/a/index.ts"));
        store.addEdge(GraphEdge.imports("src/c.ts", "src/a/index.ts"));

        List<GraphIssue> issues = analyzer.detectCircularReexports();

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.CIRCULAR_REEXPORT);
            assertThat(issue.message()).isEqualTo("2 files re-export from each other");
            assertThat(issue.meta()).containsEntry("affectedCount", 2);
            assertThat(issue.evidence().get(0))
                    .isEqualTo("Re-export chain: src/a/index.ts → src/b/index.ts → src/a/index.ts");
        });
    }

    @Test
    void detectCircularReexports_selfReexport_isCycleOfOne() {
        store.addEdge(GraphEdge.reexports("src/index.ts", "src/index.ts"));

        assertThat(analyzer.detectCircularReexports()).singleElement()
                .satisfies(issue -> assertThat(issue.message()).isEqualTo("src/index.ts re-exports from itself"));
    }

    @Test
    void detectCircularReexports_diamondIsNotACycle() {
        store.addEdge(GraphEdge.reexports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.reexports("a.ts", "c.ts"));
        store.addEdge(GraphEdge.reexports("b.ts", "d.ts"));
        store.addEdge(GraphEdge.reexports("c.ts", "d.ts"));

        assertThat(analyzer.detectCircularReexports()).isEmpty();
    }

    @Test
    void detectCircularReexports_overlappingCycles_foundWhateverTheEdgeOrder() {
        store.addEdge(GraphEdge.reexports("a.ts", "c.ts"));
        store.addEdge(GraphEdge.reexports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.reexports("b.ts", "c.ts"));
        store.addEdge(GraphEdge.reexports("c.ts", "a.ts"));

        assertThat(analyzer.detectCircularReexports())
                .extracting(issue -> issue.meta().get("cycle"))
                .containsExactlyInAnyOrder(List.of("a.ts", "c.ts"), List.of("a.ts", "b.ts", "c.ts"));
    }

    @Test
    void detectCircularReexports_overlappingCycles_otherEdgeOrder() {
        store.addEdge(GraphEdge.reexports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.reexports("a.ts", "c.ts"));
        store.addEdge(GraphEdge.reexports("b.ts", "c.ts"));
        store.addEdge(GraphEdge.reexports("c.ts", "a.ts"));

        assertThat(analyzer.detectCircularReexports())
                .extracting(issue -> issue.meta().get("cycle"))
                .containsExactlyInAnyOrder(List.of("a.ts", "c.ts"), List.of("a.ts", "b.ts", "c.ts"));
    }

    @Test
    void detectCircularReexports_cyclesSharingANode() {
        store.addEdge(GraphEdge.reexports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.reexports("b.ts", "a.ts"));
        store.addEdge(GraphEdge.reexports("b.ts", "c.ts"));
        store.addEdge(GraphEdge.reexports("c.ts", "b.ts"));
        store.addEdge(GraphEdge.reexports("c.ts", "c.ts"));

        assertThat(analyzer.detectCircularReexports())
                .extracting(issue -> issue.meta().get("cycle"))
                .containsExactlyInAnyOrder(List.of("a.ts", "b.ts"), List.of("b.ts", "c.ts"), List.of("c.ts"));
    }

    @Test
    void detectCircularReexports_longChain_doesNotOverflow() {
        for (int i = 0; i < 20_000; i++) {
            store.addEdge(GraphEdge.reexports("f" + i + ".ts", "f" + (i + 1) + ".ts"));
        }

        assertThat(analyzer.detectCircularReexports()).isEmpty();

        store.addEdge(GraphEdge.reexports("f20000.ts", "f0.ts"));

        assertThat(analyzer.detectCircularReexports()).singleElement()
                .satisfies(issue -> assertThat(issue.meta()).containsEntry("affectedCount", 20_001));
    }

    @Test
    void traceReexportChain_followsNamedStatementFirst() {
        store.addNode(GraphNode.file("src/index.ts"));
        store.addNode(GraphNode.file("src/user.ts"));
        store.addNode(GraphNode.file("src/auth.ts"));
        analyzer.createBarrelEdges("src/index.ts", INDEX).forEach(store::addEdge);

        ReexportChain chain = analyzer.traceReexportChain("src/index.ts", "auth");

        assertThat(chain.chain()).containsExactly("src/index.ts", "src/auth.ts");
        assertThat(chain.depth()).isEqualTo(1);
        assertThat(chain.circular()).isFalse();
        assertThat(chain.end()).isEqualTo("src/auth.ts");
    }

    @Test
    void traceReexportChain_detectsLoop() {
        store.addNode(GraphNode.file("a.ts"));
        store.addNode(GraphNode.file("b.ts"));
        store.addEdge(GraphEdge.reexports("a.ts", "b.ts"));
        store.addEdge(GraphEdge.reexports("b.ts", "a.ts"));

        ReexportChain chain = analyzer.traceReexportChain("a.ts", "*");

        assertThat(chain.circular()).isTrue();
        assertThat(chain.chain()).containsExactly("a.ts", "b.ts", "a.ts");
    }

    @Test
    void traceReexportChain_stopsAtDepth() {
        for (int i = 0; i < 5; i++) {
            store.addNode(GraphNode.file("f" + i + ".ts"));
        }
        for (int i = 0; i < 4; i++) {
            store.addEdge(GraphEdge.reexports("f" + i + ".ts", "f" + (i + 1) + ".ts"));
        }

        ReexportChain chain = analyzer.traceReexportChain("f0.ts", "*", 2);

        assertThat(chain.depth()).isEqualTo(2);
        assertThat(chain.end()).isEqualTo("f2.ts");
    }

    @Test
    void traceReexportChain_rejectsBadArguments() {
        assertThatThrownBy(() -> analyzer.traceReexportChain("a.ts", " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.traceReexportChain("a.ts", "x", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveRelative_normalizesDotSegments() {
        assertThat(BarrelAnalyzer.resolveRelative("src/api/index.ts", "../lib/./db")).isEqualTo("src/lib/db");
        assertThat(BarrelAnalyzer.resolveRelative("index.ts", "./a")).isEqualTo("a");
    }

    @Test
    void resolveSource_prefersRecordedEdge() {
        store.addNode(GraphNode.file("src/index.ts"));
        store.addNode(GraphNode.file("lib/real.ts"));
        store.addEdge(new GraphEdge("e1", "file:src/index.ts", "file:lib/real.ts", EdgeKind.REEXPORTS, null, null,
                Map.of(GraphEdge.META_IMPORT_PATH, "./alias")));

        assertThat(analyzer.resolveSource("src/index.ts", "./alias")).get()
                .satisfies(node -> assertThat(node.path()).isEqualTo("lib/real.ts"));
    }
}
