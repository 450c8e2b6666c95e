package io.codegraph.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphIssueTest {

    @Test
    void builder_storesLocationInMeta() {
        GraphIssue issue = GraphIssue.builder()
                .id("issue:orphan:src/x.ts:unused")
                .kind(IssueKind.ORPHAN_EXPORT)
                .filePath("src/x.ts")
                .symbol("unused")
                .line(12)
                .build();

        assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
        assertThat(issue.title()).isEqualTo("ORPHAN_EXPORT");
        assertThat(issue.filePath()).isEqualTo("src/x.ts");
        assertThat(issue.symbol()).isEqualTo("unused");
        assertThat(issue.line()).isEqualTo(12);
        assertThat(issue.targetPath()).isNull();
    }

    @Test
    void builder_ignoresNullMetaValues() {
        GraphIssue issue = GraphIssue.builder()
                .id("i1")
                .kind(IssueKind.LAYER_VIOLATION)
                .meta("source", null)
                .build();

        assertThat(issue.meta()).doesNotContainKey("source");
        assertThat(issue.line()).isEqualTo(-1);
    }

    @Test
    void builder_requiresKind() {
        assertThatThrownBy(() -> GraphIssue.builder().id("i1").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kind");
    }

    @Test
    void severity_ordersByRank() {
        assertThat(IssueSeverity.ERROR.isAtLeast(IssueSeverity.WARNING)).isTrue();
        assertThat(IssueSeverity.INFO.isAtLeast(IssueSeverity.WARNING)).isFalse();
        assertThat(IssueSeverity.fromLabel("Warning")).isEqualTo(IssueSeverity.WARNING);
    }
}
