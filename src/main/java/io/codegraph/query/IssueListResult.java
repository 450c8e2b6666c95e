package io.codegraph.query;

import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;

import java.util.List;
import java.util.Map;

/**
 * Filtered issue listing.
 *
 * @param issues Issues after filtering and limiting
 * @param stats  Counts over the filtered set before limiting
 * @param meta   Cost and truncation signal
 */
public record IssueListResult(List<IssueSummary> issues, Stats stats, QueryMeta meta) {

    /**
     * @param id           Issue id
     * @param kind         Issue kind
     * @param severity     Severity
     * @param file         File path, {@code unknown} when the issue has none
     * @param summary      Title
     * @param evidence     Supporting facts
     * @param suggestedFix Recommended action (if any)
     */
    public record IssueSummary(
            String id,
            IssueKind kind,
            IssueSeverity severity,
            String file,
            String summary,
            List<String> evidence,
            String suggestedFix
    ) {
    }

    public record Stats(
            int total,
            int returned,
            Map<IssueKind, Integer> byKind,
            Map<IssueSeverity, Integer> bySeverity
    ) {
    }

    IssueListResult withMeta(QueryMeta newMeta) {
        return new IssueListResult(issues, stats, newMeta);
    }
}
