package io.codegraph.query;

import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;

/**
 * Filters for an issue listing. Null fields do not filter.
 *
 * @param kind        Only issues of this kind
 * @param minSeverity Only issues at least this severe
 * @param scope       Only issues whose file path starts with this prefix
 * @param limit       Maximum number of issues returned
 */
public record IssueQueryOptions(IssueKind kind, IssueSeverity minSeverity, String scope, int limit) {
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 50;

    public IssueQueryOptions {
        if (scope != null && scope.isBlank()) {
            scope = null;
        }
        if (limit < 1) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static IssueQueryOptions defaults() {
        return new IssueQueryOptions(null, null, null, DEFAULT_LIMIT);
    }

    public IssueQueryOptions withKind(IssueKind newKind) {
        return new IssueQueryOptions(newKind, minSeverity, scope, limit);
    }

    public IssueQueryOptions withMinSeverity(IssueSeverity severity) {
        return new IssueQueryOptions(kind, severity, scope, limit);
    }

    public IssueQueryOptions withScope(String newScope) {
        return new IssueQueryOptions(kind, minSeverity, newScope, limit);
    }
}
