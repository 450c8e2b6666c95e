package io.codegraph.query;

import java.util.Map;

/**
 * Cost and completeness signal attached to every query result.
 *
 * @param tokensEstimate      Approximate serialized size in tokens
 * @param truncated           True when the result was cut to fit a limit
 * @param maxDepthReached     For path queries, true when a branch was cut by the depth bound
 * @param scopeApplied        Path prefix the result was restricted to (if any)
 * @param nextQuerySuggestion Hint for narrowing the next query when truncated
 * @param limits              Effective limits the query ran with
 */
public record QueryMeta(
        int tokensEstimate,
        boolean truncated,
        Boolean maxDepthReached,
        String scopeApplied,
        String nextQuerySuggestion,
        Map<String, Integer> limits
) {
    public QueryMeta {
        limits = limits == null ? Map.of() : Map.copyOf(limits);
    }

    public static QueryMeta of(boolean truncated, Map<String, Integer> limits) {
        return new QueryMeta(0, truncated, null, null, null, limits);
    }

    public QueryMeta withTokensEstimate(int tokens) {
        return new QueryMeta(tokens, truncated, maxDepthReached, scopeApplied, nextQuerySuggestion, limits);
    }

    public QueryMeta withMaxDepthReached(boolean reached) {
        return new QueryMeta(tokensEstimate, truncated, reached, scopeApplied, nextQuerySuggestion, limits);
    }

    public QueryMeta withScope(String scope) {
        return new QueryMeta(tokensEstimate, truncated, maxDepthReached, scope, nextQuerySuggestion, limits);
    }

    public QueryMeta withSuggestion(String suggestion) {
        return new QueryMeta(tokensEstimate, truncated, maxDepthReached, scopeApplied, suggestion, limits);
    }
}
