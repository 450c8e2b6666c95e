package io.codegraph.query;

import io.codegraph.model.IssueKind;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Repository-wide rollup.
 *
 * @param summary     Node and edge counts
 * @param entrypoints Entrypoint names grouped by type, each group capped
 * @param hotspots    Most imported files, descending
 * @param issues      Issue count for every kind, zero-filled
 * @param lastIndexed When the graph was last indexed (if known)
 * @param meta        Cost signal and applied scope
 */
public record DigestResult(
        Summary summary,
        Map<String, List<String>> entrypoints,
        List<Hotspot> hotspots,
        Map<IssueKind, Integer> issues,
        Instant lastIndexed,
        QueryMeta meta
) {
    public record Summary(int files, int directories, int modules, int entrypoints, int edges) {
    }

    /**
     * A file with at least the hotspot threshold of importers.
     *
     * @param path      File path
     * @param importers Number of incoming import edges
     * @param exports   Number of known exports, 0 when unknown
     */
    public record Hotspot(String path, int importers, int exports) {
    }

    DigestResult withMeta(QueryMeta newMeta) {
        return new DigestResult(summary, entrypoints, hotspots, issues, lastIndexed, newMeta);
    }
}
