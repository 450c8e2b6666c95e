package io.codegraph.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Bookkeeping about the current graph.
 *
 * @param version       Graph format version
 * @param lastIndexed   When the last full index finished, null before the first one
 * @param indexDuration How long the last index took, null before the first one
 * @param fileCount     Number of file nodes
 * @param nodeCount     Number of nodes of any kind
 * @param edgeCount     Number of edges
 * @param issueCount    Number of issues from the last analysis pass
 */
public record GraphMeta(
        String version,
        Instant lastIndexed,
        Duration indexDuration,
        int fileCount,
        int nodeCount,
        int edgeCount,
        int issueCount
) {
    public static final String CURRENT_VERSION = "1";

    public static GraphMeta empty() {
        return new GraphMeta(CURRENT_VERSION, null, null, 0, 0, 0, 0);
    }
}
