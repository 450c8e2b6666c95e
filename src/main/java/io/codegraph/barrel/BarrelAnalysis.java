package io.codegraph.barrel;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of scanning one file for re-export statements.
 *
 * @param path      File path
 * @param barrel    True when the file is an index file with at least one re-export
 * @param reexports Re-export statements in source order
 */
public record BarrelAnalysis(
        String path,
        @JsonProperty("isBarrel") boolean barrel,
        List<ReexportEntry> reexports
) {
    public BarrelAnalysis {
        reexports = List.copyOf(reexports);
    }
}
