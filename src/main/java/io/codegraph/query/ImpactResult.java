package io.codegraph.query;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Blast radius of changing one file.
 *
 * @param target              Target reference as given
 * @param found               False when the target is not in the graph
 * @param directDependents    Paths that import the target directly, limited
 * @param dependentsByDepth   Number of dependents at each distance
 * @param totalDependents     Size of the dependent closure within the depth bound
 * @param affectedEntrypoints Entrypoints that reach the target or one of its dependents
 * @param risk                Risk tier, reason and contributing factors
 * @param depthReached        Depth the closure was computed to
 * @param meta                Cost and truncation signal
 */
public record ImpactResult(
        String target,
        boolean found,
        List<String> directDependents,
        SortedMap<Integer, Integer> dependentsByDepth,
        int totalDependents,
        List<EntrypointRef> affectedEntrypoints,
        RiskAssessment risk,
        int depthReached,
        QueryMeta meta
) {
    /**
     * @param level   Tier
     * @param reason  One-line explanation of the tier
     * @param factors What pushed the tier up
     */
    public record RiskAssessment(RiskLevel level, String reason, List<String> factors) {
        public RiskAssessment {
            factors = List.copyOf(factors);
        }
    }

    static ImpactResult notFound(String target) {
        return new ImpactResult(target, false, List.of(), new TreeMap<>(), 0, List.of(),
                new RiskAssessment(RiskLevel.LOW, "Target not found in graph", List.of("File may not be indexed")),
                0, QueryMeta.of(false, null));
    }

    ImpactResult withMeta(QueryMeta newMeta) {
        return new ImpactResult(target, found, directDependents, dependentsByDepth, totalDependents,
                affectedEntrypoints, risk, depthReached, newMeta);
    }
}
