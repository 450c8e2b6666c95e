package io.codegraph.barrel;

import java.util.List;

/**
 * A walk along re-export edges.
 *
 * @param start    Path the walk started from
 * @param symbol   Symbol being traced, {@code *} for any
 * @param chain    Visited paths in order, starting with {@code start}; when circular the
 *                 repeated path appears again at the end
 * @param depth    Number of hops taken
 * @param circular True when the walk returned to a path it had already visited
 */
public record ReexportChain(
        String start,
        String symbol,
        List<String> chain,
        int depth,
        boolean circular
) {
    public ReexportChain {
        chain = List.copyOf(chain);
    }

    /**
     * Last path in the chain, the concrete source when the chain is not circular.
     */
    public String end() {
        return chain.get(chain.size() - 1);
    }
}
