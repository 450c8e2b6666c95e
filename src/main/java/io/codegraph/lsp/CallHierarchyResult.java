package io.codegraph.lsp;

import java.util.List;

/**
 * A symbol with the functions that call it and the functions it calls.
 *
 * @param item    The symbol at the requested position
 * @param callers Incoming calls
 * @param callees Outgoing calls
 */
public record CallHierarchyResult(CallHierarchyItem item, List<Call> callers, List<Call> callees) {

    public CallHierarchyResult {
        callers = callers == null ? List.of() : List.copyOf(callers);
        callees = callees == null ? List.of() : List.copyOf(callees);
    }

    /**
     * The other end of a call and where the calls happen.
     */
    public record Call(CallHierarchyItem item, List<CallSite> callSites) {
        public Call {
            callSites = callSites == null ? List.of() : List.copyOf(callSites);
        }
    }
}
