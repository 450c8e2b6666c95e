package io.codegraph.enhance;

import io.codegraph.lsp.CallHierarchyItem;
import io.codegraph.lsp.SymbolKind;

import java.util.List;

/**
 * A function in a call tree with its callers and callees expanded to a bounded depth.
 */
public record CallHierarchyNode(
        String name,
        SymbolKind kind,
        String path,
        int line,
        String detail,
        List<CallHierarchyNode> callers,
        List<CallHierarchyNode> callees
) {
    public CallHierarchyNode {
        callers = callers == null ? List.of() : List.copyOf(callers);
        callees = callees == null ? List.of() : List.copyOf(callees);
    }

    static CallHierarchyNode leaf(CallHierarchyItem item) {
        return of(item, List.of(), List.of());
    }

    static CallHierarchyNode of(CallHierarchyItem item, List<CallHierarchyNode> callers, List<CallHierarchyNode> callees) {
        return new CallHierarchyNode(item.name(), item.kind(), item.path(), item.line(), item.detail(), callers, callees);
    }
}
