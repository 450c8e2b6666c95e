package io.codegraph.enhance;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.codegraph.graph.GraphStore;
import io.codegraph.lsp.CallHierarchyItem;
import io.codegraph.lsp.CallHierarchyResult;
import io.codegraph.lsp.DefinitionInfo;
import io.codegraph.lsp.Diagnostic;
import io.codegraph.lsp.ReferenceInfo;
import io.codegraph.lsp.ReferenceOptions;
import io.codegraph.lsp.SourceRange;
import io.codegraph.lsp.SymbolInfo;
import io.codegraph.lsp.SymbolProvider;
import io.codegraph.model.Confidence;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.GraphNode;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import io.codegraph.model.NodeKind;
import io.codegraph.query.GraphQuery;
import io.codegraph.query.ModuleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Supplier;

/**
 * Combines structural facts from the graph with precise facts from a language server.
 * <p>
 * Every call into the {@link SymbolProvider} is caught here: a failing or cancelled provider
 * degrades results to "not available" or {@code validated=false, confidence=low}; no future
 * returned by this class completes exceptionally.
 * <p>
 * Document symbols are cached per file for {@link #SYMBOL_CACHE_TTL}. Concurrent requests for
 * the same file share one provider call, and failed loads are not kept.
 */
public class GraphEnhancer {

    private static final Logger log = LoggerFactory.getLogger(GraphEnhancer.class);

    public static final Duration SYMBOL_CACHE_TTL = Duration.ofSeconds(30);
    public static final int DEFAULT_CALL_HIERARCHY_DEPTH = 2;

    static final int ORPHAN_REFERENCE_LIMIT = 10;
    static final int EXPORT_REFERENCE_LIMIT = 50;
    private static final int EVIDENCE_REFERENCES_SHOWN = 3;

    private final GraphStore store;
    private final SymbolProvider provider;
    private final GraphQuery query;
    private final AsyncCache<String, SymbolSnapshot> symbolCache;
    private final Map<String, List<Diagnostic>> diagnostics = new ConcurrentSkipListMap<>();

    private record SymbolSnapshot(List<SymbolInfo> symbols, Instant fetchedAt) {}

    public GraphEnhancer(GraphStore store, SymbolProvider provider) {
        this(store, provider, Ticker.systemTicker());
    }

    GraphEnhancer(GraphStore store, SymbolProvider provider, Ticker ticker) {
        this.store = store;
        this.provider = provider;
        this.query = new GraphQuery(store);
        this.symbolCache = Caffeine.newBuilder()
                .expireAfterWrite(SYMBOL_CACHE_TTL)
                .ticker(ticker)
                .buildAsync();
    }

    // ---- Node info ----

    /**
     * Graph facts for the file together with its symbols and diagnostics.
     */
    public CompletableFuture<EnhancedNodeInfo> getEnhancedNodeInfo(String path) {
        EnhancedNodeInfo.GraphInfo graph = graphInfo(path);
        List<Diagnostic> fileDiagnostics = getDiagnostics(path);

        return symbols(path).handle((snapshot, error) -> {
            if (error != null) {
                log.debug("Symbols unavailable for {}: {}", path, describe(error));
                return new EnhancedNodeInfo(path, graph,
                        new EnhancedNodeInfo.LspInfo(false, List.of(), fileDiagnostics, null));
            }
            return new EnhancedNodeInfo(path, graph,
                    new EnhancedNodeInfo.LspInfo(true, snapshot.symbols(), fileDiagnostics, snapshot.fetchedAt()));
        });
    }

    private EnhancedNodeInfo.GraphInfo graphInfo(String path) {
        ModuleResult module = query.module(path);
        Optional<GraphNode> node = store.getNodeByPath(path);
        String nodeId = node.map(GraphNode::id).orElse(null);

        int issueCount = (int) store.getIssues().stream()
                .filter(issue -> path.equals(issue.filePath()) || (nodeId != null && nodeId.equals(issue.nodeId())))
                .count();
        boolean entrypoint = !module.entrypoints().isEmpty()
                || node.map(n -> n.kind() == NodeKind.ENTRYPOINT).orElse(false);

        return new EnhancedNodeInfo.GraphInfo(
                module.imports(),
                module.importedBy(),
                module.exports(),
                entrypoint,
                module.importedBy().size() >= GraphQuery.HOTSPOT_THRESHOLD,
                issueCount
        );
    }

    private CompletableFuture<SymbolSnapshot> symbols(String path) {
        if (log.isDebugEnabled() && symbolCache.getIfPresent(path) != null) {
            log.debug("Symbol cache hit for {}", path);
        }
        return symbolCache.get(path, (key, executor) -> call(() -> provider.documentSymbols(key))
                .thenApply(symbols -> new SymbolSnapshot(symbols == null ? List.of() : List.copyOf(symbols), Instant.now())));
    }

    // ---- Issue validation ----

    public CompletableFuture<List<ValidatedIssue>> validateIssues(List<GraphIssue> issues) {
        return validateIssues(issues, CancellationToken.none());
    }

    /**
     * Checks each issue against the language server, one after another.
     * The result holds one entry per issue in input order.
     */
    public CompletableFuture<List<ValidatedIssue>> validateIssues(List<GraphIssue> issues, CancellationToken token) {
        List<ValidatedIssue> results = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (GraphIssue issue : issues) {
            chain = chain.thenCompose(ignored -> validateIssue(issue, token)).thenAccept(results::add);
        }
        return chain.thenApply(ignored -> List.copyOf(results));
    }

    CompletableFuture<ValidatedIssue> validateIssue(GraphIssue issue, CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.completedFuture(ValidatedIssue.unchecked(issue, "Validation cancelled"));
        }
        String filePath = issue.filePath();
        if (filePath == null) {
            return CompletableFuture.completedFuture(ValidatedIssue.unchecked(issue, "Issue has no file path"));
        }

        CompletableFuture<ValidatedIssue> result = switch (issue.kind()) {
            case ORPHAN_EXPORT -> validateOrphanExport(issue, filePath, token);
            case CIRCULAR_DEPENDENCY, CIRCULAR_REEXPORT -> validateCircular(issue, filePath, token);
            case BROKEN_EXPORT_CHAIN -> validateBrokenExport(issue, filePath, token);
            default -> CompletableFuture.completedFuture(ValidatedIssue.confirmed(issue, Confidence.MEDIUM, List.of()));
        };

        return result.exceptionally(error -> {
            log.debug("Validation of {} degraded: {}", issue.id(), describe(error));
            return ValidatedIssue.unchecked(issue, "LSP validation failed: " + describe(error));
        });
    }

    private CompletableFuture<ValidatedIssue> validateOrphanExport(GraphIssue issue, String filePath, CancellationToken token) {
        String symbol = issue.symbol();
        if (symbol == null) {
            return CompletableFuture.completedFuture(
                    ValidatedIssue.confirmed(issue, Confidence.MEDIUM, List.of("No symbol name to check")));
        }

        return token.guard(symbols(filePath)).thenCompose(snapshot -> {
            Optional<SymbolInfo> declared = findSymbol(snapshot.symbols(), symbol);
            if (declared.isEmpty()) {
                return CompletableFuture.completedFuture(ValidatedIssue.confirmed(issue, Confidence.MEDIUM,
                        List.of("Symbol '" + symbol + "' not found by the language server")));
            }

            SourceRange at = declared.get().selectionRange();
            ReferenceOptions options = ReferenceOptions.excludingDeclaration(ORPHAN_REFERENCE_LIMIT);
            return token.guard(call(() -> provider.findReferences(filePath, at.startLine(), at.startColumn(), options)))
                    .thenApply(references -> {
                        List<ReferenceInfo> external = references.stream()
                                .filter(ref -> !ref.definition() && !ref.path().equals(filePath))
                                .toList();
                        if (external.isEmpty()) {
                            return ValidatedIssue.confirmed(issue, Confidence.HIGH, List.of("No external references found"));
                        }
                        List<String> evidence = new ArrayList<>();
                        evidence.add("Found " + external.size() + " external reference(s)");
                        external.stream()
                                .limit(EVIDENCE_REFERENCES_SHOWN)
                                .forEach(ref -> evidence.add("Referenced at " + ref.path() + ":" + ref.line()));
                        return ValidatedIssue.refuted(issue, Confidence.HIGH, evidence);
                    });
        });
    }

    private CompletableFuture<ValidatedIssue> validateCircular(GraphIssue issue, String filePath, CancellationToken token) {
        return token.guard(symbols(filePath)).thenApply(snapshot -> {
            List<String> evidence = snapshot.symbols().isEmpty()
                    ? List.of()
                    : List.of("File has " + snapshot.symbols().size() + " symbol(s)");
            return ValidatedIssue.confirmed(issue, Confidence.MEDIUM, evidence);
        });
    }

    private CompletableFuture<ValidatedIssue> validateBrokenExport(GraphIssue issue, String filePath, CancellationToken token) {
        String symbol = issue.symbol();
        if (symbol == null) {
            return CompletableFuture.completedFuture(
                    ValidatedIssue.confirmed(issue, Confidence.MEDIUM, List.of("No symbol name to check")));
        }
        String target = issue.targetPath() != null ? issue.targetPath() : filePath;

        return token.guard(symbols(target)).thenApply(snapshot -> findSymbol(snapshot.symbols(), symbol)
                .map(found -> ValidatedIssue.refuted(issue, Confidence.HIGH, List.of(
                        "Symbol '" + symbol + "' exists in " + target + " at line " + found.range().startLine())))
                .orElseGet(() -> ValidatedIssue.confirmed(issue, Confidence.HIGH, List.of(
                        "Symbol '" + symbol + "' not found in " + target))));
    }

    /**
     * Looks for a symbol among the top-level symbols first, then among nested ones.
     */
    private static Optional<SymbolInfo> findSymbol(List<SymbolInfo> symbols, String name) {
        for (SymbolInfo symbol : symbols) {
            if (symbol.name().equals(name)) {
                return Optional.of(symbol);
            }
        }
        for (SymbolInfo symbol : symbols) {
            Optional<SymbolInfo> nested = findSymbol(symbol.children(), name);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    // ---- References and navigation ----

    /**
     * References to every top-level exportable symbol of the file. Symbols whose names start
     * with an underscore are treated as private and skipped.
     */
    public CompletableFuture<List<SymbolReferences>> getExportReferences(String path) {
        return symbols(path).thenCompose(snapshot -> {
            List<CompletableFuture<Optional<SymbolReferences>>> lookups = snapshot.symbols().stream()
                    .filter(symbol -> symbol.kind().isExportable() && !symbol.name().startsWith("_"))
                    .map(symbol -> referencesFor(path, symbol))
                    .toList();
            return CompletableFuture.allOf(lookups.toArray(new CompletableFuture<?>[0]))
                    .thenApply(ignored -> lookups.stream()
                            .map(CompletableFuture::join)
                            .flatMap(Optional::stream)
                            .toList());
        }).exceptionally(error -> {
            log.debug("Export references unavailable for {}: {}", path, describe(error));
            return List.of();
        });
    }

    private CompletableFuture<Optional<SymbolReferences>> referencesFor(String path, SymbolInfo symbol) {
        SourceRange at = symbol.selectionRange();
        ReferenceOptions options = ReferenceOptions.excludingDeclaration(EXPORT_REFERENCE_LIMIT);
        return call(() -> provider.findReferences(path, at.startLine(), at.startColumn(), options))
                .thenApply(references -> Optional.of(new SymbolReferences(
                        symbol.name(), symbol.kind(), at.startLine(), references, true, references.isEmpty())))
                .exceptionally(error -> {
                    log.debug("References unavailable for {} in {}: {}", symbol.name(), path, describe(error));
                    return Optional.empty();
                });
    }

    public CompletableFuture<Optional<CallHierarchyNode>> getCallHierarchy(String path, int line, int column) {
        return getCallHierarchy(path, line, column, DEFAULT_CALL_HIERARCHY_DEPTH);
    }

    /**
     * Call tree around the function at a position.
     *
     * @param depth Levels of callers and callees to include; 1 means direct ones only
     * @return The tree, empty when there is no function at the position or the server failed
     */
    public CompletableFuture<Optional<CallHierarchyNode>> getCallHierarchy(String path, int line, int column, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1, got " + depth);
        }
        Set<String> visited = ConcurrentHashMap.newKeySet();
        return call(() -> provider.callHierarchy(path, line, column))
                .thenCompose(result -> {
                    if (result.isEmpty()) {
                        return CompletableFuture.completedFuture(Optional.<CallHierarchyNode>empty());
                    }
                    CallHierarchyResult root = result.get();
                    visited.add(itemKey(root.item()));
                    return expandCalls(root.callers(), depth, visited, true)
                            .thenCombine(expandCalls(root.callees(), depth, visited, false),
                                    (callers, callees) -> Optional.of(CallHierarchyNode.of(root.item(), callers, callees)));
                })
                .exceptionally(error -> {
                    log.debug("Call hierarchy unavailable for {}:{}:{}: {}", path, line, column, describe(error));
                    return Optional.empty();
                });
    }

    private CompletableFuture<List<CallHierarchyNode>> expandCalls(List<CallHierarchyResult.Call> calls, int depth,
                                                                   Set<String> visited, boolean incoming) {
        List<CompletableFuture<CallHierarchyNode>> nodes = new ArrayList<>();
        for (CallHierarchyResult.Call edge : calls) {
            CallHierarchyItem item = edge.item();
            if (depth <= 1 || !visited.add(itemKey(item))) {
                nodes.add(CompletableFuture.completedFuture(CallHierarchyNode.leaf(item)));
                continue;
            }
            nodes.add(call(() -> provider.callHierarchy(item.path(), item.line(), item.column()))
                    .thenCompose(next -> {
                        if (next.isEmpty()) {
                            return CompletableFuture.completedFuture(CallHierarchyNode.leaf(item));
                        }
                        List<CallHierarchyResult.Call> further = incoming ? next.get().callers() : next.get().callees();
                        return expandCalls(further, depth - 1, visited, incoming)
                                .thenApply(children -> incoming
                                        ? CallHierarchyNode.of(item, children, List.of())
                                        : CallHierarchyNode.of(item, List.of(), children));
                    })
                    .exceptionally(error -> {
                        log.debug("Could not expand call hierarchy at {}: {}", item.name(), describe(error));
                        return CallHierarchyNode.leaf(item);
                    }));
        }
        return CompletableFuture.allOf(nodes.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> nodes.stream().map(CompletableFuture::join).toList());
    }

    private static String itemKey(CallHierarchyItem item) {
        return item.path() + ":" + item.line() + ":" + item.name();
    }

    public CompletableFuture<List<DefinitionInfo>> getDefinition(String path, int line, int column) {
        return call(() -> provider.definitions(path, line, column))
                .exceptionally(error -> {
                    log.debug("Definition unavailable for {}:{}:{}: {}", path, line, column, describe(error));
                    return List.of();
                });
    }

    public CompletableFuture<List<ReferenceInfo>> findReferences(String path, int line, int column) {
        return findReferences(path, line, column, ReferenceOptions.defaults());
    }

    public CompletableFuture<List<ReferenceInfo>> findReferences(String path, int line, int column, ReferenceOptions options) {
        return call(() -> provider.findReferences(path, line, column, options))
                .exceptionally(error -> {
                    log.debug("References unavailable for {}:{}:{}: {}", path, line, column, describe(error));
                    return List.of();
                });
    }

    // ---- Diagnostics feed ----

    /**
     * Replaces the cached diagnostics of a file. An empty list clears them.
     */
    public void onDiagnosticsChanged(String path, List<Diagnostic> fileDiagnostics) {
        if (fileDiagnostics == null || fileDiagnostics.isEmpty()) {
            diagnostics.remove(path);
        } else {
            diagnostics.put(path, List.copyOf(fileDiagnostics));
        }
    }

    public List<Diagnostic> getDiagnostics(String path) {
        return diagnostics.getOrDefault(path, List.of());
    }

    /**
     * All cached diagnostics, by path in sorted order.
     */
    public Map<String, List<Diagnostic>> getAllDiagnostics() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    /**
     * Converts cached error and warning diagnostics into issues. Info and hint diagnostics
     * are dropped. The store is not modified.
     */
    public List<GraphIssue> syncDiagnosticsToIssues() {
        List<GraphIssue> issues = new ArrayList<>();
        for (Map.Entry<String, List<Diagnostic>> entry : diagnostics.entrySet()) {
            String path = entry.getKey();
            for (Diagnostic diagnostic : entry.getValue()) {
                IssueSeverity severity = switch (diagnostic.severity()) {
                    case ERROR -> IssueSeverity.ERROR;
                    case WARNING -> IssueSeverity.WARNING;
                    case INFO, HINT -> null;
                };
                if (severity == null) {
                    continue;
                }
                issues.add(GraphIssue.builder()
                        .id("lsp:" + path + ":" + diagnostic.line() + ":" + diagnostic.column())
                        .kind(IssueKind.DYNAMIC_EDGE_UNKNOWN)
                        .severity(severity)
                        .title("[LSP] " + (diagnostic.source() != null ? diagnostic.source() : "Diagnostic"))
                        .message(diagnostic.message())
                        .evidence(List.of(diagnostic.message()))
                        .filePath(path)
                        .line(diagnostic.line())
                        .meta(GraphIssue.META_COLUMN, diagnostic.column())
                        .meta("source", diagnostic.source())
                        .meta("code", diagnostic.code())
                        .build());
            }
        }
        return issues;
    }

    // ---- Cache control ----

    public void clearCache() {
        symbolCache.synchronous().invalidateAll();
        diagnostics.clear();
    }

    public void clearFileCache(String path) {
        symbolCache.synchronous().invalidate(path);
        diagnostics.remove(path);
    }

    public CompletableFuture<Boolean> isLspAvailable(String path) {
        return call(() -> provider.isAvailable(path))
                .thenApply(Boolean.TRUE::equals)
                .exceptionally(error -> {
                    log.debug("Availability check failed for {}: {}", path, describe(error));
                    return false;
                });
    }

    /**
     * Invokes the provider, turning a synchronous throw or a null future into a failed future.
     */
    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> request) {
        try {
            CompletableFuture<T> future = request.get();
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("Symbol provider returned no result"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }
}
