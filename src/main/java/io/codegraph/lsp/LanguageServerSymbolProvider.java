package io.codegraph.lsp;

import org.eclipse.lsp4j.CallHierarchyIncomingCallsParams;
import org.eclipse.lsp4j.CallHierarchyOutgoingCallsParams;
import org.eclipse.lsp4j.CallHierarchyPrepareParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.ReferenceContext;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.WorkspaceSymbolParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * {@link SymbolProvider} backed by an lsp4j {@link LanguageServer} proxy.
 * <p>
 * The server must already be initialized for the workspace root. Paths passed in are
 * relative to that root.
 */
public class LanguageServerSymbolProvider implements SymbolProvider {

    private static final Logger log = LoggerFactory.getLogger(LanguageServerSymbolProvider.class);

    private final LanguageServer server;
    private final Lsp4jConverters converters;
    private final Set<String> extensions;

    /**
     * @param server     Initialized language server
     * @param root       Workspace root
     * @param extensions File extensions the server handles, without the dot
     */
    public LanguageServerSymbolProvider(LanguageServer server, Path root, Set<String> extensions) {
        this.server = server;
        this.converters = new Lsp4jConverters(root);
        this.extensions = Set.copyOf(extensions);
    }

    public Lsp4jConverters converters() {
        return converters;
    }

    @Override
    public CompletableFuture<List<SymbolInfo>> documentSymbols(String path) {
        DocumentSymbolParams params = new DocumentSymbolParams(document(path));
        return server.getTextDocumentService().documentSymbol(params)
                .thenApply(Lsp4jConverters::toSymbolInfos);
    }

    @Override
    public CompletableFuture<List<WorkspaceSymbolInfo>> workspaceSymbols(String query) {
        return server.getWorkspaceService().symbol(new WorkspaceSymbolParams(query))
                .thenApply(this::toWorkspaceSymbols);
    }

    private List<WorkspaceSymbolInfo> toWorkspaceSymbols(
            Either<List<? extends SymbolInformation>, List<? extends WorkspaceSymbol>> result) {
        if (result == null) {
            return List.of();
        }
        List<WorkspaceSymbolInfo> symbols = new ArrayList<>();
        if (result.isLeft()) {
            result.getLeft().forEach(symbol -> symbols.add(converters.toWorkspaceSymbol(symbol)));
        } else {
            result.getRight().forEach(symbol -> symbols.add(converters.toWorkspaceSymbol(symbol)));
        }
        return symbols;
    }

    @Override
    public CompletableFuture<List<ReferenceInfo>> findReferences(String path, int line, int column, ReferenceOptions options) {
        ReferenceParams params = new ReferenceParams(
                document(path),
                Lsp4jConverters.toPosition(line, column),
                new ReferenceContext(options.includeDeclaration()));
        return server.getTextDocumentService().references(params)
                .thenApply(locations -> {
                    if (locations == null) {
                        return List.<ReferenceInfo>of();
                    }
                    LineReader lines = new LineReader();
                    List<ReferenceInfo> references = new ArrayList<>();
                    for (Location location : locations) {
                        if (references.size() >= options.limit()) {
                            break;
                        }
                        String refPath = converters.toPath(location.getUri());
                        int refLine = location.getRange().getStart().getLine() + 1;
                        boolean definition = refPath.equals(path) && contains(location.getRange(), line, column);
                        references.add(converters.toReference(location, lines.line(refPath, refLine), definition));
                    }
                    return references;
                });
    }

    @Override
    public CompletableFuture<List<DefinitionInfo>> definitions(String path, int line, int column) {
        DefinitionParams params = new DefinitionParams(document(path), Lsp4jConverters.toPosition(line, column));
        return server.getTextDocumentService().definition(params)
                .thenApply(result -> {
                    if (result == null) {
                        return List.<DefinitionInfo>of();
                    }
                    LineReader lines = new LineReader();
                    List<DefinitionInfo> definitions = new ArrayList<>();
                    if (result.isLeft()) {
                        for (Location location : result.getLeft()) {
                            String target = converters.toPath(location.getUri());
                            definitions.add(converters.toDefinition(location,
                                    lines.line(target, location.getRange().getStart().getLine() + 1)));
                        }
                    } else {
                        for (LocationLink link : result.getRight()) {
                            DefinitionInfo info = converters.toDefinition(link, null);
                            definitions.add(new DefinitionInfo(info.path(), info.line(), info.column(),
                                    info.endLine(), info.endColumn(), lines.line(info.path(), info.line())));
                        }
                    }
                    return definitions;
                });
    }

    @Override
    public CompletableFuture<Optional<CallHierarchyResult>> callHierarchy(String path, int line, int column) {
        CallHierarchyPrepareParams params = new CallHierarchyPrepareParams(document(path), Lsp4jConverters.toPosition(line, column));
        return server.getTextDocumentService().prepareCallHierarchy(params)
                .thenCompose(items -> {
                    if (items == null || items.isEmpty()) {
                        return CompletableFuture.completedFuture(Optional.<CallHierarchyResult>empty());
                    }
                    org.eclipse.lsp4j.CallHierarchyItem item = items.get(0);
                    var incoming = server.getTextDocumentService()
                            .callHierarchyIncomingCalls(new CallHierarchyIncomingCallsParams(item));
                    var outgoing = server.getTextDocumentService()
                            .callHierarchyOutgoingCalls(new CallHierarchyOutgoingCallsParams(item));
                    return incoming.thenCombine(outgoing, (callers, callees) -> Optional.of(new CallHierarchyResult(
                            converters.toCallHierarchyItem(item),
                            callers == null ? List.of() : callers.stream().map(converters::toCall).toList(),
                            callees == null ? List.of() : callees.stream().map(converters::toCall).toList())));
                });
    }

    @Override
    public CompletableFuture<Boolean> isAvailable(String path) {
        int dot = path.lastIndexOf('.');
        String extension = dot >= 0 ? path.substring(dot + 1) : "";
        boolean available = extensions.contains(extension)
                && Files.isRegularFile(converters.root().resolve(path));
        return CompletableFuture.completedFuture(available);
    }

    private TextDocumentIdentifier document(String path) {
        return new TextDocumentIdentifier(converters.toUri(path));
    }

    private static boolean contains(Range range, int line, int column) {
        Position position = Lsp4jConverters.toPosition(line, column);
        Position start = range.getStart();
        Position end = range.getEnd();
        boolean afterStart = position.getLine() > start.getLine()
                || (position.getLine() == start.getLine() && position.getCharacter() >= start.getCharacter());
        boolean beforeEnd = position.getLine() < end.getLine()
                || (position.getLine() == end.getLine() && position.getCharacter() <= end.getCharacter());
        return afterStart && beforeEnd;
    }

    /**
     * Reads source lines for one response, loading each file at most once.
     */
    private final class LineReader {
        private final Map<String, List<String>> files = new HashMap<>();

        String line(String path, int line) {
            List<String> lines = files.computeIfAbsent(path, this::read);
            return line >= 1 && line <= lines.size() ? lines.get(line - 1).trim() : null;
        }

        private List<String> read(String path) {
            Path file = converters.root().resolve(path);
            if (!Files.isRegularFile(file)) {
                return List.of();
            }
            try {
                return Files.readAllLines(file);
            } catch (IOException e) {
                log.debug("Could not read {} for line text: {}", file, e.getMessage());
                return List.of();
            }
        }
    }
}
