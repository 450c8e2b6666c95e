package io.codegraph.lsp;

import org.eclipse.lsp4j.CallHierarchyIncomingCall;
import org.eclipse.lsp4j.CallHierarchyOutgoingCall;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts lsp4j protocol objects to the provider's value types.
 * <p>
 * Protocol positions are 0-indexed and converted to 1-indexed. Document URIs under the
 * workspace root become root-relative paths with forward slashes; other URIs are kept as is.
 */
public final class Lsp4jConverters {

    private final Path root;

    public Lsp4jConverters(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    // ---- Paths and positions ----

    public String toUri(String path) {
        return root.resolve(path).toUri().toString();
    }

    public String toPath(String uri) {
        try {
            URI parsed = URI.create(uri);
            if (!"file".equals(parsed.getScheme())) {
                return uri;
            }
            Path file = Path.of(parsed).toAbsolutePath().normalize();
            if (file.startsWith(root)) {
                return root.relativize(file).toString().replace('\\', '/');
            }
            return file.toString();
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            return uri;
        }
    }

    public static Position toPosition(int line, int column) {
        return new Position(line - 1, column - 1);
    }

    public static SourceRange toRange(Range range) {
        Position start = range.getStart();
        Position end = range.getEnd();
        return new SourceRange(start.getLine() + 1, start.getCharacter() + 1, end.getLine() + 1, end.getCharacter() + 1);
    }

    public static SymbolKind toSymbolKind(org.eclipse.lsp4j.SymbolKind kind) {
        return kind == null ? SymbolKind.UNKNOWN : SymbolKind.fromLspValue(kind.getValue());
    }

    public static DiagnosticSeverity toSeverity(org.eclipse.lsp4j.DiagnosticSeverity severity) {
        return severity == null ? DiagnosticSeverity.INFO : DiagnosticSeverity.fromLspValue(severity.getValue());
    }

    // ---- Symbols ----

    public static SymbolInfo toSymbolInfo(DocumentSymbol symbol) {
        List<SymbolInfo> children = new ArrayList<>();
        if (symbol.getChildren() != null) {
            for (DocumentSymbol child : symbol.getChildren()) {
                children.add(toSymbolInfo(child));
            }
        }
        return new SymbolInfo(
                symbol.getName(),
                toSymbolKind(symbol.getKind()),
                toRange(symbol.getRange()),
                symbol.getSelectionRange() != null ? toRange(symbol.getSelectionRange()) : null,
                symbol.getDetail(),
                children
        );
    }

    /**
     * Converts a flat symbol. Servers that answer document symbol requests this way give no
     * nesting, so the result has no children.
     */
    public static SymbolInfo toSymbolInfo(SymbolInformation symbol) {
        SourceRange range = toRange(symbol.getLocation().getRange());
        return new SymbolInfo(symbol.getName(), toSymbolKind(symbol.getKind()), range, range, symbol.getContainerName(), List.of());
    }

    public static List<SymbolInfo> toSymbolInfos(List<Either<SymbolInformation, DocumentSymbol>> symbols) {
        if (symbols == null) {
            return List.of();
        }
        List<SymbolInfo> result = new ArrayList<>();
        for (Either<SymbolInformation, DocumentSymbol> symbol : symbols) {
            result.add(symbol.isRight() ? toSymbolInfo(symbol.getRight()) : toSymbolInfo(symbol.getLeft()));
        }
        return result;
    }

    public WorkspaceSymbolInfo toWorkspaceSymbol(SymbolInformation symbol) {
        Location location = symbol.getLocation();
        Position start = location.getRange().getStart();
        return new WorkspaceSymbolInfo(
                symbol.getName(),
                toSymbolKind(symbol.getKind()),
                symbol.getContainerName(),
                toPath(location.getUri()),
                start.getLine() + 1,
                start.getCharacter() + 1
        );
    }

    public WorkspaceSymbolInfo toWorkspaceSymbol(WorkspaceSymbol symbol) {
        if (symbol.getLocation().isLeft()) {
            Location location = symbol.getLocation().getLeft();
            Position start = location.getRange().getStart();
            return new WorkspaceSymbolInfo(symbol.getName(), toSymbolKind(symbol.getKind()), symbol.getContainerName(),
                    toPath(location.getUri()), start.getLine() + 1, start.getCharacter() + 1);
        }
        // Location without a range; resolved lazily by servers that support it
        String uri = symbol.getLocation().getRight().getUri();
        return new WorkspaceSymbolInfo(symbol.getName(), toSymbolKind(symbol.getKind()), symbol.getContainerName(),
                toPath(uri), 1, 1);
    }

    // ---- Locations ----

    public DefinitionInfo toDefinition(Location location, String lineText) {
        SourceRange range = toRange(location.getRange());
        return new DefinitionInfo(toPath(location.getUri()), range.startLine(), range.startColumn(),
                range.endLine(), range.endColumn(), lineText);
    }

    public DefinitionInfo toDefinition(LocationLink link, String lineText) {
        Range target = link.getTargetSelectionRange() != null ? link.getTargetSelectionRange() : link.getTargetRange();
        return toDefinition(new Location(link.getTargetUri(), target), lineText);
    }

    public ReferenceInfo toReference(Location location, String lineText, boolean definition) {
        Position start = location.getRange().getStart();
        return new ReferenceInfo(toPath(location.getUri()), start.getLine() + 1, start.getCharacter() + 1, lineText, definition);
    }

    // ---- Call hierarchy ----

    public CallHierarchyItem toCallHierarchyItem(org.eclipse.lsp4j.CallHierarchyItem item) {
        Range name = item.getSelectionRange() != null ? item.getSelectionRange() : item.getRange();
        return new CallHierarchyItem(
                item.getName(),
                toSymbolKind(item.getKind()),
                toPath(item.getUri()),
                name.getStart().getLine() + 1,
                name.getStart().getCharacter() + 1,
                item.getDetail()
        );
    }

    public CallHierarchyResult.Call toCall(CallHierarchyIncomingCall call) {
        return new CallHierarchyResult.Call(toCallHierarchyItem(call.getFrom()), toCallSites(call.getFromRanges()));
    }

    public CallHierarchyResult.Call toCall(CallHierarchyOutgoingCall call) {
        return new CallHierarchyResult.Call(toCallHierarchyItem(call.getTo()), toCallSites(call.getFromRanges()));
    }

    private static List<CallSite> toCallSites(List<Range> ranges) {
        if (ranges == null) {
            return List.of();
        }
        return ranges.stream()
                .map(range -> new CallSite(range.getStart().getLine() + 1, range.getStart().getCharacter() + 1))
                .toList();
    }

    // ---- Diagnostics ----

    public static Diagnostic toDiagnostic(org.eclipse.lsp4j.Diagnostic diagnostic) {
        String code = null;
        if (diagnostic.getCode() != null) {
            code = String.valueOf(diagnostic.getCode().get());
        }
        return new Diagnostic(
                toSeverity(diagnostic.getSeverity()),
                diagnostic.getMessage() != null ? diagnostic.getMessage() : "",
                diagnostic.getRange() != null ? toRange(diagnostic.getRange()) : null,
                diagnostic.getSource(),
                code
        );
    }
}
