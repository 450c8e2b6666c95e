package io.codegraph.lsp;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class Lsp4jConvertersTest {

    @TempDir
    Path root;

    @Test
    void toPath_relativizesUrisUnderRoot() {
        Lsp4jConverters converters = new Lsp4jConverters(root);

        assertThat(converters.toPath(converters.toUri("src/a.ts"))).isEqualTo("src/a.ts");
        assertThat(converters.toPath("untitled:Untitled-1")).isEqualTo("untitled:Untitled-1");
    }

    @Test
    void positions_shiftBetweenZeroAndOneIndexed() {
        assertThat(Lsp4jConverters.toPosition(1, 1)).isEqualTo(new Position(0, 0));
        assertThat(Lsp4jConverters.toRange(new Range(new Position(2, 4), new Position(3, 0))))
                .isEqualTo(new SourceRange(3, 5, 4, 1));
    }

    @Test
    void toSymbolKind_mapsProtocolValues() {
        assertThat(Lsp4jConverters.toSymbolKind(org.eclipse.lsp4j.SymbolKind.Class)).isEqualTo(SymbolKind.CLASS);
        assertThat(Lsp4jConverters.toSymbolKind(org.eclipse.lsp4j.SymbolKind.TypeParameter))
                .isEqualTo(SymbolKind.TYPE_PARAMETER);
        assertThat(Lsp4jConverters.toSymbolKind(null)).isEqualTo(SymbolKind.UNKNOWN);
    }

    @Test
    void toDiagnostic_carriesCodeAndSeverity() {
        org.eclipse.lsp4j.Diagnostic raw = new org.eclipse.lsp4j.Diagnostic(
                new Range(new Position(9, 2), new Position(9, 8)), "Cannot find name 'usr'.",
                org.eclipse.lsp4j.DiagnosticSeverity.Error, "ts");
        raw.setCode(Either.forRight(2304));

        Diagnostic diagnostic = Lsp4jConverters.toDiagnostic(raw);

        assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.ERROR);
        assertThat(diagnostic.line()).isEqualTo(10);
        assertThat(diagnostic.column()).isEqualTo(3);
        assertThat(diagnostic.code()).isEqualTo("2304");
        assertThat(diagnostic.source()).isEqualTo("ts");
    }

    @Test
    void toDiagnostic_missingSeverityIsInfo() {
        org.eclipse.lsp4j.Diagnostic raw = new org.eclipse.lsp4j.Diagnostic(
                new Range(new Position(0, 0), new Position(0, 1)), "hint");

        assertThat(Lsp4jConverters.toDiagnostic(raw).severity()).isEqualTo(DiagnosticSeverity.INFO);
        assertThat(Lsp4jConverters.toDiagnostic(raw).code()).isNull();
    }

    @Test
    void toDiagnostic_withoutRangeOrMessage_pointsAtFileStart() {
        Diagnostic diagnostic = Lsp4jConverters.toDiagnostic(new org.eclipse.lsp4j.Diagnostic());

        assertThat(diagnostic.message()).isEmpty();
        assertThat(diagnostic.line()).isEqualTo(1);
        assertThat(diagnostic.column()).isEqualTo(1);
    }
}
