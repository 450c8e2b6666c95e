package io.codegraph.lsp;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of symbol kinds, numbered as in the Language Server Protocol.
 */
public enum SymbolKind {
    UNKNOWN(0, "unknown"),
    FILE(1, "file"),
    MODULE(2, "module"),
    NAMESPACE(3, "namespace"),
    PACKAGE(4, "package"),
    CLASS(5, "class"),
    METHOD(6, "method"),
    PROPERTY(7, "property"),
    FIELD(8, "field"),
    CONSTRUCTOR(9, "constructor"),
    ENUM(10, "enum"),
    INTERFACE(11, "interface"),
    FUNCTION(12, "function"),
    VARIABLE(13, "variable"),
    CONSTANT(14, "constant"),
    STRING(15, "string"),
    NUMBER(16, "number"),
    BOOLEAN(17, "boolean"),
    ARRAY(18, "array"),
    OBJECT(19, "object"),
    KEY(20, "key"),
    NULL(21, "null"),
    ENUM_MEMBER(22, "enumMember"),
    STRUCT(23, "struct"),
    EVENT(24, "event"),
    OPERATOR(25, "operator"),
    TYPE_PARAMETER(26, "typeParameter");

    private static final Set<SymbolKind> EXPORTABLE =
            EnumSet.of(FUNCTION, CLASS, VARIABLE, CONSTANT, INTERFACE, ENUM);

    private final int lspValue;
    private final String label;

    SymbolKind(int lspValue, String label) {
        this.lspValue = lspValue;
        this.label = label;
    }

    public int lspValue() {
        return lspValue;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Returns true for kinds that can be exported from a module at top level.
     */
    public boolean isExportable() {
        return EXPORTABLE.contains(this);
    }

    /**
     * Maps a protocol kind number. Values outside 1..26 map to {@link #UNKNOWN}.
     */
    public static SymbolKind fromLspValue(int value) {
        SymbolKind[] kinds = values();
        if (value >= 1 && value < kinds.length) {
            return kinds[value];
        }
        return UNKNOWN;
    }
}
