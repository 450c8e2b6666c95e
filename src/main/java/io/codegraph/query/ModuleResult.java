package io.codegraph.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything the graph knows about a single file.
 *
 * @param path        Path as given by the caller
 * @param found       False when no node matched; every list is then empty
 * @param imports     Paths reached via outgoing import edges
 * @param importedBy  Paths reached via incoming import edges
 * @param exports     Exported symbol names, empty when unknown
 * @param reexports   Targets of outgoing re-export edges
 * @param barrel      True when the file re-exports or is typed as a barrel
 * @param entrypoints Entrypoint nodes sharing this file's path
 * @param framework   Framework detected by the crawler (if any)
 * @param meta        Cost signal
 */
public record ModuleResult(
        String path,
        boolean found,
        List<String> imports,
        List<String> importedBy,
        List<String> exports,
        List<String> reexports,
        @JsonProperty("isBarrel") boolean barrel,
        List<EntrypointRef> entrypoints,
        String framework,
        QueryMeta meta
) {
    public ModuleResult {
        imports = List.copyOf(imports);
        importedBy = List.copyOf(importedBy);
        exports = List.copyOf(exports);
        reexports = List.copyOf(reexports);
        entrypoints = List.copyOf(entrypoints);
    }

    static ModuleResult notFound(String path) {
        return new ModuleResult(path, false, List.of(), List.of(), List.of(), List.of(), false, List.of(), null,
                QueryMeta.of(false, null));
    }

    ModuleResult withMeta(QueryMeta newMeta) {
        return new ModuleResult(path, found, imports, importedBy, exports, reexports, barrel, entrypoints,
                framework, newMeta);
    }
}
