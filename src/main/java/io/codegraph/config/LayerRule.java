package io.codegraph.config;

import io.codegraph.model.IssueSeverity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * An architectural boundary: files matching {@code from} must not import files matching
 * {@code cannotImport}.
 * <p>
 * Patterns are globs over repository-relative paths: {@code **} crosses directories,
 * {@code *} stays within one segment, {@code ?} matches one character.
 *
 * @param name         Rule name, used in issue titles
 * @param from         Glob for importing files
 * @param cannotImport Glob for forbidden targets
 * @param severity     Severity of a violation
 * @param description  Why the boundary exists (optional)
 */
public record LayerRule(
        String name,
        String from,
        String cannotImport,
        IssueSeverity severity,
        String description
) {
    public LayerRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("from cannot be null or blank");
        }
        if (cannotImport == null || cannotImport.isBlank()) {
            throw new IllegalArgumentException("cannotImport cannot be null or blank");
        }
        if (severity == null) {
            severity = IssueSeverity.ERROR;
        }
    }

    /**
     * Returns true if an import from {@code sourcePath} to {@code targetPath} breaks this rule.
     */
    public boolean isViolatedBy(String sourcePath, String targetPath) {
        return matches(sourcePath, from) && matches(targetPath, cannotImport);
    }

    static boolean matches(String path, String glob) {
        if (path == null) {
            return false;
        }
        return toRegex(glob).matcher(path.replace('\\', '/')).matches();
    }

    static Pattern toRegex(String glob) {
        String normalized = glob.replace('\\', '/');
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (c == '*') {
                if (i + 1 < normalized.length() && normalized.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    /**
     * Builds a rule from a YAML mapping.
     *
     * @throws IllegalArgumentException if a required key is missing
     */
    static LayerRule fromMap(Map<?, ?> values) {
        Object severity = values.get("severity");
        return new LayerRule(
                asString(values.get("name")),
                asString(values.get("from")),
                asString(values.get("cannotImport")),
                severity != null ? IssueSeverity.fromLabel(severity.toString()) : IssueSeverity.ERROR,
                asString(values.get("description"))
        );
    }

    Map<String, Object> toMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", name);
        values.put("from", from);
        values.put("cannotImport", cannotImport);
        values.put("severity", severity.label());
        if (description != null) {
            values.put("description", description);
        }
        return values;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
