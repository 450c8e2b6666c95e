package io.codegraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A structural problem detected in the graph.
 *
 * @param id           Unique key, stable across analysis passes for the same problem
 * @param kind         Issue category
 * @param severity     How serious the problem is
 * @param nodeId       Primary node the issue is attached to (if applicable)
 * @param title        One-line summary
 * @param message      Longer explanation (if available)
 * @param evidence     Supporting facts, one per entry
 * @param suggestedFix Recommended action (if available)
 * @param meta         Extra attributes such as {@code filePath}, {@code symbol}, {@code line}
 */
public record GraphIssue(
        String id,
        IssueKind kind,
        IssueSeverity severity,
        String nodeId,
        String title,
        String message,
        List<String> evidence,
        String suggestedFix,
        Map<String, Object> meta
) {
    public static final String META_FILE_PATH = "filePath";
    public static final String META_SYMBOL = "symbol";
    public static final String META_LINE = "line";
    public static final String META_COLUMN = "column";
    public static final String META_TARGET_PATH = "targetPath";

    /**
     * Compact constructor with validation.
     */
    public GraphIssue {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (title == null) {
            title = kind.name();
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /**
     * File the issue refers to, or null when the issue is not file-scoped.
     */
    public String filePath() {
        Object value = meta.get(META_FILE_PATH);
        return value != null ? value.toString() : null;
    }

    /**
     * Symbol the issue refers to, or null.
     */
    public String symbol() {
        Object value = meta.get(META_SYMBOL);
        return value != null ? value.toString() : null;
    }

    /**
     * File the issue's symbol should live in when that differs from {@link #filePath()},
     * e.g. the source of a broken re-export. Null when not recorded.
     */
    public String targetPath() {
        Object value = meta.get(META_TARGET_PATH);
        return value != null ? value.toString() : null;
    }

    /**
     * 1-indexed line the issue refers to, or -1 when unknown.
     */
    public int line() {
        Object value = meta.get(META_LINE);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return -1;
    }

    /**
     * Builder for creating GraphIssue instances.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private IssueKind kind;
        private IssueSeverity severity = IssueSeverity.WARNING;
        private String nodeId;
        private String title;
        private String message;
        private List<String> evidence = List.of();
        private String suggestedFix;
        private final Map<String, Object> meta = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(IssueKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(IssueSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder evidence(List<String> evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder suggestedFix(String suggestedFix) {
            this.suggestedFix = suggestedFix;
            return this;
        }

        public Builder filePath(String filePath) {
            return meta(META_FILE_PATH, filePath);
        }

        public Builder symbol(String symbol) {
            return meta(META_SYMBOL, symbol);
        }

        public Builder line(int line) {
            return meta(META_LINE, line);
        }

        public Builder meta(String key, Object value) {
            if (value != null) {
                this.meta.put(key, value);
            }
            return this;
        }

        public Builder meta(Map<String, Object> values) {
            values.forEach(this::meta);
            return this;
        }

        public GraphIssue build() {
            return new GraphIssue(id, kind, severity, nodeId, title, message, evidence, suggestedFix, meta);
        }
    }
}
