package io.codegraph.report;

import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import io.codegraph.query.DigestResult;
import io.codegraph.query.EntrypointRef;
import io.codegraph.query.ImpactResult;
import io.codegraph.query.IssueListResult;
import io.codegraph.query.ModuleResult;
import io.codegraph.query.PathResult;
import io.codegraph.query.QueryMeta;
import io.codegraph.query.RiskLevel;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Formats query results for console output with ANSI colors.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    // Unicode tree-drawing characters
    private static final String TREE_BRANCH = "\u251C\u2500\u2500 ";  // ├──
    private static final String TREE_LAST = "\u2514\u2500\u2500 ";    // └──

    private static final int WIDTH = 70;

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(Object result, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        if (result instanceof DigestResult digest) {
            printDigest(out, digest);
        } else if (result instanceof PathResult path) {
            printPath(out, path);
        } else if (result instanceof ModuleResult module) {
            printModule(out, module);
        } else if (result instanceof ImpactResult impact) {
            printImpact(out, impact);
        } else if (result instanceof IssueListResult issues) {
            printIssues(out, issues);
        } else {
            throw new IllegalArgumentException("Unsupported result type: "
                    + (result == null ? "null" : result.getClass().getSimpleName()));
        }
        out.flush();
    }

    // ---- Digest ----

    private void printDigest(PrintWriter out, DigestResult digest) {
        printHeader(out, "REPOSITORY DIGEST");

        DigestResult.Summary summary = digest.summary();
        out.println(bold("SUMMARY"));
        out.println(line('-', WIDTH));
        out.println(String.format("Files: %,d | Directories: %,d | Modules: %,d | Entrypoints: %,d | Edges: %,d",
                summary.files(), summary.directories(), summary.modules(), summary.entrypoints(), summary.edges()));
        if (digest.lastIndexed() != null) {
            out.println("Last indexed: " + digest.lastIndexed());
        }
        out.println();

        if (!digest.entrypoints().isEmpty()) {
            out.println(bold("ENTRYPOINTS"));
            out.println(line('-', WIDTH));
            for (Map.Entry<String, List<String>> group : digest.entrypoints().entrySet()) {
                out.println(bold(group.getKey()) + color(CYAN, " (" + group.getValue().size() + ")"));
                printTree(out, group.getValue(), "  ");
            }
            out.println();
        }

        if (!digest.hotspots().isEmpty()) {
            out.println(bold("HOTSPOTS") + color(CYAN, " (" + digest.hotspots().size() + ")"));
            out.println(line('-', WIDTH));
            for (DigestResult.Hotspot hotspot : digest.hotspots()) {
                out.println(String.format("  %-50s %s importers, %d exports",
                        hotspot.path(), color(YELLOW, String.valueOf(hotspot.importers())), hotspot.exports()));
            }
            out.println();
        }

        out.println(bold("ISSUES"));
        out.println(line('-', WIDTH));
        long total = digest.issues().values().stream().mapToLong(Integer::longValue).sum();
        if (total == 0) {
            out.println(color(GREEN, "No issues recorded."));
        } else {
            for (Map.Entry<IssueKind, Integer> entry : digest.issues().entrySet()) {
                if (entry.getValue() > 0) {
                    out.println(String.format("  %-25s %d", entry.getKey().name(), entry.getValue()));
                }
            }
        }
        printFooter(out, digest.meta());
    }

    // ---- Path ----

    private void printPath(PrintWriter out, PathResult result) {
        printHeader(out, "DEPENDENCY PATH");
        out.println(result.from() + " → " + result.to());

        if (!result.connected()) {
            out.println(color(YELLOW, "Not connected within the depth limit."));
            printFooter(out, result.meta());
            return;
        }

        out.println(color(GREEN, "Connected") + ", shortest path " + result.shortestPath() + " hop(s)");
        out.println();
        int index = 1;
        for (PathResult.Path path : result.paths()) {
            out.println(bold("[" + index++ + "]") + color(CYAN, " " + path.length() + " hop(s)"));
            printTree(out, path.nodes(), "  ");
        }
        printFooter(out, result.meta());
    }

    // ---- Module ----

    private void printModule(PrintWriter out, ModuleResult module) {
        printHeader(out, "MODULE");
        out.println("Path: " + module.path());

        if (!module.found()) {
            out.println(color(YELLOW, "Module not found in graph."));
            printFooter(out, module.meta());
            return;
        }

        if (module.barrel()) {
            out.println(color(CYAN, "Barrel file"));
        }
        if (module.framework() != null) {
            out.println("Framework: " + module.framework());
        }
        out.println();

        printSection(out, "IMPORTS", module.imports());
        printSection(out, "IMPORTED BY", module.importedBy());
        printSection(out, "EXPORTS", module.exports());
        printSection(out, "RE-EXPORTS", module.reexports());

        if (!module.entrypoints().isEmpty()) {
            out.println(bold("ENTRYPOINTS") + color(CYAN, " (" + module.entrypoints().size() + ")"));
            printTree(out, module.entrypoints().stream().map(this::describe).toList(), "  ");
        }
        printFooter(out, module.meta());
    }

    // ---- Impact ----

    private void printImpact(PrintWriter out, ImpactResult impact) {
        printHeader(out, "CHANGE IMPACT");
        out.println("Target: " + impact.target());

        ImpactResult.RiskAssessment risk = impact.risk();
        out.println("Risk: " + riskIndicator(risk.level()) + " " + risk.reason());
        for (String factor : risk.factors()) {
            out.println("  - " + factor);
        }
        if (!impact.found()) {
            printFooter(out, impact.meta());
            return;
        }
        out.println();

        out.println(bold("DEPENDENTS") + color(CYAN, " (" + impact.totalDependents() + " within depth "
                + impact.depthReached() + ")"));
        out.println(line('-', WIDTH));
        for (Map.Entry<Integer, Integer> level : impact.dependentsByDepth().entrySet()) {
            out.println(String.format("  depth %d: %d", level.getKey(), level.getValue()));
        }
        printTree(out, impact.directDependents(), "  ");
        out.println();

        if (!impact.affectedEntrypoints().isEmpty()) {
            out.println(bold("AFFECTED ENTRYPOINTS") + color(CYAN, " (" + impact.affectedEntrypoints().size() + ")"));
            printTree(out, impact.affectedEntrypoints().stream().map(this::describe).toList(), "  ");
        }
        printFooter(out, impact.meta());
    }

    // ---- Issues ----

    private void printIssues(PrintWriter out, IssueListResult result) {
        printHeader(out, "ISSUES");
        IssueListResult.Stats stats = result.stats();
        out.println(String.format("Showing %d of %d", stats.returned(), stats.total()));

        StringBuilder bySeverity = new StringBuilder("Severity: ");
        bySeverity.append(color(RED, stats.bySeverity().getOrDefault(IssueSeverity.ERROR, 0) + " error")).append(" | ");
        bySeverity.append(color(YELLOW, stats.bySeverity().getOrDefault(IssueSeverity.WARNING, 0) + " warning")).append(" | ");
        bySeverity.append(stats.bySeverity().getOrDefault(IssueSeverity.INFO, 0)).append(" info");
        out.println(bySeverity);
        out.println();

        if (result.issues().isEmpty()) {
            out.println(color(GREEN, "No issues found."));
        }

        int index = 1;
        for (IssueListResult.IssueSummary issue : result.issues()) {
            out.println("[" + index++ + "] " + severityIndicator(issue.severity()) + " "
                    + bold(issue.summary()) + color(CYAN, " " + issue.kind().name()));
            if (issue.file() != null) {
                out.println("    File: " + issue.file());
            }
            for (String evidence : issue.evidence()) {
                out.println("    - " + evidence);
            }
            if (issue.suggestedFix() != null) {
                out.println("    " + color(GREEN, "Fix: " + issue.suggestedFix()));
            }
            out.println();
        }
        printFooter(out, result.meta());
    }

    // ---- Shared pieces ----

    private void printHeader(PrintWriter out, String title) {
        out.println();
        out.println(line('=', WIDTH));
        out.println(center(title, WIDTH));
        out.println(line('=', WIDTH));
        out.println();
    }

    private void printFooter(PrintWriter out, QueryMeta meta) {
        out.println(line('=', WIDTH));
        if (meta == null) {
            return;
        }
        if (meta.truncated()) {
            String hint = meta.nextQuerySuggestion() != null ? " " + meta.nextQuerySuggestion() + "." : "";
            out.println(color(YELLOW, "Results truncated." + hint));
        }
        if (meta.scopeApplied() != null) {
            out.println("Scope: " + meta.scopeApplied());
        }
        out.println("~" + meta.tokensEstimate() + " tokens");
    }

    private void printSection(PrintWriter out, String title, List<String> items) {
        out.println(bold(title) + color(CYAN, " (" + items.size() + ")"));
        printTree(out, items, "  ");
        out.println();
    }

    private void printTree(PrintWriter out, List<String> items, String indent) {
        for (int i = 0; i < items.size(); i++) {
            boolean last = i == items.size() - 1;
            out.println(indent + (last ? TREE_LAST : TREE_BRANCH) + items.get(i));
        }
    }

    private String describe(EntrypointRef entrypoint) {
        String type = entrypoint.type() != null ? " [" + entrypoint.type() + "]" : "";
        return entrypoint.name() + type + (entrypoint.path() != null ? " " + entrypoint.path() : "");
    }

    private String riskIndicator(RiskLevel level) {
        return switch (level) {
            case CRITICAL -> color(RED, "[CRIT]");
            case HIGH -> color(YELLOW, "[HIGH]");
            case MEDIUM -> "[MED]";
            case LOW -> color(GREEN, "[LOW]");
        };
    }

    private String severityIndicator(IssueSeverity severity) {
        return switch (severity) {
            case ERROR -> color(RED, "[ERR]");
            case WARNING -> color(YELLOW, "[WARN]");
            case INFO -> color(CYAN, "[INFO]");
        };
    }

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
