package io.codegraph;

import io.codegraph.barrel.BarrelAnalyzer;
import io.codegraph.config.GraphConfig;
import io.codegraph.detectors.DetectorRegistry;
import io.codegraph.graph.GraphStore;
import io.codegraph.io.GraphJson;
import io.codegraph.model.GraphIssue;
import io.codegraph.model.IssueKind;
import io.codegraph.model.IssueSeverity;
import io.codegraph.query.GraphQuery;
import io.codegraph.query.ImpactOptions;
import io.codegraph.query.IssueQueryOptions;
import io.codegraph.query.PathOptions;
import io.codegraph.report.ConsoleReporter;
import io.codegraph.report.JsonReporter;
import io.codegraph.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the code-graph tool.
 * <p>
 * Loads a graph snapshot produced by a crawler and answers one query against it.
 * Exit codes: 0 success, 1 error, 2 when {@code --fail-on} is reached.
 */
@Command(
        name = "code-graph",
        mixinStandardHelpOptions = true,
        version = "code-graph 1.0.0",
        description = "Queries a code dependency graph: paths, modules, digests, change impact and issues.",
        subcommands = {
                CodeGraphCli.DigestCommand.class,
                CodeGraphCli.PathCommand.class,
                CodeGraphCli.ModuleCommand.class,
                CodeGraphCli.ImpactCommand.class,
                CodeGraphCli.IssuesCommand.class,
                CodeGraphCli.AnalyzeCommand.class
        },
        footer = {
                "",
                "Examples:",
                "  code-graph graph.json digest --scope src/api",
                "  code-graph graph.json path src/app.ts src/db.ts --max-depth 6",
                "  code-graph graph.json impact src/shared/config.ts --format json",
                "  code-graph graph.json analyze --fail-on error"
        }
)
public class CodeGraphCli implements Callable<Integer> {

    static final String PROJECT_CONFIG = "code-graph.yaml";

    @Parameters(
            index = "0",
            description = "Graph snapshot JSON file ({nodes, edges, issues})"
    )
    Path snapshotPath;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file"
    )
    Path configFile;

    @Option(
            names = {"-o", "--format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    OutputFormat format;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    boolean verbose;

    public enum OutputFormat {
        console,
        json
    }

    /**
     * Loaded graph and configuration shared by the subcommands.
     */
    record Session(GraphStore store, GraphConfig config, GraphQuery query) {}

    @Override
    public Integer call() throws Exception {
        // Without a subcommand, show the digest
        DigestCommand digest = new DigestCommand();
        digest.parent = this;
        return digest.call();
    }

    Session open() throws IOException {
        if (!Files.isRegularFile(snapshotPath)) {
            throw new IOException("Snapshot file does not exist: " + snapshotPath);
        }
        GraphConfig config = loadConfig();
        GraphStore store = new GraphStore();
        log("Loading graph from: " + snapshotPath);
        new GraphJson().load(snapshotPath, store);
        log("  " + store.nodeCount() + " nodes, " + store.edgeCount() + " edges, " + store.issueCount() + " issues");
        return new Session(store, config, new GraphQuery(store));
    }

    private GraphConfig loadConfig() throws IOException {
        GraphConfig defaultConfig = GraphConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Configuration file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return defaultConfig.merge(GraphConfig.loadFromFile(configFile));
        }

        // Check for code-graph.yaml next to the snapshot
        Path parent = snapshotPath.toAbsolutePath().getParent();
        Path projectConfig = parent != null ? parent.resolve(PROJECT_CONFIG) : null;
        if (projectConfig != null && Files.exists(projectConfig)) {
            log("Loading configuration from: " + projectConfig);
            return defaultConfig.merge(GraphConfig.loadFromFile(projectConfig));
        }

        return defaultConfig;
    }

    Reporter createReporter() {
        return switch (format) {
            case console -> new ConsoleReporter(!noColor);
            case json -> new JsonReporter(true);
        };
    }

    int print(Object result) throws IOException {
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        createReporter().write(result, out);
        out.flush();
        return 0;
    }

    void log(String message) {
        if (verbose && format != OutputFormat.json) {
            System.out.println(message);
        }
    }

    /**
     * Runs a query, mapping load and argument failures to exit code 1.
     */
    int run(Query query) {
        try {
            return query.run(open());
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    @FunctionalInterface
    interface Query {
        int run(Session session) throws IOException;
    }

    static int failOnExitCode(List<GraphIssue> issues, IssueSeverity failOn, boolean console) {
        if (failOn == null) {
            return 0;
        }
        long failing = issues.stream().filter(issue -> issue.severity().isAtLeast(failOn)).count();
        if (failing == 0) {
            return 0;
        }
        if (console) {
            System.err.println();
            System.err.println("Failing due to " + failing + " issue(s) at " + failOn.label() + " level or higher.");
        }
        return 2;
    }

    // ---- Subcommands ----

    @Command(name = "digest", description = "Summarize the repository: counts, entrypoints, hotspots, issues")
    static class DigestCommand implements Callable<Integer> {

        @ParentCommand
        CodeGraphCli parent;

        @Option(names = {"-s", "--scope"}, description = "Only consider paths starting with this prefix")
        String scope;

        @Override
        public Integer call() {
            return parent.run(session -> parent.print(session.query().digest(session.config().digestOptions(scope))));
        }
    }

    @Command(name = "path", description = "Find dependency paths between two files")
    static class PathCommand implements Callable<Integer> {

        @ParentCommand
        CodeGraphCli parent;

        @Parameters(index = "0", description = "Source file path or node id")
        String from;

        @Parameters(index = "1", description = "Target file path or node id")
        String to;

        @Option(names = {"--max-depth"}, description = "Maximum hops (default from config, capped at 20)")
        Integer maxDepth;

        @Option(names = {"--max-paths"}, description = "Maximum paths returned (default from config, capped at 20)")
        Integer maxPaths;

        @Override
        public Integer call() {
            return parent.run(session -> {
                PathOptions defaults = session.config().pathOptions();
                PathOptions options = new PathOptions(
                        maxDepth != null ? maxDepth : defaults.maxDepth(),
                        maxPaths != null ? maxPaths : defaults.maxPaths());
                return parent.print(session.query().path(from, to, options));
            });
        }
    }

    @Command(name = "module", description = "Show a file's imports, dependents, exports and entrypoints")
    static class ModuleCommand implements Callable<Integer> {

        @ParentCommand
        CodeGraphCli parent;

        @Parameters(index = "0", description = "File path or node id")
        String path;

        @Override
        public Integer call() {
            return parent.run(session -> parent.print(session.query().module(path)));
        }
    }

    @Command(name = "impact", description = "Estimate the blast radius of changing a file")
    static class ImpactCommand implements Callable<Integer> {

        @ParentCommand
        CodeGraphCli parent;

        @Parameters(index = "0", description = "File path or node id")
        String target;

        @Option(names = {"--max-depth"}, description = "Dependent levels to explore (default from config, capped at 4)")
        Integer maxDepth;

        @Override
        public Integer call() {
            return parent.run(session -> {
                ImpactOptions defaults = session.config().impactOptions();
                ImpactOptions options = new ImpactOptions(maxDepth != null ? maxDepth : defaults.depth(), defaults.limit());
                return parent.print(session.query().impact(target, options));
            });
        }
    }

    /**
     * Options shared by the commands that list issues.
     */
    static class IssueFilter {

        @Option(names = {"-k", "--kind"}, description = "Only this issue kind, e.g. ORPHAN_EXPORT")
        IssueKind kind;

        @Option(names = {"--severity"}, description = "Minimum severity: info, warning, error")
        IssueSeverity severity;

        @Option(names = {"-s", "--scope"}, description = "Only issues in files starting with this prefix")
        String scope;

        @Option(names = {"--fail-on"}, description = "Exit with code 2 if issues at this severity or higher exist")
        IssueSeverity failOn;

        IssueQueryOptions apply(IssueQueryOptions defaults) {
            return defaults.withKind(kind).withMinSeverity(severity).withScope(scope);
        }
    }

    @Command(name = "issues", description = "List issues recorded in the snapshot")
    static class IssuesCommand implements Callable<Integer> {

        @ParentCommand
        CodeGraphCli parent;

        @CommandLine.Mixin
        IssueFilter filter = new IssueFilter();

        @Override
        public Integer call() {
            return parent.run(session -> {
                parent.print(session.query().issues(filter.apply(session.config().issueQueryOptions())));
                return failOnExitCode(session.store().getIssues(), filter.failOn, parent.format == OutputFormat.console);
            });
        }
    }

    @Command(name = "analyze", description = "Run the structural detectors and list the issues they find")
    static class AnalyzeCommand implements Callable<Integer> {

        @ParentCommand
        CodeGraphCli parent;

        @CommandLine.Mixin
        IssueFilter filter = new IssueFilter();

        @Override
        public Integer call() {
            return parent.run(session -> {
                parent.log("Running detectors...");
                DetectorRegistry registry = DetectorRegistry.createDefault(new BarrelAnalyzer(session.store()));
                List<GraphIssue> issues = registry.analyze(session.store(), session.config());
                parent.log("  Found " + issues.size() + " issues");
                parent.print(session.query().issues(filter.apply(session.config().issueQueryOptions())));
                return failOnExitCode(issues, filter.failOn, parent.format == OutputFormat.console);
            });
        }
    }

    static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new CodeGraphCli());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
