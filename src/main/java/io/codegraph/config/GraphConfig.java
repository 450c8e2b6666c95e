package io.codegraph.config;

import io.codegraph.query.DigestOptions;
import io.codegraph.query.ImpactOptions;
import io.codegraph.query.IssueQueryOptions;
import io.codegraph.query.PathOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tunable settings for queries and detectors, loaded from YAML.
 * <p>
 * The bundled {@code code-graph-defaults.yaml} holds the defaults; a user file can be merged
 * on top of it. Missing keys fall back to the built-in defaults of the query options.
 */
public class GraphConfig {

    private static final Logger log = LoggerFactory.getLogger(GraphConfig.class);

    private static final String DEFAULT_CONFIG = "/code-graph-defaults.yaml";

    static final String PATH_MAX_DEPTH = "pathMaxDepth";
    static final String PATH_MAX_PATHS = "pathMaxPaths";
    static final String IMPACT_DEPTH = "impactDepth";
    static final String IMPACT_LIMIT = "impactLimit";
    static final String DIGEST_LIMIT = "digestLimit";
    static final String ISSUES_LIMIT = "issuesLimit";
    static final String UNREACHABLE_SKIP_PATTERNS = "unreachableSkipPatterns";
    static final String DISABLED_DETECTORS = "disabledDetectors";
    static final String LAYER_RULES = "layerRules";

    private final Map<String, Object> raw;
    private final int pathMaxDepth;
    private final int pathMaxPaths;
    private final int impactDepth;
    private final int impactLimit;
    private final int digestLimit;
    private final int issuesLimit;
    private final List<Pattern> unreachableSkipPatterns;
    private final Set<String> disabledDetectors;
    private final List<LayerRule> layerRules;

    private GraphConfig(Map<String, Object> config) {
        this.raw = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.pathMaxDepth = getInt(config, PATH_MAX_DEPTH, PathOptions.DEFAULT_MAX_DEPTH);
        this.pathMaxPaths = getInt(config, PATH_MAX_PATHS, PathOptions.DEFAULT_MAX_PATHS);
        this.impactDepth = getInt(config, IMPACT_DEPTH, ImpactOptions.DEFAULT_DEPTH);
        this.impactLimit = getInt(config, IMPACT_LIMIT, ImpactOptions.DEFAULT_LIMIT);
        this.digestLimit = getInt(config, DIGEST_LIMIT, DigestOptions.DEFAULT_LIMIT);
        this.issuesLimit = getInt(config, ISSUES_LIMIT, IssueQueryOptions.DEFAULT_LIMIT);
        this.unreachableSkipPatterns = compilePatterns(getStringList(config, UNREACHABLE_SKIP_PATTERNS));
        this.disabledDetectors = Set.copyOf(getStringList(config, DISABLED_DETECTORS));
        this.layerRules = parseLayerRules(config.get(LAYER_RULES));
    }

    /**
     * Configuration with no keys set: built-in defaults, no skip patterns, no layer rules.
     */
    public static GraphConfig empty() {
        return new GraphConfig(Map.of());
    }

    /**
     * Loads the bundled defaults from the classpath.
     */
    public static GraphConfig loadDefault() {
        try (InputStream is = GraphConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     */
    public static GraphConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (RuntimeException e) {
            // SnakeYAML reports syntax errors unchecked
            throw new IOException("Invalid configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public static GraphConfig load(InputStream is) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(is);
        if (loaded == null) {
            return empty();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Configuration must be a YAML mapping, got " + loaded.getClass().getSimpleName());
        }
        Map<String, Object> config = new LinkedHashMap<>();
        map.forEach((key, value) -> config.put(String.valueOf(key), value));
        return new GraphConfig(config);
    }

    /**
     * Merges this configuration with another, with the other taking precedence.
     * List settings are combined; scalar settings from {@code other} win when present.
     */
    public GraphConfig merge(GraphConfig other) {
        Map<String, Object> merged = new LinkedHashMap<>(this.raw);
        for (Map.Entry<String, Object> entry : other.raw.entrySet()) {
            String key = entry.getKey();
            if (key.equals(UNREACHABLE_SKIP_PATTERNS) || key.equals(DISABLED_DETECTORS)) {
                merged.put(key, mergeLists(getStringList(this.raw, key), getStringList(other.raw, key)));
            } else if (key.equals(LAYER_RULES)) {
                List<Object> rules = new ArrayList<>();
                this.layerRules.forEach(rule -> rules.add(rule.toMap()));
                other.layerRules.forEach(rule -> rules.add(rule.toMap()));
                merged.put(key, rules);
            } else {
                merged.put(key, entry.getValue());
            }
        }
        return new GraphConfig(merged);
    }

    private static List<String> mergeLists(List<String> a, List<String> b) {
        Set<String> merged = new LinkedHashSet<>(a);
        merged.addAll(b);
        return new ArrayList<>(merged);
    }

    private static int getInt(Map<String, Object> config, String key, int fallback) {
        Object value = config.get(key);
        if (value instanceof Number number && number.intValue() >= 1) {
            return number.intValue();
        }
        if (value != null) {
            log.warn("Ignoring value '{}' for {}, expected a positive integer", value, key);
        }
        return fallback;
    }

    private static List<String> getStringList(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof String s) {
                    result.add(s);
                }
            }
            return List.copyOf(result);
        }
        return List.of();
    }

    /**
     * Compiles regex strings. Invalid patterns are logged and skipped.
     */
    private static List<Pattern> compilePatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : patterns) {
            try {
                compiled.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid skip pattern '{}': {}", regex, e.getDescription());
            }
        }
        return List.copyOf(compiled);
    }

    private static List<LayerRule> parseLayerRules(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<LayerRule> rules = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                log.warn("Ignoring layer rule that is not a mapping: {}", item);
                continue;
            }
            try {
                rules.add(LayerRule.fromMap(map));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid layer rule {}: {}", map, e.getMessage());
            }
        }
        return List.copyOf(rules);
    }

    // ---- Query option factories ----

    public PathOptions pathOptions() {
        return new PathOptions(pathMaxDepth, pathMaxPaths);
    }

    public ImpactOptions impactOptions() {
        return new ImpactOptions(impactDepth, impactLimit);
    }

    public DigestOptions digestOptions(String scope) {
        return new DigestOptions(scope, digestLimit);
    }

    public IssueQueryOptions issueQueryOptions() {
        return new IssueQueryOptions(null, null, null, issuesLimit);
    }

    // ---- Accessors ----

    public int pathMaxDepth() {
        return pathMaxDepth;
    }

    public int pathMaxPaths() {
        return pathMaxPaths;
    }

    public int impactDepth() {
        return impactDepth;
    }

    public int impactLimit() {
        return impactLimit;
    }

    public int digestLimit() {
        return digestLimit;
    }

    public int issuesLimit() {
        return issuesLimit;
    }

    /**
     * Returns true if the path matches one of the skip patterns of the unreachable check.
     */
    public boolean isUnreachableSkipped(String path) {
        for (Pattern pattern : unreachableSkipPatterns) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }

    public List<Pattern> unreachableSkipPatterns() {
        return unreachableSkipPatterns;
    }

    public boolean isDetectorDisabled(String detectorId) {
        return disabledDetectors.contains(detectorId);
    }

    public Set<String> disabledDetectors() {
        return disabledDetectors;
    }

    public List<LayerRule> layerRules() {
        return layerRules;
    }
}
