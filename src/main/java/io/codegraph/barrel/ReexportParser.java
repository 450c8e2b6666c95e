package io.codegraph.barrel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts re-export statements from JavaScript and TypeScript source text.
 * <p>
 * Regex based: re-export syntax is regular enough that a full parse is not needed. Three
 * forms are recognized, each optionally with a {@code type} modifier:
 * <pre>
 *   export * from './a'
 *   export { a, b as c } from './b'
 *   export * as ns from './c'
 * </pre>
 */
public final class ReexportParser {

    private static final Pattern REEXPORT_ALL =
            Pattern.compile("export\\s+(?:type\\s+)?\\*\\s+from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern REEXPORT_NAMED =
            Pattern.compile("export\\s+(?:type\\s+)?\\{([^}]*)\\}\\s*from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern REEXPORT_NAMESPACE =
            Pattern.compile("export\\s+(?:type\\s+)?\\*\\s+as\\s+([\\w$]+)\\s+from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern ALIAS = Pattern.compile("^(?:type\\s+)?([\\w$]+)(?:\\s+as\\s+[\\w$]+)?$");

    private ReexportParser() {
    }

    /**
     * Returns every re-export statement in the content, in source order.
     */
    public static List<ReexportEntry> parse(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        record Positioned(int offset, ReexportEntry entry) {}

        int[] lineStarts = lineStarts(content);
        List<Positioned> found = new ArrayList<>();

        Matcher all = REEXPORT_ALL.matcher(content);
        while (all.find()) {
            found.add(new Positioned(all.start(), ReexportEntry.all(all.group(1), lineOf(lineStarts, all.start()))));
        }

        Matcher named = REEXPORT_NAMED.matcher(content);
        while (named.find()) {
            List<String> symbols = parseSpecifiers(named.group(1));
            found.add(new Positioned(named.start(),
                    ReexportEntry.named(named.group(2), symbols, lineOf(lineStarts, named.start()))));
        }

        Matcher namespace = REEXPORT_NAMESPACE.matcher(content);
        while (namespace.find()) {
            found.add(new Positioned(namespace.start(),
                    ReexportEntry.namespace(namespace.group(2), namespace.group(1), lineOf(lineStarts, namespace.start()))));
        }

        return found.stream()
                .sorted(Comparator.comparingInt(Positioned::offset))
                .map(Positioned::entry)
                .toList();
    }

    /**
     * Splits {@code a, b as c, type d} into source-side names {@code a, b, d}.
     */
    static List<String> parseSpecifiers(String specifiers) {
        List<String> names = new ArrayList<>();
        for (String raw : specifiers.split(",")) {
            String specifier = raw.trim().replaceAll("\\s+", " ");
            if (specifier.isEmpty()) {
                continue;
            }
            Matcher alias = ALIAS.matcher(specifier);
            names.add(alias.matches() ? alias.group(1) : specifier);
        }
        return names;
    }

    /**
     * Offsets at which each line begins; the first is always 0.
     */
    private static int[] lineStarts(String content) {
        int count = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                count++;
            }
        }
        int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }

    private static int lineOf(int[] lineStarts, int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }
}
