package superss.emit;

import superss.ast.selector.SelectorPrinter;
import superss.ast.selector.SingleSelector;
import superss.resolve.ResolvedRule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Serializes resolved rules. No resolution happens here. */
public final class CssEmitter {

    public enum Style {
        /** One declaration per line, blank line between rules. */
        PRETTY,
        /** No optional whitespace at all. */
        MINIFIED
    }

    private CssEmitter() {}

    public static String emit(List<ResolvedRule> rules, Style style) {
        StringBuilder sb = new StringBuilder();
        for (ResolvedRule rule : rules) {
            if (style == Style.PRETTY) {
                if (sb.length() > 0) sb.append('\n');
                writePretty(sb, rule);
            } else {
                writeMinified(sb, rule);
            }
        }
        return sb.toString();
    }

    public static void write(Path out, List<ResolvedRule> rules, Style style) throws IOException {
        Files.writeString(out, emit(rules, style), StandardCharsets.UTF_8);
    }

    // ---- internals ----

    private static void writePretty(StringBuilder sb, ResolvedRule rule) {
        sb.append(selectorList(rule.chains(), false)).append(" {\n");
        for (Map.Entry<String, String> d : rule.declarations().entrySet()) {
            sb.append("  ").append(d.getKey()).append(": ").append(d.getValue()).append(";\n");
        }
        sb.append("}\n");
    }

    private static void writeMinified(StringBuilder sb, ResolvedRule rule) {
        sb.append(selectorList(rule.chains(), true)).append('{');
        sb.append(rule.declarations().entrySet().stream()
                .map(d -> d.getKey() + ":" + d.getValue())
                .collect(Collectors.joining(";")));
        sb.append('}');
    }

    private static String selectorList(List<SingleSelector> chains, boolean compact) {
        return chains.stream()
                .map(s -> SelectorPrinter.print(s, compact))
                .collect(Collectors.joining(compact ? "," : ", "));
    }
}
