package superss.ast.selector;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical selector text. Pretty form spaces out explicit combinators ({@code .a > .b}),
 * compact form drops those spaces ({@code .a>.b}); the descendant combinator is one space
 * in both.
 */
public final class SelectorPrinter {
    private SelectorPrinter() {}

    public static String print(Selector selector, boolean compact) {
        return selector.alternatives().stream()
                .map(s -> print(s, compact))
                .collect(Collectors.joining(compact ? "," : ", "));
    }

    public static String print(SingleSelector selector) {
        return print(selector, false);
    }

    public static String print(SingleSelector selector, boolean compact) {
        StringBuilder sb = new StringBuilder();
        if (selector.head() != null) appendCompound(sb, selector.head());

        for (SingleSelector.Link link : selector.links()) {
            Combinator c = link.combinator();
            if (c == Combinator.DESCENDANT) sb.append(' ');
            else if (compact) sb.append(c.symbol());
            else sb.append(' ').append(c.symbol()).append(' ');
            appendCompound(sb, link.compound());
        }

        PseudoElement pe = selector.pseudoElement();
        if (pe != null) {
            sb.append("::").append(pe.name());
            appendAttributes(sb, pe.attributes());
        }
        return sb.toString();
    }

    public static String print(CompoundSelector compound) {
        StringBuilder sb = new StringBuilder();
        appendCompound(sb, compound);
        return sb.toString();
    }

    public static String print(AttributeSelector attr) {
        StringBuilder sb = new StringBuilder();
        appendAttribute(sb, attr);
        return sb.toString();
    }

    // ---- internals ----

    private static void appendCompound(StringBuilder sb, CompoundSelector c) {
        if (c.type() != null) sb.append(c.type().name());
        appendAttributes(sb, c.typeAttributes());

        for (SubclassSelector sub : c.subclasses()) {
            sb.append(sub.kind().prefix()).append(sub.name());
            appendAttributes(sb, sub.attributes());
        }
        for (PseudoClass pc : c.pseudoClasses()) {
            sb.append(':').append(pc.name());
            appendAttributes(sb, pc.attributes());
        }
    }

    private static void appendAttributes(StringBuilder sb, List<AttributeSelector> attrs) {
        for (AttributeSelector a : attrs) appendAttribute(sb, a);
    }

    private static void appendAttribute(StringBuilder sb, AttributeSelector a) {
        sb.append('[').append(a.name());
        if (!a.isPresenceTest()) {
            sb.append(a.operator().symbol());
            AttributeSelector.Operand operand = a.operand();
            if (operand.quoted()) {
                sb.append('"')
                        .append(operand.text().replace("\\", "\\\\").replace("\"", "\\\""))
                        .append('"');
            } else {
                sb.append(operand.text());
            }
        }
        sb.append(']');
    }
}
