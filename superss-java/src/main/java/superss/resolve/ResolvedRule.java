package superss.resolve;

import superss.ast.selector.SelectorPrinter;
import superss.ast.selector.SingleSelector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One flat output rule: fully expanded selector alternatives and the merged declarations,
 * in first-insertion order with the last written value.
 */
public record ResolvedRule(List<SingleSelector> chains, Map<String, String> declarations) {

    public ResolvedRule {
        chains = List.copyOf(chains);
        declarations = Collections.unmodifiableMap(new LinkedHashMap<>(declarations));
    }

    /** Selector alternatives as canonical text, e.g. {@code .a > .c}. */
    public List<String> selectors() {
        return chains.stream().map(SelectorPrinter::print).toList();
    }

    @Override
    public String toString() {
        return String.join(", ", selectors()) + " " + declarations;
    }
}
