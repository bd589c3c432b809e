package superss.resolve;

import superss.ast.Stylesheet;
import superss.ast.body.BodyItem;
import superss.ast.body.Declaration;
import superss.ast.body.NestedRule;
import superss.ast.selector.Combinator;
import superss.ast.selector.SelectorPrinter;
import superss.ast.selector.SelectorStructureException;
import superss.ast.selector.SingleSelector;
import superss.ast.stmt.MixinDef;
import superss.ast.stmt.MixinRef;
import superss.ast.stmt.StyleRule;
import superss.lexer.SourcePosition;
import superss.sema.ElementRegistry;
import superss.sema.SymbolTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the AST into flat rules: aliases substituted, mixins spliced, nested rules
 * flattened depth-first in source order. The AST is only read.
 */
public final class Resolver {
    private final SymbolTable symbols;
    private final AliasExpander aliases;

    public Resolver(SymbolTable symbols) {
        this(symbols, ElementRegistry.standard());
    }

    public Resolver(SymbolTable symbols, ElementRegistry elements) {
        this.symbols = symbols;
        this.aliases = new AliasExpander(symbols, elements);
    }

    public List<ResolvedRule> resolve(Stylesheet stylesheet) {
        // 1) every alias, used or not
        aliases.expandAll();

        // 2) mixin inclusion graph
        new MixinGraph(symbols, aliases).check();

        // 3) flatten top-level rules
        List<ResolvedRule> out = new ArrayList<>();
        for (StyleRule rule : stylesheet.styleRules()) {
            flatten(rule, aliases.expand(rule.selector()), out);
        }
        return List.copyOf(out);
    }

    private void flatten(StyleRule rule, List<SingleSelector> selectors, List<ResolvedRule> out) {
        Map<String, String> declarations = new LinkedHashMap<>();
        List<NestedRule> nested = new ArrayList<>();

        for (BodyItem item : effectiveBody(rule)) {
            if (item instanceof Declaration d) {
                declarations.put(d.property(), d.value());
            } else if (item instanceof NestedRule n) {
                nested.add(n);
            }
        }

        // emitted even without declarations: `.a {}` stays `.a{}`
        out.add(new ResolvedRule(selectors, declarations));

        for (NestedRule n : nested) {
            StyleRule child = n.rule();
            List<SingleSelector> combined =
                    combine(selectors, n.combinator(), aliases.expand(child.selector()), child.position());
            flatten(child, combined, out);
        }
    }

    /** Items of each used mixin in listed order, then the rule's own items. */
    private List<BodyItem> effectiveBody(StyleRule rule) {
        if (rule.mixins().isEmpty()) return rule.body();

        List<BodyItem> items = new ArrayList<>();
        for (MixinRef ref : rule.mixins()) {
            MixinDef mixin = symbols.mixin(ref.name());
            if (mixin == null) throw new UndefinedMixinException(ref.name(), rule.position());
            items.addAll(mixin.body());
        }
        items.addAll(rule.body());
        return items;
    }

    /**
     * Every parent alternative joined with every child alternative through {@code combinator};
     * parents in the outer loop. A bare pseudo-element child under the descendant combinator
     * attaches to the parent itself.
     */
    static List<SingleSelector> combine(List<SingleSelector> parents, Combinator combinator,
                                        List<SingleSelector> children, SourcePosition site) {
        List<SingleSelector> out = new ArrayList<>(parents.size() * children.size());
        for (SingleSelector p : parents) {
            if (p.endsWithPseudoElement()) {
                throw new SelectorStructureException(site,
                        "cannot nest beneath '" + SelectorPrinter.print(p) + "', which ends in a pseudo-element");
            }
            for (SingleSelector c : children) {
                if (c.head() != null) {
                    out.add(p.join(combinator, c));
                } else if (combinator == Combinator.DESCENDANT) {
                    out.add(p.withPseudoElement(c.pseudoElement()));
                } else {
                    throw new SelectorStructureException(site,
                            "a pseudo-element cannot follow the '" + combinator.symbol() + "' combinator");
                }
            }
        }
        return out;
    }
}
