package superss.resolve;

import superss.ast.selector.Combinator;
import superss.ast.selector.CompoundSelector;
import superss.ast.selector.Selector;
import superss.ast.selector.SelectorStructureException;
import superss.ast.selector.SingleSelector;
import superss.ast.selector.TypeSelector;
import superss.ast.stmt.AliasDef;
import superss.sema.ElementRegistry;
import superss.sema.SymbolTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces alias references in type position with the alias target. A target with several
 * alternatives multiplies the selector it is used in; the rest of the referencing compound
 * (attributes, classes, pseudo-classes) is merged into the last compound of each alternative.
 */
public final class AliasExpander {
    private final SymbolTable symbols;
    private final ElementRegistry elements;

    // alias name -> fully expanded target
    private final Map<String, List<SingleSelector>> expanded = new HashMap<>();

    public AliasExpander(SymbolTable symbols, ElementRegistry elements) {
        this.symbols = symbols;
        this.elements = elements;
    }

    /** Expands every alias once, in definition order, so cycles surface even if unused. */
    public void expandAll() {
        for (AliasDef a : symbols.aliases()) {
            expandAlias(a.name(), new ArrayDeque<>());
        }
    }

    public List<SingleSelector> expand(Selector selector) {
        return expand(selector, new ArrayDeque<>());
    }

    private List<SingleSelector> expand(Selector selector, Deque<String> chain) {
        List<SingleSelector> out = new ArrayList<>();
        for (SingleSelector s : selector.alternatives()) {
            out.addAll(expandSingle(s, chain));
        }
        return out;
    }

    private List<SingleSelector> expandSingle(SingleSelector s, Deque<String> chain) {
        if (s.head() == null) return List.of(s);

        List<SingleSelector> partial = expandCompound(s.head(), chain);

        for (SingleSelector.Link link : s.links()) {
            List<SingleSelector> variants = expandCompound(link.compound(), chain);
            List<SingleSelector> next = new ArrayList<>(partial.size() * variants.size());
            for (SingleSelector left : partial) {
                requireOpenEnd(left, link.compound());
                for (SingleSelector right : variants) {
                    next.add(attach(left, link.combinator(), right, link.compound()));
                }
            }
            partial = next;
        }

        if (s.pseudoElement() != null) {
            List<SingleSelector> next = new ArrayList<>(partial.size());
            for (SingleSelector left : partial) {
                requireOpenEnd(left, s.lastCompound());
                next.add(left.withPseudoElement(s.pseudoElement()));
            }
            partial = next;
        }
        return partial;
    }

    private List<SingleSelector> expandCompound(CompoundSelector c, Deque<String> chain) {
        TypeSelector type = c.type();
        if (type == null || type.isUniversal()) return List.of(SingleSelector.of(c));

        if (!symbols.isAlias(type.name())) {
            String element = elements.canonicalName(type.name());
            if (element == null) throw new UndefinedAliasException(type.name(), type.position());
            if (element.equals(type.name())) return List.of(SingleSelector.of(c));
            return List.of(SingleSelector.of(new CompoundSelector(new TypeSelector(element, type.position()),
                    c.typeAttributes(), c.subclasses(), c.pseudoClasses())));
        }

        List<SingleSelector> targets = expandAlias(type.name(), chain);
        if (c.isTypeOnly()) return targets;

        List<SingleSelector> out = new ArrayList<>(targets.size());
        for (SingleSelector t : targets) {
            if (t.endsWithPseudoElement()) {
                throw new SelectorStructureException(type.position(),
                        "alias '" + type.name() + "' ends in a pseudo-element and cannot take more selector parts");
            }
            out.add(t.withLastCompound(t.lastCompound().mergeRest(c)));
        }
        return out;
    }

    private List<SingleSelector> expandAlias(String name, Deque<String> chain) {
        if (chain.contains(name)) {
            List<String> cycle = new ArrayList<>(chain);
            cycle.add(name);
            throw new CyclicAliasException(cycle);
        }

        List<SingleSelector> done = expanded.get(name);
        if (done != null) return done;

        chain.addLast(name);
        List<SingleSelector> result = List.copyOf(expand(symbols.alias(name).target(), chain));
        chain.removeLast();

        expanded.put(name, result);
        return result;
    }

    /**
     * {@code left K right}. A variant that is a bare pseudo-element, from an alias such as
     * {@code alias sel as ::selection}, attaches to {@code left} under the descendant combinator.
     */
    private static SingleSelector attach(SingleSelector left, Combinator combinator,
                                         SingleSelector right, CompoundSelector reference) {
        if (right.head() != null) return left.join(combinator, right);
        if (combinator != Combinator.DESCENDANT) {
            TypeSelector t = reference.type();
            throw new SelectorStructureException(t == null ? null : t.position(),
                    "a pseudo-element cannot follow the '" + combinator.symbol() + "' combinator");
        }
        return left.withPseudoElement(right.pseudoElement());
    }

    private static void requireOpenEnd(SingleSelector left, CompoundSelector following) {
        if (left.endsWithPseudoElement()) {
            TypeSelector t = following.type();
            throw new SelectorStructureException(t == null ? null : t.position(),
                    "a pseudo-element must end its selector");
        }
    }
}
