package superss.resolve;

import superss.ast.body.BodyItem;
import superss.ast.body.NestedRule;
import superss.ast.stmt.MixinDef;
import superss.ast.stmt.MixinRef;
import superss.ast.stmt.StyleRule;
import superss.sema.SymbolTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Depth-first walk over mixin to mixin edges. An edge is a {@code using} clause on any
 * nested rule, at any depth, inside a mixin body. Also validates the alias references in
 * those nested selectors, since an unused mixin is never flattened.
 */
final class MixinGraph {
    private final SymbolTable symbols;
    private final AliasExpander aliases;
    private final Set<String> done = new HashSet<>();

    MixinGraph(SymbolTable symbols, AliasExpander aliases) {
        this.symbols = symbols;
        this.aliases = aliases;
    }

    void check() {
        for (MixinDef m : symbols.mixins()) {
            visit(m, new ArrayDeque<>());
        }
    }

    private void visit(MixinDef mixin, Deque<String> chain) {
        if (chain.contains(mixin.name())) {
            List<String> cycle = new ArrayList<>(chain);
            cycle.add(mixin.name());
            throw new CyclicMixinException(cycle);
        }
        if (done.contains(mixin.name())) return;

        chain.addLast(mixin.name());
        walk(mixin.body(), chain);
        chain.removeLast();

        done.add(mixin.name());
    }

    private void walk(List<BodyItem> body, Deque<String> chain) {
        for (BodyItem item : body) {
            if (!(item instanceof NestedRule nested)) continue;

            StyleRule rule = nested.rule();
            aliases.expand(rule.selector());
            for (MixinRef ref : rule.mixins()) {
                MixinDef target = symbols.mixin(ref.name());
                if (target == null) throw new UndefinedMixinException(ref.name(), rule.position());
                visit(target, chain);
            }
            walk(rule.body(), chain);
        }
    }
}
