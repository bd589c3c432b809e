package superss.sema;

import superss.ast.Stylesheet;
import superss.ast.stmt.AliasDef;
import superss.ast.stmt.MixinDef;
import superss.ast.stmt.Statement;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single pass over the top-level statements. Collecting before resolving is what lets a
 * rule use a mixin or alias defined further down the file.
 */
public final class DefinitionCollector {

    public SymbolTable collect(Stylesheet stylesheet) {
        Map<String, MixinDef> mixins = new LinkedHashMap<>();
        Map<String, AliasDef> aliases = new LinkedHashMap<>();

        for (Statement s : stylesheet.statements()) {
            if (s instanceof MixinDef m) {
                if (mixins.putIfAbsent(m.name(), m) != null) {
                    throw new DuplicateDefinitionException(m.name(), Namespace.MIXIN, m.position());
                }
            } else if (s instanceof AliasDef a) {
                if (aliases.putIfAbsent(a.name(), a) != null) {
                    throw new DuplicateDefinitionException(a.name(), Namespace.ALIAS, a.position());
                }
            }
        }
        return new SymbolTable(mixins, aliases);
    }
}
