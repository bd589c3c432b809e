package superss.sema;

import superss.ast.stmt.AliasDef;
import superss.ast.stmt.MixinDef;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mixin and alias definitions of one stylesheet, in definition order. Read-only once
 * {@link DefinitionCollector} has built it.
 */
public final class SymbolTable {
    private final Map<String, MixinDef> mixins;
    private final Map<String, AliasDef> aliases;

    SymbolTable(Map<String, MixinDef> mixins, Map<String, AliasDef> aliases) {
        this.mixins = Collections.unmodifiableMap(new LinkedHashMap<>(mixins));
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public static SymbolTable empty() {
        return new SymbolTable(Map.of(), Map.of());
    }

    public MixinDef mixin(String name) { return mixins.get(name); }

    public AliasDef alias(String name) { return aliases.get(name); }

    public boolean isAlias(String name) { return aliases.containsKey(name); }

    public Collection<MixinDef> mixins() { return mixins.values(); }

    public Collection<AliasDef> aliases() { return aliases.values(); }
}
