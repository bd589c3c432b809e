package superss.ast.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * One node-matching unit: optional type, attributes bound to the type, class/id parts,
 * then pseudo-classes. Never empty.
 */
public record CompoundSelector(
        TypeSelector type,
        List<AttributeSelector> typeAttributes,
        List<SubclassSelector> subclasses,
        List<PseudoClass> pseudoClasses
) {

    public CompoundSelector {
        typeAttributes = List.copyOf(typeAttributes);
        subclasses = List.copyOf(subclasses);
        pseudoClasses = List.copyOf(pseudoClasses);
        if (type == null && typeAttributes.isEmpty() && subclasses.isEmpty() && pseudoClasses.isEmpty()) {
            throw new SelectorStructureException(null, "empty compound selector");
        }
    }

    /** True when nothing but the type component is present. */
    public boolean isTypeOnly() {
        return typeAttributes.isEmpty() && subclasses.isEmpty() && pseudoClasses.isEmpty();
    }

    /**
     * Appends {@code other}'s non-type parts to this compound. Attributes that {@code other}
     * bound to its type attach to this compound's last class/id part, or to its type when it
     * has none.
     */
    public CompoundSelector mergeRest(CompoundSelector other) {
        List<AttributeSelector> attrs = new ArrayList<>(typeAttributes);
        List<SubclassSelector> subs = new ArrayList<>(subclasses);

        if (!other.typeAttributes.isEmpty()) {
            if (subs.isEmpty()) {
                attrs.addAll(other.typeAttributes);
            } else {
                SubclassSelector last = subs.remove(subs.size() - 1);
                List<AttributeSelector> lastAttrs = new ArrayList<>(last.attributes());
                lastAttrs.addAll(other.typeAttributes);
                subs.add(new SubclassSelector(last.kind(), last.name(), lastAttrs));
            }
        }
        subs.addAll(other.subclasses);

        List<PseudoClass> pseudos = new ArrayList<>(pseudoClasses);
        pseudos.addAll(other.pseudoClasses);

        return new CompoundSelector(type, attrs, subs, pseudos);
    }
}
