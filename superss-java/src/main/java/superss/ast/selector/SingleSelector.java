package superss.ast.selector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One descendant/sibling chain. The head compound is absent only for a bare
 * pseudo-element such as {@code ::selection}.
 */
public record SingleSelector(CompoundSelector head, List<Link> links, PseudoElement pseudoElement) {

    public record Link(Combinator combinator, CompoundSelector compound) {
        public Link {
            Objects.requireNonNull(combinator, "combinator");
            if (compound == null) {
                throw new SelectorStructureException(null, "combinator '" + combinator.symbol() + "' without a compound");
            }
        }
    }

    public SingleSelector {
        links = List.copyOf(links);
        if (head == null && (!links.isEmpty() || pseudoElement == null)) {
            throw new SelectorStructureException(null, "selector chain without a leading compound");
        }
    }

    public static SingleSelector of(CompoundSelector compound) {
        return new SingleSelector(compound, List.of(), null);
    }

    public boolean endsWithPseudoElement() {
        return pseudoElement != null;
    }

    public CompoundSelector lastCompound() {
        return links.isEmpty() ? head : links.get(links.size() - 1).compound();
    }

    /** Same chain with its last compound replaced. */
    public SingleSelector withLastCompound(CompoundSelector compound) {
        if (links.isEmpty()) {
            return new SingleSelector(compound, links, pseudoElement);
        }
        List<Link> ls = new ArrayList<>(links);
        Link last = ls.remove(ls.size() - 1);
        ls.add(new Link(last.combinator(), compound));
        return new SingleSelector(head, ls, pseudoElement);
    }

    public SingleSelector withPseudoElement(PseudoElement pe) {
        return new SingleSelector(head, links, pe);
    }

    /** {@code this K other}; {@code other} must have a head compound. */
    public SingleSelector join(Combinator combinator, SingleSelector other) {
        if (other.head == null) {
            throw new SelectorStructureException(null, "cannot join a bare pseudo-element with a combinator");
        }
        List<Link> ls = new ArrayList<>(links);
        ls.add(new Link(combinator, other.head));
        ls.addAll(other.links);
        return new SingleSelector(head, ls, other.pseudoElement);
    }
}
