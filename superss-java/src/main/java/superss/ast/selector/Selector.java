package superss.ast.selector;

import java.util.List;

/** Comma-separated alternatives, in source order. */
public record Selector(List<SingleSelector> alternatives) {

    public Selector {
        alternatives = List.copyOf(alternatives);
        if (alternatives.isEmpty()) throw new IllegalArgumentException("Selector needs at least one alternative");
    }
}
