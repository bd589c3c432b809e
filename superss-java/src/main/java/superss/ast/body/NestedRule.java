package superss.ast.body;

import superss.ast.selector.Combinator;
import superss.ast.stmt.StyleRule;

/** A rule inside a parent's body; the combinator is DESCENDANT when none was written. */
public record NestedRule(Combinator combinator, StyleRule rule) implements BodyItem {}
