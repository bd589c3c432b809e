package superss.ast.selector;

import superss.lexer.SourcePosition;

/** Element name, alias reference, or {@code *}. */
public record TypeSelector(String name, SourcePosition position) {

    public static final String UNIVERSAL = "*";

    public boolean isUniversal() {
        return UNIVERSAL.equals(name);
    }
}
