package superss.ast.selector;

public enum Combinator {
    DESCENDANT(" "),
    CHILD(">"),
    SIBLING("~"),
    ADJACENT_SIBLING("+");

    private final String symbol;

    Combinator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
