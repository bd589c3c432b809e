package superss.ast.selector;

public enum AttributeOperator {
    EQUALS("="),
    INCLUDES("~="),
    DASH_MATCH("|="),
    PREFIX_MATCH("^="),
    SUFFIX_MATCH("$="),
    SUBSTRING_MATCH("*=");

    private final String symbol;

    AttributeOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
