package superss.lexer;

public enum TokenKind {
    IDENTIFIER,
    STRING,
    PROPERTY,
    PROPERTY_VALUE,
    COMBINATOR,
    ATTRIBUTE_OPERATOR,
    PUNCTUATION,
    KEYWORD,
    END
}
