package superss.lexer;

public enum TokenType {

    // literals
    IDENTIFIER(TokenKind.IDENTIFIER),
    STRING(TokenKind.STRING),

    // declaration position
    PROPERTY(TokenKind.PROPERTY),
    PROPERTY_VALUE(TokenKind.PROPERTY_VALUE),

    // keywords
    MIXIN(TokenKind.KEYWORD),
    ALIAS(TokenKind.KEYWORD),
    AS(TokenKind.KEYWORD),
    USING(TokenKind.KEYWORD),

    // combinators; DESCENDANT is synthesized from whitespace
    DESCENDANT(TokenKind.COMBINATOR),
    CHILD(TokenKind.COMBINATOR),
    ADJACENT_SIBLING(TokenKind.COMBINATOR),
    SIBLING(TokenKind.COMBINATOR),

    // attribute operators
    EQUALS(TokenKind.ATTRIBUTE_OPERATOR),
    INCLUDES(TokenKind.ATTRIBUTE_OPERATOR),
    DASH_MATCH(TokenKind.ATTRIBUTE_OPERATOR),
    PREFIX_MATCH(TokenKind.ATTRIBUTE_OPERATOR),
    SUFFIX_MATCH(TokenKind.ATTRIBUTE_OPERATOR),
    SUBSTRING_MATCH(TokenKind.ATTRIBUTE_OPERATOR),

    // symbols
    LBRACE(TokenKind.PUNCTUATION), RBRACE(TokenKind.PUNCTUATION),
    LBRACKET(TokenKind.PUNCTUATION), RBRACKET(TokenKind.PUNCTUATION),
    LPAREN(TokenKind.PUNCTUATION), RPAREN(TokenKind.PUNCTUATION),
    COLON(TokenKind.PUNCTUATION), DOUBLE_COLON(TokenKind.PUNCTUATION),
    COMMA(TokenKind.PUNCTUATION), SEMICOLON(TokenKind.PUNCTUATION),
    DOT(TokenKind.PUNCTUATION), HASH(TokenKind.PUNCTUATION),
    STAR(TokenKind.PUNCTUATION),

    EOF(TokenKind.END);

    private final TokenKind kind;

    TokenType(TokenKind kind) {
        this.kind = kind;
    }

    public TokenKind kind() {
        return kind;
    }
}
