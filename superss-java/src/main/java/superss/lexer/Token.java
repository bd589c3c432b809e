package superss.lexer;

public record Token(TokenType type, String lexeme, SourcePosition position) {

    public int line() { return position.line(); }

    public int column() { return position.column(); }

    public TokenKind kind() { return type.kind(); }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + position;
    }
}
