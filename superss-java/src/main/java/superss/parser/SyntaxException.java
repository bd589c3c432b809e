package superss.parser;

import superss.CompileException;
import superss.lexer.Token;

public final class SyntaxException extends CompileException {
    private final String expected;
    private final Token found;

    public SyntaxException(String expected, Token found) {
        super(found.position(), "Expected " + expected + " (got " + found.type() + " '" + found.lexeme() + "')");
        this.expected = expected;
        this.found = found;
    }

    /** The construct the parser was looking for. */
    public String expected() {
        return expected;
    }

    public Token found() {
        return found;
    }

    @Override
    public String kind() {
        return "SyntaxError";
    }
}
