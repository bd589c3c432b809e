package superss.lexer;

import superss.CompileException;

public final class LexerException extends CompileException {
    private final char unexpected;

    public LexerException(SourcePosition position, String message, char unexpected) {
        super(position, message);
        this.unexpected = unexpected;
    }

    /** The offending character, or {@code '\0'} when the input ended early. */
    public char unexpected() {
        return unexpected;
    }

    @Override
    public String kind() {
        return "LexError";
    }
}
