package superss;

import superss.lexer.SourcePosition;

/**
 * Base of every error the compiler reports. Compilation is atomic: the first
 * exception aborts the remaining stages and no partial output is produced.
 */
public abstract class CompileException extends RuntimeException {
    private final SourcePosition position;

    protected CompileException(SourcePosition position, String message) {
        super(position == null ? message : "[" + position + "] " + message);
        this.position = position;
    }

    /** Where the error was detected, or null when it has no single site (cycles). */
    public SourcePosition position() {
        return position;
    }

    /** Taxonomy name shown to users, e.g. {@code SyntaxError}. */
    public abstract String kind();
}
