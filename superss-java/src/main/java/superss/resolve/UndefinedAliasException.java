package superss.resolve;

import superss.CompileException;
import superss.lexer.SourcePosition;

/** A bare name in type position that is neither an alias nor a known element. */
public final class UndefinedAliasException extends CompileException {
    private final String name;

    public UndefinedAliasException(String name, SourcePosition site) {
        super(site, "Unknown alias or element: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public String kind() {
        return "UndefinedAliasError";
    }
}
