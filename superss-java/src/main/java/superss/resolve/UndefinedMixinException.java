package superss.resolve;

import superss.CompileException;
import superss.lexer.SourcePosition;

public final class UndefinedMixinException extends CompileException {
    private final String name;

    public UndefinedMixinException(String name, SourcePosition site) {
        super(site, "Unknown mixin: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public String kind() {
        return "UndefinedMixinError";
    }
}
