package superss.ast.selector;

import superss.CompileException;
import superss.lexer.SourcePosition;

public final class SelectorStructureException extends CompileException {
    private final String reason;

    public SelectorStructureException(SourcePosition site, String reason) {
        super(site, "Invalid selector structure: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String kind() {
        return "SelectorStructureError";
    }
}
