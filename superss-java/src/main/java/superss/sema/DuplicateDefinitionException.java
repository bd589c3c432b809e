package superss.sema;

import superss.CompileException;
import superss.lexer.SourcePosition;

public final class DuplicateDefinitionException extends CompileException {
    private final String name;
    private final Namespace namespace;

    public DuplicateDefinitionException(String name, Namespace namespace, SourcePosition position) {
        super(position, "Duplicate " + namespace.label() + ": " + name);
        this.name = name;
        this.namespace = namespace;
    }

    public String name() {
        return name;
    }

    public Namespace namespace() {
        return namespace;
    }

    @Override
    public String kind() {
        return "DuplicateDefinitionError";
    }
}
