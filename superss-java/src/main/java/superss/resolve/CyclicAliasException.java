package superss.resolve;

import superss.CompileException;

import java.util.List;

public final class CyclicAliasException extends CompileException {
    private final List<String> chain;

    public CyclicAliasException(List<String> chain) {
        super(null, "Alias cycle: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    /** Active expansion chain, ending with the revisited name. */
    public List<String> chain() {
        return chain;
    }

    @Override
    public String kind() {
        return "CyclicAliasError";
    }
}
