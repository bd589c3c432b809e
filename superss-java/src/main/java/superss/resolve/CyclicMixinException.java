package superss.resolve;

import superss.CompileException;

import java.util.List;

public final class CyclicMixinException extends CompileException {
    private final List<String> chain;

    public CyclicMixinException(List<String> chain) {
        super(null, "Mixin inclusion cycle: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    /** Active inclusion chain, ending with the revisited name. */
    public List<String> chain() {
        return chain;
    }

    @Override
    public String kind() {
        return "CyclicMixinError";
    }
}
