package superss.sema;

/** Mixins and aliases are looked up separately; one name may be both. */
public enum Namespace {
    MIXIN("mixin"),
    ALIAS("alias");

    private final String label;

    Namespace(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
