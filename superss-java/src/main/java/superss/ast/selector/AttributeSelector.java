package superss.ast.selector;

import java.util.Objects;

/**
 * {@code [name]}, or {@code [name op operand]}. Operator and operand are either both
 * present or both absent.
 */
public record AttributeSelector(String name, AttributeOperator operator, Operand operand) {

    public record Operand(String text, boolean quoted) {}

    public AttributeSelector {
        Objects.requireNonNull(name, "name");
        if ((operator == null) != (operand == null)) {
            throw new IllegalArgumentException("Attribute operator and operand go together: [" + name + "]");
        }
    }

    public static AttributeSelector present(String name) {
        return new AttributeSelector(name, null, null);
    }

    public boolean isPresenceTest() {
        return operator == null;
    }
}
