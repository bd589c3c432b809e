package superss.ast.selector;

import java.util.List;

public record PseudoClass(String name, List<AttributeSelector> attributes) {

    public PseudoClass {
        attributes = List.copyOf(attributes);
    }
}
