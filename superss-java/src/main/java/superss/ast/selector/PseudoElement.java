package superss.ast.selector;

import java.util.List;

public record PseudoElement(String name, List<AttributeSelector> attributes) {

    public PseudoElement {
        attributes = List.copyOf(attributes);
    }
}
