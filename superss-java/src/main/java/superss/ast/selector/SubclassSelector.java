package superss.ast.selector;

import java.util.List;

/** {@code .name} or {@code #name}, with the attribute selectors written right after it. */
public record SubclassSelector(Kind kind, String name, List<AttributeSelector> attributes) {

    public enum Kind {
        CLASS("."),
        ID("#");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public SubclassSelector {
        attributes = List.copyOf(attributes);
    }
}
