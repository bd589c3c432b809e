package superss.ast;

import superss.ast.stmt.Statement;
import superss.ast.stmt.StyleRule;

import java.util.List;

public record Stylesheet(List<Statement> statements) {

    public Stylesheet {
        statements = List.copyOf(statements);
    }

    public List<StyleRule> styleRules() {
        return statements.stream()
                .filter(StyleRule.class::isInstance)
                .map(StyleRule.class::cast)
                .toList();
    }
}
