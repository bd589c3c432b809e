package superss.ast.stmt;

import superss.ast.selector.Selector;
import superss.lexer.SourcePosition;

public record AliasDef(String name, Selector target, SourcePosition position) implements Statement {}
