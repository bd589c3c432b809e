package superss.ast.stmt;

import superss.ast.body.BodyItem;
import superss.ast.selector.Selector;
import superss.lexer.SourcePosition;

import java.util.List;

public record StyleRule(
        Selector selector,
        List<MixinRef> mixins,
        List<BodyItem> body,
        SourcePosition position
) implements Statement {

    public StyleRule {
        mixins = List.copyOf(mixins);
        body = List.copyOf(body);
    }
}
