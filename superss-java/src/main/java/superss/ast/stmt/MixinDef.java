package superss.ast.stmt;

import superss.ast.body.BodyItem;
import superss.lexer.SourcePosition;

import java.util.List;

public record MixinDef(String name, List<BodyItem> body, SourcePosition position) implements Statement {

    public MixinDef {
        body = List.copyOf(body);
    }
}
