package superss.ast.stmt;

import superss.lexer.SourcePosition;

public sealed interface Statement permits StyleRule, MixinDef, AliasDef {
    SourcePosition position();
}
