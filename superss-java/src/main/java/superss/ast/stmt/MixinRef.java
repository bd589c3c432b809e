package superss.ast.stmt;

import superss.lexer.SourcePosition;

/** One name in a {@code using} clause. */
public record MixinRef(String name, SourcePosition position) {}
