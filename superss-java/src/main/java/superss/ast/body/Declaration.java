package superss.ast.body;

import superss.lexer.SourcePosition;

/** Property and value are kept verbatim. */
public record Declaration(String property, String value, SourcePosition position) implements BodyItem {}
