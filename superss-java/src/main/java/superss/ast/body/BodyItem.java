package superss.ast.body;

public sealed interface BodyItem permits Declaration, NestedRule {}
