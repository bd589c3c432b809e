package superss;

import superss.ast.Stylesheet;
import superss.emit.CssEmitter;
import superss.lexer.Lexer;
import superss.parser.Parser;
import superss.resolve.ResolvedRule;
import superss.resolve.Resolver;
import superss.sema.DefinitionCollector;
import superss.sema.SymbolTable;

import java.util.List;

/** lex, parse, collect, resolve; the first {@link CompileException} aborts. */
public final class Compiler {
    private Compiler() {}

    public static Stylesheet parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parseStylesheet();
    }

    public static List<ResolvedRule> compile(String source) {
        Stylesheet stylesheet = parse(source);
        SymbolTable symbols = new DefinitionCollector().collect(stylesheet);
        return new Resolver(symbols).resolve(stylesheet);
    }

    public static String compileToCss(String source, CssEmitter.Style style) {
        return CssEmitter.emit(compile(source), style);
    }
}
