package superss.cli;

import superss.CompileException;
import superss.emit.CssEmitter;
import superss.lexer.Lexer;
import superss.lexer.Token;
import superss.parser.Parser;
import superss.resolve.Resolver;
import superss.sema.DefinitionCollector;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class Main {
    static final int OK = 0;
    static final int COMPILE_ERROR = 1;
    static final int USAGE = 2;

    private static final String USAGE_LINE = "Usage: superss <input.sss> [output.css] [--min] [--tokens]";

    public static void main(String[] args) throws IOException {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        boolean minify = false;
        boolean dumpTokens = false;
        List<String> paths = new ArrayList<>();

        for (String a : args) {
            switch (a) {
                case "--min" -> minify = true;
                case "--tokens" -> dumpTokens = true;
                default -> {
                    if (a.startsWith("--")) {
                        err.println("Unknown option: " + a);
                        err.println(USAGE_LINE);
                        return USAGE;
                    }
                    paths.add(a);
                }
            }
        }
        if (paths.isEmpty() || paths.size() > 2) {
            err.println(USAGE_LINE);
            return USAGE;
        }

        Path input = Path.of(paths.get(0));
        Path output = (paths.size() == 2)
                ? Path.of(paths.get(1))
                : Path.of(input.toString().replaceFirst("\\.sss$", "") + ".css");

        // 1. read
        String source = Files.readString(input, StandardCharsets.UTF_8);
        out.println("[1/5] Reading: " + input);

        try {
            // 2. lexer
            var tokens = new Lexer(source).tokenize();
            out.println("[2/5] Lexer: " + tokens.size() + " tokens");
            if (dumpTokens) {
                for (Token t : tokens) out.println("  " + t);
            }

            // 3. parser
            var stylesheet = new Parser(tokens).parseStylesheet();
            out.println("[3/5] Parser: " + stylesheet.statements().size() + " statements");

            // 4. definitions
            var symbols = new DefinitionCollector().collect(stylesheet);
            out.println("[4/5] Definitions: " + symbols.mixins().size() + " mixins, "
                    + symbols.aliases().size() + " aliases");

            // 5. resolve
            var rules = new Resolver(symbols).resolve(stylesheet);
            out.println("[5/5] Resolver: " + rules.size() + " rules");

            CssEmitter.write(output, rules, minify ? CssEmitter.Style.MINIFIED : CssEmitter.Style.PRETTY);
        } catch (CompileException e) {
            err.println(e.kind() + ": " + e.getMessage());
            return COMPILE_ERROR;
        }

        out.println("\n✓ Success: " + output);
        out.println("  File size: " + Files.size(output) + " bytes");
        return OK;
    }
}
