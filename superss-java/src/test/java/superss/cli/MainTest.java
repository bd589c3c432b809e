package superss.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static Path source(Path dir, String text) throws Exception {
        Path p = dir.resolve("style.sss");
        Files.writeString(p, text, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void compiles_next_to_input_by_default(@TempDir Path dir) throws Exception {
        Path in = source(dir, "mixin m { color: red; }\n.a using m { }");

        assertEquals(Main.OK, run(in.toString()));

        Path css = dir.resolve("style.css");
        assertEquals(".a {\n  color: red;\n}\n", Files.readString(css, StandardCharsets.UTF_8));
        String log = out.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("[4/5] Definitions: 1 mixins, 0 aliases"), log);
        assertTrue(log.contains("[5/5] Resolver: 1 rules"), log);
        assertTrue(log.contains("Success"), log);
    }

    @Test
    void minified_to_explicit_output(@TempDir Path dir) throws Exception {
        Path in = source(dir, ".a { > .b { x: y } }");
        Path css = dir.resolve("build.css");

        assertEquals(Main.OK, run(in.toString(), css.toString(), "--min"));
        assertEquals(".a{}.a>.b{x:y}", Files.readString(css, StandardCharsets.UTF_8));
    }

    @Test
    void token_dump(@TempDir Path dir) throws Exception {
        Path in = source(dir, ".a { x: y }");
        assertEquals(Main.OK, run("--tokens", in.toString()));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("PROPERTY_VALUE('y')@1:9"));
    }

    @Test
    void compile_error_exit_code(@TempDir Path dir) throws Exception {
        Path in = source(dir, ".a using nope { x: y }");

        assertEquals(Main.COMPILE_ERROR, run(in.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("UndefinedMixinError: [1:1] Unknown mixin: nope"));
        assertFalse(Files.exists(dir.resolve("style.css")));
    }

    @Test
    void usage_errors() throws Exception {
        assertEquals(Main.USAGE, run());
        assertEquals(Main.USAGE, run("a.sss", "b.css", "c.css"));
        assertEquals(Main.USAGE, run("--watch", "a.sss"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown option: --watch"));
    }
}
