package superss.emit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import superss.Compiler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CssEmitterTest {

    private static String pretty(String src) {
        return Compiler.compileToCss(src, CssEmitter.Style.PRETTY);
    }

    private static String min(String src) {
        return Compiler.compileToCss(src, CssEmitter.Style.MINIFIED);
    }

    @Test
    void pretty_single_rule() {
        assertEquals(".a > .c, .b > .c {\n  x: y;\n  z: w;\n}\n",
                pretty(".a > .c, .b > .c { x: y; z: w }"));
    }

    @Test
    void pretty_rules_separated_by_blank_line() {
        assertEquals(".a {\n  color: red;\n}\n\n.a .b {\n  margin: 0 auto;\n}\n",
                pretty(".a { color: red; .b { margin: 0 auto } }"));
    }

    @Test
    void minified_drops_optional_whitespace() {
        assertEquals("div>div>p{color:red}", min("div> div  >p  { color: red }"));
        assertEquals("div~.my-class p>h2+#test{a:b}", min("div ~ . my-class p> h2 +#test { a: b }"));
        assertEquals(".my-class,#my-id,h3,h1{a:b}", min(".my-class,  #my-id    ,   h3,h1{ a: b }"));
    }

    @Test
    void minified_joins_declarations_and_rules() {
        assertEquals(".a{x:1;y:2}.b{z:3}", min(".a { x: 1; y: 2 } .b { z: 3 }"));
    }

    @Test
    void quoted_attribute_operand_is_requoted() {
        assertEquals("a[title=\"x y\"]{c:d}", min("a[title='x y'] { c: d }"));
    }

    @Test
    void values_are_emitted_verbatim() {
        assertEquals("p{font:12px/1.5 \"Helvetica Neue\", sans-serif}",
                min("p { font: 12px/1.5 \"Helvetica Neue\", sans-serif; }"));
    }

    @Test
    void nothing_to_emit() {
        assertEquals("", CssEmitter.emit(List.of(), CssEmitter.Style.PRETTY));
    }

    @Test
    void empty_rules_are_printed() {
        assertEquals(".my-class{}", min(".my-class {}"));
        assertEquals(".my-class {\n}\n", pretty(".my-class {}"));
        assertEquals(".a,.b{}.a>.c,.b>.c{x:y}", min(".a, .b { > .c { x:y } }"));
    }

    @Test
    void write_to_file(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("out.css");
        CssEmitter.write(out, Compiler.compile(".a { x: y }"), CssEmitter.Style.MINIFIED);
        assertEquals(".a{x:y}", Files.readString(out, StandardCharsets.UTF_8));
    }
}
