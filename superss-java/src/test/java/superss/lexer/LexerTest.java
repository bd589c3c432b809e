package superss.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> typesNoEof(String src) {
        return lex(src).stream().filter(t -> t.type() != TokenType.EOF).map(Token::type).toList();
    }

    @Test
    void lex_punctuation() {
        var ts = typesNoEof("{ } [ ] ( ) , ; . # *");
        assertEquals(List.of(
                TokenType.LBRACE, TokenType.RBRACE,
                TokenType.LBRACKET, TokenType.RBRACKET,
                TokenType.LPAREN, TokenType.RPAREN,
                TokenType.COMMA, TokenType.SEMICOLON,
                TokenType.DOT, TokenType.HASH, TokenType.STAR
        ), ts);
    }

    @Test
    void lex_attribute_operators() {
        assertEquals(List.of(
                TokenType.EQUALS, TokenType.INCLUDES, TokenType.DASH_MATCH,
                TokenType.PREFIX_MATCH, TokenType.SUFFIX_MATCH, TokenType.SUBSTRING_MATCH
        ), typesNoEof("= ~= |= ^= $= *="));
    }

    @Test
    void lex_pseudo_colons() {
        assertEquals(List.of(TokenType.COLON, TokenType.DOUBLE_COLON), typesNoEof(": ::"));
    }

    @Test
    void lex_explicit_combinators() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.CHILD, TokenType.IDENTIFIER,
                TokenType.ADJACENT_SIBLING, TokenType.IDENTIFIER,
                TokenType.SIBLING, TokenType.IDENTIFIER
        ), typesNoEof("a > b + c ~ d"));
    }

    @Test
    void lex_descendant_synthesized_from_whitespace() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.DESCENDANT, TokenType.IDENTIFIER),
                typesNoEof("ul li"));
        assertEquals(List.of(TokenType.DOT, TokenType.IDENTIFIER, TokenType.DESCENDANT, TokenType.DOT, TokenType.IDENTIFIER),
                typesNoEof(".a .b"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.DESCENDANT,
                        TokenType.LBRACKET, TokenType.IDENTIFIER, TokenType.RBRACKET),
                typesNoEof("a [href]"));
    }

    @Test
    void lex_no_descendant_around_explicit_combinator_or_comma() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.CHILD, TokenType.IDENTIFIER), typesNoEof("div  >  p"));
        assertEquals(List.of(TokenType.DOT, TokenType.IDENTIFIER, TokenType.COMMA, TokenType.DOT, TokenType.IDENTIFIER),
                typesNoEof(".a , .b"));
        // space after the class prefix does not split the compound
        assertEquals(List.of(TokenType.DOT, TokenType.IDENTIFIER), typesNoEof(".  my-class"));
    }

    @Test
    void lex_keywords() {
        assertEquals(List.of(TokenType.MIXIN, TokenType.ALIAS, TokenType.AS, TokenType.USING),
                typesNoEof("mixin alias as using"));
    }

    @Test
    void lex_keyword_spelled_name_after_prefix_is_identifier() {
        assertEquals(List.of(TokenType.DOT, TokenType.IDENTIFIER, TokenType.HASH, TokenType.IDENTIFIER),
                typesNoEof(".using#as"));
    }

    static Stream<String> identifierInputs() {
        return Stream.of("test1", "test-test_test", "_test", "-webkit-box", "--main-color", "_-_-1_-x");
    }

    @ParameterizedTest
    @MethodSource("identifierInputs")
    void lex_identifier(String input) {
        var toks = lex(input);
        assertEquals(2, toks.size());
        assertEquals(TokenType.IDENTIFIER, toks.get(0).type());
        assertEquals(input, toks.get(0).lexeme());
        assertEquals(TokenKind.IDENTIFIER, toks.get(0).kind());
    }

    @Test
    void lex_strings_with_both_quotes_and_escapes() {
        assertEquals("a b", lex("\"a b\"").get(0).lexeme());
        assertEquals("x", lex("'x'").get(0).lexeme());
        assertEquals("a\"b", lex("\"a\\\"b\"").get(0).lexeme());
        assertEquals(TokenType.STRING, lex("'x'").get(0).type());
    }

    @Test
    void lex_declaration_captures_value_verbatim() {
        var toks = lex("a { color: red; }");
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.LBRACE,
                TokenType.PROPERTY, TokenType.COLON, TokenType.PROPERTY_VALUE, TokenType.SEMICOLON,
                TokenType.RBRACE, TokenType.EOF
        ), toks.stream().map(Token::type).toList());
        assertEquals("color", toks.get(2).lexeme());
        assertEquals("red", toks.get(4).lexeme());
        assertEquals(TokenKind.PROPERTY_VALUE, toks.get(4).kind());
    }

    @Test
    void lex_value_keeps_strings_escapes_and_slashes() {
        assertEquals("12px/1.5 \"Helvetica Neue\", sans-serif",
                lex("p { font: 12px/1.5 \"Helvetica Neue\", sans-serif }").get(4).lexeme());
        assertEquals("\";\"", lex("p { content: \";\" }").get(4).lexeme());
        assertEquals("a\\;b", lex("p { x: a\\;b; }").get(4).lexeme());
    }

    @Test
    void lex_value_ends_at_closing_brace() {
        var toks = lex("p { margin: 0 auto }");
        assertEquals("0 auto", toks.get(4).lexeme());
        assertEquals(TokenType.RBRACE, toks.get(5).type());
    }

    @Test
    void lex_nested_pseudo_class_selector_is_not_a_declaration() {
        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.LBRACE,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER, TokenType.LBRACE, TokenType.RBRACE,
                TokenType.RBRACE
        ), typesNoEof("a { b:hover { } }"));
    }

    @Test
    void lex_declaration_only_inside_braces() {
        // top level: plain selector tokens
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER), typesNoEof("a:hover"));
    }

    @Test
    void lex_comments_skipped_and_count_as_whitespace() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.DESCENDANT, TokenType.IDENTIFIER), typesNoEof("a /* c */ b"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LBRACE, TokenType.RBRACE), typesNoEof("a // note\n{ }"));
    }

    @Test
    void lex_whitespace_and_positions() {
        var toks = lex("a\n  b");
        assertEquals("IDENTIFIER('a')@1:1", toks.get(0).toString());
        assertEquals(TokenType.DESCENDANT, toks.get(1).type());
        assertEquals("IDENTIFIER('b')@2:3", toks.get(2).toString());
        assertEquals(4, toks.get(2).position().offset());
    }

    @Test
    void lex_is_restartable() {
        var lexer = new Lexer(".a > .b { color: red }");
        assertEquals(lexer.tokenize(), lexer.tokenize());
    }

    @Test
    void lex_error_unexpected_char() {
        var e = assertThrows(LexerException.class, () -> lex("a @"));
        assertEquals('@', e.unexpected());
        assertEquals(1, e.position().line());
        assertEquals(3, e.position().column());
        assertEquals("LexError", e.kind());
    }

    @Test
    void lex_error_lone_operator_prefix() {
        assertThrows(LexerException.class, () -> lex("|"));
        assertThrows(LexerException.class, () -> lex("^"));
        assertThrows(LexerException.class, () -> lex("$"));
    }

    @Test
    void lex_error_unterminated_string_and_comment() {
        assertThrows(LexerException.class, () -> lex("\"abc"));
        assertThrows(LexerException.class, () -> lex("\"ab\nc\""));
        assertThrows(LexerException.class, () -> lex("a /* never closed"));
        assertThrows(LexerException.class, () -> lex("p { content: \"open; }"));
    }
}
