package superss.lexer;

import java.util.*;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos;
    private int line;
    private int col;

    private int depth;          // brace nesting
    private boolean itemStart;  // next token opens a body item
    private boolean sawSpace;
    private SourcePosition spaceAt;

    private static final Map<String, TokenType> keywords = Map.of(
            "mixin", TokenType.MIXIN,
            "alias", TokenType.ALIAS,
            "as", TokenType.AS,
            "using", TokenType.USING
    );

    // tokens after which an identifier is a name even if it spells a keyword
    private static final Set<TokenType> nameIntroducers = EnumSet.of(
            TokenType.DOT, TokenType.HASH, TokenType.COLON, TokenType.DOUBLE_COLON, TokenType.LBRACKET,
            TokenType.EQUALS, TokenType.INCLUDES, TokenType.DASH_MATCH,
            TokenType.PREFIX_MATCH, TokenType.SUFFIX_MATCH, TokenType.SUBSTRING_MATCH
    );

    private static final Set<TokenType> compoundEnds = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.STAR, TokenType.RBRACKET, TokenType.RPAREN
    );

    private static final Set<TokenType> compoundStarts = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.DOT, TokenType.HASH, TokenType.STAR,
            TokenType.LBRACKET, TokenType.COLON
    );

    public Lexer(String source) {
        this.source = source;
    }

    /** Scans the whole source; every call starts over from the beginning. */
    public List<Token> tokenize() {
        reset();
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) break;

            SourcePosition start = here();

            if (depth > 0 && itemStart && isIdentStart(peek(), peekNext()) && looksLikeDeclaration()) {
                declaration(start);
                continue;
            }

            char c = advance();

            switch (c) {
                case '{' -> {
                    add(TokenType.LBRACE, "{", start);
                    depth++;
                    itemStart = true;
                }
                case '}' -> {
                    add(TokenType.RBRACE, "}", start);
                    if (depth > 0) depth--;
                    itemStart = depth > 0;
                }
                case ';' -> {
                    add(TokenType.SEMICOLON, ";", start);
                    itemStart = depth > 0;
                }

                case '[' -> add(TokenType.LBRACKET, "[", start);
                case ']' -> add(TokenType.RBRACKET, "]", start);
                case '(' -> add(TokenType.LPAREN, "(", start);
                case ')' -> add(TokenType.RPAREN, ")", start);
                case ',' -> add(TokenType.COMMA, ",", start);
                case '.' -> add(TokenType.DOT, ".", start);
                case '#' -> add(TokenType.HASH, "#", start);
                case '>' -> add(TokenType.CHILD, ">", start);
                case '+' -> add(TokenType.ADJACENT_SIBLING, "+", start);
                case '=' -> add(TokenType.EQUALS, "=", start);

                case ':' -> {
                    boolean dbl = match(':');
                    add(dbl ? TokenType.DOUBLE_COLON : TokenType.COLON, dbl ? "::" : ":", start);
                }
                case '*' -> {
                    boolean op = match('=');
                    add(op ? TokenType.SUBSTRING_MATCH : TokenType.STAR, op ? "*=" : "*", start);
                }
                case '~' -> {
                    boolean op = match('=');
                    add(op ? TokenType.INCLUDES : TokenType.SIBLING, op ? "~=" : "~", start);
                }
                case '|' -> {
                    if (match('=')) add(TokenType.DASH_MATCH, "|=", start);
                    else throw error(start, "Unexpected '|'", c);
                }
                case '^' -> {
                    if (match('=')) add(TokenType.PREFIX_MATCH, "^=", start);
                    else throw error(start, "Unexpected '^'", c);
                }
                case '$' -> {
                    if (match('=')) add(TokenType.SUFFIX_MATCH, "$=", start);
                    else throw error(start, "Unexpected '$'", c);
                }

                case '"', '\'' -> string(c, start);

                default -> {
                    if (isIdentStart(c, peek())) identifier(c, start);
                    else throw error(start, "Unexpected character: '" + c + "'", c);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", here()));
        return List.copyOf(tokens);
    }

    // ================= declarations =================

    /**
     * At the start of a body item: an identifier, then ':' (not '::'), and the rest of the
     * item reaches ';', '}' or the end before any '{'.
     */
    private boolean looksLikeDeclaration() {
        int i = pos + 1;
        while (i < source.length() && isIdentPart(source.charAt(i))) i++;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) i++;

        if (i >= source.length() || source.charAt(i) != ':') return false;
        if (i + 1 < source.length() && source.charAt(i + 1) == ':') return false;

        i++;
        while (i < source.length()) {
            char c = source.charAt(i);
            switch (c) {
                case '{' -> { return false; }
                case ';', '}' -> { return true; }
                case '\\' -> i += 2;
                case '"', '\'' -> i = skipQuoted(i);
                default -> i++;
            }
        }
        return true;
    }

    private int skipQuoted(int i) {
        char quote = source.charAt(i++);
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') i += 2;
            else if (c == quote) return i + 1;
            else if (c == '\n') return i;
            else i++;
        }
        return i;
    }

    private void declaration(SourcePosition start) {
        add(TokenType.PROPERTY, readIdentifier(), start);

        skipWhitespaceAndComments();
        SourcePosition colonAt = here();
        advance(); // ':' guaranteed by looksLikeDeclaration
        add(TokenType.COLON, ":", colonAt);

        while (!isAtEnd() && Character.isWhitespace(peek())) advance();

        SourcePosition valueAt = here();
        int from = pos;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ';' || c == '}') break;
            if (c == '\\') {
                advance();
                if (!isAtEnd()) advance();
            } else if (c == '"' || c == '\'') {
                skipValueString(c);
            } else {
                advance();
            }
        }
        add(TokenType.PROPERTY_VALUE, source.substring(from, pos).strip(), valueAt);
    }

    private void skipValueString(char quote) {
        SourcePosition start = here();
        advance(); // opening quote
        while (!isAtEnd()) {
            char c = advance();
            if (c == '\\') {
                if (!isAtEnd()) advance();
            } else if (c == quote) {
                return;
            } else if (c == '\n') {
                throw error(start, "Unterminated string in property value", c);
            }
        }
        throw error(start, "Unterminated string in property value", '\0');
    }

    // ================= helpers =================

    private void identifier(char first, SourcePosition start) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isIdentPart(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = TokenType.IDENTIFIER;
        if (keywords.containsKey(text) && !followsNameIntroducer()) {
            type = keywords.get(text);
        }
        add(type, text, start);
    }

    private String readIdentifier() {
        int from = pos;
        advance();
        while (!isAtEnd() && isIdentPart(peek())) advance();
        return source.substring(from, pos);
    }

    private void string(char quote, SourcePosition start) {
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') throw error(start, "Unterminated string", c);
            if (c == '\\') {
                if (isAtEnd()) break;
                sb.append(advance());
                continue;
            }
            sb.append(c);
        }

        if (isAtEnd()) throw error(start, "Unterminated string", '\0');

        advance(); // closing quote
        add(TokenType.STRING, sb.toString(), start);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                markSpace();
                advance();
            } else if (c == '/' && peekNext() == '*') {
                markSpace();
                SourcePosition at = here();
                advance();
                advance();
                while (!(peek() == '*' && peekNext() == '/')) {
                    if (isAtEnd()) throw error(at, "Unterminated comment", '\0');
                    advance();
                }
                advance();
                advance();
            } else if (c == '/' && peekNext() == '/') {
                markSpace();
                while (!isAtEnd() && peek() != '\n') advance();
            } else {
                return;
            }
        }
    }

    private void markSpace() {
        if (!sawSpace) {
            sawSpace = true;
            spaceAt = here();
        }
    }

    private boolean followsNameIntroducer() {
        return !tokens.isEmpty() && nameIntroducers.contains(tokens.get(tokens.size() - 1).type());
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private SourcePosition here() {
        return new SourcePosition(pos, line, col);
    }

    private static boolean isIdentStart(char c, char next) {
        if (Character.isLetter(c) || c == '_') return true;
        return c == '-' && (Character.isLetter(next) || next == '_' || next == '-');
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private void add(TokenType type, String lexeme, SourcePosition at) {
        if (sawSpace && !tokens.isEmpty()
                && compoundEnds.contains(tokens.get(tokens.size() - 1).type())
                && compoundStarts.contains(type)) {
            tokens.add(new Token(TokenType.DESCENDANT, " ", spaceAt));
        }
        sawSpace = false;
        itemStart = false;
        tokens.add(new Token(type, lexeme, at));
    }

    private void reset() {
        tokens.clear();
        pos = 0;
        line = 1;
        col = 1;
        depth = 0;
        itemStart = false;
        sawSpace = false;
        spaceAt = null;
    }

    private LexerException error(SourcePosition at, String message, char unexpected) {
        return new LexerException(at, message, unexpected);
    }
}
