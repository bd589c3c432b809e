package superss.parser;

import superss.ast.Stylesheet;
import superss.ast.body.BodyItem;
import superss.ast.body.Declaration;
import superss.ast.body.NestedRule;
import superss.ast.selector.AttributeOperator;
import superss.ast.selector.AttributeSelector;
import superss.ast.selector.Combinator;
import superss.ast.selector.CompoundSelector;
import superss.ast.selector.PseudoClass;
import superss.ast.selector.PseudoElement;
import superss.ast.selector.Selector;
import superss.ast.selector.SelectorStructureException;
import superss.ast.selector.SingleSelector;
import superss.ast.selector.SubclassSelector;
import superss.ast.selector.TypeSelector;
import superss.ast.stmt.AliasDef;
import superss.ast.stmt.MixinDef;
import superss.ast.stmt.MixinRef;
import superss.ast.stmt.Statement;
import superss.ast.stmt.StyleRule;
import superss.lexer.SourcePosition;
import superss.lexer.Token;
import superss.lexer.TokenKind;
import superss.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

public final class Parser {
    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Stylesheet parseStylesheet() {
        List<Statement> statements = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            if (match(TokenType.MIXIN)) statements.add(parseMixinDef(previous()));
            else if (match(TokenType.ALIAS)) statements.add(parseAliasDef(previous()));
            else if (startsSelector()) statements.add(parseStyle());
            else throw error(peek(), "style rule, 'mixin' or 'alias' at top level");
        }
        consume(TokenType.EOF, "end of input");
        return new Stylesheet(statements);
    }

    // ---------- definitions ----------
    private MixinDef parseMixinDef(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "mixin name");
        List<BodyItem> body = parseStyleBody();
        return new MixinDef(name.lexeme(), body, keyword.position());
    }

    private AliasDef parseAliasDef(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "alias name");
        consume(TokenType.AS, "'as' after alias name");
        Selector target = parseSelector();
        match(TokenType.SEMICOLON);
        return new AliasDef(name.lexeme(), target, keyword.position());
    }

    // ---------- style ----------
    private StyleRule parseStyle() {
        SourcePosition at = peek().position();
        Selector selector = parseSelector();

        List<MixinRef> mixins = new ArrayList<>();
        if (match(TokenType.USING)) {
            do {
                Token n = consume(TokenType.IDENTIFIER, "mixin name after 'using'");
                mixins.add(new MixinRef(n.lexeme(), n.position()));
            } while (match(TokenType.COMMA));
        }

        List<BodyItem> body = parseStyleBody();
        return new StyleRule(selector, mixins, body, at);
    }

    private List<BodyItem> parseStyleBody() {
        consume(TokenType.LBRACE, "'{'");
        List<BodyItem> items = new ArrayList<>();

        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            if (match(TokenType.SEMICOLON)) continue;

            // the last declaration may omit its ';'
            if (check(TokenType.PROPERTY)) {
                items.add(parseDeclaration());
                if (!check(TokenType.RBRACE)) consume(TokenType.SEMICOLON, "';' after declaration");
                continue;
            }

            Combinator combinator = Combinator.DESCENDANT;
            boolean leading = isCombinator(peek().type());
            if (leading) {
                combinator = toCombinator(advance().type());
            }
            // after a leading combinator a missing selector is an empty compound
            if (!leading && !startsSelector()) throw error(peek(), "declaration or nested rule");
            items.add(new NestedRule(combinator, parseStyle()));
        }

        consume(TokenType.RBRACE, "'}'");
        return items;
    }

    private Declaration parseDeclaration() {
        Token property = consume(TokenType.PROPERTY, "property name");
        consume(TokenType.COLON, "':' after property name");
        Token value = consume(TokenType.PROPERTY_VALUE, "property value");
        if (value.lexeme().isEmpty()) throw error(value, "property value");
        return new Declaration(property.lexeme(), value.lexeme(), property.position());
    }

    // ---------- selectors ----------
    private Selector parseSelector() {
        List<SingleSelector> alternatives = new ArrayList<>();
        do {
            alternatives.add(parseSingleSelector());
        } while (match(TokenType.COMMA));
        return new Selector(alternatives);
    }

    private SingleSelector parseSingleSelector() {
        if (check(TokenType.DOUBLE_COLON)) {
            return new SingleSelector(null, List.of(), parsePseudoElement());
        }

        CompoundSelector head = parseCompound();
        List<SingleSelector.Link> links = new ArrayList<>();
        while (isCombinator(peek().type())) {
            Combinator c = toCombinator(advance().type());
            links.add(new SingleSelector.Link(c, parseCompound()));
        }

        PseudoElement pseudoElement = check(TokenType.DOUBLE_COLON) ? parsePseudoElement() : null;
        return new SingleSelector(head, links, pseudoElement);
    }

    private CompoundSelector parseCompound() {
        Token start = peek();

        TypeSelector type = null;
        if (check(TokenType.IDENTIFIER) || check(TokenType.STAR)) {
            Token t = advance();
            type = new TypeSelector(t.lexeme(), t.position());
        }
        List<AttributeSelector> typeAttributes = parseAttributes();

        List<SubclassSelector> subclasses = new ArrayList<>();
        while (check(TokenType.DOT) || check(TokenType.HASH)) {
            SubclassSelector.Kind kind = advance().type() == TokenType.DOT
                    ? SubclassSelector.Kind.CLASS
                    : SubclassSelector.Kind.ID;
            Token name = consume(TokenType.IDENTIFIER,
                    kind == SubclassSelector.Kind.CLASS ? "class name after '.'" : "id after '#'");
            subclasses.add(new SubclassSelector(kind, name.lexeme(), parseAttributes()));
        }

        List<PseudoClass> pseudoClasses = new ArrayList<>();
        while (match(TokenType.COLON)) {
            Token name = consume(TokenType.IDENTIFIER, "pseudo-class name after ':'");
            pseudoClasses.add(new PseudoClass(name.lexeme(), parseAttributes()));
        }

        if (type == null && typeAttributes.isEmpty() && subclasses.isEmpty() && pseudoClasses.isEmpty()) {
            throw new SelectorStructureException(start.position(),
                    "empty compound selector (got " + start.type() + " '" + start.lexeme() + "')");
        }
        return new CompoundSelector(type, typeAttributes, subclasses, pseudoClasses);
    }

    private PseudoElement parsePseudoElement() {
        consume(TokenType.DOUBLE_COLON, "'::'");
        Token name = consume(TokenType.IDENTIFIER, "pseudo-element name after '::'");
        return new PseudoElement(name.lexeme(), parseAttributes());
    }

    private List<AttributeSelector> parseAttributes() {
        List<AttributeSelector> attrs = new ArrayList<>();
        while (check(TokenType.LBRACKET)) {
            attrs.add(parseAttribute());
        }
        return attrs;
    }

    private AttributeSelector parseAttribute() {
        consume(TokenType.LBRACKET, "'['");
        Token name = consume(TokenType.IDENTIFIER, "attribute name");

        AttributeSelector attr = AttributeSelector.present(name.lexeme());
        if (peek().kind() == TokenKind.ATTRIBUTE_OPERATOR) {
            AttributeOperator op = toAttributeOperator(advance().type());
            if (!check(TokenType.IDENTIFIER) && !check(TokenType.STRING)) {
                throw error(peek(), "attribute value (identifier or string) after '" + op.symbol() + "'");
            }
            Token operand = advance();
            attr = new AttributeSelector(name.lexeme(), op,
                    new AttributeSelector.Operand(operand.lexeme(), operand.type() == TokenType.STRING));
        }

        consume(TokenType.RBRACKET, "']' after attribute selector");
        return attr;
    }

    // ---------- helpers ----------
    private boolean startsSelector() {
        return switch (peek().type()) {
            case IDENTIFIER, DOT, HASH, STAR, LBRACKET, COLON, DOUBLE_COLON -> true;
            default -> false;
        };
    }

    private static boolean isCombinator(TokenType t) {
        return t.kind() == TokenKind.COMBINATOR;
    }

    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String expected) {
        if (check(t)) return advance();
        throw error(peek(), expected);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private SyntaxException error(Token at, String expected) {
        return new SyntaxException(expected, at);
    }

    private static Combinator toCombinator(TokenType t) {
        return switch (t) {
            case DESCENDANT       -> Combinator.DESCENDANT;
            case CHILD            -> Combinator.CHILD;
            case SIBLING          -> Combinator.SIBLING;
            case ADJACENT_SIBLING -> Combinator.ADJACENT_SIBLING;
            default -> throw new IllegalArgumentException("Not a combinator token: " + t);
        };
    }

    private static AttributeOperator toAttributeOperator(TokenType t) {
        return switch (t) {
            case EQUALS          -> AttributeOperator.EQUALS;
            case INCLUDES        -> AttributeOperator.INCLUDES;
            case DASH_MATCH      -> AttributeOperator.DASH_MATCH;
            case PREFIX_MATCH    -> AttributeOperator.PREFIX_MATCH;
            case SUFFIX_MATCH    -> AttributeOperator.SUFFIX_MATCH;
            case SUBSTRING_MATCH -> AttributeOperator.SUBSTRING_MATCH;
            default -> throw new IllegalArgumentException("Not an attribute operator token: " + t);
        };
    }
}
