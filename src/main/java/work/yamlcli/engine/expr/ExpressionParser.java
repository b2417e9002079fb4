package work.yamlcli.engine.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.yamlcli.engine.error.EvaluationException;
import work.yamlcli.engine.error.ExpressionSyntaxException;

/**
 * Recursive-descent parser for the restricted expression grammar:
 *
 * <pre>
 * expr       := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := postfix (('=='|'!='|'&lt;'|'&lt;='|'&gt;'|'&gt;=') postfix)*
 * postfix    := primary ('.' NAME | '[' expr ']')*
 * primary    := literal | NAME | helper '(' expr ')' | '(' expr ')' | '[' items ']' | '{' entries '}'
 * </pre>
 *
 * Constructs outside the whitelist (arithmetic, membership tests, lambdas, arbitrary calls) are
 * rejected here, before anything is evaluated.
 */
public final class ExpressionParser {
    static final Set<String> HELPERS = Set.of("len", "empty", "exists");
    private static final Set<String> FORBIDDEN_KEYWORDS = Set.of(
        "in", "is", "if", "else", "lambda", "for", "import", "from", "yield", "await", "del", "global", "assert"
    );

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
    }

    public static Node parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionSyntaxException("Invalid expression syntax: empty expression");
        }
        var parser = new ExpressionParser(expression);
        var node = parser.parseOr();
        if (!parser.peek().is(TokenType.EOF)) {
            throw parser.unexpected(parser.peek());
        }
        return node;
    }

    private Node parseOr() {
        var first = parseAnd();
        if (!peek().isName("or")) {
            return first;
        }
        var operands = new ArrayList<Node>();
        operands.add(first);
        while (peek().isName("or")) {
            advance();
            operands.add(parseAnd());
        }
        return new Node.BoolOp(Node.Operator.OR, List.copyOf(operands));
    }

    private Node parseAnd() {
        var first = parseNot();
        if (!peek().isName("and")) {
            return first;
        }
        var operands = new ArrayList<Node>();
        operands.add(first);
        while (peek().isName("and")) {
            advance();
            operands.add(parseNot());
        }
        return new Node.BoolOp(Node.Operator.AND, List.copyOf(operands));
    }

    private Node parseNot() {
        if (peek().isName("not")) {
            advance();
            return new Node.Not(parseNot());
        }
        return parseComparison();
    }

    private Node parseComparison() {
        var first = parsePostfix();
        var rest = new ArrayList<Node.Comparison>();
        while (true) {
            var op = compareOp(peek());
            if (op == null) {
                if (peek().isName("in") || peek().isName("is") || (peek().isName("not") && peekAt(1).isName("in"))) {
                    throw forbidden("membership/identity test '" + peek().text() + "'");
                }
                break;
            }
            advance();
            rest.add(new Node.Comparison(op, parsePostfix()));
        }
        return rest.isEmpty() ? first : new Node.Compare(first, List.copyOf(rest));
    }

    private Node parsePostfix() {
        var node = parsePrimary();
        while (true) {
            var token = peek();
            if (token.is(TokenType.DOT)) {
                advance();
                var name = expect(TokenType.NAME, "attribute name");
                if (peek().is(TokenType.LPAREN)) {
                    throw forbidden("method call '." + name.text() + "()'");
                }
                node = new Node.Attr(node, name.text());
            } else if (token.is(TokenType.LBRACKET)) {
                advance();
                if (peek().is(TokenType.COLON)) {
                    throw forbidden("slice");
                }
                var key = parseOr();
                if (peek().is(TokenType.COLON)) {
                    throw forbidden("slice");
                }
                expect(TokenType.RBRACKET, "']'");
                node = new Node.Index(node, key);
            } else if (token.is(TokenType.LPAREN)) {
                throw forbidden("call on a computed value");
            } else if (token.is(TokenType.FORBIDDEN)) {
                throw forbidden("operator '" + token.text() + "'");
            } else {
                return node;
            }
        }
    }

    private Node parsePrimary() {
        var token = advance();
        switch (token.type()) {
            case NUMBER:
            case STRING:
                return new Node.Literal(token.literal());
            case FORBIDDEN:
                if ("-".equals(token.text()) && peek().is(TokenType.NUMBER)) {
                    var number = advance().literal();
                    return new Node.Literal(number instanceof Long l ? (Object) (-l) : (Object) (-((Double) number)));
                }
                throw forbidden("operator '" + token.text() + "'");
            case NAME:
                return parseName(token);
            case LPAREN: {
                if (peek().is(TokenType.RPAREN)) {
                    throw forbidden("tuple");
                }
                var inner = parseOr();
                if (peek().is(TokenType.COMMA)) {
                    throw forbidden("tuple");
                }
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case LBRACKET:
                return parseList();
            case LBRACE:
                return parseMap();
            default:
                throw unexpected(token);
        }
    }

    private Node parseName(Token token) {
        var name = token.text();
        switch (name) {
            case "True":
            case "true":
                return new Node.Literal(Boolean.TRUE);
            case "False":
            case "false":
                return new Node.Literal(Boolean.FALSE);
            case "None":
            case "null":
                return new Node.Literal(null);
            default:
                break;
        }
        if (FORBIDDEN_KEYWORDS.contains(name)) {
            throw forbidden("keyword '" + name + "'");
        }
        if (!peek().is(TokenType.LPAREN)) {
            return new Node.Name(name);
        }
        if (!HELPERS.contains(name)) {
            throw new EvaluationException("Only len, empty, exists helpers are supported (got '" + name + "') in: " + source);
        }
        advance();
        if (peek().is(TokenType.RPAREN)) {
            throw new EvaluationException(name + "() takes exactly one argument: " + source);
        }
        var argument = parseOr();
        if (peek().is(TokenType.COMMA)) {
            throw new EvaluationException(name + "() takes exactly one argument: " + source);
        }
        expect(TokenType.RPAREN, "')'");
        return new Node.Call(name, argument);
    }

    private Node parseList() {
        var items = new ArrayList<Node>();
        if (peek().is(TokenType.RBRACKET)) {
            advance();
            return new Node.ListLit(List.of());
        }
        while (true) {
            items.add(parseOr());
            if (peek().isName("for")) {
                throw forbidden("comprehension");
            }
            if (peek().is(TokenType.COMMA)) {
                advance();
                if (peek().is(TokenType.RBRACKET)) {
                    advance();
                    break;
                }
                continue;
            }
            expect(TokenType.RBRACKET, "']'");
            break;
        }
        return new Node.ListLit(List.copyOf(items));
    }

    private Node parseMap() {
        var keys = new ArrayList<Node>();
        var values = new ArrayList<Node>();
        if (peek().is(TokenType.RBRACE)) {
            advance();
            return new Node.MapLit(List.of(), List.of());
        }
        while (true) {
            keys.add(parseOr());
            if (!peek().is(TokenType.COLON)) {
                throw forbidden("set literal");
            }
            advance();
            values.add(parseOr());
            if (peek().isName("for")) {
                throw forbidden("comprehension");
            }
            if (peek().is(TokenType.COMMA)) {
                advance();
                if (peek().is(TokenType.RBRACE)) {
                    advance();
                    break;
                }
                continue;
            }
            expect(TokenType.RBRACE, "'}'");
            break;
        }
        return new Node.MapLit(List.copyOf(keys), List.copyOf(values));
    }

    private static Node.CompareOp compareOp(Token token) {
        switch (token.type()) {
            case EQ: return Node.CompareOp.EQ;
            case NE: return Node.CompareOp.NE;
            case LT: return Node.CompareOp.LT;
            case LE: return Node.CompareOp.LE;
            case GT: return Node.CompareOp.GT;
            case GE: return Node.CompareOp.GE;
            default: return null;
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        var token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type, String what) {
        var token = peek();
        if (token.is(TokenType.FORBIDDEN)) {
            throw forbidden("operator '" + token.text() + "'");
        }
        if (!token.is(type)) {
            throw new ExpressionSyntaxException("Invalid expression syntax: " + source + " (expected " + what + " at " + token.position() + ")");
        }
        return advance();
    }

    private RuntimeException unexpected(Token token) {
        if (token.is(TokenType.FORBIDDEN)) {
            return forbidden("operator '" + token.text() + "'");
        }
        if (token.is(TokenType.NAME) && FORBIDDEN_KEYWORDS.contains(token.text())) {
            return forbidden("keyword '" + token.text() + "'");
        }
        var what = token.is(TokenType.EOF) ? "end of expression" : "'" + token.text() + "'";
        return new ExpressionSyntaxException("Invalid expression syntax: " + source + " (unexpected " + what + " at " + token.position() + ")");
    }

    private EvaluationException forbidden(String construct) {
        return new EvaluationException("Forbidden expression construct: " + construct + " in: " + source);
    }
}
