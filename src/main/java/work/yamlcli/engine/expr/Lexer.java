package work.yamlcli.engine.expr;

import java.util.ArrayList;
import java.util.List;
import work.yamlcli.engine.error.ExpressionSyntaxException;

/**
 * Splits an expression into tokens. Python-style string literals (single or double quotes with
 * backslash escapes) and integer/decimal numbers are decoded here.
 */
final class Lexer {
    private final String source;
    private int pos;

    Lexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char ch = source.charAt(pos);
        if (Character.isDigit(ch)) {
            return number();
        }
        if (ch == '\'' || ch == '"') {
            return string(ch);
        }
        if (Character.isLetter(ch) || ch == '_') {
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return new Token(TokenType.NAME, source.substring(start, pos), null, start);
        }
        pos++;
        switch (ch) {
            case '.': return simple(TokenType.DOT, start);
            case ',': return simple(TokenType.COMMA, start);
            case ':': return simple(TokenType.COLON, start);
            case '(': return simple(TokenType.LPAREN, start);
            case ')': return simple(TokenType.RPAREN, start);
            case '[': return simple(TokenType.LBRACKET, start);
            case ']': return simple(TokenType.RBRACKET, start);
            case '{': return simple(TokenType.LBRACE, start);
            case '}': return simple(TokenType.RBRACE, start);
            case '=':
                if (match('=')) return simple(TokenType.EQ, start);
                throw error("assignment is not an expression", start);
            case '!':
                if (match('=')) return simple(TokenType.NE, start);
                throw error("unexpected '!'", start);
            case '<':
                if (match('=')) return simple(TokenType.LE, start);
                if (match('<')) return simple(TokenType.FORBIDDEN, start);
                return simple(TokenType.LT, start);
            case '>':
                if (match('=')) return simple(TokenType.GE, start);
                if (match('>')) return simple(TokenType.FORBIDDEN, start);
                return simple(TokenType.GT, start);
            case '*':
                match('*');
                return simple(TokenType.FORBIDDEN, start);
            case '/':
                match('/');
                return simple(TokenType.FORBIDDEN, start);
            case '+':
            case '-':
            case '%':
            case '&':
            case '|':
            case '^':
            case '~':
            case '@':
                return simple(TokenType.FORBIDDEN, start);
            default:
                throw error("unexpected character '" + ch + "'", start);
        }
    }

    private Token number() {
        int start = pos;
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        boolean decimal = false;
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            decimal = true;
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                decimal = true;
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw error("invalid number literal", start);
        }
        var text = source.substring(start, pos);
        var digits = text.replace("_", "");
        try {
            Object literal = decimal ? (Object) Double.parseDouble(digits) : (Object) Long.parseLong(digits);
            return new Token(TokenType.NUMBER, text, literal, start);
        } catch (NumberFormatException ex) {
            throw error("invalid number literal '" + text + "'", start);
        }
    }

    private Token string(char quote) {
        int start = pos;
        pos++;
        var builder = new StringBuilder();
        while (pos < source.length()) {
            char ch = source.charAt(pos++);
            if (ch == quote) {
                return new Token(TokenType.STRING, source.substring(start, pos), builder.toString(), start);
            }
            if (ch == '\\') {
                if (pos >= source.length()) break;
                char esc = source.charAt(pos++);
                switch (esc) {
                    case 'n': builder.append('\n'); break;
                    case 't': builder.append('\t'); break;
                    case 'r': builder.append('\r'); break;
                    case '0': builder.append('\0'); break;
                    case '\\': builder.append('\\'); break;
                    case '\'': builder.append('\''); break;
                    case '"': builder.append('"'); break;
                    default: builder.append('\\').append(esc);
                }
                continue;
            }
            builder.append(ch);
        }
        throw error("unterminated string literal", start);
    }

    private Token simple(TokenType type, int start) {
        return new Token(type, source.substring(start, pos), null, start);
    }

    private boolean match(char expected) {
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private ExpressionSyntaxException error(String detail, int at) {
        return new ExpressionSyntaxException("Invalid expression syntax: " + source + " (" + detail + " at " + at + ")");
    }
}
