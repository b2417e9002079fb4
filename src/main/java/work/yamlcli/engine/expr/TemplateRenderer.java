package work.yamlcli.engine.expr;

import java.util.ArrayList;
import java.util.List;
import work.yamlcli.engine.error.ExpressionSyntaxException;
import work.yamlcli.engine.value.Values;

/**
 * Substitutes {@code ${expression}} placeholders. A string that is exactly one placeholder (ignoring
 * surrounding whitespace) yields the expression's native value; otherwise every placeholder is
 * stringified in place and the literal text around it is kept verbatim.
 */
public final class TemplateRenderer {
    private final ExpressionEvaluator evaluator;

    public TemplateRenderer(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public Object render(Object value, Scope scope) {
        if (!(value instanceof String text)) {
            return value;
        }
        var segments = split(text);
        if (segments.size() == 1 && segments.get(0).expression()) {
            return evaluator.evaluate(segments.get(0).text(), scope);
        }
        var trimmed = text.strip();
        if (trimmed.length() != text.length()) {
            var inner = split(trimmed);
            if (inner.size() == 1 && inner.get(0).expression()) {
                return evaluator.evaluate(inner.get(0).text(), scope);
            }
        }
        var out = new StringBuilder(text.length());
        for (var segment : segments) {
            if (segment.expression()) {
                out.append(Values.stringify(evaluator.evaluate(segment.text(), scope)));
            } else {
                out.append(segment.text());
            }
        }
        return out.toString();
    }

    public String renderString(Object value, Scope scope) {
        return Values.stringify(render(value, scope));
    }

    public boolean renderCondition(Object value, Scope scope) {
        if (value == null) {
            return true;
        }
        return Values.isTruthy(render(value, scope));
    }

    public boolean evaluateGuard(Object guard, Scope scope) {
        if (guard == null) {
            return true;
        }
        if (guard instanceof String text && !text.contains("${")) {
            return evaluator.test(text, scope);
        }
        return renderCondition(guard, scope);
    }

    public static boolean containsPlaceholder(Object value) {
        return value instanceof String text && text.contains("${");
    }

    static List<Segment> split(String text) {
        var segments = new ArrayList<Segment>();
        var literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            int start = text.indexOf("${", i);
            if (start < 0) {
                literal.append(text, i, text.length());
                break;
            }
            literal.append(text, i, start);
            int end = findClose(text, start + 2);
            if (end < 0) {
                throw new ExpressionSyntaxException("Unclosed template expression: " + text);
            }
            if (literal.length() > 0) {
                segments.add(new Segment(literal.toString(), false));
                literal.setLength(0);
            }
            segments.add(new Segment(text.substring(start + 2, end).strip(), true));
            i = end + 1;
        }
        if (literal.length() > 0 || segments.isEmpty()) {
            segments.add(new Segment(literal.toString(), false));
        }
        return segments;
    }

    /**
     * Finds the brace closing a placeholder, skipping braces nested in map literals or quoted strings.
     */
    private static int findClose(String text, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    record Segment(String text, boolean expression) {}
}
