package work.yamlcli.engine.argv;

import java.util.Map;
import work.yamlcli.engine.error.EvaluationException;
import work.yamlcli.engine.value.Values;

/**
 * Brace-style per-item formatter used by {@code repeat} and {@code join} argv modes.
 *
 * <p>Map items substitute by key ({@code "{name}={value}"}). Scalar items fill positional fields
 * ({@code "{}"}, {@code "{0}"}) and the {@code {value}} field. {@code {{} and {@code }}} escape braces.
 */
final class ItemTemplate {
    private ItemTemplate() {}

    static String format(String template, Object item) {
        var out = new StringBuilder(template.length() + 16);
        int i = 0;
        while (i < template.length()) {
            char ch = template.charAt(i);
            if (ch == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close < 0) {
                    throw new EvaluationException("Single '{' encountered in argv template: " + template);
                }
                out.append(Values.stringify(resolveField(template, template.substring(i + 1, close).strip(), item)));
                i = close + 1;
                continue;
            }
            if (ch == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new EvaluationException("Single '}' encountered in argv template: " + template);
            }
            out.append(ch);
            i++;
        }
        return out.toString();
    }

    private static Object resolveField(String template, String field, Object item) {
        if (item instanceof Map<?, ?> map) {
            if (!map.containsKey(field)) {
                throw new EvaluationException("argv template field '{" + field + "}' not found in item " + Values.stringify(item));
            }
            return map.get(field);
        }
        if (field.isEmpty() || "0".equals(field) || "value".equals(field)) {
            return item;
        }
        throw new EvaluationException("argv template field '{" + field + "}' cannot be applied to scalar item in: " + template);
    }
}
