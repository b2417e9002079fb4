package work.yamlcli.engine.argv;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import work.yamlcli.engine.error.ConfigException;
import work.yamlcli.engine.expr.Scope;
import work.yamlcli.engine.expr.TemplateRenderer;
import work.yamlcli.engine.value.Values;

/**
 * Turns a declarative argv spec into a concrete argument vector.
 *
 * <p>Entries are literal strings, single-key shorthand maps ({@code {"--name": "${form.name}"}}) or
 * extended option maps keyed by {@code opt}. Output order always follows declaration order; an entry
 * may vary how many values it emits but never which option names.
 */
public final class ArgvBuilder {
    private static final Set<String> TRI_STATE = Set.of("auto", "true", "false");
    private static final Set<String> EXTENDED_KEYS = Set.of(
        "opt", "from", "mode", "style", "template", "joiner", "false_opt", "omit_if_empty", "when"
    );

    private final TemplateRenderer renderer;

    public ArgvBuilder(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    public List<String> build(List<?> spec, Scope scope) {
        var out = new ArrayList<String>();
        if (spec == null) {
            return out;
        }
        for (var item : spec) {
            if (item instanceof String literal) {
                out.add(renderer.renderString(literal, scope));
            } else if (item instanceof Map<?, ?> map && map.containsKey("opt")) {
                appendExtended(out, map, scope);
            } else if (item instanceof Map<?, ?> map && map.size() == 1) {
                var entry = map.entrySet().iterator().next();
                appendShorthand(out, String.valueOf(entry.getKey()), renderer.render(entry.getValue(), scope));
            } else if (item instanceof Number || item instanceof Boolean) {
                out.add(Values.stringify(item));
            } else {
                throw new ConfigException("Unsupported argv item: " + Values.stringify(item));
            }
        }
        return out;
    }

    private static void appendShorthand(List<String> out, String opt, Object value) {
        if (Boolean.TRUE.equals(value)) {
            out.add(opt);
        } else if (value == null || Boolean.FALSE.equals(value) || "".equals(value)) {
            return;
        } else if (value instanceof List<?> list) {
            for (var element : list) {
                out.add(opt);
                out.add(Values.stringify(element));
            }
        } else {
            out.add(opt);
            out.add(Values.stringify(value));
        }
    }

    private void appendExtended(List<String> out, Map<?, ?> item, Scope scope) {
        for (var key : item.keySet()) {
            if (!EXTENDED_KEYS.contains(String.valueOf(key))) {
                throw new ConfigException("Unknown argv option key '" + key + "' in " + Values.stringify(item));
            }
        }
        if (item.containsKey("when") && !renderer.evaluateGuard(item.get("when"), scope)) {
            return;
        }
        var opt = Values.stringify(item.get("opt"));
        if (opt.isEmpty()) {
            throw new ConfigException("argv option requires a non-empty 'opt'");
        }
        var value = renderer.render(item.get("from"), scope);
        var falseOpt = item.get("false_opt") == null ? null : Values.stringify(item.get("false_opt"));
        var style = Style.of(item.get("style"));
        var template = item.get("template") == null ? null : Values.stringify(item.get("template"));
        var omitIfEmpty = !Boolean.FALSE.equals(item.get("omit_if_empty"));

        // "auto"/"true"/"false" strings are flags whatever the declared mode says.
        if (value instanceof String text && TRI_STATE.contains(text)) {
            if ("true".equals(text)) {
                out.add(opt);
            } else if ("false".equals(text) && falseOpt != null && !falseOpt.isEmpty()) {
                out.add(falseOpt);
            }
            return;
        }
        if (omitIfEmpty && Values.isEmpty(value)) {
            return;
        }

        var mode = Mode.of(item.get("mode"), value);
        switch (mode) {
            case FLAG:
                if (Boolean.TRUE.equals(value)) {
                    out.add(opt);
                } else if (Boolean.FALSE.equals(value) && falseOpt != null && !falseOpt.isEmpty()) {
                    out.add(falseOpt);
                }
                break;
            case VALUE:
                append(out, opt, style, template == null ? Values.stringify(value) : ItemTemplate.format(template, value));
                break;
            case REPEAT:
                for (var element : asList(value)) {
                    append(out, opt, style, template == null ? Values.stringify(element) : ItemTemplate.format(template, element));
                }
                break;
            case JOIN:
                var joiner = item.containsKey("joiner") ? Values.stringify(item.get("joiner")) : ",";
                var rendered = new ArrayList<String>();
                for (var element : asList(value)) {
                    rendered.add(template == null ? Values.stringify(element) : ItemTemplate.format(template, element));
                }
                append(out, opt, style, String.join(joiner, rendered));
                break;
            default:
                throw new ConfigException("Unknown argv mode: " + mode);
        }
    }

    private static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        return value == null ? List.of() : List.of(value);
    }

    private static void append(List<String> out, String opt, Style style, String value) {
        if (style == Style.EQUALS) {
            out.add(opt + "=" + value);
        } else {
            out.add(opt);
            out.add(value);
        }
    }

    enum Mode {
        FLAG,
        VALUE,
        REPEAT,
        JOIN;

        static Mode of(Object raw, Object value) {
            var name = raw == null ? "auto" : String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
            if ("auto".equals(name)) {
                if (value instanceof Boolean) return FLAG;
                if (value instanceof List<?>) return REPEAT;
                return VALUE;
            }
            try {
                return Mode.valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new ConfigException("Unknown argv mode: " + raw);
            }
        }
    }

    enum Style {
        SEPARATE,
        EQUALS;

        static Style of(Object raw) {
            if (raw == null) {
                return SEPARATE;
            }
            try {
                return Style.valueOf(String.valueOf(raw).trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new ConfigException("Unknown argv style: " + raw);
            }
        }
    }
}
