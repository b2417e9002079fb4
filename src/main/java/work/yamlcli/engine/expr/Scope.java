package work.yamlcli.engine.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.yamlcli.engine.value.Values;

/**
 * Read-only variable environment visible to expressions. Built fresh before every guard and step
 * body; {@link #toBuilder()} derives a new scope and leaves this one untouched.
 */
public final class Scope {
    public static final String VARS = "vars";
    public static final String FORM = "form";
    public static final String ENV = "env";
    public static final String STEP = "step";
    public static final String CWD = "cwd";
    public static final String HOME = "home";
    public static final String TEMP = "temp";
    public static final String OS = "os";
    public static final String LOOP = "loop";
    public static final String ERROR = "error";

    private static final Scope EMPTY = new Scope(Map.of());

    private final Map<String, Object> bindings;

    private Scope(Map<String, Object> bindings) {
        this.bindings = bindings;
    }

    public static Scope empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    public Object get(String name) {
        return bindings.get(name);
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.bindings.putAll(bindings);
        return builder;
    }

    public static final class Builder {
        private final Map<String, Object> bindings = new LinkedHashMap<>();

        private Builder() {}

        public Builder vars(Map<String, Object> vars) {
            return bind(VARS, vars == null ? Map.of() : vars);
        }

        public Builder form(Map<String, Object> form) {
            return bind(FORM, form == null ? Map.of() : form);
        }

        public Builder env(Map<String, String> env) {
            return bind(ENV, env == null ? Map.of() : env);
        }

        public Builder steps(Map<String, ?> steps) {
            return bind(STEP, steps == null ? Map.of() : steps);
        }

        public Builder cwd(String cwd) {
            return bind(CWD, cwd);
        }

        public Builder home(String home) {
            return bind(HOME, home);
        }

        public Builder temp(String temp) {
            return bind(TEMP, temp);
        }

        public Builder os(String os) {
            return bind(OS, os);
        }

        public Builder error(Map<String, Object> error) {
            return bind(ERROR, error);
        }

        public Builder bindAll(Map<String, Object> extra) {
            if (extra != null) {
                extra.forEach(this::bind);
            }
            return this;
        }

        public Builder bind(String name, Object value) {
            bindings.put(name, Values.freeze(value));
            return this;
        }

        public Scope build() {
            return new Scope(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)));
        }
    }
}
