package work.yamlcli.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, validated workflow tree: global variables, app defaults, runtime program overrides and
 * the actions keyed by id.
 */
public record WorkflowConfig(
    Map<String, Object> vars,
    AppSettings app,
    Map<String, String> runtimeExecutables,
    Map<String, ActionDef> actions
) {
    public WorkflowConfig {
        vars = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(vars, "vars")));
        Objects.requireNonNull(app, "app");
        runtimeExecutables = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(runtimeExecutables, "runtimeExecutables")));
        actions = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(actions, "actions")));
    }

    public Optional<ActionDef> action(String id) {
        return Optional.ofNullable(actions.get(id));
    }

    public List<String> actionIds() {
        return List.copyOf(actions.keySet());
    }
}
