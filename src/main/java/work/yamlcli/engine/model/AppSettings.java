package work.yamlcli.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Workflow-wide step defaults from the {@code app} block.
 */
public record AppSettings(Map<String, Object> env, Object workdir, boolean shell) {
    public static final AppSettings DEFAULT = new AppSettings(Map.of(), null, false);

    public AppSettings {
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
    }
}
