package work.yamlcli.engine.process;

import java.util.List;
import java.util.Map;

/**
 * Step settings inherited from the enclosing workflow and action: environment layers (applied in
 * order, before the step's own), the default working directory and the default shell flag.
 */
public record LaunchDefaults(List<Map<String, Object>> envLayers, Object workdir, boolean shell) {
    public static final LaunchDefaults NONE = new LaunchDefaults(List.of(), null, false);

    public LaunchDefaults {
        envLayers = List.copyOf(envLayers);
    }
}
