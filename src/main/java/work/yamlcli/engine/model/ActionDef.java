package work.yamlcli.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A user-triggerable unit of work: its primary pipeline and an optional recovery pipeline.
 */
public record ActionDef(String id, String title, List<StepDef> pipeline, List<StepDef> onError, Map<String, Object> env) {
    public ActionDef {
        pipeline = List.copyOf(pipeline);
        onError = onError == null ? null : List.copyOf(onError);
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
    }

    public Optional<List<StepDef>> recoveryPipeline() {
        return Optional.ofNullable(onError);
    }
}
