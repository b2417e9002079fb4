package work.yamlcli.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.yamlcli.engine.error.ErrorContext;
import work.yamlcli.engine.process.StepResult;

/**
 * Outcome of a completed action: every recorded step result plus the {@code _meta} record. A
 * recovered run also carries the context of the failure its {@code on_error} pipeline handled.
 */
public record RunResult(Status status, Map<String, StepResult> steps, ErrorContext error) {
    public static final String META_KEY = "_meta";
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
    }

    public static RunResult success(Map<String, StepResult> steps) {
        return new RunResult(Status.SUCCESS, steps, null);
    }

    public static RunResult recovered(Map<String, StepResult> steps, ErrorContext error) {
        return new RunResult(Status.RECOVERED, steps, error);
    }

    public Optional<StepResult> step(String id) {
        return Optional.ofNullable(steps.get(id));
    }

    public Optional<ErrorContext> errorContext() {
        return Optional.ofNullable(error);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        steps.forEach((id, result) -> map.put(id, result.toMap()));
        var meta = new LinkedHashMap<String, Object>();
        meta.put("status", status.label());
        if (error != null) {
            meta.put("error", error.toMap());
        }
        map.put(META_KEY, meta);
        return map;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toMap());
        } catch (JsonProcessingException ex) {
            return "{\"_meta\":{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}}";
        }
    }

    public enum Status {
        SUCCESS("success"),
        RECOVERED("recovered");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
