package work.yamlcli.engine.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured description of a failure: which step, what kind, and a readable message.
 */
public record ErrorContext(String stepId, String type, String message) {
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("step_id", stepId);
        map.put("type", type);
        map.put("message", message);
        return map;
    }

    public String describe() {
        var where = stepId == null || stepId.isBlank() ? "<action>" : stepId;
        return where + " (" + type + "): " + message;
    }
}
