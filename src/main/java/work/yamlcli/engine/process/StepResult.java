package work.yamlcli.engine.process;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@code run} step, exposed to later expressions as
 * {@code step.<id>.exit_code/.stdout/.stderr/.duration_ms}.
 */
public record StepResult(int exitCode, String stdout, String stderr, long durationMs) {
    public StepResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("exit_code", exitCode);
        map.put("stdout", stdout);
        map.put("stderr", stderr);
        map.put("duration_ms", durationMs);
        return map;
    }
}
