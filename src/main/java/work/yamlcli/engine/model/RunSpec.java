package work.yamlcli.engine.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative description of one external program invocation. Template-bearing fields stay raw
 * ({@code Object}) and are rendered against the step scope at execution time.
 */
public record RunSpec(
    Object program,
    List<Object> argv,
    Map<String, Object> env,
    Object workdir,
    Boolean shell,
    StreamMode stdout,
    StreamMode stderr,
    Optional<Duration> timeout
) {
    public RunSpec {
        Objects.requireNonNull(program, "program");
        argv = argv == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(argv));
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        stdout = stdout == null ? StreamMode.capture() : stdout;
        stderr = stderr == null ? StreamMode.capture() : stderr;
        timeout = timeout == null ? Optional.empty() : timeout;
    }
}
