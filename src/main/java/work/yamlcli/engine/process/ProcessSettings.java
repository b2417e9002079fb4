package work.yamlcli.engine.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Engine-wide launch settings shared by every {@code run} step.
 *
 * @param baseDirectory directory relative working directories resolve against
 * @param environment base environment every child starts from
 * @param programOverrides logical program name to executable template
 * @param pollInterval how often a running child is checked for exit, cancellation and timeout
 * @param terminationGrace how long a cancelled tree may take to exit before it is killed
 * @param defaultTimeout applied to steps that declare no timeout
 */
public record ProcessSettings(
    Path baseDirectory,
    Map<String, String> environment,
    Map<String, String> programOverrides,
    Duration pollInterval,
    Duration terminationGrace,
    Optional<Duration> defaultTimeout
) {
    public ProcessSettings {
        baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
        environment = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(environment, "environment")));
        programOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(programOverrides, "programOverrides")));
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(terminationGrace, "terminationGrace");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (terminationGrace.isNegative()) {
            throw new IllegalArgumentException("terminationGrace must not be negative");
        }
        defaultTimeout = defaultTimeout == null ? Optional.empty() : defaultTimeout;
    }
}
