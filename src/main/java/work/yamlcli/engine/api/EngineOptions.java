package work.yamlcli.engine.api;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings of a {@link WorkflowEngine}.
 */
public record EngineOptions(
    Path workingDirectory,
    Map<String, String> processEnvironment,
    Map<String, String> programOverrides,
    Duration pollInterval,
    Duration terminationGrace,
    Optional<Duration> defaultTimeout
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_TERMINATION_GRACE = Duration.ofSeconds(1);

    public EngineOptions {
        workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory").toAbsolutePath().normalize();
        processEnvironment = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(processEnvironment, "processEnvironment")));
        programOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(programOverrides, "programOverrides")));
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(terminationGrace, "terminationGrace");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
    }

    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .workingDirectory(workingDirectory)
            .processEnvironment(processEnvironment)
            .programOverrides(programOverrides)
            .pollInterval(pollInterval)
            .terminationGrace(terminationGrace)
            .defaultTimeout(defaultTimeout);
    }

    public static final class Builder {
        private Path workingDirectory;
        private Map<String, String> processEnvironment;
        private Map<String, String> programOverrides = Map.of();
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration terminationGrace = DEFAULT_TERMINATION_GRACE;
        private Optional<Duration> defaultTimeout = Optional.empty();

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder processEnvironment(Map<String, String> processEnvironment) {
            this.processEnvironment = processEnvironment;
            return this;
        }

        public Builder programOverrides(Map<String, String> programOverrides) {
            this.programOverrides = programOverrides;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder terminationGrace(Duration terminationGrace) {
            this.terminationGrace = terminationGrace;
            return this;
        }

        public Builder defaultTimeout(Optional<Duration> defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(
                workingDirectory == null ? Paths.get("") : workingDirectory,
                processEnvironment == null ? System.getenv() : processEnvironment,
                programOverrides,
                pollInterval,
                terminationGrace,
                defaultTimeout
            );
        }
    }
}
