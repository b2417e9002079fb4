package work.yamlcli.engine.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.yamlcli.engine.error.ConfigException;
import work.yamlcli.engine.shared.DurationParser;

/**
 * Optional TOML file with launcher defaults:
 *
 * <pre>
 * [launcher]
 * default_workflow = "workflows/tools.yaml"
 * log_level = "info"
 * poll_interval = "50ms"
 * termination_grace = "2s"
 * default_timeout = "10m"
 *
 * [runtime.python]
 * executable = "venv/bin/python"
 * </pre>
 *
 * Relative paths resolve against the directory holding the settings file.
 */
record LaunchSettings(
    Optional<Path> defaultWorkflow,
    Optional<String> logLevel,
    Optional<Duration> pollInterval,
    Optional<Duration> terminationGrace,
    Optional<Duration> defaultTimeout,
    Map<String, String> runtimeExecutables
) {
    static final LaunchSettings EMPTY = new LaunchSettings(
        Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Map.of()
    );

    LaunchSettings {
        runtimeExecutables = Collections.unmodifiableMap(new LinkedHashMap<>(runtimeExecutables));
    }

    static LaunchSettings load(Path file) {
        var path = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Settings file not found: " + path);
        }
        TomlParseResult toml;
        try {
            toml = Toml.parse(path);
        } catch (IOException ex) {
            throw new ConfigException("Failed to read settings " + path + ": " + ex.getMessage(), ex);
        }
        if (toml.hasErrors()) {
            var problems = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ConfigException("Invalid settings " + path + ": " + problems);
        }
        var base = path.getParent();
        var runtime = new LinkedHashMap<String, String>();
        var runtimeTable = toml.getTable("runtime");
        if (runtimeTable != null) {
            for (var name : runtimeTable.keySet()) {
                var entry = runtimeTable.getTable(name);
                var executable = entry == null ? null : entry.getString("executable");
                if (executable != null && !executable.isBlank()) {
                    runtime.put(name, resolveExecutable(base, executable));
                }
            }
        }
        return new LaunchSettings(
            Optional.ofNullable(toml.getString("launcher.default_workflow")).map(value -> base.resolve(value).normalize()),
            Optional.ofNullable(toml.getString("launcher.log_level")),
            duration(toml, "launcher.poll_interval"),
            duration(toml, "launcher.termination_grace"),
            duration(toml, "launcher.default_timeout"),
            runtime
        );
    }

    private static Optional<Duration> duration(TomlParseResult toml, String key) {
        try {
            return DurationParser.fromValue(toml.get(key));
        } catch (IllegalArgumentException ex) {
            throw new ConfigException("Invalid " + key + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Bare command names stay as they are so PATH lookup still applies.
     */
    private static String resolveExecutable(Path base, String executable) {
        if (executable.indexOf('/') < 0 && executable.indexOf('\\') < 0) {
            return executable;
        }
        var candidate = Path.of(executable);
        return candidate.isAbsolute() ? executable : base.resolve(candidate).normalize().toString();
    }
}
