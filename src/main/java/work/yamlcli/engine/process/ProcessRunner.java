package work.yamlcli.engine.process;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.yamlcli.engine.argv.ArgvBuilder;
import work.yamlcli.engine.error.CancelledException;
import work.yamlcli.engine.error.ConfigException;
import work.yamlcli.engine.error.ProcessLaunchException;
import work.yamlcli.engine.error.StepTimeoutException;
import work.yamlcli.engine.expr.Scope;
import work.yamlcli.engine.expr.TemplateRenderer;
import work.yamlcli.engine.model.RunSpec;
import work.yamlcli.engine.model.StreamMode;
import work.yamlcli.engine.value.Values;

/**
 * Launches the program of one {@code run} step and waits for it while honouring cancellation and
 * the step's deadline. Captured streams are drained by one reader thread each.
 */
public final class ProcessRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessRunner.class);

    private final TemplateRenderer renderer;
    private final ArgvBuilder argvBuilder;
    private final ProcessSettings settings;

    public ProcessRunner(TemplateRenderer renderer, ProcessSettings settings) {
        this.renderer = renderer;
        this.argvBuilder = new ArgvBuilder(renderer);
        this.settings = settings;
    }

    public StepResult run(
        String stepId,
        RunSpec spec,
        LaunchDefaults defaults,
        Scope scope,
        ProcessTracker tracker,
        Consumer<String> events
    ) {
        var program = resolveProgram(spec.program(), scope);
        var args = argvBuilder.build(spec.argv(), scope);
        var shell = spec.shell() == null ? defaults.shell() : spec.shell();
        var workdir = resolveWorkdir(spec.workdir() != null ? spec.workdir() : defaults.workdir(), scope);

        var builder = new ProcessBuilder(command(program, args, shell)).directory(workdir.toFile());
        applyEnvironment(builder.environment(), defaults, spec, scope);
        builder.redirectOutput(redirect(spec.stdout(), workdir, scope));
        builder.redirectError(redirect(spec.stderr(), workdir, scope));
        builder.redirectInput(Redirect.INHERIT);

        var display = new ArrayList<String>();
        display.add(program);
        display.addAll(args);
        events.accept("[run] " + stepId + ": " + String.join(" ", display));
        LOG.debug("Starting step {}: {} (cwd={}, shell={})", stepId, builder.command(), workdir, shell);

        if (tracker.isCancelled()) {
            throw new CancelledException();
        }
        long started = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new ProcessLaunchException("Failed to start '" + program + "': " + ex.getMessage(), ex);
        }
        tracker.attach(process);
        try {
            var stdout = StreamCollector.start(process.getInputStream(), spec.stdout(), "stdout", stepId, events);
            var stderr = StreamCollector.start(process.getErrorStream(), spec.stderr(), "stderr", stepId, events);
            var timeout = spec.timeout().or(settings::defaultTimeout);
            return await(process, program, timeout, started, tracker, stdout, stderr);
        } finally {
            tracker.detach(process);
        }
    }

    private StepResult await(
        Process process,
        String program,
        Optional<Duration> timeout,
        long started,
        ProcessTracker tracker,
        StreamCollector stdout,
        StreamCollector stderr
    ) {
        long pollMillis = settings.pollInterval().toMillis();
        Long deadline = timeout.map(t -> started + t.toNanos()).orElse(null);
        var known = new LinkedHashSet<ProcessHandle>();
        try {
            while (true) {
                // Readers may outlive the root while orphaned children still hold the pipes.
                boolean running = process.isAlive();
                if (running) {
                    ProcessTrees.track(process, known);
                }
                if (tracker.isCancelled()) {
                    LOG.debug("Cancelling pid {}", process.pid());
                    ProcessTrees.terminate(process, known, settings.terminationGrace());
                    throw new CancelledException(partial(process, started, stdout, stderr));
                }
                long wait = Math.max(1, pollMillis);
                if (deadline != null) {
                    long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                    if (remaining <= 0) {
                        LOG.warn("'{}' exceeded its timeout of {} ms; killing pid {}", program, timeout.get().toMillis(), process.pid());
                        ProcessTrees.kill(process, known, settings.terminationGrace());
                        throw new StepTimeoutException(program, timeout.get(), partial(process, started, stdout, stderr));
                    }
                    wait = Math.max(1, Math.min(wait, remaining));
                }
                if (running) {
                    process.waitFor(wait, TimeUnit.MILLISECONDS);
                } else if (stdout.join(wait) && stderr.join(wait)) {
                    break;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            ProcessTrees.kill(process, known, settings.terminationGrace());
            throw new CancelledException(partial(process, started, stdout, stderr));
        }
        var result = new StepResult(process.exitValue(), stdout.text(), stderr.text(), elapsedMillis(started));
        LOG.debug("pid {} exited with {} after {} ms", process.pid(), result.exitCode(), result.durationMs());
        if (tracker.isCancelled()) {
            throw new CancelledException(result);
        }
        return result;
    }

    // Output drains within one grace period; children we could not reach may keep a pipe open.
    private StepResult partial(Process process, long started, StreamCollector stdout, StreamCollector stderr) {
        long until = System.nanoTime() + settings.terminationGrace().toNanos();
        stdout.joinUntil(until);
        stderr.joinUntil(until);
        int exitCode = process.isAlive() ? -1 : process.exitValue();
        return new StepResult(exitCode, stdout.text(), stderr.text(), elapsedMillis(started));
    }

    private String resolveProgram(Object raw, Scope scope) {
        var program = renderer.renderString(raw, scope);
        if (program.isBlank()) {
            throw new ConfigException("run.program rendered to an empty string");
        }
        var override = settings.programOverrides().get(program);
        return override == null ? program : renderer.renderString(override, scope);
    }

    private Path resolveWorkdir(Object raw, Scope scope) {
        var base = settings.baseDirectory();
        var rendered = raw == null ? "" : renderer.renderString(raw, scope);
        Path workdir;
        try {
            workdir = rendered.isBlank() ? base : base.resolve(rendered).normalize();
        } catch (InvalidPathException ex) {
            throw new ProcessLaunchException("Invalid working directory: " + rendered, ex);
        }
        if (!Files.isDirectory(workdir)) {
            throw new ProcessLaunchException("Working directory does not exist: " + workdir, null);
        }
        return workdir;
    }

    private void applyEnvironment(Map<String, String> target, LaunchDefaults defaults, RunSpec spec, Scope scope) {
        target.clear();
        target.putAll(settings.environment());
        for (var layer : defaults.envLayers()) {
            applyLayer(target, layer, scope);
        }
        applyLayer(target, spec.env(), scope);
    }

    private void applyLayer(Map<String, String> target, Map<String, Object> layer, Scope scope) {
        for (var entry : layer.entrySet()) {
            var value = renderer.render(entry.getValue(), scope);
            if (value == null) {
                target.remove(entry.getKey());
            } else {
                target.put(entry.getKey(), Values.stringify(value));
            }
        }
    }

    private Redirect redirect(StreamMode mode, Path workdir, Scope scope) {
        switch (mode.kind()) {
            case INHERIT:
                return Redirect.INHERIT;
            case FILE:
                var target = workdir.resolve(renderer.renderString(mode.pathTemplate(), scope)).normalize();
                try {
                    if (target.getParent() != null) {
                        Files.createDirectories(target.getParent());
                    }
                } catch (IOException ex) {
                    throw new ProcessLaunchException("Cannot create output directory for " + target, ex);
                }
                return Redirect.to(target.toFile());
            default:
                return Redirect.PIPE;
        }
    }

    static List<String> command(String program, List<String> args, boolean shell) {
        var command = new ArrayList<String>();
        if (!shell) {
            command.add(program);
            command.addAll(args);
            return command;
        }
        var line = new StringBuilder(program);
        for (var arg : args) {
            line.append(' ').append(arg);
        }
        if (File.separatorChar == '\\') {
            command.add("cmd.exe");
            command.add("/c");
        } else {
            command.add("/bin/sh");
            command.add("-c");
        }
        command.add(line.toString());
        return command;
    }

    private static long elapsedMillis(long started) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }

    /**
     * Drains one captured stream on its own thread. Lines are kept only by this collector; a reader
     * still blocked on a pipe held by an unreachable child is abandoned.
     */
    private static final class StreamCollector {
        private static final StreamCollector NONE = new StreamCollector();

        private final List<String> lines = Collections.synchronizedList(new ArrayList<>());
        private final Thread thread;

        private StreamCollector() {
            this.thread = null;
        }

        private StreamCollector(InputStream stream, String label, String stepId, Consumer<String> events) {
            this.thread = new Thread(() -> drain(stream, label, events), "yamlcli-" + stepId + "-" + label);
            this.thread.setDaemon(true);
        }

        static StreamCollector start(InputStream stream, StreamMode mode, String label, String stepId, Consumer<String> events) {
            if (mode.kind() != StreamMode.Kind.CAPTURE) {
                return NONE;
            }
            var collector = new StreamCollector(stream, label, stepId, events);
            collector.thread.start();
            return collector;
        }

        private void drain(InputStream stream, String label, Consumer<String> events) {
            try (var reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                LineSplitter.split(reader, line -> {
                    lines.add(line);
                    events.accept("[" + label + "] " + line);
                });
            } catch (IOException ex) {
                // The pipe closes underneath us when the tree is killed.
                LOG.debug("{} reader stopped: {}", label, ex.getMessage());
            }
        }

        boolean join(long millis) throws InterruptedException {
            if (thread == null) {
                return true;
            }
            thread.join(millis);
            return !thread.isAlive();
        }

        void joinUntil(long deadlineNanos) {
            if (thread == null) {
                return;
            }
            try {
                thread.join(Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime())));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }

        String text() {
            synchronized (lines) {
                return String.join("\n", lines);
            }
        }
    }
}
