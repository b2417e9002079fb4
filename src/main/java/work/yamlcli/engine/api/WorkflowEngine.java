package work.yamlcli.engine.api;

import java.io.File;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.yamlcli.engine.error.CancelledException;
import work.yamlcli.engine.error.ConfigException;
import work.yamlcli.engine.error.EngineException;
import work.yamlcli.engine.error.RecoveryException;
import work.yamlcli.engine.expr.ExpressionEvaluator;
import work.yamlcli.engine.expr.Scope;
import work.yamlcli.engine.expr.TemplateRenderer;
import work.yamlcli.engine.flow.ExecutionFrame;
import work.yamlcli.engine.flow.PipelineInterpreter;
import work.yamlcli.engine.model.ActionDef;
import work.yamlcli.engine.model.WorkflowConfig;
import work.yamlcli.engine.process.LaunchDefaults;
import work.yamlcli.engine.process.ProcessRunner;
import work.yamlcli.engine.process.ProcessSettings;
import work.yamlcli.engine.runtime.RunHandle;
import work.yamlcli.engine.runtime.RunRegistry;

/**
 * Entry point for callers: resolves an action's variables, runs an action to completion and stops
 * running actions. One engine serves one loaded workflow; any number of threads may call
 * {@link #run} concurrently.
 */
public final class WorkflowEngine {
    private static final Logger LOG = LoggerFactory.getLogger(WorkflowEngine.class);
    private static final RunRegistry SHARED_REGISTRY = new RunRegistry();

    private final WorkflowConfig config;
    private final EngineOptions options;
    private final RunRegistry registry;
    private final TemplateRenderer renderer;
    private final PipelineInterpreter interpreter;

    public WorkflowEngine(WorkflowConfig config) {
        this(config, EngineOptions.defaults());
    }

    public WorkflowEngine(WorkflowConfig config, EngineOptions options) {
        this(config, options, SHARED_REGISTRY);
    }

    public WorkflowEngine(WorkflowConfig config, EngineOptions options, RunRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.options = Objects.requireNonNull(options, "options");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.renderer = new TemplateRenderer(new ExpressionEvaluator(options.workingDirectory()));
        var overrides = new LinkedHashMap<>(options.programOverrides());
        overrides.putAll(config.runtimeExecutables());
        var settings = new ProcessSettings(
            options.workingDirectory(),
            options.processEnvironment(),
            overrides,
            options.pollInterval(),
            options.terminationGrace(),
            options.defaultTimeout()
        );
        this.interpreter = new PipelineInterpreter(renderer, new ProcessRunner(renderer, settings));
    }

    public WorkflowConfig config() {
        return config;
    }

    public EngineOptions options() {
        return options;
    }

    public List<String> actionIds() {
        return config.actionIds();
    }

    public Optional<ActionDef> action(String actionId) {
        return config.action(actionId);
    }

    /**
     * Computes the action's variables for display without running anything.
     */
    public Map<String, Object> resolve(String actionId, Map<String, Object> form) {
        requireAction(actionId);
        return resolveVars(form);
    }

    public RunResult run(String actionId, Map<String, Object> form) {
        return run(actionId, form, line -> {});
    }

    /**
     * Runs the action on the calling thread.
     *
     * @param logger receives one line per skip, run, output, warning and recovery event; it may be
     *     called from the step's output reader threads, but never concurrently
     * @throws EngineException when the action fails and is not recovered
     */
    public RunResult run(String actionId, Map<String, Object> form, Consumer<String> logger) {
        var action = requireAction(actionId);
        var events = serialized(logger);
        var handle = registry.acquire(actionId);
        LOG.info("Action {} started", actionId);
        try {
            var base = baseScope(form).vars(resolveVars(form)).build();
            var defaults = new LaunchDefaults(List.of(config.app().env(), action.env()), config.app().workdir(), config.app().shell());
            var primary = new ExecutionFrame(base, handle, defaults, events);
            try {
                interpreter.execute(action.pipeline(), primary);
            } catch (EngineException ex) {
                if (action.recoveryPipeline().isEmpty()) {
                    LOG.info("Action {} failed: {}", actionId, ex.getMessage());
                    throw ex;
                }
                return recover(action, ex, primary, base, handle, events);
            }
            LOG.info("Action {} finished", actionId);
            return RunResult.success(primary.results());
        } finally {
            registry.release(handle);
        }
    }

    /**
     * Requests a cooperative stop of every active run of the action. Returns without waiting; the
     * runs end with a cancellation error (or their recovery result) shortly after.
     */
    public void stop(String actionId) {
        registry.stop(actionId);
    }

    public RunRegistry registry() {
        return registry;
    }

    private RunResult recover(ActionDef action, EngineException primaryError, ExecutionFrame primary, Scope base, RunHandle handle, Consumer<String> events) {
        var error = primaryError.toContext();
        LOG.warn("Action {} failed at {}; running on_error pipeline", action.id(), error.describe());
        events.accept("[on_error] " + error.describe());
        if (primaryError instanceof CancelledException) {
            // A stop that lands after any other failure still applies to the recovery pipeline.
            registry.prepareRecovery(handle);
        }
        var recovery = primary.recovery(base.toBuilder().error(error.toMap()).build());
        try {
            interpreter.execute(action.onError(), recovery);
        } catch (EngineException recoveryError) {
            var combined = new RecoveryException(action.id(), primaryError, recoveryError);
            LOG.error("{}", combined.getMessage());
            throw combined;
        }
        var steps = new LinkedHashMap<>(primary.results());
        steps.putAll(recovery.results());
        LOG.info("Action {} recovered", action.id());
        return RunResult.recovered(steps, error);
    }

    private ActionDef requireAction(String actionId) {
        return config.action(actionId)
            .orElseThrow(() -> new ConfigException("Unknown action: " + actionId));
    }

    private Map<String, Object> resolveVars(Map<String, Object> form) {
        var base = baseScope(form);
        var resolved = new LinkedHashMap<String, Object>();
        for (var entry : config.vars().entrySet()) {
            var scope = base.vars(resolved).build();
            resolved.put(entry.getKey(), renderer.render(entry.getValue(), scope));
        }
        return Collections.unmodifiableMap(resolved);
    }

    private Scope.Builder baseScope(Map<String, Object> form) {
        return Scope.builder()
            .vars(Map.of())
            .form(form == null ? Map.of() : form)
            .env(options.processEnvironment())
            .steps(Map.of())
            .cwd(options.workingDirectory().toString())
            .home(System.getProperty("user.home"))
            .temp(System.getProperty("java.io.tmpdir"))
            .os(File.separatorChar == '\\' ? "nt" : "posix");
    }

    private static Consumer<String> serialized(Consumer<String> logger) {
        if (logger == null) {
            return line -> {};
        }
        var lock = new Object();
        return line -> {
            synchronized (lock) {
                logger.accept(line);
            }
        };
    }
}
