package work.yamlcli.engine.flow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.yamlcli.engine.error.CancelledException;
import work.yamlcli.engine.error.ConfigException;
import work.yamlcli.engine.error.EngineException;
import work.yamlcli.engine.error.EvaluationException;
import work.yamlcli.engine.error.ProcessExitException;
import work.yamlcli.engine.expr.Scope;
import work.yamlcli.engine.expr.TemplateRenderer;
import work.yamlcli.engine.model.StepDef;
import work.yamlcli.engine.process.ProcessRunner;
import work.yamlcli.engine.process.StepResult;
import work.yamlcli.engine.value.Values;

/**
 * Walks a step tree in declaration order. Guards are evaluated against a scope rebuilt before every
 * step; failures propagate unless the failing step opted into {@code continue_on_error}.
 *
 * <p>Inside a {@code foreach} every recorded key gets an {@code [index]} suffix per loop level, so
 * iterations never overwrite each other. Within an iteration the plain id still resolves to the
 * current iteration's result.
 */
public final class PipelineInterpreter {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineInterpreter.class);

    private final TemplateRenderer renderer;
    private final ProcessRunner runner;

    public PipelineInterpreter(TemplateRenderer renderer, ProcessRunner runner) {
        this.renderer = renderer;
        this.runner = runner;
    }

    public void execute(List<StepDef> steps, ExecutionFrame frame) {
        runSteps(steps, frame, Iteration.ROOT);
    }

    private void runSteps(List<StepDef> steps, ExecutionFrame frame, Iteration iteration) {
        for (var step : steps) {
            int position = frame.visit();
            var id = step.id() == null ? "step_" + position : step.id();
            var local = id + iteration.suffix();
            var key = frame.resultKey(local);
            if (frame.tracker().isCancelled()) {
                var cancelled = new CancelledException();
                cancelled.attachStep(key);
                throw cancelled;
            }
            try {
                var scope = scopeFor(frame, iteration);
                if (!renderer.evaluateGuard(step.when(), scope)) {
                    frame.emit("[skip] " + key + " (when=false)");
                    continue;
                }
                dispatch(step, local, key, scope, frame, iteration);
            } catch (EngineException ex) {
                ex.attachStep(key);
                if (!step.continueOnError() || ex instanceof ConfigException) {
                    throw ex;
                }
                LOG.warn("Step {} failed and continues: {}", key, ex.getMessage());
                frame.emit("[warn] " + key + ": " + ex.getMessage());
            }
        }
    }

    private void dispatch(StepDef step, String local, String key, Scope scope, ExecutionFrame frame, Iteration iteration) {
        if (step instanceof StepDef.RunStep run) {
            runStep(run, local, key, scope, frame, iteration);
        } else if (step instanceof StepDef.PipelineStep pipeline) {
            LOG.debug("Entering pipeline {}", key);
            runSteps(pipeline.steps(), frame, iteration);
        } else if (step instanceof StepDef.ForeachStep foreach) {
            runForeach(foreach, key, scope, frame, iteration);
        } else {
            throw new ConfigException("Unknown step type in " + key);
        }
    }

    private void runStep(StepDef.RunStep step, String local, String key, Scope scope, ExecutionFrame frame, Iteration iteration) {
        // Before launch, not at load time: ids under exclusive guards may repeat.
        frame.requireUnused(local);
        StepResult result;
        try {
            result = runner.run(key, step.run(), frame.defaults(), scope, frame.tracker(), frame::emit);
        } catch (EngineException ex) {
            ex.partialResult().ifPresent(partial -> record(frame, iteration, local, step.id(), partial));
            throw ex;
        }
        record(frame, iteration, local, step.id(), result);
        if (!result.succeeded() && !step.continueOnError()) {
            throw new ProcessExitException(key, result);
        }
    }

    private void runForeach(StepDef.ForeachStep step, String key, Scope scope, ExecutionFrame frame, Iteration iteration) {
        var source = step.in();
        var items = source instanceof String text && !TemplateRenderer.containsPlaceholder(text)
            ? renderer.evaluator().evaluate(text, scope)
            : renderer.render(source, scope);
        if (!(items instanceof List<?> list)) {
            throw new EvaluationException("foreach.in of " + key + " must evaluate to a list, got " + Values.typeName(items));
        }
        LOG.debug("foreach {} over {} item(s)", key, list.size());
        for (int index = 0; index < list.size(); index++) {
            var bindings = new LinkedHashMap<>(iteration.bindings());
            bindings.put(step.alias(), list.get(index));
            bindings.put(Scope.LOOP, Map.of("index", (long) index));
            var child = new Iteration(bindings, iteration.suffix() + "[" + index + "]", new LinkedHashMap<>(iteration.local()));
            runSteps(step.steps(), frame, child);
        }
    }

    private static void record(ExecutionFrame frame, Iteration iteration, String local, String declaredId, StepResult result) {
        frame.record(local, result);
        if (!iteration.suffix().isEmpty() && declaredId != null) {
            iteration.local().put(declaredId, result.toMap());
        }
    }

    private static Scope scopeFor(ExecutionFrame frame, Iteration iteration) {
        return frame.baseScope().toBuilder()
            .steps(frame.visibleSteps(iteration.local()))
            .bindAll(iteration.bindings())
            .build();
    }

    /**
     * Loop bindings active for the steps being walked, the key suffix they imply and the results
     * recorded in the current iteration under their plain ids.
     */
    private record Iteration(Map<String, Object> bindings, String suffix, Map<String, Object> local) {
        static final Iteration ROOT = new Iteration(Map.of(), "", Map.of());
    }
}
