package work.yamlcli.engine.model;

import java.util.List;

/**
 * One node of a pipeline. Every kind carries an optional id, an optional {@code when} guard and the
 * {@code continue_on_error} flag.
 */
public interface StepDef {
    /** Declared id, or {@code null} when the interpreter should assign a positional one. */
    String id();

    /** Guard expression or template; {@code null} means always run. */
    Object when();

    boolean continueOnError();

    record RunStep(String id, Object when, boolean continueOnError, RunSpec run) implements StepDef {}

    record PipelineStep(String id, Object when, boolean continueOnError, List<StepDef> steps) implements StepDef {
        public PipelineStep {
            steps = List.copyOf(steps);
        }
    }

    record ForeachStep(String id, Object when, boolean continueOnError, Object in, String alias, List<StepDef> steps) implements StepDef {
        public ForeachStep {
            steps = List.copyOf(steps);
        }
    }
}
