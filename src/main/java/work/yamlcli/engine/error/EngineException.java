package work.yamlcli.engine.error;

import java.util.Optional;
import work.yamlcli.engine.process.StepResult;

/**
 * Base class for every failure raised by the engine. Carries the error kind, the id of the
 * step that failed (attached once, at the innermost step) and an optional partial result.
 */
public class EngineException extends RuntimeException {
    private final ErrorKind kind;
    private volatile String stepId;
    private final StepResult partialResult;

    public EngineException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public EngineException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    protected EngineException(ErrorKind kind, String message, String stepId, StepResult partialResult, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stepId = stepId;
        this.partialResult = partialResult;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String stepId() {
        return stepId;
    }

    public EngineException attachStep(String id) {
        if (this.stepId == null && id != null) {
            this.stepId = id;
        }
        return this;
    }

    public Optional<StepResult> partialResult() {
        return Optional.ofNullable(partialResult);
    }

    public ErrorContext toContext() {
        return new ErrorContext(stepId, kind.code(), getMessage());
    }
}
