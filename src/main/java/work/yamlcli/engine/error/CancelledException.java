package work.yamlcli.engine.error;

import work.yamlcli.engine.process.StepResult;

/**
 * The action was stopped by the user. Its process trees have been torn down.
 */
public final class CancelledException extends EngineException {
    public static final String MESSAGE = "Action was stopped by user";

    public CancelledException() {
        this(null);
    }

    public CancelledException(StepResult partial) {
        super(ErrorKind.CANCELLED, MESSAGE, null, partial, null);
    }
}
