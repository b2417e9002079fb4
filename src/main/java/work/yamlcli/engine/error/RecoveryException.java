package work.yamlcli.engine.error;

/**
 * The primary pipeline failed and so did its {@code on_error} recovery pipeline. Both contexts are
 * kept: the primary failure is the cause, the recovery failure is attached as suppressed.
 */
public final class RecoveryException extends EngineException {
    private final ErrorContext primary;
    private final ErrorContext recovery;

    public RecoveryException(String actionId, EngineException primaryError, EngineException recoveryError) {
        super(ErrorKind.RECOVERY, message(actionId, primaryError.toContext(), recoveryError.toContext()), recoveryError.stepId(), null, primaryError);
        this.primary = primaryError.toContext();
        this.recovery = recoveryError.toContext();
        addSuppressed(recoveryError);
    }

    public ErrorContext primary() {
        return primary;
    }

    public ErrorContext recovery() {
        return recovery;
    }

    private static String message(String actionId, ErrorContext primary, ErrorContext recovery) {
        return "Action " + actionId + " failed at " + primary.describe()
            + "; recovery pipeline failed at " + recovery.describe();
    }
}
