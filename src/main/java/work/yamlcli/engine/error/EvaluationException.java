package work.yamlcli.engine.error;

/**
 * Raised for unresolved names, type mismatches and constructs outside the expression whitelist.
 */
public final class EvaluationException extends EngineException {
    public EvaluationException(String message) {
        super(ErrorKind.EVALUATION, message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(ErrorKind.EVALUATION, message, cause);
    }
}
