package work.yamlcli.engine.error;

/**
 * Malformed expression or template text.
 */
public final class ExpressionSyntaxException extends EngineException {
    public ExpressionSyntaxException(String message) {
        super(ErrorKind.SYNTAX, message);
    }
}
