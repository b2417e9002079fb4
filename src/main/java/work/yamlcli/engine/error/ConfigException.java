package work.yamlcli.engine.error;

/**
 * Structurally invalid workflow, action or step. Never downgraded by {@code continue_on_error}.
 */
public final class ConfigException extends EngineException {
    public ConfigException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }
}
