package work.yamlcli.engine.error;

/**
 * Machine-readable failure categories surfaced in {@code _meta.error.type} and recovery scopes.
 */
public enum ErrorKind {
    SYNTAX("syntax"),
    EVALUATION("evaluation"),
    CONFIG("config"),
    PROCESS_EXIT("process_exit"),
    PROCESS_ERROR("process_error"),
    TIMEOUT("timeout"),
    CANCELLED("cancelled"),
    RECOVERY("recovery");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
