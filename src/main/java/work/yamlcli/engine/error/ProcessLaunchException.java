package work.yamlcli.engine.error;

/**
 * The program could not be started (missing executable, bad working directory, I/O failure).
 */
public final class ProcessLaunchException extends EngineException {
    public ProcessLaunchException(String message, Throwable cause) {
        super(ErrorKind.PROCESS_ERROR, message, cause);
    }
}
