package work.yamlcli.engine.error;

import java.time.Duration;
import work.yamlcli.engine.process.StepResult;

public final class StepTimeoutException extends EngineException {
    private final Duration timeout;

    public StepTimeoutException(String program, Duration timeout, StepResult partial) {
        super(ErrorKind.TIMEOUT, "Command '" + program + "' timed out after " + timeout.toMillis() + " ms", null, partial, null);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
