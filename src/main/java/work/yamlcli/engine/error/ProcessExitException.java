package work.yamlcli.engine.error;

import work.yamlcli.engine.process.StepResult;

public final class ProcessExitException extends EngineException {
    private final int exitCode;

    public ProcessExitException(String stepId, StepResult result) {
        super(ErrorKind.PROCESS_EXIT, "Step " + stepId + " failed with exit code " + result.exitCode(), stepId, result, null);
        this.exitCode = result.exitCode();
    }

    public int exitCode() {
        return exitCode;
    }
}
