package work.yamlcli.engine.process;

/**
 * Cancellation view handed to the runner for one action invocation. Spawned processes are attached
 * so a stop request can tear them down from another thread.
 */
public interface ProcessTracker {
    boolean isCancelled();

    void attach(Process process);

    void detach(Process process);

    ProcessTracker NONE = new ProcessTracker() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public void attach(Process process) {}

        @Override
        public void detach(Process process) {}
    };
}
