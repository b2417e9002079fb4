package work.yamlcli.engine.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import work.yamlcli.engine.process.ProcessTracker;
import work.yamlcli.engine.process.ProcessTrees;

/**
 * Cancellation token of one action invocation: a settable flag plus the processes it currently has
 * running. Obtained from {@link RunRegistry#acquire(String)} and returned with
 * {@link RunRegistry#release(RunHandle)}.
 */
public final class RunHandle implements ProcessTracker {
    private final String actionId;
    private final Set<Process> processes = new LinkedHashSet<>();
    private volatile boolean cancelled;

    RunHandle(String actionId, boolean cancelled) {
        this.actionId = actionId;
        this.cancelled = cancelled;
    }

    public String actionId() {
        return actionId;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void attach(Process process) {
        synchronized (processes) {
            processes.add(process);
        }
    }

    @Override
    public void detach(Process process) {
        synchronized (processes) {
            processes.remove(process);
        }
    }

    public int liveProcessCount() {
        synchronized (processes) {
            return (int) processes.stream().filter(Process::isAlive).count();
        }
    }

    void cancel() {
        cancelled = true;
    }

    /**
     * Kills attached process trees directly. Used when no runner is polling them any more.
     */
    void killAttached(Duration grace) {
        ArrayList<Process> snapshot;
        synchronized (processes) {
            snapshot = new ArrayList<>(processes);
        }
        for (var process : snapshot) {
            if (process.isAlive()) {
                ProcessTrees.kill(process, grace);
            }
        }
    }

    void resetForRecovery() {
        cancelled = false;
    }
}
