package work.yamlcli.engine.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide cancellation state keyed by action id. Every invocation of an action holds a
 * {@link RunHandle}; {@link #stop(String)} cancels all of them. A stop stays pending until the
 * action's last active run has released its handle, so runs that start while the stop propagates
 * are cancelled too.
 */
public final class RunRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(RunRegistry.class);

    private final Map<String, ActionRuns> actions = new HashMap<>();

    public synchronized RunHandle acquire(String actionId) {
        var runs = actions.computeIfAbsent(actionId, id -> new ActionRuns());
        var handle = new RunHandle(actionId, runs.stopPending);
        runs.handles.add(handle);
        LOG.debug("Run acquired for action {} (active={}, stopPending={})", actionId, runs.handles.size(), runs.stopPending);
        return handle;
    }

    public synchronized void release(RunHandle handle) {
        var runs = actions.get(handle.actionId());
        if (runs == null || !runs.handles.remove(handle)) {
            return;
        }
        if (runs.handles.isEmpty()) {
            actions.remove(handle.actionId());
            LOG.debug("Last run of action {} released", handle.actionId());
        }
    }

    /**
     * Requests cancellation of every active run of the action. Returns the number of runs signalled;
     * zero means nothing was running and no stop stays pending.
     */
    public synchronized int stop(String actionId) {
        var runs = actions.get(actionId);
        if (runs == null || runs.handles.isEmpty()) {
            LOG.debug("Stop requested for idle action {}", actionId);
            return 0;
        }
        runs.stopPending = true;
        for (var handle : runs.handles) {
            handle.cancel();
        }
        LOG.info("Stop requested for action {} ({} active run(s))", actionId, runs.handles.size());
        return runs.handles.size();
    }

    /**
     * Stops the action and kills any process tree still attached, without waiting for the runners'
     * next poll. Used on JVM shutdown.
     */
    public void stopNow(String actionId, Duration grace) {
        List<RunHandle> handles;
        synchronized (this) {
            stop(actionId);
            var runs = actions.get(actionId);
            handles = runs == null ? List.of() : new ArrayList<>(runs.handles);
        }
        for (var handle : handles) {
            handle.killAttached(grace);
        }
    }

    public synchronized boolean isCancelled(String actionId) {
        var runs = actions.get(actionId);
        return runs != null && runs.stopPending;
    }

    public synchronized int activeRuns(String actionId) {
        var runs = actions.get(actionId);
        return runs == null ? 0 : runs.handles.size();
    }

    /**
     * Re-arms a cancelled handle for its recovery pipeline. The action's pending stop is lifted only
     * when no other run of it is still being cancelled.
     */
    public synchronized void prepareRecovery(RunHandle handle) {
        handle.resetForRecovery();
        var runs = actions.get(handle.actionId());
        if (runs != null && runs.handles.stream().allMatch(h -> h == handle || !h.isCancelled())) {
            runs.stopPending = false;
        }
    }

    private static final class ActionRuns {
        private final List<RunHandle> handles = new ArrayList<>();
        private boolean stopPending;
    }
}
