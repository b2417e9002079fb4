package work.yamlcli.engine.process;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tears down a process together with every descendant it spawned.
 *
 * <p>Descendants are only reachable through their parents. Callers that outlive the root keep the
 * handles seen by {@link #track} so children orphaned by an exited root can still be stopped.
 */
public final class ProcessTrees {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessTrees.class);
    private static final long CHECK_INTERVAL_MS = 20;

    private ProcessTrees() {}

    public static void track(Process process, Set<ProcessHandle> known) {
        known.add(process.toHandle());
        process.descendants().forEach(known::add);
    }

    /**
     * Asks the whole tree to stop, then forcibly kills whatever is still alive after {@code grace}.
     */
    public static void terminate(Process process, Set<ProcessHandle> known, Duration grace) {
        var tree = snapshot(process, known);
        for (var handle : tree) {
            handle.destroy();
        }
        if (awaitExit(tree, grace)) {
            return;
        }
        var survivors = tree.stream().filter(ProcessHandle::isAlive).collect(Collectors.toList());
        LOG.warn("Process tree of pid {} ignored graceful termination; killing {} process(es)", process.pid(), survivors.size());
        for (var handle : survivors) {
            handle.destroyForcibly();
        }
        awaitExit(survivors, grace);
    }

    public static void kill(Process process, Duration grace) {
        kill(process, Set.of(), grace);
    }

    public static void kill(Process process, Set<ProcessHandle> known, Duration grace) {
        var tree = snapshot(process, known);
        for (var handle : tree) {
            handle.destroyForcibly();
        }
        awaitExit(tree, grace);
    }

    // Descendants first, the root last, all collected before anything is signalled.
    private static List<ProcessHandle> snapshot(Process process, Set<ProcessHandle> known) {
        var tree = new LinkedHashSet<ProcessHandle>();
        process.descendants().forEach(tree::add);
        for (var handle : known) {
            if (handle.isAlive()) {
                handle.descendants().forEach(tree::add);
                tree.add(handle);
            }
        }
        tree.remove(process.toHandle());
        var ordered = new ArrayList<>(tree);
        ordered.add(process.toHandle());
        return ordered;
    }

    private static boolean awaitExit(List<ProcessHandle> handles, Duration grace) {
        long deadline = System.nanoTime() + grace.toNanos();
        while (true) {
            if (handles.stream().noneMatch(ProcessHandle::isAlive)) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(CHECK_INTERVAL_MS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
