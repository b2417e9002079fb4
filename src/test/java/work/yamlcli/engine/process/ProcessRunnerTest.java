package work.yamlcli.engine.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import work.yamlcli.engine.error.CancelledException;
import work.yamlcli.engine.error.ErrorKind;
import work.yamlcli.engine.error.ProcessLaunchException;
import work.yamlcli.engine.error.StepTimeoutException;
import work.yamlcli.engine.expr.ExpressionEvaluator;
import work.yamlcli.engine.expr.Scope;
import work.yamlcli.engine.expr.TemplateRenderer;
import work.yamlcli.engine.model.RunSpec;
import work.yamlcli.engine.model.StreamMode;

@EnabledOnOs({OS.LINUX, OS.MAC})
final class ProcessRunnerTest {
    private static final Duration POLL = Duration.ofMillis(20);
    private static final Duration GRACE = Duration.ofMillis(500);

    @TempDir
    Path workdir;

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final Scope scope = Scope.builder().form(Map.of("name", "demo", "c", "step")).build();

    @Test
    void capturesStdoutAndStderrSeparately() {
        var result = runner().run("s1", sh("printf 'one\\ntwo\\n'; printf 'err\\n' >&2; exit 3"), LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add);

        assertEquals(3, result.exitCode());
        assertEquals("one\ntwo", result.stdout());
        assertEquals("err", result.stderr());
        assertTrue(result.durationMs() >= 0);
        assertTrue(events.get(0).startsWith("[run] s1: sh -c"), events.get(0));
        assertTrue(events.contains("[stdout] one"));
        assertTrue(events.contains("[stdout] two"));
        assertTrue(events.contains("[stderr] err"));
    }

    @Test
    void carriageReturnsSplitProgressOutput() {
        var result = runner().run("p", sh("printf '10%%\\r20%%\\r30%%\\n'"), LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add);
        assertEquals("10%\n20%\n30%", result.stdout());
    }

    @Test
    void environmentLayersApplyInOrder() {
        var stepEnv = new HashMap<String, Object>();
        stepEnv.put("C", "${form.c}");
        stepEnv.put("A", null);
        var spec = new RunSpec("sh", List.of("-c", "printf '%s|%s|%s' \"$A\" \"$B\" \"$C\""), stepEnv, null, null,
            StreamMode.capture(), StreamMode.capture(), Optional.empty());
        var defaults = new LaunchDefaults(List.of(Map.of("A", "app", "B", "app"), Map.of("B", "action")), null, false);

        var result = runner().run("env", spec, defaults, scope, ProcessTracker.NONE, events::add);
        assertEquals("|action|step", result.stdout());
    }

    @Test
    void relativeWorkdirResolvesAgainstBaseDirectory() throws Exception {
        var sub = Files.createDirectories(workdir.resolve("sub"));
        var spec = new RunSpec("sh", List.of("-c", "pwd -P"), Map.of(), "sub", null,
            StreamMode.capture(), StreamMode.capture(), Optional.empty());
        var result = runner().run("wd", spec, LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add);
        assertEquals(sub.toRealPath().toString(), result.stdout());
    }

    @Test
    void launchFailuresAreProcessErrors() {
        var missingDir = new RunSpec("sh", List.of("-c", "true"), Map.of(), "does-not-exist", null,
            StreamMode.capture(), StreamMode.capture(), Optional.empty());
        var error = assertThrows(ProcessLaunchException.class,
            () -> runner().run("a", missingDir, LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add));
        assertEquals(ErrorKind.PROCESS_ERROR, error.kind());

        assertThrows(ProcessLaunchException.class,
            () -> runner().run("b", new RunSpec("definitely-not-a-program-xyz", List.of(), Map.of(), null, null,
                null, null, Optional.empty()), LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add));
    }

    @Test
    void shellModeJoinsProgramAndArguments() {
        var spec = new RunSpec("echo", List.of("$((1+2))"), Map.of(), null, true,
            StreamMode.capture(), StreamMode.capture(), Optional.empty());
        assertEquals("3", runner().run("sh", spec, LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add).stdout());
    }

    @Test
    void programOverridesRemapLogicalNames() {
        var settings = new ProcessSettings(workdir, System.getenv(), Map.of("tool", "sh"), POLL, GRACE, Optional.empty());
        var runner = new ProcessRunner(new TemplateRenderer(new ExpressionEvaluator()), settings);
        var spec = new RunSpec("tool", List.of("-c", "echo over"), Map.of(), null, null,
            StreamMode.capture(), StreamMode.capture(), Optional.empty());
        assertEquals("over", runner.run("o", spec, LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add).stdout());
    }

    @Test
    void fileModeWritesToRenderedPath() throws Exception {
        var spec = new RunSpec("sh", List.of("-c", "echo hello"), Map.of(), null, null,
            StreamMode.parse("file:out/${form.name}.log"), StreamMode.capture(), Optional.empty());
        var result = runner().run("f", spec, LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add);

        assertEquals("", result.stdout());
        assertEquals("hello\n", Files.readString(workdir.resolve("out/demo.log")));
    }

    @Test
    void timeoutKillsProcessAndReportsPartialOutput() {
        var spec = new RunSpec("sh", List.of("-c", "echo started; sleep 5"), Map.of(), null, null,
            StreamMode.capture(), StreamMode.capture(), Optional.of(Duration.ofMillis(300)));
        long started = System.nanoTime();
        var error = assertThrows(StepTimeoutException.class,
            () -> runner().run("t", spec, LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add));

        assertTrue(elapsedMillis(started) < 3_000);
        assertEquals(ErrorKind.TIMEOUT, error.kind());
        assertTrue(error.getMessage().contains("timed out after 300 ms"));
        assertEquals("started", error.partialResult().orElseThrow().stdout());
    }

    @Test
    void defaultTimeoutAppliesWhenStepDeclaresNone() {
        var settings = new ProcessSettings(workdir, System.getenv(), Map.of(), POLL, GRACE, Optional.of(Duration.ofMillis(200)));
        var runner = new ProcessRunner(new TemplateRenderer(new ExpressionEvaluator()), settings);
        assertThrows(StepTimeoutException.class,
            () -> runner.run("t", sh("sleep 5"), LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add));
    }

    @Test
    void cancellationTearsDownTheWholeTree() throws Exception {
        var tracker = new FlagTracker();
        var executor = Executors.newSingleThreadExecutor();
        try {
            var future = executor.submit(() -> runner().run("c", sh("sleep 30 & sleep 30; wait"), LaunchDefaults.NONE, scope, tracker, events::add));
            assertTrue(tracker.attached.await(5, TimeUnit.SECONDS));
            var process = tracker.process.get();
            var tree = awaitDescendants(process, 2);

            long started = System.nanoTime();
            tracker.cancelled.set(true);
            var thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));

            assertInstanceOf(CancelledException.class, thrown.getCause());
            assertTrue(elapsedMillis(started) < POLL.toMillis() + GRACE.toMillis() + 1_500);
            assertFalse(process.isAlive());
            assertNoneAlive(tree);
            assertTrue(tracker.detached.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void cancellationEscalatesWhenTermIsIgnored() throws Exception {
        var tracker = new FlagTracker();
        var executor = Executors.newSingleThreadExecutor();
        try {
            var future = executor.submit(() -> runner().run("c", sh("trap '' TERM; sleep 30"), LaunchDefaults.NONE, scope, tracker, events::add));
            assertTrue(tracker.attached.await(5, TimeUnit.SECONDS));
            var process = tracker.process.get();
            var tree = awaitDescendants(process, 1);

            tracker.cancelled.set(true);
            var thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(CancelledException.class, thrown.getCause());
            assertFalse(process.isAlive());
            assertNoneAlive(tree);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void timeoutStillAppliesWhileABackgroundChildHoldsTheOutput() {
        var spec = new RunSpec("sh", List.of("-c", "sleep 6 &"), Map.of(), null, null,
            StreamMode.capture(), StreamMode.capture(), Optional.of(Duration.ofMillis(300)));
        long started = System.nanoTime();
        assertThrows(StepTimeoutException.class,
            () -> runner().run("t", spec, LaunchDefaults.NONE, scope, ProcessTracker.NONE, events::add));
        assertTrue(elapsedMillis(started) < 300 + POLL.toMillis() + 2 * GRACE.toMillis() + 1_000);
    }

    @Test
    void timeoutKillsChildrenOrphanedByTheRoot() throws Exception {
        var tracker = new FlagTracker();
        var spec = new RunSpec("sh", List.of("-c", "sleep 6 & sleep 0.3"), Map.of(), null, null,
            StreamMode.capture(), StreamMode.capture(), Optional.of(Duration.ofMillis(900)));
        var executor = Executors.newSingleThreadExecutor();
        try {
            var future = executor.submit(() -> runner().run("t", spec, LaunchDefaults.NONE, scope, tracker, events::add));
            assertTrue(tracker.attached.await(5, TimeUnit.SECONDS));
            var tree = awaitDescendants(tracker.process.get(), 2);

            var thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(StepTimeoutException.class, thrown.getCause());
            assertNoneAlive(tree);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void cancellationReachesChildrenAfterTheRootExited() throws Exception {
        var tracker = new FlagTracker();
        var executor = Executors.newSingleThreadExecutor();
        try {
            var future = executor.submit(() -> runner().run("c", sh("sleep 7 & sleep 0.3"), LaunchDefaults.NONE, scope, tracker, events::add));
            assertTrue(tracker.attached.await(5, TimeUnit.SECONDS));
            var process = tracker.process.get();
            var tree = awaitDescendants(process, 2);
            assertTrue(process.waitFor(5, TimeUnit.SECONDS));
            assertFalse(future.isDone());

            long started = System.nanoTime();
            tracker.cancelled.set(true);
            var thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));

            assertInstanceOf(CancelledException.class, thrown.getCause());
            assertTrue(elapsedMillis(started) < POLL.toMillis() + GRACE.toMillis() + 1_500);
            assertNoneAlive(tree);
        } finally {
            executor.shutdownNow();
        }
    }

    private ProcessRunner runner() {
        var settings = new ProcessSettings(workdir, System.getenv(), Map.of(), POLL, GRACE, Optional.empty());
        return new ProcessRunner(new TemplateRenderer(new ExpressionEvaluator()), settings);
    }

    private static RunSpec sh(String script) {
        return new RunSpec("sh", List.of("-c", script), Map.of(), null, null,
            StreamMode.capture(), StreamMode.capture(), Optional.empty());
    }

    private static List<ProcessHandle> awaitDescendants(Process process, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        List<ProcessHandle> tree = new ArrayList<>();
        while (System.nanoTime() < deadline) {
            tree = new ArrayList<>();
            process.descendants().forEach(tree::add);
            if (tree.size() >= expected) {
                return tree;
            }
            Thread.sleep(20);
        }
        return tree;
    }

    private static void assertNoneAlive(List<ProcessHandle> handles) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (handles.stream().anyMatch(ProcessRunnerTest::running) && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(handles.stream().noneMatch(ProcessRunnerTest::running), "descendants still alive: " + handles);
    }

    // Orphaned zombies keep a pid until init reaps them but have no command line any more.
    private static boolean running(ProcessHandle handle) {
        return handle.isAlive() && handle.info().commandLine().isPresent();
    }

    private static long elapsedMillis(long started) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }

    private static final class FlagTracker implements ProcessTracker {
        final AtomicBoolean cancelled = new AtomicBoolean();
        final AtomicBoolean detached = new AtomicBoolean();
        final AtomicReference<Process> process = new AtomicReference<>();
        final CountDownLatch attached = new CountDownLatch(1);

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }

        @Override
        public void attach(Process p) {
            process.set(p);
            attached.countDown();
        }

        @Override
        public void detach(Process p) {
            detached.set(true);
        }
    }
}
