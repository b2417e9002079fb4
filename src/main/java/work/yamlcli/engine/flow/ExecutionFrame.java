package work.yamlcli.engine.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import work.yamlcli.engine.error.ConfigException;
import work.yamlcli.engine.expr.Scope;
import work.yamlcli.engine.process.LaunchDefaults;
import work.yamlcli.engine.process.ProcessTracker;
import work.yamlcli.engine.process.StepResult;

/**
 * Mutable state of one pipeline walk: the base scope, the results recorded so far and the
 * cancellation tracker.
 *
 * <p>A recovery pipeline gets its own frame. Its results are keyed {@code on_error.<id>} and read
 * back as {@code step.on_error.<id>}, while the primary results stay readable as {@code step.<id>}.
 * Recovery steps may therefore reuse primary ids.
 */
public final class ExecutionFrame {
    public static final String RECOVERY_NAMESPACE = "on_error";

    private final Scope baseScope;
    private final String namespace;
    private final Map<String, Object> inherited;
    private final ProcessTracker tracker;
    private final LaunchDefaults defaults;
    private final Consumer<String> events;
    private final Map<String, StepResult> results = new LinkedHashMap<>();
    private final Map<String, Object> own = new LinkedHashMap<>();
    private int visited;

    public ExecutionFrame(Scope baseScope, ProcessTracker tracker, LaunchDefaults defaults, Consumer<String> events) {
        this(baseScope, null, Map.of(), tracker, defaults, events);
    }

    private ExecutionFrame(
        Scope baseScope,
        String namespace,
        Map<String, Object> inherited,
        ProcessTracker tracker,
        LaunchDefaults defaults,
        Consumer<String> events
    ) {
        this.baseScope = baseScope;
        this.namespace = namespace;
        this.inherited = inherited;
        this.tracker = tracker;
        this.defaults = defaults;
        this.events = events;
    }

    public ExecutionFrame recovery(Scope recoveryScope) {
        var primary = new LinkedHashMap<>(inherited);
        primary.putAll(own);
        return new ExecutionFrame(
            recoveryScope, RECOVERY_NAMESPACE, Collections.unmodifiableMap(primary), tracker, defaults, events);
    }

    public Scope baseScope() {
        return baseScope;
    }

    public ProcessTracker tracker() {
        return tracker;
    }

    public LaunchDefaults defaults() {
        return defaults;
    }

    public void emit(String line) {
        events.accept(line);
    }

    int visit() {
        return ++visited;
    }

    String resultKey(String localKey) {
        return namespace == null ? localKey : namespace + "." + localKey;
    }

    void requireUnused(String localKey) {
        var key = resultKey(localKey);
        if (results.containsKey(key)) {
            throw new ConfigException("Duplicate step id: " + key);
        }
    }

    void record(String localKey, StepResult result) {
        requireUnused(localKey);
        results.put(resultKey(localKey), result);
        own.put(localKey, result.toMap());
    }

    Map<String, Object> visibleSteps(Map<String, Object> overlay) {
        var mine = new LinkedHashMap<>(own);
        mine.putAll(overlay);
        var steps = new LinkedHashMap<>(inherited);
        if (namespace == null) {
            steps.putAll(mine);
        } else {
            steps.put(namespace, mine);
        }
        return steps;
    }

    public Map<String, StepResult> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }
}
