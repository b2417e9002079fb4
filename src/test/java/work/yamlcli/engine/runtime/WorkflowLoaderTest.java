package work.yamlcli.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.yamlcli.engine.error.ConfigException;
import work.yamlcli.engine.model.StepDef;
import work.yamlcli.engine.model.StreamMode;

class WorkflowLoaderTest {
    private static final Path FIXTURE = Path.of("src", "test", "resources", "workflows", "tools.yaml").toAbsolutePath();

    @Test
    void loadsWorkflowFixture() {
        var config = WorkflowLoader.load(FIXTURE);

        assertEquals(List.of("greet", "each", "quick"), config.actionIds());
        assertEquals("Hello", config.vars().get("greeting"));
        assertEquals("${vars.greeting} ${form.name}", config.vars().get("target"));
        assertEquals(Map.of("TOOL_MODE", "app"), config.app().env());
        assertFalse(config.app().shell());
        assertEquals(Map.of("python", "python3"), config.runtimeExecutables());

        var greet = config.action("greet").orElseThrow();
        assertEquals("Greet someone", greet.title());
        assertEquals(Map.of("TOOL_MODE", "action"), greet.env());
        assertTrue(greet.recoveryPipeline().isEmpty());
        var say = assertInstanceOf(StepDef.RunStep.class, greet.pipeline().get(0));
        assertEquals("say", say.id());
        assertEquals("echo", say.run().program());
        assertEquals(List.of("${vars.target}"), say.run().argv());
        assertEquals(StreamMode.Kind.CAPTURE, say.run().stdout().kind());
        var maybe = assertInstanceOf(StepDef.RunStep.class, greet.pipeline().get(1));
        assertEquals("form.loud", maybe.when());
        assertTrue(maybe.continueOnError());
        assertEquals(Duration.ofSeconds(5), maybe.run().timeout().orElseThrow());
    }

    @Test
    void loadsForeachAndRecoveryPipelines() {
        var each = WorkflowLoader.load(FIXTURE).action("each").orElseThrow();

        var loop = assertInstanceOf(StepDef.ForeachStep.class, each.pipeline().get(0));
        assertEquals("form.files", loop.in());
        assertEquals("file", loop.alias());
        var show = assertInstanceOf(StepDef.RunStep.class, loop.steps().get(0));
        assertEquals(StreamMode.Kind.INHERIT, show.run().stdout().kind());
        assertEquals("cleanup", each.onError().get(0).id());
    }

    @Test
    void runShorthandBecomesSingleStepPipeline() {
        var quick = WorkflowLoader.load(FIXTURE).action("quick").orElseThrow();

        assertEquals(1, quick.pipeline().size());
        var step = assertInstanceOf(StepDef.RunStep.class, quick.pipeline().get(0));
        assertEquals("quick_run", step.id());
        assertEquals(new StreamMode(StreamMode.Kind.FILE, "logs/quick.err"), step.run().stderr());
    }

    @Test
    void acceptsJsonDocuments() {
        var config = WorkflowLoader.parse("""
            {"version": 1, "actions": {"a": {"title": "A", "run": {"program": "true", "capture": false}}}}
            """);
        var step = assertInstanceOf(StepDef.RunStep.class, config.action("a").orElseThrow().pipeline().get(0));
        assertEquals("a_run", step.id());
        assertEquals(StreamMode.Kind.INHERIT, step.run().stdout().kind());
        assertEquals(StreamMode.Kind.INHERIT, step.run().stderr().kind());
    }

    @Test
    void defaultsForOptionalFields() {
        var config = WorkflowLoader.parse("""
            version: 1
            actions:
              a:
                title: A
                pipeline:
                  - run: {program: "true"}
                  - foreach: {in: "[1, 2]"}
            """);
        var steps = config.action("a").orElseThrow().pipeline();
        assertNull(steps.get(0).id());
        assertFalse(steps.get(0).continueOnError());
        var loop = assertInstanceOf(StepDef.ForeachStep.class, steps.get(1));
        assertEquals("item", loop.alias());
        assertTrue(loop.steps().isEmpty());
        assertTrue(config.vars().isEmpty());
    }

    @Test
    void rejectsStructuralProblems() {
        assertConfigError("""
            version: 2
            actions: {a: {title: A, run: {program: x}}}
            """, "version");
        assertConfigError("""
            version: 1
            actions: {}
            """, "actions");
        assertConfigError("""
            version: 1
            actions: {a: {run: {program: x}}}
            """, "title");
        assertConfigError("""
            version: 1
            actions: {a: {title: A}}
            """, "pipeline or run");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: {run: {program: x}}}}
            """, "must be list");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{run: {program: x}, pipeline: []}]}}
            """, "more than one");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{id: s}]}}
            """, "Unknown step type");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{foreach: {as: x}}]}}
            """, "requires 'in'");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{foreach: {in: "[]", as: loop}}]}}
            """, "other than 'loop'");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{run: {program: x, argv: "-v"}}]}}
            """, "argv must be list");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{run: {program: x, stdout: pipe}}]}}
            """, "stream mode");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{run: {program: x, timeout: soon}}]}}
            """, "timeout");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{run: {argv: []}}]}}
            """, "program is required");
        assertConfigError("""
            version: 1
            actions: {a: {title: A, pipeline: [{id: on_error, run: {program: x}}]}}
            """, "reserved for recovery results");
        assertConfigError("- not a map", "must be a map");
    }

    @Test
    void readsCliScalarsAsYaml() {
        assertEquals(3L, WorkflowLoader.readScalar("3"));
        assertEquals(true, WorkflowLoader.readScalar("true"));
        assertEquals(0.5, WorkflowLoader.readScalar("0.5"));
        assertEquals("hello world", WorkflowLoader.readScalar("hello world"));
        assertEquals("[a, b", WorkflowLoader.readScalar("[a, b"));
        assertEquals("[a]", WorkflowLoader.readScalar("[a]"));
        assertEquals("", WorkflowLoader.readScalar(""));
    }

    @Test
    void readsFormMaps() {
        var form = WorkflowLoader.readMap("name: World\ncount: 2\n", "form.yaml");
        assertEquals(Map.of("name", "World", "count", 2L), form);
        assertThrows(ConfigException.class, () -> WorkflowLoader.readMap("[1, 2]", "form.yaml"));
    }

    private static void assertConfigError(String document, String fragment) {
        var error = assertThrows(ConfigException.class, () -> WorkflowLoader.parse(document));
        assertTrue(error.getMessage().contains(fragment), () -> "expected '" + fragment + "' in: " + error.getMessage());
    }
}
