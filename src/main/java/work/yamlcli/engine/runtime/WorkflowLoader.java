package work.yamlcli.engine.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import work.yamlcli.engine.error.ConfigException;
import work.yamlcli.engine.flow.ExecutionFrame;
import work.yamlcli.engine.model.ActionDef;
import work.yamlcli.engine.model.AppSettings;
import work.yamlcli.engine.model.RunSpec;
import work.yamlcli.engine.model.StepDef;
import work.yamlcli.engine.model.StreamMode;
import work.yamlcli.engine.model.WorkflowConfig;
import work.yamlcli.engine.shared.DurationParser;

/**
 * Loads workflow documents (YAML or JSON) into the typed {@link WorkflowConfig} tree, failing fast on
 * structural problems the engine cannot run.
 */
public final class WorkflowLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private WorkflowLoader() {}

    public static WorkflowConfig load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return fromMap(toRootMap(YAML_MAPPER.readTree(in), path.toString()));
        } catch (IOException ex) {
            throw new ConfigException("Failed to read workflow: " + path + " (" + ex.getMessage() + ")", ex);
        }
    }

    public static WorkflowConfig parse(String document) {
        try {
            return fromMap(toRootMap(YAML_MAPPER.readTree(document), "<inline>"));
        } catch (IOException ex) {
            throw new ConfigException("Failed to parse workflow: " + ex.getMessage(), ex);
        }
    }

    /**
     * Reads a YAML/JSON document as a plain map (used for form value files).
     */
    public static Map<String, Object> readMap(String document, String origin) {
        try {
            return toRootMap(YAML_MAPPER.readTree(document), origin);
        } catch (IOException ex) {
            throw new ConfigException("Failed to parse " + origin + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Scalar YAML conversion for {@code key=value} CLI fields: {@code 3} becomes a number, {@code true} a
     * boolean, anything unparseable stays a string.
     */
    public static Object readScalar(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        try {
            var node = YAML_MAPPER.readTree(text);
            if (node == null || node.isContainerNode() || node.isMissingNode()) {
                return text;
            }
            return convertNode(node);
        } catch (IOException ex) {
            return text;
        }
    }

    public static WorkflowConfig fromMap(Map<String, Object> root) {
        if (root == null) {
            throw new ConfigException("Workflow root must be a map");
        }
        var version = root.get("version");
        if (!(version instanceof Number n) || n.doubleValue() != 1) {
            throw new ConfigException("Only version: 1 is supported");
        }
        var actionsRaw = root.get("actions");
        if (!(actionsRaw instanceof Map<?, ?> actionsMap) || actionsMap.isEmpty()) {
            throw new ConfigException("actions must be a non-empty map");
        }

        var vars = new LinkedHashMap<String, Object>();
        var varsRaw = root.get("vars");
        if (varsRaw != null) {
            for (var entry : asMap(varsRaw, "vars").entrySet()) {
                var value = entry.getValue();
                if (value instanceof Map<?, ?> spec && spec.containsKey("default")) {
                    value = spec.get("default");
                }
                vars.put(entry.getKey(), value);
            }
        }

        var app = AppSettings.DEFAULT;
        if (root.get("app") != null) {
            var appMap = asMap(root.get("app"), "app");
            app = new AppSettings(
                optionalMap(appMap.get("env"), "app.env"),
                appMap.get("workdir"),
                bool(appMap.get("shell"), false, "app.shell")
            );
        }

        var runtime = new LinkedHashMap<String, String>();
        if (root.get("runtime") != null) {
            for (var entry : asMap(root.get("runtime"), "runtime").entrySet()) {
                var spec = entry.getValue();
                Object executable = spec instanceof Map<?, ?> specMap ? specMap.get("executable") : spec;
                if (executable != null) {
                    runtime.put(entry.getKey(), String.valueOf(executable));
                }
            }
        }

        var actions = new LinkedHashMap<String, ActionDef>();
        for (var entry : actionsMap.entrySet()) {
            var id = String.valueOf(entry.getKey());
            actions.put(id, parseAction(id, entry.getValue()));
        }
        return new WorkflowConfig(vars, app, runtime, actions);
    }

    private static ActionDef parseAction(String id, Object raw) {
        var where = "actions." + id;
        var action = asMap(raw, where);
        if (!action.containsKey("title")) {
            throw new ConfigException("Action " + id + " requires title");
        }
        var pipelineRaw = action.get("pipeline");
        var runRaw = action.get("run");
        if (pipelineRaw == null && runRaw == null) {
            throw new ConfigException("Action " + id + " requires pipeline or run");
        }
        List<StepDef> pipeline;
        if (pipelineRaw != null) {
            if (!(pipelineRaw instanceof List<?>)) {
                throw new ConfigException("Action " + id + ".pipeline must be list");
            }
            pipeline = parseSteps(pipelineRaw, where + ".pipeline");
        } else {
            pipeline = List.of(new StepDef.RunStep(id + "_run", null, false, parseRun(runRaw, where + ".run")));
        }
        List<StepDef> onError = null;
        if (action.get("on_error") != null) {
            if (!(action.get("on_error") instanceof List<?>)) {
                throw new ConfigException("Action " + id + ".on_error must be list");
            }
            onError = parseSteps(action.get("on_error"), where + ".on_error");
        }
        var title = action.get("title") == null ? id : String.valueOf(action.get("title"));
        return new ActionDef(id, title, pipeline, onError, optionalMap(action.get("env"), where + ".env"));
    }

    private static List<StepDef> parseSteps(Object raw, String where) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new ConfigException(where + " must be list");
        }
        var steps = new ArrayList<StepDef>(list.size());
        for (int i = 0; i < list.size(); i++) {
            steps.add(parseStep(list.get(i), where + "[" + i + "]"));
        }
        return steps;
    }

    private static StepDef parseStep(Object raw, String where) {
        var step = asMap(raw, where);
        var id = step.get("id") == null ? null : String.valueOf(step.get("id"));
        if (id != null && id.isBlank()) {
            throw new ConfigException(where + ".id must not be blank");
        }
        if (ExecutionFrame.RECOVERY_NAMESPACE.equals(id)) {
            throw new ConfigException(where + ".id '" + id + "' is reserved for recovery results");
        }
        var when = step.get("when");
        var continueOnError = bool(step.get("continue_on_error"), false, where + ".continue_on_error");
        int kinds = (step.containsKey("run") ? 1 : 0) + (step.containsKey("pipeline") ? 1 : 0) + (step.containsKey("foreach") ? 1 : 0);
        if (kinds > 1) {
            throw new ConfigException("Step " + describe(id, where) + " declares more than one of run/pipeline/foreach");
        }
        if (step.containsKey("run")) {
            return new StepDef.RunStep(id, when, continueOnError, parseRun(step.get("run"), where + ".run"));
        }
        if (step.containsKey("pipeline")) {
            if (!(step.get("pipeline") instanceof List<?>)) {
                throw new ConfigException("pipeline step requires list: " + describe(id, where));
            }
            return new StepDef.PipelineStep(id, when, continueOnError, parseSteps(step.get("pipeline"), where + ".pipeline"));
        }
        if (step.containsKey("foreach")) {
            var foreach = asMap(step.get("foreach"), where + ".foreach");
            if (!foreach.containsKey("in")) {
                throw new ConfigException(where + ".foreach requires 'in'");
            }
            var alias = foreach.get("as") == null ? "item" : String.valueOf(foreach.get("as"));
            if (!IDENTIFIER.matcher(alias).matches() || "loop".equals(alias)) {
                throw new ConfigException(where + ".foreach.as must be an identifier other than 'loop': " + alias);
            }
            return new StepDef.ForeachStep(id, when, continueOnError, foreach.get("in"), alias, parseSteps(foreach.get("steps"), where + ".foreach.steps"));
        }
        throw new ConfigException("Unknown step type in " + describe(id, where));
    }

    private static RunSpec parseRun(Object raw, String where) {
        var run = asMap(raw, where);
        if (run.get("program") == null) {
            throw new ConfigException(where + ".program is required");
        }
        var argvRaw = run.get("argv");
        if (argvRaw != null && !(argvRaw instanceof List<?>)) {
            throw new ConfigException(where + ".argv must be list");
        }
        var argv = argvRaw == null ? List.<Object>of() : new ArrayList<Object>((List<?>) argvRaw);
        var capture = bool(run.get("capture"), true, where + ".capture");
        var fallback = capture ? StreamMode.capture() : StreamMode.inherit();
        var stdout = run.get("stdout") == null ? fallback : StreamMode.parse(run.get("stdout"));
        var stderr = run.get("stderr") == null ? fallback : StreamMode.parse(run.get("stderr"));
        Boolean shell = run.get("shell") == null ? null : bool(run.get("shell"), false, where + ".shell");
        return new RunSpec(
            run.get("program"),
            argv,
            optionalMap(run.get("env"), where + ".env"),
            run.get("workdir"),
            shell,
            stdout,
            stderr,
            timeout(run, where)
        );
    }

    private static Optional<Duration> timeout(Map<String, Object> run, String where) {
        var raw = run.containsKey("timeout_ms") ? run.get("timeout_ms") : run.get("timeout");
        try {
            return DurationParser.fromValue(raw).filter(duration -> !duration.isZero());
        } catch (IllegalArgumentException ex) {
            throw new ConfigException(where + ".timeout: " + ex.getMessage(), ex);
        }
    }

    private static String describe(String id, String where) {
        return id == null ? where : id;
    }

    private static boolean bool(Object raw, boolean fallback, String where) {
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        throw new ConfigException(where + " must be a boolean");
    }

    private static Map<String, Object> optionalMap(Object raw, String where) {
        return raw == null ? Map.of() : asMap(raw, where);
    }

    private static Map<String, Object> asMap(Object raw, String where) {
        if (raw instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return copy;
        }
        throw new ConfigException(where + " must be a map");
    }

    private static Map<String, Object> toRootMap(JsonNode root, String origin) throws IOException {
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new ConfigException("Root of " + origin + " must be a map");
        }
        return asMap(convertNode(root), origin);
    }

    private static Object convertNode(JsonNode node) throws IOException {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
