package work.yamlcli.engine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.yamlcli.engine.api.EngineOptions;
import work.yamlcli.engine.api.WorkflowEngine;
import work.yamlcli.engine.model.ActionDef;
import work.yamlcli.engine.runtime.WorkflowLoader;
import work.yamlcli.engine.shared.DurationParser;

@CommandLine.Command(
    name = "yaml-cli-run",
    description = "Run an action of a YAML CLI workflow.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-f", "--workflow"},
        description = "Workflow file (YAML or JSON). Defaults to the settings' default_workflow.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path workflow;

    @CommandLine.Option(
        names = {"-a", "--action"},
        description = "Id of the action to run or resolve.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String action;

    @CommandLine.Option(
        names = {"-F", "--field"},
        paramLabel = "KEY=VALUE",
        description = "Form value; VALUE is read as a YAML scalar (repeatable)."
    )
    private Map<String, String> fields = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--form",
        paramLabel = "PATH|-",
        description = "JSON/YAML map of form values; use '-' to read from stdin.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String form;

    @CommandLine.Option(names = "--resolve", description = "Print the action's resolved variables instead of running it.")
    private boolean resolveOnly;

    @CommandLine.Option(names = "--list", description = "List the workflow's actions.")
    private boolean list;

    @CommandLine.Option(
        names = "--settings",
        paramLabel = "PATH",
        description = "TOML launcher settings.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path settingsFile;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevel;

    @CommandLine.Option(
        names = "--timeout",
        description = "Default timeout for steps that declare none (e.g. 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @Override
    public Integer call() throws Exception {
        var settings = settingsFile == null ? LaunchSettings.EMPTY : LaunchSettings.load(settingsFile);
        LogbackConfigurator.configure(logLevel != null ? logLevel : settings.logLevel().orElse("warn"));

        var workflowPath = Optional.ofNullable(workflow)
            .map(path -> path.toAbsolutePath().normalize())
            .or(settings::defaultWorkflow)
            .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "--workflow is required (no default_workflow in settings)"));
        if (!Files.isRegularFile(workflowPath)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Workflow file not found: " + workflowPath);
        }

        var options = EngineOptions.builder()
            .workingDirectory(Paths.get(""))
            .programOverrides(settings.runtimeExecutables())
            .pollInterval(settings.pollInterval().orElse(EngineOptions.DEFAULT_POLL_INTERVAL))
            .terminationGrace(settings.terminationGrace().orElse(EngineOptions.DEFAULT_TERMINATION_GRACE))
            .defaultTimeout(timeoutRaw != null ? parseTimeout() : settings.defaultTimeout())
            .build();
        var engine = new WorkflowEngine(WorkflowLoader.load(workflowPath), options);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (list) {
            for (var id : engine.actionIds()) {
                out.println(id + "\t" + engine.action(id).map(ActionDef::title).orElse(id));
            }
            out.flush();
            return 0;
        }
        if (action == null || action.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--action is required; available: " + String.join(", ", engine.actionIds()));
        }
        var formValues = loadForm();

        if (resolveOnly) {
            out.println(JSON_WRITER.writeValueAsString(engine.resolve(action, formValues)));
            out.flush();
            return 0;
        }

        var stopOnExit = new Thread(() -> engine.registry().stopNow(action, options.terminationGrace()), "yamlcli-stop-" + action);
        Runtime.getRuntime().addShutdownHook(stopOnExit);
        try {
            var result = engine.run(action, formValues, line -> {
                err.println(line);
                err.flush();
            });
            out.println(result.toPrettyJson());
            out.flush();
            return 0;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(stopOnExit);
            } catch (IllegalStateException ex) {
                LOG.debug("JVM is shutting down; stop hook stays registered");
            }
        }
    }

    private Optional<Duration> parseTimeout() {
        try {
            return DurationParser.parse(timeoutRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private Map<String, Object> loadForm() {
        var values = new LinkedHashMap<String, Object>();
        if (form != null && !form.isBlank()) {
            String text;
            String origin;
            try {
                if ("-".equals(form)) {
                    text = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
                    origin = "stdin";
                } else {
                    var path = Paths.get(form).toAbsolutePath().normalize();
                    text = Files.readString(path, StandardCharsets.UTF_8);
                    origin = path.toString();
                }
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read form values: " + ex.getMessage());
            }
            if (!text.isBlank()) {
                values.putAll(WorkflowLoader.readMap(text, origin));
            }
        }
        fields.forEach((key, raw) -> values.put(key, WorkflowLoader.readScalar(raw)));
        return values;
    }
}
