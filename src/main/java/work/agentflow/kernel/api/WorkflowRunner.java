package work.agentflow.kernel.api;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.agents.AgentDefinition;
import work.agentflow.kernel.agents.AgentPromotion;
import work.agentflow.kernel.agents.AgentRepository;
import work.agentflow.kernel.agents.JsonAgentRepository;
import work.agentflow.kernel.agents.LayeredAgentDirectory;
import work.agentflow.kernel.agents.PromotionReport;
import work.agentflow.kernel.agents.PromotionSuggestion;
import work.agentflow.kernel.compile.WorkflowCompiler;
import work.agentflow.kernel.config.AgentflowConfig;
import work.agentflow.kernel.config.ConfigLoader;
import work.agentflow.kernel.config.EngineSettings;
import work.agentflow.kernel.config.WorkflowDocument;
import work.agentflow.kernel.config.WorkflowDocumentLoader;
import work.agentflow.kernel.error.ErrorDetails;
import work.agentflow.kernel.error.ValidationIssue;
import work.agentflow.kernel.error.WorkflowException;
import work.agentflow.kernel.error.WorkflowValidationException;
import work.agentflow.kernel.render.AsciiGraphRenderer;
import work.agentflow.kernel.render.RenderingListener;
import work.agentflow.kernel.runtime.BuiltinSteps;
import work.agentflow.kernel.runtime.ExecutionEngine;
import work.agentflow.kernel.runtime.ProcessStepFunction;
import work.agentflow.kernel.runtime.RunOutcome;
import work.agentflow.kernel.runtime.StepFunction;
import work.agentflow.kernel.runtime.StepRegistry;
import work.agentflow.kernel.runtime.SteeringHandler;
import work.agentflow.kernel.steering.ConsolePrompt;
import work.agentflow.kernel.steering.InteractiveSteering;
import work.agentflow.kernel.steering.PromptCollaborator;
import work.agentflow.kernel.steering.SnapshotStack;
import work.agentflow.kernel.steering.SteeringContext;
import work.agentflow.kernel.steering.UnattendedSteering;
import work.agentflow.kernel.syntax.WorkflowSyntaxException;
import work.agentflow.kernel.variables.VariableInterpolator;

/**
 * Public entry point for embedding the workflow kernel: loads configuration and the workflow
 * document, compiles, runs and reports.
 */
public final class WorkflowRunner {
    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);
    static final String DEFAULT_REGISTRY = ".agentflow/agents.json";

    private final PromptCollaborator prompt;
    private final PrintWriter out;
    private final StepFunction fallback;

    public WorkflowRunner() {
        this(null, new PrintWriter(System.out, true), null);
    }

    /**
     * @param prompt operator prompt for interactive runs; {@code null} reads from stdin
     * @param fallback step function for agents with no registration of their own, may be {@code null}
     */
    public WorkflowRunner(PromptCollaborator prompt, PrintWriter out, StepFunction fallback) {
        this.out = Objects.requireNonNull(out, "out");
        this.prompt = prompt;
        this.fallback = fallback;
    }

    /**
     * Compiles and validates without running anything.
     */
    public RunResult check(WorkflowRunConfiguration configuration) {
        var started = Instant.now();
        var metadata = baseMetadata(configuration);
        try {
            var workspace = open(configuration);
            var compiler = compilerFor(workspace);
            var report = compiler.check(workspace.document().source());
            metadata.put("issues", report.issues().stream().map(ValidationIssue::toString).toList());
            if (!report.isValid()) {
                metadata.put("errors", report.errors().size());
                return RunResult.failure(RunResult.Status.INVALID, "Workflow has " + report.errors().size() + " error(s)", metadata, started);
            }
            metadata.put("status", "ok");
            return RunResult.of(RunResult.Status.SUCCESS, metadata, started);
        } catch (WorkflowSyntaxException ex) {
            return invalid(ex, metadata, started);
        } catch (WorkflowException ex) {
            return failed(ex, metadata, started);
        }
    }

    public RunResult run(WorkflowRunConfiguration configuration) {
        var started = Instant.now();
        var metadata = baseMetadata(configuration);
        try {
            var workspace = open(configuration);
            var compiler = compilerFor(workspace);
            var compiled = compiler.compile(workspace.document().source());
            for (var warning : compiled.report().warnings()) {
                log.warn("{}", warning);
            }
            var engine = new ExecutionEngine(backendFor(workspace, configuration.workingDirectory()), workspace.settings());
            if (configuration.watch()) {
                engine.addListener(new RenderingListener(new AsciiGraphRenderer(), out));
            }
            SteeringHandler steering = configuration.interactive()
                ? new InteractiveSteering(new SteeringContext(prompt(), compiler, workspace.settings(), new SnapshotStack()))
                : new UnattendedSteering(workspace.settings().failurePolicy());

            var outcome = engine.run(compiled.graph(), steering);
            describeOutcome(outcome, metadata);
            return switch (outcome.status()) {
                case COMPLETED -> RunResult.of(RunResult.Status.SUCCESS, metadata, started);
                case ABORTED -> RunResult.failure(RunResult.Status.FAILURE, outcome.message(), metadata, started);
                case DEADLOCKED -> RunResult.failure(RunResult.Status.DEADLOCKED, outcome.message(), metadata, started);
            };
        } catch (WorkflowSyntaxException | WorkflowValidationException ex) {
            return invalid(ex, metadata, started);
        } catch (WorkflowException ex) {
            return failed(ex, metadata, started);
        } catch (RuntimeException ex) {
            if (Boolean.getBoolean("agentflow.debug")) {
                ex.printStackTrace();
            }
            return RunResult.failure(RunResult.Status.FAILURE, ErrorDetails.message(ex), metadata, started);
        }
    }

    public List<PromotionSuggestion> suggestPromotions(WorkflowRunConfiguration configuration) {
        var workspace = open(configuration);
        return new AgentPromotion(workspace.repository()).suggest(workspace.document().temporaryAgents());
    }

    /**
     * Saves the selected temporary agents of the workflow document as defined agents.
     */
    public PromotionReport promote(WorkflowRunConfiguration configuration, List<String> selected) {
        var workspace = open(configuration);
        return new AgentPromotion(workspace.repository()).promote(workspace.document().temporaryAgents(), selected);
    }

    /**
     * Resolves configuration, agent registry and the workflow document for a configuration.
     */
    public Workspace open(WorkflowRunConfiguration configuration) {
        var workingDirectory = configuration.workingDirectory();
        var configPath = configuration.configFile().orElse(workingDirectory.resolve(AgentflowConfig.FILE_NAME));
        var config = ConfigLoader.load(configPath);

        var settings = config.engine().toBuilder();
        configuration.concurrency().ifPresent(settings::concurrency);
        configuration.nodeTimeout().ifPresent(timeout -> settings.nodeTimeout(Optional.of(timeout)));
        configuration.failurePolicy().ifPresent(settings::failurePolicy);

        var registryPath = configuration.registryFile()
            .or(config::registryPath)
            .orElse(workingDirectory.resolve(DEFAULT_REGISTRY));
        var repository = new JsonAgentRepository(registryPath);

        var document = configuration.source().inline()
            .map(WorkflowDocument::of)
            .orElseGet(() -> WorkflowDocumentLoader.load(resolve(workingDirectory, configuration.source().path().orElseThrow())));

        var defined = new ArrayList<AgentDefinition>(repository.load());
        defined.addAll(config.agents());
        var directory = new LayeredAgentDirectory(BuiltinSteps.NAMES, defined, document.temporaryAgents());
        log.debug("Workspace for {}: {} defined, {} temporary agent(s)", document.origin(), defined.size(), document.temporaryAgents().size());
        return new Workspace(config, settings.build(), document, directory, repository);
    }

    public record Workspace(
        AgentflowConfig config,
        EngineSettings settings,
        WorkflowDocument document,
        LayeredAgentDirectory directory,
        AgentRepository repository
    ) {}

    private WorkflowCompiler compilerFor(Workspace workspace) {
        return new WorkflowCompiler(workspace.directory(), workspace.settings().strictConditions());
    }

    private StepRegistry backendFor(Workspace workspace, Path workingDirectory) {
        var registry = BuiltinSteps.register(new StepRegistry());
        var agents = new ArrayList<AgentDefinition>(workspace.directory().definedAgents());
        agents.addAll(workspace.directory().temporaryAgents());
        for (var agent : agents) {
            if (!agent.command().isEmpty() && !BuiltinSteps.NAMES.contains(agent.name())) {
                registry.register(agent.name(), new ProcessStepFunction(agent.command(), workingDirectory), agent.description());
            }
        }
        if (fallback != null) {
            registry.setFallback(fallback);
        }
        return registry;
    }

    private PromptCollaborator prompt() {
        if (prompt != null) {
            return prompt;
        }
        return new ConsolePrompt(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), out);
    }

    private static Path resolve(Path workingDirectory, Path path) {
        return path.isAbsolute() ? path : workingDirectory.resolve(path);
    }

    private static Map<String, Object> baseMetadata(WorkflowRunConfiguration configuration) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("workflow", configuration.source().display());
        metadata.put("logLevel", configuration.logLevel().name());
        return metadata;
    }

    private static void describeOutcome(RunOutcome outcome, Map<String, Object> metadata) {
        var snapshot = outcome.snapshot();
        metadata.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
        metadata.put("message", outcome.message());
        var nodes = new ArrayList<Map<String, Object>>();
        for (var node : snapshot.graph().nodes()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("id", node.id());
            entry.put("label", node.label());
            entry.put("status", snapshot.status(node.id()).name().toLowerCase(Locale.ROOT));
            var output = snapshot.output(node.id());
            if (output != null) {
                entry.put("success", output.success());
                entry.put("durationMs", output.durationMs());
                if (!output.success()) {
                    entry.put("error", output.error());
                    entry.put("errorKind", String.valueOf(output.errorKind()));
                }
            }
            nodes.add(entry);
        }
        metadata.put("nodes", nodes);
        var variables = new LinkedHashMap<String, Object>();
        snapshot.variables().forEach((name, value) -> variables.put(name, value == null ? null : VariableInterpolator.stringify(value)));
        metadata.put("variables", variables);
        if (!outcome.unfinished().isEmpty()) {
            metadata.put("unfinished", outcome.unfinished());
        }
    }

    private static RunResult invalid(WorkflowException ex, Map<String, Object> metadata, Instant started) {
        log.debug("Workflow rejected: {}", ex.getMessage());
        var meta = new LinkedHashMap<>(metadata);
        meta.putAll(ErrorDetails.normalize(ex));
        if (ex instanceof WorkflowValidationException validation) {
            var issues = new ArrayList<String>();
            validation.errors().forEach(issue -> issues.add(issue.toString()));
            validation.warnings().forEach(issue -> issues.add(issue.toString()));
            meta.put("issues", issues);
        }
        return RunResult.failure(RunResult.Status.INVALID, ex.describe(), meta, started);
    }

    private static RunResult failed(WorkflowException ex, Map<String, Object> metadata, Instant started) {
        if (Boolean.getBoolean("agentflow.debug")) {
            ex.printStackTrace();
        }
        var meta = new LinkedHashMap<>(metadata);
        meta.putAll(ErrorDetails.normalize(ex));
        var status = WorkflowDocumentLoader.isDocumentError(ex) ? RunResult.Status.INVALID : RunResult.Status.FAILURE;
        return RunResult.failure(status, ex.describe(), meta, started);
    }
}
