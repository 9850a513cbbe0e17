package work.agentflow.kernel.cli;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.agentflow.kernel.agents.AgentPromotion;
import work.agentflow.kernel.api.RunResult;
import work.agentflow.kernel.api.WorkflowRunConfiguration;
import work.agentflow.kernel.api.WorkflowRunner;
import work.agentflow.kernel.config.FailurePolicy;
import work.agentflow.kernel.shared.DurationParser;
import work.agentflow.kernel.steering.ConsolePrompt;
import work.agentflow.kernel.steering.PromptCollaborator;

@CommandLine.Command(
    name = "run",
    description = "Run a workflow.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    WorkflowArgument workflow = new WorkflowArgument();

    @CommandLine.Mixin
    CommonOptions common = new CommonOptions();

    @CommandLine.Option(
        names = {"-i", "--interactive"},
        description = "Pause at checkpoints and failures and ask for steering commands."
    )
    boolean interactive;

    @CommandLine.Option(
        names = {"-w", "--watch"},
        description = "Draw the graph after every status change."
    )
    boolean watch;

    @CommandLine.Option(
        names = "--concurrency",
        description = "Maximum number of steps running at once.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Integer concurrency;

    @CommandLine.Option(
        names = "--node-timeout",
        description = "Default step timeout (e.g. 30s, 2m, 1h).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String nodeTimeoutRaw;

    @CommandLine.Option(
        names = "--failure-policy",
        description = "What unattended runs do with a failed node (retry|skip|abort).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String failurePolicyRaw;

    @CommandLine.Option(
        names = "--max-retries",
        description = "Retries per node for --failure-policy retry.",
        defaultValue = "2"
    )
    int maxRetries;

    @CommandLine.Option(
        names = "--promote",
        description = "After the run, offer to save temporary agents to the registry."
    )
    boolean promote;

    @CommandLine.Option(
        names = "--json",
        description = "Print the run result as JSON."
    )
    boolean json;

    @Override
    public Integer call() {
        var commandLine = spec.commandLine();
        var level = common.logLevel();
        LogLevels.apply(level);

        Optional<Duration> nodeTimeout = DurationParser.parse(nodeTimeoutRaw);
        Optional<FailurePolicy> policy = Optional.ofNullable(failurePolicyRaw)
            .map(FailurePolicy.Mode::from)
            .map(mode -> new FailurePolicy(mode, maxRetries));

        var configuration = WorkflowRunConfiguration.builder()
            .source(workflow.toSource(commandLine))
            .workingDirectory(common.workingDirectory())
            .configFile(common.configFile())
            .registryFile(common.registryFile())
            .concurrency(Optional.ofNullable(concurrency))
            .nodeTimeout(nodeTimeout)
            .failurePolicy(policy)
            .interactive(interactive)
            .watch(watch)
            .logLevel(level)
            .build();

        var out = commandLine.getOut();
        var prompt = consolePrompt(out);
        var runner = new WorkflowRunner(prompt, out, null);
        RunResult result = runner.run(configuration);
        if (json) {
            out.println(result.toPrettyJson());
        } else {
            printSummary(result, out, commandLine.getErr());
        }
        out.flush();

        if (promote && result.status() != RunResult.Status.INVALID) {
            offerPromotion(runner, configuration, prompt);
        }
        return result.status().exitCode();
    }

    private void offerPromotion(WorkflowRunner runner, WorkflowRunConfiguration configuration, PromptCollaborator prompt) {
        var suggestions = runner.suggestPromotions(configuration);
        if (suggestions.isEmpty()) {
            return;
        }
        prompt.say(AgentPromotion.describe(suggestions));
        var names = new ArrayList<String>();
        suggestions.forEach(suggestion -> names.add(suggestion.name()));
        var selected = prompt.askMany("Save which temporary agents to the registry?", names);
        var report = runner.promote(configuration, selected);
        prompt.say(PromoteCommand.describe(report));
    }

    private static PromptCollaborator consolePrompt(PrintWriter out) {
        return new ConsolePrompt(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), out);
    }

    static void printSummary(RunResult result, PrintWriter out, PrintWriter err) {
        var metadata = result.metadata();
        var message = metadata.getOrDefault("message", metadata.get("error"));
        if (result.isSuccess()) {
            out.println(message);
        } else {
            err.println(message);
            err.flush();
        }
        if (metadata.get("nodes") instanceof List<?> nodes) {
            for (var node : nodes) {
                if (node instanceof Map<?, ?> entry) {
                    var line = "  " + entry.get("status") + "  " + entry.get("label");
                    if (entry.get("error") != null) {
                        line += "  [" + entry.get("errorKind") + "] " + entry.get("error");
                    }
                    out.println(line);
                }
            }
        }
    }
}
