package work.agentflow.kernel.cli;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.agentflow.kernel.agents.AgentPromotion;
import work.agentflow.kernel.agents.PromotionReport;
import work.agentflow.kernel.agents.PromotionSuggestion;
import work.agentflow.kernel.api.WorkflowRunConfiguration;
import work.agentflow.kernel.api.WorkflowRunner;
import work.agentflow.kernel.steering.ConsolePrompt;

@CommandLine.Command(
    name = "promote",
    description = "Save temporary agents of a workflow document to the agent registry.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class PromoteCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    WorkflowArgument workflow = new WorkflowArgument();

    @CommandLine.Mixin
    CommonOptions common = new CommonOptions();

    @CommandLine.Option(
        names = {"-a", "--agent"},
        description = "Temporary agent to promote (repeatable). Without it the choice is asked interactively."
    )
    List<String> agents = new ArrayList<>();

    @CommandLine.Option(
        names = "--recommended",
        description = "Promote every agent the analysis recommends."
    )
    boolean recommended;

    @Override
    public Integer call() {
        var commandLine = spec.commandLine();
        var level = common.logLevel();
        LogLevels.apply(level);
        var configuration = WorkflowRunConfiguration.builder()
            .source(workflow.toSource(commandLine))
            .workingDirectory(common.workingDirectory())
            .configFile(common.configFile())
            .registryFile(common.registryFile())
            .logLevel(level)
            .build();

        var out = commandLine.getOut();
        var runner = new WorkflowRunner();
        var suggestions = runner.suggestPromotions(configuration);
        if (suggestions.isEmpty()) {
            out.println("No temporary agents to promote.");
            out.flush();
            return 0;
        }

        List<String> selected;
        if (!agents.isEmpty()) {
            selected = agents;
        } else if (recommended) {
            selected = suggestions.stream().filter(PromotionSuggestion::recommended).map(PromotionSuggestion::name).toList();
        } else {
            var prompt = new ConsolePrompt(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), out);
            prompt.say(AgentPromotion.describe(suggestions));
            var names = suggestions.stream().map(PromotionSuggestion::name).toList();
            selected = prompt.askMany("Save which temporary agents to the registry?", names);
        }

        var report = runner.promote(configuration, selected);
        out.println(describe(report));
        out.flush();
        return report.failed().isEmpty() ? 0 : 1;
    }

    static String describe(PromotionReport report) {
        var builder = new StringBuilder();
        if (report.promoted().isEmpty()) {
            builder.append("No agents promoted.");
        } else {
            builder.append("Promoted: ").append(String.join(", ", report.promoted()));
        }
        for (var failure : report.failed()) {
            builder.append(System.lineSeparator()).append("Failed: ").append(failure.name()).append(" (").append(failure.reason()).append(')');
        }
        if (!report.discarded().isEmpty()) {
            builder.append(System.lineSeparator()).append("Discarded: ").append(String.join(", ", report.discarded()));
        }
        return builder.toString();
    }
}
