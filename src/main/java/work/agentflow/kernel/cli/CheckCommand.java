package work.agentflow.kernel.cli;

import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.agentflow.kernel.api.WorkflowRunConfiguration;
import work.agentflow.kernel.api.WorkflowRunner;

@CommandLine.Command(
    name = "check",
    description = "Compile and validate a workflow without running it.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class CheckCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    WorkflowArgument workflow = new WorkflowArgument();

    @CommandLine.Mixin
    CommonOptions common = new CommonOptions();

    @CommandLine.Option(names = "--json", description = "Print the result as JSON.")
    boolean json;

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

        var result = new WorkflowRunner().check(configuration);
        var out = commandLine.getOut();
        if (json) {
            out.println(result.toPrettyJson());
        } else {
            if (result.metadata().get("issues") instanceof List<?> issues) {
                issues.forEach(out::println);
            }
            if (result.isSuccess()) {
                out.println("OK: " + configuration.source().display());
            } else {
                commandLine.getErr().println(result.metadata().get("error"));
                commandLine.getErr().flush();
            }
        }
        out.flush();
        return result.status().exitCode();
    }
}
