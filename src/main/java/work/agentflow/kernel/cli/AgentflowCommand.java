package work.agentflow.kernel.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "agentflow",
    description = "Compile, check and run agent workflows.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {RunCommand.class, CheckCommand.class, PromoteCommand.class}
)
final class AgentflowCommand implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
