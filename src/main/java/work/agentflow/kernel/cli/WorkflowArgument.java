package work.agentflow.kernel.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.agentflow.kernel.api.WorkflowSource;

/**
 * Either a workflow file or inline syntax given with {@code -e}.
 */
final class WorkflowArgument {
    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "WORKFLOW",
        description = "Workflow file (.flow with plain syntax, or .yaml/.yml document)."
    )
    Path file;

    @CommandLine.Option(
        names = {"-e", "--expr"},
        paramLabel = "SYNTAX",
        description = "Inline workflow syntax instead of a file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String inline;

    WorkflowSource toSource(CommandLine commandLine) {
        if (file != null && inline != null) {
            throw new CommandLine.ParameterException(commandLine, "Pass either a WORKFLOW file or --expr, not both.");
        }
        if (file != null) {
            return WorkflowSource.forFile(file);
        }
        if (inline != null && !inline.isBlank()) {
            return WorkflowSource.forInline(inline);
        }
        throw new CommandLine.ParameterException(commandLine, "A WORKFLOW file or --expr is required.");
    }
}
