package work.agentflow.kernel.cli;

import picocli.CommandLine;
import work.agentflow.kernel.api.RunResult;
import work.agentflow.kernel.error.WorkflowException;
import work.agentflow.kernel.error.WorkflowValidationException;
import work.agentflow.kernel.syntax.WorkflowSyntaxException;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message;
        if (ex instanceof WorkflowException we) {
            message = we.describe();
        } else {
            message = ex.getMessage();
        }
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("agentflow.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof WorkflowSyntaxException || ex instanceof WorkflowValidationException) {
            return RunResult.Status.INVALID.exitCode();
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
