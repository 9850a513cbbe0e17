package work.agentflow.kernel.error;

import java.util.List;

/**
 * Thrown when static validation finds errors. Carries every error, never just the first.
 */
public final class WorkflowValidationException extends WorkflowException {
    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public WorkflowValidationException(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        super(
            "validation_error",
            "ValidationError: workflow has " + (errors != null ? errors.size() : 0) + " error(s)",
            "Fix the listed problems and compile again; nothing was executed"
        );
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public List<ValidationIssue> errors() {
        return errors;
    }

    public List<ValidationIssue> warnings() {
        return warnings;
    }

    @Override
    public String describe() {
        var text = new StringBuilder(getMessage());
        for (var issue : errors) {
            text.append(System.lineSeparator()).append("  - ").append(issue);
        }
        for (var issue : warnings) {
            text.append(System.lineSeparator()).append("  - ").append(issue);
        }
        return text.toString();
    }
}
