package work.agentflow.kernel.error;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Aggregated findings of every static check run over one workflow.
 */
public record ValidationReport(List<ValidationIssue> issues) {
    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public static ValidationReport empty() {
        return new ValidationReport(List.of());
    }

    public ValidationReport plus(Collection<ValidationIssue> more) {
        var merged = new ArrayList<>(issues);
        merged.addAll(more);
        return new ValidationReport(merged);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(issue -> !issue.isError()).toList();
    }

    public boolean isValid() {
        return errors().isEmpty();
    }

    /**
     * @throws WorkflowValidationException listing every error when the report is not valid
     */
    public ValidationReport orThrow() {
        if (!isValid()) {
            throw new WorkflowValidationException(errors(), warnings());
        }
        return this;
    }
}
