package work.agentflow.kernel.error;

import java.util.Objects;

/**
 * A single finding of static validation.
 *
 * @param check short name of the check that produced it (e.g. {@code unknown-step})
 * @param location where it applies: a character position, node ids or a cycle path
 * @param hint what the author can do about it
 */
public record ValidationIssue(Severity severity, String check, String message, String location, String hint) {
    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(check, "check");
        Objects.requireNonNull(message, "message");
        location = location == null ? "" : location;
        hint = hint == null ? "" : hint;
    }

    public static ValidationIssue error(String check, String message, String location, String hint) {
        return new ValidationIssue(Severity.ERROR, check, message, location, hint);
    }

    public static ValidationIssue warning(String check, String message, String location, String hint) {
        return new ValidationIssue(Severity.WARNING, check, message, location, hint);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        var text = new StringBuilder()
            .append(severity == Severity.ERROR ? "error" : "warning")
            .append(" [").append(check).append("] ")
            .append(message);
        if (!location.isBlank()) {
            text.append(" (at ").append(location).append(')');
        }
        if (!hint.isBlank()) {
            text.append(" - ").append(hint);
        }
        return text.toString();
    }

    public enum Severity {
        ERROR,
        WARNING
    }
}
