package work.agentflow.kernel.syntax;

import java.util.Locale;
import java.util.Objects;

/**
 * Parsed {@code (if ...)} text. Built-in forms are recognized exactly; anything else is kept as
 * {@link Form#HEURISTIC} and evaluated by keyword containment.
 */
public record Condition(Form form, String argument, String text) {
    public Condition {
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(text, "text");
    }

    public static Condition parse(String raw) {
        var text = raw == null ? "" : raw.trim().replaceAll("\\s+", " ");
        var normalized = text.toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "if passed", "if success", "if succeeded" -> {
                return new Condition(Form.PASSED, null, text);
            }
            case "if failed", "if failure" -> {
                return new Condition(Form.FAILED, null, text);
            }
            case "if all success", "if all passed" -> {
                return new Condition(Form.ALL_SUCCESS, null, text);
            }
            case "if any success", "if any passed" -> {
                return new Condition(Form.ANY_SUCCESS, null, text);
            }
            case "if all failed" -> {
                return new Condition(Form.ALL_FAILED, null, text);
            }
            case "if any failed" -> {
                return new Condition(Form.ANY_FAILED, null, text);
            }
            default -> {
                if (normalized.startsWith("if contains ") && text.length() > "if contains ".length()) {
                    var argument = stripQuotes(text.substring("if contains ".length()).trim());
                    return new Condition(Form.CONTAINS, argument, text);
                }
                return new Condition(Form.HEURISTIC, null, text);
            }
        }
    }

    public boolean isRecognized() {
        return form != Form.HEURISTIC;
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    public enum Form {
        PASSED,
        FAILED,
        ALL_SUCCESS,
        ANY_SUCCESS,
        ALL_FAILED,
        ANY_FAILED,
        CONTAINS,
        HEURISTIC
    }
}
