package work.agentflow.kernel.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalizes throwables into {@code code/message/hint} maps for run summaries.
 */
public final class ErrorDetails {
    private ErrorDetails() {}

    public static Map<String, Object> normalize(Throwable error) {
        if (error instanceof WorkflowException we) {
            return toMap(we.code(), we.getMessage(), we.hint());
        }
        if (error == null) {
            return toMap("unexpected_error", "Unexpected error", null);
        }
        var message = error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : error.getClass().getSimpleName();
        return toMap("unexpected_error", message, null);
    }

    public static String message(Throwable error) {
        if (error instanceof WorkflowException we) {
            return we.describe();
        }
        return String.valueOf(normalize(error).get("message"));
    }

    private static Map<String, Object> toMap(String code, String message, String hint) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        if (hint != null) {
            map.put("hint", hint);
        }
        return map;
    }
}
