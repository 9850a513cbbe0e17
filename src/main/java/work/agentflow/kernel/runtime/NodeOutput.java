package work.agentflow.kernel.runtime;

import java.util.Locale;
import work.agentflow.kernel.variables.VariableInterpolator;

/**
 * Result of one node execution as stored in the execution state.
 */
public record NodeOutput(boolean success, Object payload, String error, ErrorKind errorKind, long durationMs) {
    public static NodeOutput success(Object payload, long durationMs) {
        return new NodeOutput(true, payload, null, null, durationMs);
    }

    public static NodeOutput failure(ErrorKind kind, String error, long durationMs) {
        return failure(kind, error, null, durationMs);
    }

    public static NodeOutput failure(ErrorKind kind, String error, Object payload, long durationMs) {
        var message = error == null || error.isBlank() ? kind.name().toLowerCase(Locale.ROOT) : error;
        return new NodeOutput(false, payload, message, kind, durationMs);
    }

    /**
     * Payload for successful outputs, the error text otherwise.
     */
    public String describe() {
        if (success) {
            return payload == null ? "(no output)" : VariableInterpolator.stringify(payload);
        }
        var text = "[" + errorKind + "] " + error;
        if (payload != null) {
            text += System.lineSeparator() + VariableInterpolator.stringify(payload);
        }
        return text;
    }
}
