package work.agentflow.kernel.variables;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.regex.Matcher;

/**
 * Replaces {@code {name}} placeholders with stored values. Missing names fail fast.
 */
public final class VariableInterpolator {
    public static final int DEFAULT_LIMIT = 2000;
    public static final String TRUNCATION_MARKER = "\n\n... (truncated)";
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final int limit;

    public VariableInterpolator() {
        this(DEFAULT_LIMIT);
    }

    public VariableInterpolator(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("truncation limit must be positive: " + limit);
        }
        this.limit = limit;
    }

    /**
     * @throws VariableException when a referenced name is unset or null
     */
    public String interpolate(String instruction, VariableStore store, String nodeId) {
        if (instruction == null || instruction.isEmpty()) {
            return instruction;
        }
        var matcher = VariableReferences.PLACEHOLDER.matcher(instruction);
        var result = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            if (!store.contains(name)) {
                throw new VariableException(name, nodeId, store.names(), false);
            }
            var value = store.get(name);
            if (value == null) {
                throw new VariableException(name, nodeId, store.names(), true);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(truncate(stringify(value))));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    String truncate(String text) {
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit) + TRUNCATION_MARKER;
    }

    /**
     * Strings pass through, structured values become pretty JSON.
     */
    public static String stringify(Object value) {
        if (value instanceof String s) {
            return s;
        }
        try {
            return JSON_WRITER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }
}
