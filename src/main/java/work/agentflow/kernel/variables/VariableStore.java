package work.agentflow.kernel.variables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name to last captured value for one run. Written only by the scheduler thread and by steering
 * commands while the scheduler is paused.
 */
public final class VariableStore {
    private static final int PREVIEW_LENGTH = 50;

    private final Map<String, Object> values;

    public VariableStore() {
        this.values = new LinkedHashMap<>();
    }

    private VariableStore(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public void capture(String name, Object value) {
        values.put(name, value);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public void remove(String name) {
        values.remove(name);
    }

    public List<String> names() {
        return new ArrayList<>(values.keySet());
    }

    public Map<String, Object> asMap() {
        return new LinkedHashMap<>(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public VariableStore copy() {
        return new VariableStore(values);
    }

    /**
     * One line per variable with a short preview of its value.
     */
    public String summary() {
        if (values.isEmpty()) {
            return "No variables captured yet.";
        }
        var lines = new StringBuilder("Current variables:");
        for (var entry : values.entrySet()) {
            var value = entry.getValue();
            var full = value == null ? "(empty)" : VariableInterpolator.stringify(value).replace('\n', ' ');
            var preview = full.length() > PREVIEW_LENGTH ? full.substring(0, PREVIEW_LENGTH) + "..." : full;
            lines.append(System.lineSeparator()).append("  ").append(entry.getKey()).append(": ").append(preview);
        }
        return lines.toString();
    }
}
