package work.agentflow.kernel.variables;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds {@code {name}} placeholders in instruction text.
 */
public final class VariableReferences {
    static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private VariableReferences() {}

    /**
     * Distinct names in order of first appearance.
     */
    public static List<String> find(String instruction) {
        if (instruction == null || instruction.isEmpty()) {
            return List.of();
        }
        var names = new LinkedHashSet<String>();
        var matcher = PLACEHOLDER.matcher(instruction);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return new ArrayList<>(names);
    }
}
