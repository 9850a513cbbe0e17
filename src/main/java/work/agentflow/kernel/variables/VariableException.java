package work.agentflow.kernel.variables;

import java.util.List;
import work.agentflow.kernel.error.WorkflowException;

/**
 * Interpolation referenced a variable that has no value. Fails the consuming node.
 */
public final class VariableException extends WorkflowException {
    private final String variable;
    private final List<String> available;

    public VariableException(String variable, String nodeId, List<String> available, boolean presentButEmpty) {
        super(
            "variable_error",
            presentButEmpty
                ? "VariableError: variable '" + variable + "' used by node " + nodeId + " has no value yet"
                : "VariableError: unknown variable '{" + variable + "}' in instruction of node " + nodeId
                    + ". Available variables: " + (available.isEmpty() ? "none" : String.join(", ", available)),
            "Make sure the step that captures ':" + variable + "' runs before " + nodeId + ", or use 'jump' to re-run it"
        );
        this.variable = variable;
        this.available = List.copyOf(available);
    }

    public String variable() {
        return variable;
    }

    public List<String> available() {
        return available;
    }
}
