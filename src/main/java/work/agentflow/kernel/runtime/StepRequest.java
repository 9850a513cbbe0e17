package work.agentflow.kernel.runtime;

import java.util.Objects;

/**
 * @param instruction interpolated instruction text, {@code null} for bare steps
 */
public record StepRequest(String nodeId, String stepName, String instruction, StepOptions options) {
    public StepRequest {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(options, "options");
    }

    public String instructionOrEmpty() {
        return instruction == null ? "" : instruction;
    }
}
