package work.agentflow.kernel.runtime;

import java.util.Objects;

/**
 * A point where the engine stopped and handed control to steering.
 *
 * @param state live state of the run; steering may mutate it before resuming
 */
public record Pause(Kind kind, String nodeId, ExecutionState state) {
    public Pause {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(state, "state");
    }

    public enum Kind {
        CHECKPOINT,
        FAILURE,
        HOLD
    }

    public String describe() {
        var node = state.graph().node(nodeId);
        return switch (kind) {
            case CHECKPOINT -> "Checkpoint reached: " + node.label();
            case FAILURE -> {
                var output = state.output(nodeId);
                yield "Node failed: " + node.label() + (output == null ? "" : " [" + output.errorKind() + "] " + output.error());
            }
            case HOLD -> "Holding before " + node.label();
        };
    }
}
