package work.agentflow.kernel.runtime;

import java.util.List;
import java.util.Objects;

/**
 * @param unfinished ids of nodes that are not COMPLETED or SKIPPED at the end of the run
 */
public record RunOutcome(Status status, ExecutionSnapshot snapshot, List<String> unfinished, String message) {
    public RunOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(snapshot, "snapshot");
        unfinished = unfinished == null ? List.of() : List.copyOf(unfinished);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public enum Status {
        COMPLETED,
        ABORTED,
        DEADLOCKED
    }
}
