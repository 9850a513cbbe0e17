package work.agentflow.kernel.graph;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import work.agentflow.kernel.agents.AgentKind;

/**
 * Durable unit of a compiled workflow. Immutable; run-time status lives in the execution state.
 *
 * @param stepName agent name for steps, label for checkpoints, {@code null} for parallel nodes
 * @param position source offset of the step or checkpoint, {@code -1} for synthesized nodes
 */
public record GraphNode(
    String id,
    NodeKind kind,
    String stepName,
    String instruction,
    String capturesVariable,
    List<String> usesVariables,
    AgentKind agentKind,
    String model,
    Duration timeout,
    int position
) {
    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        usesVariables = usesVariables == null ? List.of() : List.copyOf(usesVariables);
    }

    public static GraphNode step(String id, String stepName, String instruction, String capture, List<String> uses, int position) {
        return new GraphNode(id, NodeKind.STEP, stepName, instruction, capture, uses, null, null, null, position);
    }

    public static GraphNode checkpoint(String id, String label, int position) {
        return new GraphNode(id, NodeKind.CHECKPOINT, label, null, null, List.of(), null, null, null, position);
    }

    public static GraphNode parallelEntry(String id) {
        return new GraphNode(id, NodeKind.PARALLEL_ENTRY, null, null, null, List.of(), null, null, null, -1);
    }

    public static GraphNode parallelMerge(String id) {
        return new GraphNode(id, NodeKind.PARALLEL_MERGE, null, null, null, List.of(), null, null, null, -1);
    }

    public GraphNode withAgent(AgentKind kind, String defaultModel, Duration defaultTimeout) {
        return new GraphNode(id, this.kind, stepName, instruction, capturesVariable, usesVariables, kind, defaultModel, defaultTimeout, position);
    }

    public boolean isStep() {
        return kind == NodeKind.STEP;
    }

    public boolean isCheckpoint() {
        return kind == NodeKind.CHECKPOINT;
    }

    public boolean isSynthetic() {
        return kind == NodeKind.PARALLEL_ENTRY || kind == NodeKind.PARALLEL_MERGE;
    }

    /**
     * Short operator-facing label, e.g. {@code n3 reviewer} or {@code n5 @approve}.
     */
    public String label() {
        return switch (kind) {
            case STEP -> id + " " + stepName;
            case CHECKPOINT -> id + " @" + stepName;
            case PARALLEL_ENTRY -> id + " (parallel)";
            case PARALLEL_MERGE -> id + " (merge)";
        };
    }
}
