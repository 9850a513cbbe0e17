package work.agentflow.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.agentflow.kernel.graph.WorkflowGraph;

/**
 * Immutable view of an execution state, safe to hand to listeners on any thread.
 */
public record ExecutionSnapshot(
    WorkflowGraph graph,
    Map<String, NodeStatus> statuses,
    Map<String, NodeOutput> outputs,
    Map<String, Object> variables,
    Set<String> holds,
    List<String> completionOrder
) {
    public ExecutionSnapshot {
        Objects.requireNonNull(graph, "graph");
        statuses = Map.copyOf(statuses);
        outputs = Map.copyOf(outputs);
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        holds = Set.copyOf(holds);
        completionOrder = List.copyOf(completionOrder);
    }

    public NodeStatus status(String nodeId) {
        return statuses.getOrDefault(nodeId, NodeStatus.PENDING);
    }

    public NodeOutput output(String nodeId) {
        return outputs.get(nodeId);
    }

    public long count(NodeStatus status) {
        return graph.nodes().stream().filter(node -> status(node.id()) == status).count();
    }
}
