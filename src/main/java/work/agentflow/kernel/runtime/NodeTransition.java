package work.agentflow.kernel.runtime;

public record NodeTransition(String nodeId, NodeStatus from, NodeStatus to) {
    @Override
    public String toString() {
        return nodeId + " " + from + " -> " + to;
    }
}
