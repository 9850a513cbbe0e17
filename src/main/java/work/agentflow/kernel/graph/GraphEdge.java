package work.agentflow.kernel.graph;

import java.util.Objects;

/**
 * Directed edge. A {@code condition} gates traversal; a back edge closes a loop to an earlier step.
 */
public record GraphEdge(String from, String to, String condition, boolean backEdge) {
    public GraphEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static GraphEdge of(String from, String to) {
        return new GraphEdge(from, to, null, false);
    }

    public boolean isConditional() {
        return condition != null && !condition.isBlank();
    }

    public GraphEdge withCondition(String text) {
        return new GraphEdge(from, to, text, backEdge);
    }

    public GraphEdge redirectTo(String target) {
        return new GraphEdge(from, target, condition, backEdge);
    }

    @Override
    public String toString() {
        var arrow = backEdge ? " ↺ " : " -> ";
        return from + arrow + to + (isConditional() ? " (" + condition + ")" : "");
    }
}
