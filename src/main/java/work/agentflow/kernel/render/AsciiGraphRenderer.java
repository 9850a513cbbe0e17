package work.agentflow.kernel.render;

import java.util.List;
import java.util.Locale;
import work.agentflow.kernel.graph.GraphEdge;
import work.agentflow.kernel.graph.GraphNode;
import work.agentflow.kernel.graph.NodeKind;
import work.agentflow.kernel.graph.WorkflowGraph;
import work.agentflow.kernel.runtime.ExecutionSnapshot;
import work.agentflow.kernel.runtime.NodeStatus;

/**
 * Draws the graph top to bottom in node order with one status symbol per node.
 *
 * <pre>
 * ✓ n1 analyzer "scan"
 *     ↓ [captures bugs]
 *     [uses bugs] ↓
 * ● n2 fixer "fix {bugs}"
 * </pre>
 *
 * Parallel regions are indented between a {@code ┬} entry line and a {@code ┴} merge line, and
 * each branch starts with {@code ├─}.
 */
public final class AsciiGraphRenderer implements GraphRenderer {
    private static final String INDENT = "    ";
    private static final int MAX_INSTRUCTION = 40;
    private static final int MAX_LISTED_VARIABLES = 3;

    @Override
    public String render(ExecutionSnapshot snapshot) {
        var graph = snapshot.graph();
        var out = new StringBuilder();
        int depth = 0;
        for (var node : graph.nodes()) {
            var status = snapshot.status(node.id());
            if (node.kind() == NodeKind.PARALLEL_MERGE) {
                depth = Math.max(0, depth - 1);
            }
            var prefix = prefix(graph, node, depth);

            for (var edge : graph.forwardIncoming(node.id())) {
                if (edge.isConditional()) {
                    line(out, prefix, "~(" + edge.condition() + ")~> from " + edge.from());
                }
            }
            if (!node.usesVariables().isEmpty()) {
                line(out, prefix, INDENT + usage(node.usesVariables()));
            }
            line(out, prefix, status.symbol() + " " + describe(node) + (snapshot.holds().contains(node.id()) ? " (held)" : ""));
            if (node.capturesVariable() != null) {
                line(out, prefix, INDENT + "↓ [captures " + node.capturesVariable() + "]");
            }
            for (var edge : graph.outgoing(node.id())) {
                if (edge.backEdge()) {
                    line(out, prefix, INDENT + "↺ back to " + edge.to() + condition(edge));
                }
            }
            if (node.kind() == NodeKind.PARALLEL_ENTRY) {
                depth++;
            }
        }
        out.append(summary(snapshot));
        return out.toString();
    }

    private static String prefix(WorkflowGraph graph, GraphNode node, int depth) {
        if (depth == 0) {
            return "";
        }
        boolean branchStart = graph.forwardIncoming(node.id()).stream()
            .anyMatch(edge -> graph.node(edge.from()).kind() == NodeKind.PARALLEL_ENTRY);
        return "│  ".repeat(depth - 1) + (branchStart ? "├─ " : "│  ");
    }

    private static String describe(GraphNode node) {
        return switch (node.kind()) {
            case STEP -> {
                var text = new StringBuilder(node.id()).append(' ').append(node.stepName());
                if (node.instruction() != null) {
                    text.append(" \"").append(abbreviate(node.instruction())).append('"');
                }
                yield text.toString();
            }
            case CHECKPOINT -> node.id() + " @" + node.stepName();
            case PARALLEL_ENTRY -> "┬ " + node.id() + " parallel";
            case PARALLEL_MERGE -> "┴ " + node.id() + " merge";
        };
    }

    static String usage(List<String> variables) {
        if (variables.size() <= MAX_LISTED_VARIABLES) {
            return "[uses " + String.join(", ", variables) + "] ↓";
        }
        var shown = variables.subList(0, 2);
        return "[uses " + String.join(", ", shown) + ", +" + (variables.size() - 2) + " more] ↓";
    }

    private static String condition(GraphEdge edge) {
        return edge.isConditional() ? " (" + edge.condition() + ")" : "";
    }

    private static String abbreviate(String text) {
        var flat = text.replace('\n', ' ');
        return flat.length() > MAX_INSTRUCTION ? flat.substring(0, MAX_INSTRUCTION - 3) + "..." : flat;
    }

    private static String summary(ExecutionSnapshot snapshot) {
        var parts = new StringBuilder();
        for (var status : NodeStatus.values()) {
            long count = snapshot.count(status);
            if (count > 0) {
                if (parts.length() > 0) {
                    parts.append("  ");
                }
                parts.append(status.symbol()).append(' ').append(count).append(' ').append(status.name().toLowerCase(Locale.ROOT));
            }
        }
        return parts.toString();
    }

    private static void line(StringBuilder out, String prefix, String text) {
        out.append(prefix).append(text).append(System.lineSeparator());
    }
}
