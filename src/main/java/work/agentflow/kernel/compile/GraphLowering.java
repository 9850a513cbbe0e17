package work.agentflow.kernel.compile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import work.agentflow.kernel.agents.AgentDirectory;
import work.agentflow.kernel.graph.GraphEdge;
import work.agentflow.kernel.graph.GraphNode;
import work.agentflow.kernel.graph.WorkflowGraph;
import work.agentflow.kernel.syntax.AstNode;
import work.agentflow.kernel.variables.VariableReferences;

/**
 * Flattens the syntax tree into a {@link WorkflowGraph} with a depth-first walk that threads
 * the current predecessor id through every node.
 *
 * <p>A bare step whose name matches a step already upstream of the predecessor is a
 * back-reference: it adds a back edge to that step instead of a new node, which is how loops
 * are written ({@code a (if failed)~> b -> a}).
 */
public final class GraphLowering {
    private final AgentDirectory directory;
    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private int counter;

    private GraphLowering(AgentDirectory directory) {
        this.directory = directory;
    }

    public static WorkflowGraph lower(AstNode ast) {
        return lower(ast, (AgentDirectory) null);
    }

    public static WorkflowGraph lower(AstNode ast, AgentDirectory directory) {
        var lowering = new GraphLowering(directory);
        lowering.lowerNode(ast, null);
        return new WorkflowGraph(lowering.nodes, lowering.edges);
    }

    private String lowerNode(AstNode node, String predecessor) {
        if (node instanceof AstNode.Step step) {
            return lowerStep(step, predecessor);
        }
        if (node instanceof AstNode.Checkpoint checkpoint) {
            var id = nextId();
            nodes.add(GraphNode.checkpoint(id, checkpoint.label(), checkpoint.position()));
            link(predecessor, id);
            return id;
        }
        if (node instanceof AstNode.Sequence sequence) {
            var current = predecessor;
            for (var child : sequence.steps()) {
                current = lowerNode(child, current);
            }
            return current;
        }
        if (node instanceof AstNode.Parallel parallel) {
            var entry = nextId();
            nodes.add(GraphNode.parallelEntry(entry));
            link(predecessor, entry);
            var exits = new ArrayList<String>();
            for (var branch : parallel.branches()) {
                exits.add(lowerNode(branch, entry));
            }
            var merge = nextId();
            nodes.add(GraphNode.parallelMerge(merge));
            for (var exit : exits) {
                link(exit, merge);
            }
            return merge;
        }
        if (node instanceof AstNode.Conditional conditional) {
            var sourceExit = lowerNode(conditional.source(), predecessor);
            int firstTargetEdge = edges.size();
            var targetExit = lowerNode(conditional.target(), sourceExit);
            if (firstTargetEdge < edges.size()) {
                edges.set(firstTargetEdge, edges.get(firstTargetEdge).withCondition(conditional.conditionText()));
            }
            return targetExit;
        }
        if (node instanceof AstNode.Subgraph subgraph) {
            return lowerNode(subgraph.child(), predecessor);
        }
        throw new IllegalStateException("Unsupported syntax node: " + node);
    }

    private String lowerStep(AstNode.Step step, String predecessor) {
        if (step.isBare() && predecessor != null) {
            var loopTarget = findUpstreamStep(step.name(), predecessor);
            if (loopTarget != null) {
                edges.add(new GraphEdge(predecessor, loopTarget, null, true));
                return loopTarget;
            }
        }
        var id = nextId();
        var graphNode = GraphNode.step(
            id,
            step.name(),
            step.instruction(),
            step.capture(),
            VariableReferences.find(step.instruction()),
            step.position()
        );
        if (directory != null) {
            var resolution = directory.resolve(step.name());
            if (resolution.found()) {
                var definition = resolution.definition();
                graphNode = graphNode.withAgent(
                    resolution.kind(),
                    definition == null ? null : definition.model(),
                    definition == null ? null : definition.timeout()
                );
            }
        }
        nodes.add(graphNode);
        link(predecessor, id);
        return id;
    }

    /**
     * Latest step named {@code name} among {@code from} and its forward ancestors, or {@code null}.
     */
    private String findUpstreamStep(String name, String from) {
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(from);
        seen.add(from);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            for (var edge : edges) {
                if (!edge.backEdge() && edge.to().equals(current) && seen.add(edge.from())) {
                    queue.add(edge.from());
                }
            }
        }
        for (int i = nodes.size() - 1; i >= 0; i--) {
            var candidate = nodes.get(i);
            if (candidate.isStep() && name.equals(candidate.stepName()) && seen.contains(candidate.id())) {
                return candidate.id();
            }
        }
        return null;
    }

    private void link(String from, String to) {
        if (from != null) {
            edges.add(GraphEdge.of(from, to));
        }
    }

    private String nextId() {
        counter++;
        return "n" + counter;
    }
}
