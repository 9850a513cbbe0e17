package work.agentflow.kernel.compile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.agents.AgentDirectory;
import work.agentflow.kernel.error.ValidationIssue;
import work.agentflow.kernel.graph.GraphNode;
import work.agentflow.kernel.graph.WorkflowGraph;
import work.agentflow.kernel.shared.EditDistance;
import work.agentflow.kernel.syntax.Condition;
import work.agentflow.kernel.syntax.Token;
import work.agentflow.kernel.syntax.TokenKind;

/**
 * Static checks over a lowered graph. Every check runs; findings are aggregated rather than
 * stopping at the first one.
 */
public final class GraphValidator {
    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    public static final String BRACKETS = "brackets";
    public static final String UNKNOWN_STEP = "unknown-step";
    public static final String CONNECTIVITY = "connectivity";
    public static final String CYCLE = "cycle";
    public static final String CONDITION = "condition";

    private final AgentDirectory directory;
    private final boolean strictConditions;

    public GraphValidator(AgentDirectory directory, boolean strictConditions) {
        this.directory = directory;
        this.strictConditions = strictConditions;
    }

    public List<ValidationIssue> validate(WorkflowGraph graph, List<Token> tokens) {
        var issues = new ArrayList<ValidationIssue>();
        issues.addAll(checkBrackets(tokens));
        issues.addAll(checkUnknownSteps(graph));
        issues.addAll(checkConnectivity(graph));
        issues.addAll(checkCycles(graph));
        issues.addAll(checkConditions(graph));
        return issues;
    }

    List<ValidationIssue> checkBrackets(List<Token> tokens) {
        var issues = new ArrayList<ValidationIssue>();
        if (tokens == null) {
            return issues;
        }
        Deque<Token> open = new ArrayDeque<>();
        for (var token : tokens) {
            if (token.kind() == TokenKind.OPEN_BRACKET) {
                open.push(token);
            } else if (token.kind() == TokenKind.CLOSE_BRACKET) {
                if (open.isEmpty()) {
                    issues.add(ValidationIssue.error(
                        BRACKETS,
                        "']' without a matching '['",
                        "position " + token.position(),
                        "Remove the ']' or add '[' before it"
                    ));
                } else {
                    open.pop();
                }
            }
        }
        while (!open.isEmpty()) {
            var unclosed = open.pop();
            issues.add(ValidationIssue.error(
                BRACKETS,
                "'[' is never closed",
                "position " + unclosed.position(),
                "Add ']' to close the group"
            ));
        }
        return issues;
    }

    List<ValidationIssue> checkUnknownSteps(WorkflowGraph graph) {
        var issues = new ArrayList<ValidationIssue>();
        if (directory == null) {
            return issues;
        }
        for (var node : graph.steps()) {
            var resolution = directory.resolve(node.stepName());
            if (resolution.found()) {
                continue;
            }
            var suggestion = EditDistance.nearest(node.stepName(), directory.knownNames());
            var hint = suggestion
                .map(name -> "Did you mean '" + name + "'?")
                .orElse("Define the agent in the workflow document or the agent registry");
            issues.add(ValidationIssue.error(
                UNKNOWN_STEP,
                "unknown step '" + node.stepName() + "'",
                node.id() + " (position " + node.position() + ")",
                hint
            ));
        }
        return issues;
    }

    List<ValidationIssue> checkConnectivity(WorkflowGraph graph) {
        var reached = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        for (var start : graph.startNodes()) {
            if (reached.add(start.id())) {
                queue.add(start.id());
            }
        }
        while (!queue.isEmpty()) {
            var current = queue.poll();
            for (var edge : graph.outgoing(current)) {
                if (reached.add(edge.to())) {
                    queue.add(edge.to());
                }
            }
        }
        var orphans = graph.nodes().stream()
            .filter(node -> !reached.contains(node.id()))
            .map(GraphNode::label)
            .toList();
        if (orphans.isEmpty()) {
            return List.of();
        }
        return List.of(ValidationIssue.error(
            CONNECTIVITY,
            "unreachable nodes: " + String.join(", ", orphans),
            String.join(", ", orphans),
            "Connect them to the workflow with -> or remove them"
        ));
    }

    /**
     * A cycle can terminate only if one of its edges carries a condition, so every cycle left in
     * the subgraph of unconditional edges is fatal.
     */
    List<ValidationIssue> checkCycles(WorkflowGraph graph) {
        var issues = new ArrayList<ValidationIssue>();
        Map<String, Integer> colour = new HashMap<>();
        for (var node : graph.nodes()) {
            if (colour.getOrDefault(node.id(), 0) == 0) {
                visit(graph, node.id(), colour, new ArrayList<>(), issues);
            }
        }
        return issues;
    }

    private void visit(
        WorkflowGraph graph,
        String id,
        Map<String, Integer> colour,
        List<String> path,
        List<ValidationIssue> issues
    ) {
        colour.put(id, 1);
        path.add(id);
        for (var edge : graph.outgoing(id)) {
            if (edge.isConditional()) {
                continue;
            }
            int state = colour.getOrDefault(edge.to(), 0);
            if (state == 0) {
                visit(graph, edge.to(), colour, path, issues);
            } else if (state == 1) {
                var cyclePath = new ArrayList<>(path.subList(path.indexOf(edge.to()), path.size()));
                cyclePath.add(edge.to());
                log.debug("Unconditional cycle {}", cyclePath);
                issues.add(ValidationIssue.error(
                    CYCLE,
                    "unconditional cycle " + String.join(" -> ", cyclePath) + " can never terminate",
                    String.join(" -> ", cyclePath),
                    "Guard one edge of the loop with a condition, e.g. step (if failed)~> retry"
                ));
            }
        }
        path.remove(path.size() - 1);
        colour.put(id, 2);
    }

    List<ValidationIssue> checkConditions(WorkflowGraph graph) {
        var issues = new ArrayList<ValidationIssue>();
        for (var edge : graph.edges()) {
            if (!edge.isConditional()) {
                continue;
            }
            var condition = Condition.parse(edge.condition());
            if (condition.isRecognized()) {
                continue;
            }
            var message = "condition '" + edge.condition() + "' is not a built-in form and will be evaluated by keyword match";
            var location = edge.from() + " -> " + edge.to();
            var hint = "Use if passed, if failed, if all/any success, if all/any failed or if contains <text>";
            if (strictConditions) {
                issues.add(ValidationIssue.error(CONDITION, message, location, hint));
            } else {
                log.warn("Condition '{}' on edge {} is not a built-in form; falling back to keyword match", edge.condition(), location);
                issues.add(ValidationIssue.warning(CONDITION, message, location, hint));
            }
        }
        return issues;
    }
}
