package work.agentflow.kernel.variables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.agentflow.kernel.error.ValidationIssue;
import work.agentflow.kernel.graph.GraphNode;
import work.agentflow.kernel.graph.WorkflowGraph;

/**
 * Static check that every {@code {name}} used by a node has a producer that runs before it.
 */
public final class VariableAnalyzer {
    public static final String CHECK = "variables";

    private VariableAnalyzer() {}

    public static List<ValidationIssue> analyze(WorkflowGraph graph) {
        var issues = new ArrayList<ValidationIssue>();
        Map<String, List<GraphNode>> producers = new LinkedHashMap<>();
        for (var node : graph.nodes()) {
            if (node.capturesVariable() != null) {
                producers.computeIfAbsent(node.capturesVariable(), key -> new ArrayList<>()).add(node);
            }
        }

        for (var consumer : graph.nodes()) {
            for (var name : consumer.usesVariables()) {
                var candidates = producers.getOrDefault(name, List.of());
                if (candidates.isEmpty()) {
                    issues.add(ValidationIssue.error(
                        CHECK,
                        "variable '" + name + "' is used by " + consumer.label() + " but no step captures it",
                        consumer.id(),
                        "Add ':" + name + "' to the step whose output should fill {" + name + "}"
                    ));
                    continue;
                }
                var earlier = candidates.stream()
                    .filter(producer -> graph.indexOf(producer.id()) < graph.indexOf(consumer.id()))
                    .toList();
                if (earlier.isEmpty()) {
                    var producer = candidates.get(0);
                    issues.add(ValidationIssue.error(
                        CHECK,
                        "variable '" + name + "' is used by " + consumer.id() + " before it is produced by " + producer.id(),
                        producer.id() + ", " + consumer.id(),
                        "Move " + producer.label() + " before " + consumer.label()
                    ));
                    continue;
                }
                var ancestors = graph.forwardAncestors(consumer.id());
                boolean ordered = earlier.stream().anyMatch(producer -> ancestors.contains(producer.id()));
                if (!ordered) {
                    var producer = earlier.get(earlier.size() - 1);
                    issues.add(ValidationIssue.warning(
                        CHECK,
                        "variable '" + name + "' is produced by " + producer.id() + " on a branch that does not lead to "
                            + consumer.id() + "; the value may not be ready in time",
                        producer.id() + ", " + consumer.id(),
                        "Place " + consumer.label() + " after the parallel merge"
                    ));
                }
            }
        }
        return issues;
    }
}
