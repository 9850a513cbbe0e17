package work.agentflow.kernel.compile;

import java.util.List;
import java.util.Objects;
import work.agentflow.kernel.error.ValidationReport;
import work.agentflow.kernel.graph.WorkflowGraph;
import work.agentflow.kernel.syntax.AstNode;
import work.agentflow.kernel.syntax.Token;

/**
 * Everything one compile pass produced. Only built for workflows that passed validation.
 */
public record CompiledWorkflow(String source, List<Token> tokens, AstNode ast, WorkflowGraph graph, ValidationReport report) {
    public CompiledWorkflow {
        Objects.requireNonNull(source, "source");
        tokens = List.copyOf(tokens);
        Objects.requireNonNull(ast, "ast");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(report, "report");
    }
}
