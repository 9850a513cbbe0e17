package work.agentflow.kernel.compile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.agents.AgentDirectory;
import work.agentflow.kernel.error.ValidationReport;
import work.agentflow.kernel.syntax.AstBuilder;
import work.agentflow.kernel.syntax.Tokenizer;
import work.agentflow.kernel.variables.VariableAnalyzer;

/**
 * Tokenize, parse, lower and validate. Syntax and validation errors abort the whole pass.
 */
public final class WorkflowCompiler {
    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final AgentDirectory directory;
    private final GraphValidator validator;

    public WorkflowCompiler(AgentDirectory directory) {
        this(directory, false);
    }

    public WorkflowCompiler(AgentDirectory directory, boolean strictConditions) {
        this.directory = directory;
        this.validator = new GraphValidator(directory, strictConditions);
    }

    /**
     * @throws work.agentflow.kernel.syntax.WorkflowSyntaxException on malformed text
     * @throws work.agentflow.kernel.error.WorkflowValidationException when any check reports an error
     */
    public CompiledWorkflow compile(String source) {
        var tokens = Tokenizer.tokenize(source);
        var ast = AstBuilder.build(tokens, source.length());
        var graph = GraphLowering.lower(ast, directory);
        var report = ValidationReport.empty()
            .plus(validator.validate(graph, tokens))
            .plus(VariableAnalyzer.analyze(graph));
        for (var warning : report.warnings()) {
            log.debug("Validation warning: {}", warning);
        }
        report.orThrow();
        log.debug("Compiled workflow: {} nodes, {} edges", graph.nodes().size(), graph.edges().size());
        return new CompiledWorkflow(source, tokens, ast, graph, report);
    }

    /**
     * Runs every stage but returns the report instead of throwing on validation errors.
     */
    public ValidationReport check(String source) {
        var tokens = Tokenizer.tokenize(source);
        var ast = AstBuilder.build(tokens, source.length());
        var graph = GraphLowering.lower(ast, directory);
        return ValidationReport.empty()
            .plus(validator.validate(graph, tokens))
            .plus(VariableAnalyzer.analyze(graph));
    }
}
