package work.agentflow.kernel.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.agentflow.kernel.error.ValidationIssue;
import work.agentflow.kernel.error.WorkflowValidationException;
import work.agentflow.kernel.graph.GraphEdge;
import work.agentflow.kernel.support.StubSteps;
import work.agentflow.kernel.syntax.WorkflowSyntaxException;
import work.agentflow.kernel.variables.VariableAnalyzer;

class WorkflowCompilerTest {
    private final WorkflowCompiler compiler = new WorkflowCompiler(StubSteps.directory("analyzer", "fixer", "tester", "a", "b"));

    @Test
    void compilesValidWorkflow() {
        var compiled = compiler.compile("analyzer:\"scan\":bugs -> fixer:\"fix {bugs}\":fixed");
        assertEquals(2, compiled.graph().nodes().size());
        assertTrue(compiled.report().isValid());
        assertEquals(3, compiled.tokens().size());
    }

    @Test
    void acceptsLoopWithConditionalExit() {
        var compiled = compiler.compile("a (if failed)~> b -> a");
        assertTrue(compiled.graph().edges().stream().anyMatch(GraphEdge::backEdge));
    }

    @Test
    void rejectsUnconditionalCycle() {
        var ex = assertThrows(WorkflowValidationException.class, () -> compiler.compile("a -> b -> a"));
        assertEquals(1, ex.errors().size());
        assertEquals(GraphValidator.CYCLE, ex.errors().get(0).check());
        assertTrue(ex.describe().contains("n1 -> n2 -> n1"));
    }

    @Test
    void reportsEveryErrorAtOnce() {
        var ex = assertThrows(WorkflowValidationException.class, () -> compiler.compile("analyser -> fixer:\"fix {bugs}\""));
        var checks = ex.errors().stream().map(ValidationIssue::check).toList();
        assertTrue(checks.contains(GraphValidator.UNKNOWN_STEP));
        assertTrue(checks.contains(VariableAnalyzer.CHECK));
        assertTrue(ex.describe().contains("Did you mean 'analyzer'?"));
    }

    @Test
    void syntaxErrorsPropagate() {
        assertThrows(WorkflowSyntaxException.class, () -> compiler.compile("a -> [b -> a"));
    }

    @Test
    void checkReturnsReportInsteadOfThrowing() {
        var report = compiler.check("tester -> deploy");
        assertFalse(report.isValid());
        assertEquals(1, report.errors().size());
    }

    @Test
    void strictConditionsRejectUnknownConditionText() {
        var text = "tester (if tests look flaky)~> fixer";
        assertEquals(1, compiler.compile(text).report().warnings().size());
        var strict = new WorkflowCompiler(StubSteps.directory("tester", "fixer"), true);
        assertThrows(WorkflowValidationException.class, () -> strict.compile(text));
    }
}
