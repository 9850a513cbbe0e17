package work.agentflow.kernel.variables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.agentflow.kernel.compile.GraphLowering;
import work.agentflow.kernel.error.ValidationIssue;
import work.agentflow.kernel.syntax.AstBuilder;
import work.agentflow.kernel.syntax.Tokenizer;

class VariableAnalyzerTest {
    @Test
    void producerBeforeConsumerIsClean() {
        assertTrue(analyze("analyzer:\"scan\":bugs -> fixer:\"fix {bugs}\"").isEmpty());
    }

    @Test
    void missingProducerIsAnError() {
        var issues = analyze("fixer:\"fix {bugs}\"");
        assertEquals(1, issues.size());
        assertTrue(issues.get(0).isError());
        assertTrue(issues.get(0).message().contains("no step captures it"));
    }

    @Test
    void consumerBeforeProducerReportsBothIds() {
        var issues = analyze("fixer:\"fix {bugs}\" -> analyzer:\"scan\":bugs");
        assertEquals(1, issues.size());
        assertTrue(issues.get(0).isError());
        assertEquals("n2, n1", issues.get(0).location());
        assertTrue(issues.get(0).message().contains("used by n1 before it is produced by n2"));
    }

    @Test
    void parallelSiblingProducerIsAWarning() {
        var issues = analyze("[analyzer:\"scan\":bugs || fixer:\"fix {bugs}\"]");
        assertEquals(1, issues.size());
        assertFalse(issues.get(0).isError());
        assertTrue(issues.get(0).message().contains("may not be ready"));
    }

    @Test
    void valueAfterMergeIsOrdered() {
        assertTrue(analyze("[analyzer:\"scan\":bugs || tester] -> fixer:\"fix {bugs}\"").isEmpty());
    }

    private static List<ValidationIssue> analyze(String text) {
        return VariableAnalyzer.analyze(GraphLowering.lower(AstBuilder.build(Tokenizer.tokenize(text))));
    }
}
