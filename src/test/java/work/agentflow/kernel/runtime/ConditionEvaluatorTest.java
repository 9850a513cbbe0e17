package work.agentflow.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {
    private final ConditionEvaluator evaluator = new ConditionEvaluator();
    private final NodeOutput ok = NodeOutput.success("LGTM, ship it", 5);
    private final NodeOutput failed = NodeOutput.failure(ErrorKind.BACKEND, "tests are flaky", 5);

    @Test
    void passedAndFailedLookAtTheSource() {
        assertTrue(evaluator.evaluate("if passed", ok, List.of()));
        assertFalse(evaluator.evaluate("if passed", failed, List.of()));
        assertTrue(evaluator.evaluate("if failed", failed, List.of()));
        assertTrue(evaluator.evaluate("if failed", null, List.of()));
    }

    @Test
    void aggregateFormsLookAtTributaries() {
        var mixed = List.of(ok, failed);
        assertFalse(evaluator.evaluate("if all success", ok, mixed));
        assertTrue(evaluator.evaluate("if any success", ok, mixed));
        assertTrue(evaluator.evaluate("if any failed", ok, mixed));
        assertFalse(evaluator.evaluate("if all failed", ok, mixed));
    }

    @Test
    void aggregateFormsFallBackToTheSourceAlone() {
        assertTrue(evaluator.evaluate("if all success", ok, List.of()));
        assertTrue(evaluator.evaluate("if all failed", failed, List.of()));
    }

    @Test
    void containsIsCaseInsensitive() {
        assertTrue(evaluator.evaluate("if contains \"lgtm\"", ok, List.of()));
        assertFalse(evaluator.evaluate("if contains rejected", ok, List.of()));
        assertTrue(evaluator.evaluate("if contains flaky", failed, List.of()));
    }

    @Test
    void heuristicMatchesLongKeywordsThenFallsBackToSuccess() {
        assertTrue(evaluator.evaluate("if tests look flaky", failed, List.of()));
        assertTrue(evaluator.evaluate("if it is ok", ok, List.of()));
        assertFalse(evaluator.evaluate("if it is ok", failed, List.of()));
    }
}
