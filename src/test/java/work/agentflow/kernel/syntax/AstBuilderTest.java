package work.agentflow.kernel.syntax;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AstBuilderTest {
    @Test
    void foldsSequencesIntoOneList() {
        var ast = parse("a -> b -> c");
        var sequence = assertInstanceOf(AstNode.Sequence.class, ast);
        assertEquals(List.of("a", "b", "c"), sequence.steps().stream().map(step -> ((AstNode.Step) step).name()).toList());
    }

    @Test
    void parallelBindsTighterThanSequence() {
        var sequence = assertInstanceOf(AstNode.Sequence.class, parse("a -> b || c"));
        assertEquals(2, sequence.steps().size());
        var parallel = assertInstanceOf(AstNode.Parallel.class, sequence.steps().get(1));
        assertEquals(2, parallel.branches().size());
    }

    @Test
    void conditionalBindsLoosest() {
        var conditional = assertInstanceOf(AstNode.Conditional.class, parse("a (if passed)~> b -> c"));
        assertEquals("if passed", conditional.conditionText());
        assertInstanceOf(AstNode.Step.class, conditional.source());
        assertInstanceOf(AstNode.Sequence.class, conditional.target());
    }

    @Test
    void conditionDefaultsToIfFailed() {
        var conditional = assertInstanceOf(AstNode.Conditional.class, parse("tester ~> fixer"));
        assertEquals(AstBuilder.DEFAULT_CONDITION, conditional.conditionText());
    }

    @Test
    void bracketsGroupIntoSubgraph() {
        var parallel = assertInstanceOf(AstNode.Parallel.class, parse("[a -> b] || c"));
        var group = assertInstanceOf(AstNode.Subgraph.class, parallel.branches().get(0));
        assertInstanceOf(AstNode.Sequence.class, group.child());
    }

    @Test
    void keepsCheckpointsAndStepDetails() {
        var sequence = assertInstanceOf(AstNode.Sequence.class, parse("fixer:\"fix it\":patch -> @approve"));
        var step = assertInstanceOf(AstNode.Step.class, sequence.steps().get(0));
        assertEquals("fix it", step.instruction());
        assertEquals("patch", step.capture());
        var checkpoint = assertInstanceOf(AstNode.Checkpoint.class, sequence.steps().get(1));
        assertEquals("approve", checkpoint.label());
        assertEquals(24, checkpoint.position());
    }

    @Test
    void unclosedBracketNamesMissingPosition() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> parse("a -> [b -> c"));
        assertEquals(12, ex.position());
        assertTrue(ex.getMessage().contains("unclosed bracket"));
        assertTrue(ex.getMessage().contains("expected ']' at position 12"));
        assertTrue(ex.getMessage().contains("opened at position 5"));
    }

    @Test
    void unclosedBracketBeforeStrayToken() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> parse("[a -> b ~> c"));
        assertTrue(ex.getMessage().contains("unclosed bracket"));
    }

    @Test
    void rejectsStrayClosingBracket() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> parse("a ] -> b"));
        assertEquals(2, ex.position());
        assertTrue(ex.getMessage().contains("unmatched ']'"));
    }

    @Test
    void rejectsDanglingOperator() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> parse("a ->"));
        assertEquals(4, ex.position());
    }

    @Test
    void rejectsLeadingOperator() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> parse("|| a"));
        assertEquals(0, ex.position());
        assertEquals("An operator needs a step on both sides", ex.hint());
    }

    @Test
    void rejectsAdjacentOperands() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> parse("a b"));
        assertEquals(2, ex.position());
    }

    @Test
    void conditionMustPrecedeConditionalOperator() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> parse("a (if passed) -> b"));
        assertTrue(ex.getMessage().contains("must be followed by '~>'"));
    }

    @Test
    void rejectsEmptyWorkflowAndEmptyBrackets() {
        assertThrows(WorkflowSyntaxException.class, () -> parse("   "));
        assertThrows(WorkflowSyntaxException.class, () -> parse("a -> []"));
    }

    private static AstNode parse(String text) {
        return AstBuilder.build(Tokenizer.tokenize(text), text.length());
    }
}
