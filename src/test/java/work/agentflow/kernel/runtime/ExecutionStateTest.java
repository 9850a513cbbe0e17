package work.agentflow.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.agentflow.kernel.graph.GraphEdge;
import work.agentflow.kernel.graph.GraphNode;
import work.agentflow.kernel.graph.WorkflowGraph;

class ExecutionStateTest {
    private final WorkflowGraph graph = new WorkflowGraph(
        List.of(
            GraphNode.step("n1", "analyzer", "scan", "bugs", List.of(), 0),
            GraphNode.parallelEntry("n2"),
            GraphNode.step("n3", "fixer", "fix {bugs}", null, List.of("bugs"), 20)
        ),
        List.of(GraphEdge.of("n1", "n2"), GraphEdge.of("n2", "n3"))
    );

    @Test
    void completionCapturesDeclaredVariable() {
        var state = new ExecutionState(graph);
        state.begin("n1");
        state.complete("n1", NodeOutput.success("2 bugs", 3));

        assertEquals("2 bugs", state.variables().get("bugs"));
        assertEquals(NodeStatus.COMPLETED, state.status("n1"));
        assertEquals(List.of("n2", "n3"), state.unfinishedIds());
    }

    @Test
    void resetKeepsCapturedVariables() {
        var state = new ExecutionState(graph);
        state.begin("n1");
        state.complete("n1", NodeOutput.success("2 bugs", 3));
        state.reset(List.of("n1"));

        assertEquals(NodeStatus.PENDING, state.status("n1"));
        assertNull(state.output("n1"));
        assertTrue(state.variables().contains("bugs"));
    }

    @Test
    void lastCompletedIgnoresSyntheticNodes() {
        var state = new ExecutionState(graph);
        assertEquals(Optional.empty(), state.lastCompleted());
        state.complete("n1", NodeOutput.success("x", 1));
        state.complete("n2", NodeOutput.success(null, 0));
        assertEquals(Optional.of("n1"), state.lastCompleted());
    }

    @Test
    void restoreReturnsToCopyAndPublishesTransitions() {
        var state = new ExecutionState(graph);
        var saved = state.copy();
        state.begin("n1");
        state.complete("n1", NodeOutput.success("2 bugs", 3));
        state.hold("n3");
        state.drainTransitions();

        state.restore(saved);

        assertEquals(NodeStatus.PENDING, state.status("n1"));
        assertFalse(state.isHeld("n3"));
        assertFalse(state.variables().contains("bugs"));
        assertEquals(List.of(new NodeTransition("n1", NodeStatus.COMPLETED, NodeStatus.PENDING)), state.drainTransitions());
    }

    @Test
    void retryCountsAndActivates() {
        var state = new ExecutionState(graph);
        state.begin("n1");
        state.fail("n1", NodeOutput.failure(ErrorKind.BACKEND, "boom", 1));
        state.retry("n1");

        assertEquals(1, state.retryCount("n1"));
        assertTrue(state.isActivated("n1"));
        assertEquals(NodeStatus.PENDING, state.status("n1"));
    }

    @Test
    void resetForStartsOver() {
        var state = new ExecutionState(graph);
        state.complete("n1", NodeOutput.success("2 bugs", 3));
        long before = state.revision();
        var replacement = new WorkflowGraph(List.of(GraphNode.step("n1", "echo", "hi", null, List.of(), 0)), List.of());

        state.resetFor(replacement);

        assertTrue(state.revision() > before);
        assertTrue(state.variables().isEmpty());
        assertEquals(List.of("n1"), state.unfinishedIds());
        assertEquals(replacement, state.graph());
    }
}
