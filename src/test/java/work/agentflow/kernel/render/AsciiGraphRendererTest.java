package work.agentflow.kernel.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.agentflow.kernel.compile.WorkflowCompiler;
import work.agentflow.kernel.runtime.ExecutionState;
import work.agentflow.kernel.runtime.NodeOutput;
import work.agentflow.kernel.support.StubSteps;

class AsciiGraphRendererTest {
    private static final String REVIEW =
        "analyzer:\"scan the diff\":bugs -> [fixer:\"fix {bugs}\":patch || reviewer:\"review {bugs}\"] -> @approve -> echo:\"ship {patch}\"";

    private final WorkflowCompiler compiler = new WorkflowCompiler(StubSteps.directory("analyzer", "fixer", "reviewer", "echo", "a", "b"));
    private final AsciiGraphRenderer renderer = new AsciiGraphRenderer();

    @Test
    void drawsParallelRegionIndented() {
        var state = new ExecutionState(compiler.compile(REVIEW).graph());
        var lines = renderer.render(state.snapshot()).lines().toList();

        assertEquals("○ n1 analyzer \"scan the diff\"", lines.get(0));
        assertEquals("    ↓ [captures bugs]", lines.get(1));
        assertEquals("○ ┬ n2 parallel", lines.get(2));
        assertTrue(lines.contains("├─ ○ n3 fixer \"fix {bugs}\""), String.join("\n", lines));
        assertTrue(lines.contains("├─     [uses bugs] ↓"), String.join("\n", lines));
        assertTrue(lines.contains("○ ┴ n5 merge"), String.join("\n", lines));
        assertTrue(lines.contains("○ n6 @approve"), String.join("\n", lines));
        assertEquals("○ 7 pending", lines.get(lines.size() - 1));
    }

    @Test
    void showsStatusHoldsAndSummary() {
        var state = new ExecutionState(compiler.compile(REVIEW).graph());
        state.begin("n1");
        state.complete("n1", NodeOutput.success("2 bugs", 4));
        state.hold("n7");

        var text = renderer.render(state.snapshot());

        assertTrue(text.contains("✓ n1 analyzer"), text);
        assertTrue(text.contains("○ n7 echo \"ship {patch}\" (held)"), text);
        assertTrue(text.endsWith("○ 6 pending  ✓ 1 completed"), text);
    }

    @Test
    void marksConditionsAndBackEdges() {
        var state = new ExecutionState(compiler.compile("a (if failed)~> b -> a").graph());
        var text = renderer.render(state.snapshot());

        assertTrue(text.contains("~(if failed)~> from n1"), text);
        assertTrue(text.contains("    ↺ back to n1"), text);
    }

    @Test
    void abbreviatesLongInstructionsAndVariableLists() {
        var state = new ExecutionState(compiler.compile("a:\"" + "x".repeat(60) + "\"").graph());
        assertTrue(renderer.render(state.snapshot()).contains("\"" + "x".repeat(37) + "...\""));
        assertEquals("[uses a, b, +3 more] ↓", AsciiGraphRenderer.usage(List.of("a", "b", "c", "d", "e")));
        assertEquals("[uses a, b, c] ↓", AsciiGraphRenderer.usage(List.of("a", "b", "c")));
    }
}
