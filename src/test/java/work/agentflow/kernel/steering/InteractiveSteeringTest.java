package work.agentflow.kernel.steering;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.agentflow.kernel.compile.WorkflowCompiler;
import work.agentflow.kernel.config.EngineSettings;
import work.agentflow.kernel.runtime.ExecutionEngine;
import work.agentflow.kernel.runtime.NodeStatus;
import work.agentflow.kernel.runtime.RunOutcome;
import work.agentflow.kernel.runtime.StepResult;
import work.agentflow.kernel.support.ScriptedPrompt;
import work.agentflow.kernel.support.StubSteps;

class InteractiveSteeringTest {
    private final WorkflowCompiler compiler = new WorkflowCompiler(StubSteps.directory("a", "b", "diagnose"));

    @Test
    void continuePassesCheckpoint() {
        var prompt = new ScriptedPrompt("continue");
        var steps = new StubSteps().echoing("a").echoing("b");

        var outcome = run("a:\"draft\" -> @check -> b", steps, prompt);

        assertEquals(RunOutcome.Status.COMPLETED, outcome.status());
        assertEquals("Checkpoint reached: n2 @check", prompt.messages().get(0));
        assertEquals("Continuing past n2 @check", prompt.messages().get(1));
        assertEquals(1, steps.calls("b"));
    }

    @Test
    void debugThenSkipAfterFailure() {
        var prompt = new ScriptedPrompt("debug", "why does b fail", "skip");
        var steps = new StubSteps().echoing("a").failing("b", "boom");

        var outcome = run("a -> b", steps, prompt);

        assertEquals(RunOutcome.Status.COMPLETED, outcome.status());
        assertEquals("Workflow completed: 2 completed, 1 skipped", outcome.message());
        assertEquals("why does b fail", outcome.snapshot().output("n3").payload());
        assertEquals(NodeStatus.SKIPPED, outcome.snapshot().status("n2"));
        assertTrue(prompt.messages().contains("Node failed: n2 b [BACKEND] boom"), prompt.transcript());
        assertTrue(prompt.messages().contains("Holding before n2 b"), prompt.transcript());
        assertEquals(1, steps.calls("b"));
    }

    @Test
    void stayingCommandsAskAgain() {
        var prompt = new ScriptedPrompt("variables", "retry");
        var attempts = new int[1];
        var steps = new StubSteps().echoing("a").on("b", request ->
            ++attempts[0] == 1 ? StepResult.failure("flaky") : StepResult.success("fine"));

        var outcome = run("a -> b", steps, prompt);

        assertEquals(RunOutcome.Status.COMPLETED, outcome.status());
        assertEquals(2, steps.calls("b"));
        assertTrue(prompt.messages().contains("No variables captured yet."), prompt.transcript());
        assertEquals(0, prompt.remaining());
    }

    @Test
    void closedInputAbortsTheRun() {
        var prompt = new ScriptedPrompt();
        var steps = new StubSteps().failing("a", "boom");

        var outcome = run("a -> b", steps, prompt);

        assertEquals(RunOutcome.Status.ABORTED, outcome.status());
        assertEquals("Operator input closed while paused at n1", outcome.message());
    }

    private RunOutcome run(String source, StubSteps steps, ScriptedPrompt prompt) {
        var settings = EngineSettings.defaults();
        var steering = new InteractiveSteering(new SteeringContext(prompt, compiler, settings, new SnapshotStack()));
        return new ExecutionEngine(steps.registry(), settings).run(compiler.compile(source).graph(), steering);
    }
}
