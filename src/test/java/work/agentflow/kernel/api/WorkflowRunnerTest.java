package work.agentflow.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.kernel.agents.JsonAgentRepository;
import work.agentflow.kernel.runtime.StepResult;
import work.agentflow.kernel.support.ScriptedPrompt;

class WorkflowRunnerTest {
    @TempDir
    Path workdir;

    private final StringWriter output = new StringWriter();
    private ScriptedPrompt prompt;

    @BeforeEach
    void setUp() {
        prompt = new ScriptedPrompt();
    }

    @Test
    void runsInlineWorkflowWithBuiltins() {
        var result = runner().run(inline("echo:\"3 issues\":bugs -> echo:\"fix {bugs}\":fixed").build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals("completed", result.metadata().get("status"));
        assertEquals(Map.of("bugs", "3 issues", "fixed", "fix 3 issues"), result.metadata().get("variables"));
        assertEquals("Workflow completed: 2 completed, 0 skipped", result.metadata().get("message"));
        assertEquals(2, ((List<?>) result.metadata().get("nodes")).size());
    }

    @Test
    void syntaxErrorIsInvalid() {
        var result = runner().run(inline("echo -> [noop").build());

        assertEquals(RunResult.Status.INVALID, result.status());
        assertEquals(3, result.status().exitCode());
        assertTrue(result.metadata().containsKey("error"));
    }

    @Test
    void unknownStepIsInvalidWithIssues() {
        var result = runner().run(inline("echo -> deploy").build());

        assertEquals(RunResult.Status.INVALID, result.status());
        var issues = (List<?>) result.metadata().get("issues");
        assertTrue(issues.stream().anyMatch(issue -> issue.toString().contains("deploy")), issues.toString());
    }

    @Test
    void checkValidatesWithoutRunning() {
        var ok = runner().check(inline("echo -> noop").build());
        assertEquals(RunResult.Status.SUCCESS, ok.status());
        assertEquals("ok", ok.metadata().get("status"));

        var broken = runner().check(inline("echo -> deploy").build());
        assertEquals(RunResult.Status.INVALID, broken.status());
        assertEquals("Workflow has 1 error(s)", broken.metadata().get("error"));
    }

    @Test
    void temporaryAgentsWithoutBackendFailUnlessFallbackServesThem() throws Exception {
        var document = copyResource("review.yaml");
        var configuration = WorkflowRunConfiguration.builder()
            .source(WorkflowSource.forFile(document.getFileName()))
            .workingDirectory(workdir)
            .build();

        var failed = runner().run(configuration);
        assertEquals(RunResult.Status.FAILURE, failed.status());
        assertTrue(failed.metadata().get("error").toString().contains("No step function registered for agent 'scanner'"));

        var served = new WorkflowRunner(prompt, new PrintWriter(output, true), request -> StepResult.success(request.stepName() + " ok"))
            .run(configuration);
        assertEquals(RunResult.Status.SUCCESS, served.status());
        assertEquals("scanner ok", ((Map<?, ?>) served.metadata().get("variables")).get("findings"));
    }

    @Test
    void promotionWritesTheRegistry() throws Exception {
        var document = copyResource("review.yaml");
        var configuration = WorkflowRunConfiguration.builder()
            .source(WorkflowSource.forFile(document))
            .workingDirectory(workdir)
            .build();
        var runner = runner();

        var suggestions = runner.suggestPromotions(configuration);
        assertTrue(suggestions.get(0).recommended());
        assertFalse(suggestions.get(1).recommended());

        var report = runner.promote(configuration, List.of("scanner"));
        assertEquals(List.of("scanner"), report.promoted());
        assertEquals(List.of("formatter"), report.discarded());

        var registry = workdir.resolve(WorkflowRunner.DEFAULT_REGISTRY);
        assertTrue(Files.isRegularFile(registry));
        assertEquals("scanner", new JsonAgentRepository(registry).load().get(0).name());
    }

    @Test
    void watchDrawsTheGraph() {
        var result = runner().run(inline("echo:\"hi\" -> noop").watch(true).build());

        assertTrue(result.isSuccess());
        assertTrue(output.toString().contains("✓ n1 echo \"hi\""), output.toString());
    }

    @Test
    void interactiveRunAsksAtCheckpoints() {
        prompt = new ScriptedPrompt("continue");
        var result = runner().run(inline("echo:\"draft\" -> @review -> echo:\"final\"").interactive(true).build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertTrue(prompt.messages().contains("Checkpoint reached: n2 @review"));
    }

    @Test
    void operatorCanQuit() {
        prompt = new ScriptedPrompt("quit", "yes");
        var result = runner().run(inline("echo:\"draft\" -> @review -> echo:\"final\"").interactive(true).build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("Run aborted by operator (1 pending, 1 executing, 1 completed)", result.metadata().get("message"));
        assertEquals(List.of("n2", "n3"), result.metadata().get("unfinished"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void configuredAgentsRunAsProcesses() throws Exception {
        Files.writeString(workdir.resolve("agentflow.toml"), "[agents.shout]\ncommand = [\"tr\", \"a-z\", \"A-Z\"]\n");

        var result = runner().run(inline("shout:\"hello\":loud").build());

        assertEquals(RunResult.Status.SUCCESS, result.status(), String.valueOf(result.metadata().get("error")));
        assertEquals("HELLO", ((Map<?, ?>) result.metadata().get("variables")).get("loud"));
    }

    @Test
    void brokenConfigurationIsReported() throws Exception {
        Files.writeString(workdir.resolve("agentflow.toml"), "[engine]\nfailure-policy = \"pray\"\n");

        var result = runner().run(inline("echo").build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("config_error", result.metadata().get("code"));
    }

    private WorkflowRunner runner() {
        return new WorkflowRunner(prompt, new PrintWriter(output, true), null);
    }

    private WorkflowRunConfiguration.Builder inline(String syntax) {
        return WorkflowRunConfiguration.builder()
            .source(WorkflowSource.forInline(syntax))
            .workingDirectory(workdir);
    }

    private Path copyResource(String name) throws Exception {
        var target = workdir.resolve(name);
        try (var in = getClass().getResourceAsStream("/workflows/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }
}
