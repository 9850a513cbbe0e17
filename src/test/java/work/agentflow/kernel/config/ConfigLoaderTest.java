package work.agentflow.kernel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.agentflow.kernel.agents.AgentDefinition;
import work.agentflow.kernel.error.WorkflowException;

class ConfigLoaderTest {

    @Test
    void loadsEngineRegistryAndAgents() throws Exception {
        var path = Path.of(getClass().getResource("/workflows/agentflow.toml").toURI());
        var config = ConfigLoader.load(path);

        var engine = config.engine();
        assertEquals(2, engine.concurrency());
        assertEquals(Optional.of(Duration.ofSeconds(45)), engine.nodeTimeout());
        assertEquals(FailurePolicy.retry(3), engine.failurePolicy());
        assertEquals(4, engine.maxLoopIterations());
        assertTrue(engine.strictConditions());
        assertEquals(path.toAbsolutePath().getParent().resolve("registry/agents.json"), config.registryPath().orElseThrow());

        var analyzer = agent(config, "analyzer");
        assertEquals(List.of("cat"), analyzer.command());
        assertEquals(Duration.ofMillis(1500), analyzer.timeout());
        assertEquals("Echoes its instruction", analyzer.description());
        var fixer = agent(config, "fixer");
        assertEquals(List.of("cat", "-"), fixer.command());
        assertEquals("large", fixer.model());
        assertEquals(3, config.agents().size());
    }

    @Test
    void missingFileMeansDefaults(@TempDir Path dir) {
        var config = ConfigLoader.load(dir.resolve(AgentflowConfig.FILE_NAME));
        assertEquals(AgentflowConfig.defaults(), config);
        assertEquals(EngineSettings.DEFAULT_CONCURRENCY, config.engine().concurrency());
    }

    @Test
    void invalidTomlIsAConfigError() {
        var ex = assertThrows(WorkflowException.class, () -> ConfigLoader.parse("[engine\nconcurrency = 2", null, "broken.toml"));
        assertEquals(ConfigLoader.CODE, ex.code());
        assertTrue(ex.getMessage().startsWith("Invalid configuration broken.toml"), ex.getMessage());
    }

    @Test
    void unknownFailurePolicyIsAConfigError() {
        var ex = assertThrows(WorkflowException.class,
            () -> ConfigLoader.parse("[engine]\nfailure-policy = \"pray\"", null, "agentflow.toml"));
        assertEquals(ConfigLoader.CODE, ex.code());
        assertTrue(ex.getMessage().contains("Unknown failure policy 'pray'"), ex.getMessage());
    }

    @Test
    void zeroConcurrencyIsRejected() {
        var ex = assertThrows(WorkflowException.class,
            () -> ConfigLoader.parse("[engine]\nconcurrency = 0", null, "agentflow.toml"));
        assertTrue(ex.getMessage().contains("concurrency must be at least 1"), ex.getMessage());
    }

    private static AgentDefinition agent(AgentflowConfig config, String name) {
        return config.agents().stream().filter(agent -> agent.name().equals(name)).findFirst().orElseThrow();
    }
}
