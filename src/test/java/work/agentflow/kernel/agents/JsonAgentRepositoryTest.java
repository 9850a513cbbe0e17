package work.agentflow.kernel.agents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonAgentRepositoryTest {
    @TempDir
    Path tempDir;

    @Test
    void missingFileIsEmptyRegistry() {
        assertTrue(new JsonAgentRepository(tempDir.resolve("agents.json")).load().isEmpty());
    }

    @Test
    void savesPrettyJsonAndReadsItBack() throws Exception {
        var file = tempDir.resolve("nested/agents.json");
        var repository = new JsonAgentRepository(file);
        repository.save(List.of(new AgentDefinition(
            "reviewer",
            AgentKind.TEMPORARY,
            "Reviews diffs",
            "Output format: bullet list",
            "large",
            Duration.ofSeconds(90),
            List.of("review-tool", "--strict")
        )));

        var json = Files.readString(file);
        assertTrue(json.contains("\"timeout\" : \"90s\""), json);

        var loaded = repository.load();
        assertEquals(1, loaded.size());
        var reviewer = loaded.get(0);
        assertEquals(AgentKind.DEFINED, reviewer.kind());
        assertEquals("large", reviewer.model());
        assertEquals(Duration.ofSeconds(90), reviewer.timeout());
        assertEquals(List.of("review-tool", "--strict"), reviewer.command());
    }

    @Test
    void entryWithoutNameIsRejected() throws Exception {
        var file = tempDir.resolve("agents.json");
        Files.writeString(file, "[{\"description\": \"nameless\"}]");
        assertThrows(IllegalStateException.class, () -> new JsonAgentRepository(file).load());
    }
}
