package work.agentflow.kernel.agents;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reusable step definition: what an agent is for and, optionally, how to run it.
 *
 * @param command external command for process-backed agents; empty when another backend serves the name
 */
public record AgentDefinition(
    String name,
    AgentKind kind,
    String description,
    String prompt,
    String model,
    Duration timeout,
    List<String> command
) {
    public AgentDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        description = description == null ? "" : description;
        prompt = prompt == null ? "" : prompt;
        command = command == null ? List.of() : List.copyOf(command);
    }

    public static AgentDefinition named(String name, AgentKind kind) {
        return new AgentDefinition(name, kind, "", "", null, null, List.of());
    }

    public AgentDefinition withKind(AgentKind newKind) {
        return new AgentDefinition(name, newKind, description, prompt, model, timeout, command);
    }
}
