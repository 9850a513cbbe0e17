package work.agentflow.kernel.agents;

import java.util.Optional;

/**
 * Result of looking a step name up in an {@link AgentDirectory}.
 */
public record AgentResolution(String name, boolean found, AgentKind kind, AgentDefinition definition) {

    public static AgentResolution found(AgentDefinition definition) {
        return new AgentResolution(definition.name(), true, definition.kind(), definition);
    }

    public static AgentResolution notFound(String name) {
        return new AgentResolution(name, false, null, null);
    }

    public Optional<AgentDefinition> maybeDefinition() {
        return Optional.ofNullable(definition);
    }
}
