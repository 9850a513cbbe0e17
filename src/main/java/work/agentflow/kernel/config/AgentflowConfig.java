package work.agentflow.kernel.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.agentflow.kernel.agents.AgentDefinition;

/**
 * Everything read from {@code agentflow.toml}.
 *
 * @param registryPath location of the JSON agent registry, resolved against the config file
 * @param agents agents declared under {@code [agents.<name>]}, usually process-backed
 */
public record AgentflowConfig(EngineSettings engine, Optional<Path> registryPath, List<AgentDefinition> agents) {
    public static final String FILE_NAME = "agentflow.toml";

    public AgentflowConfig {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(registryPath, "registryPath");
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    public static AgentflowConfig defaults() {
        return new AgentflowConfig(EngineSettings.defaults(), Optional.empty(), List.of());
    }
}
