package work.agentflow.kernel.agents;

import java.util.ArrayList;
import java.util.List;

final class InMemoryAgentRepository implements AgentRepository {
    private volatile List<AgentDefinition> definitions;

    InMemoryAgentRepository(List<AgentDefinition> initial) {
        this.definitions = initial == null ? List.of() : List.copyOf(initial);
    }

    @Override
    public List<AgentDefinition> load() {
        return new ArrayList<>(definitions);
    }

    @Override
    public void save(List<AgentDefinition> updated) {
        this.definitions = updated == null ? List.of() : List.copyOf(updated);
    }
}
