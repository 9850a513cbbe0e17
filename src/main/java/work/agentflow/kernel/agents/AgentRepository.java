package work.agentflow.kernel.agents;

import java.util.List;

/**
 * Persistence of defined (reusable) agents. The storage format belongs to the implementation.
 */
public interface AgentRepository {

    List<AgentDefinition> load();

    void save(List<AgentDefinition> definitions);

    /**
     * Repository that keeps definitions in memory only.
     */
    static AgentRepository inMemory(List<AgentDefinition> initial) {
        return new InMemoryAgentRepository(initial);
    }
}
