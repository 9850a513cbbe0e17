package work.agentflow.kernel.config;

import java.util.List;
import java.util.Objects;
import work.agentflow.kernel.agents.AgentDefinition;

/**
 * A workflow as loaded from disk: its syntax plus the temporary agents it declares.
 *
 * @param origin file name or other label used in messages
 */
public record WorkflowDocument(String source, List<AgentDefinition> temporaryAgents, String origin) {
    public WorkflowDocument {
        Objects.requireNonNull(source, "source");
        temporaryAgents = temporaryAgents == null ? List.of() : List.copyOf(temporaryAgents);
        origin = origin == null ? "<inline>" : origin;
    }

    public static WorkflowDocument of(String source) {
        return new WorkflowDocument(source, List.of(), null);
    }
}
