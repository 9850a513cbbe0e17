package work.agentflow.kernel.agents;

import java.util.Collection;

/**
 * Name resolution for step names. A name that does not resolve is a compile-time error.
 */
public interface AgentDirectory {

    AgentResolution resolve(String name);

    /**
     * Every resolvable name, used for "did you mean" suggestions.
     */
    Collection<String> knownNames();
}
