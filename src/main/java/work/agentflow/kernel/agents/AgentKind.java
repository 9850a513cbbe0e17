package work.agentflow.kernel.agents;

import java.util.Locale;

/**
 * Where an agent name was resolved from.
 */
public enum AgentKind {
    BUILTIN,
    DEFINED,
    TEMPORARY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
