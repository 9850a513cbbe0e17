package work.agentflow.kernel.agents;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves names against builtins, then workflow-local temporary agents, then defined agents.
 * Builtin names cannot be shadowed; temporary agents shadow defined ones of the same name.
 */
public final class LayeredAgentDirectory implements AgentDirectory {
    private final Map<String, AgentDefinition> builtins = new LinkedHashMap<>();
    private final Map<String, AgentDefinition> temporary = new LinkedHashMap<>();
    private final Map<String, AgentDefinition> defined = new LinkedHashMap<>();

    public LayeredAgentDirectory(Set<String> builtinNames, List<AgentDefinition> definedAgents, List<AgentDefinition> temporaryAgents) {
        if (builtinNames != null) {
            for (var name : builtinNames) {
                builtins.put(name, AgentDefinition.named(name, AgentKind.BUILTIN));
            }
        }
        if (definedAgents != null) {
            for (var definition : definedAgents) {
                defined.put(definition.name(), definition.withKind(AgentKind.DEFINED));
            }
        }
        if (temporaryAgents != null) {
            for (var definition : temporaryAgents) {
                temporary.put(definition.name(), definition.withKind(AgentKind.TEMPORARY));
            }
        }
    }

    @Override
    public AgentResolution resolve(String name) {
        if (name == null) {
            return AgentResolution.notFound(null);
        }
        var builtin = builtins.get(name);
        if (builtin != null) {
            return AgentResolution.found(builtin);
        }
        var temp = temporary.get(name);
        if (temp != null) {
            return AgentResolution.found(temp);
        }
        var def = defined.get(name);
        if (def != null) {
            return AgentResolution.found(def);
        }
        return AgentResolution.notFound(name);
    }

    @Override
    public Collection<String> knownNames() {
        var names = new LinkedHashSet<String>();
        names.addAll(builtins.keySet());
        names.addAll(temporary.keySet());
        names.addAll(defined.keySet());
        return names;
    }

    public List<AgentDefinition> temporaryAgents() {
        return List.copyOf(temporary.values());
    }

    public List<AgentDefinition> definedAgents() {
        return List.copyOf(defined.values());
    }
}
