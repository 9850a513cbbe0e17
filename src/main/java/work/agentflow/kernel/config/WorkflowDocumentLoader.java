package work.agentflow.kernel.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import work.agentflow.kernel.agents.AgentDefinition;
import work.agentflow.kernel.agents.AgentKind;
import work.agentflow.kernel.error.WorkflowException;
import work.agentflow.kernel.shared.DurationParser;

/**
 * Loads workflow documents. {@code .yaml}/{@code .yml} files carry a {@code workflow:} text and
 * an optional {@code agents:} list of temporary agents; any other file is plain workflow syntax.
 */
public final class WorkflowDocumentLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String CODE = "document_error";

    private WorkflowDocumentLoader() {}

    public static WorkflowDocument load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new WorkflowException(CODE, "Failed to read workflow " + path, "Check that the file exists and is readable.", ex);
        }
        var name = path.getFileName() == null ? path.toString() : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return parseYaml(text, path.toString());
        }
        return new WorkflowDocument(text, List.of(), path.toString());
    }

    public static WorkflowDocument parseYaml(String yaml, String origin) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException ex) {
            throw new WorkflowException(CODE, "Invalid YAML in " + origin + ": " + ex.getMessage(), "Fix the YAML syntax.", ex);
        }
        if (root == null || !root.hasNonNull("workflow") || !root.get("workflow").isTextual()) {
            throw new WorkflowException(CODE, "Workflow document " + origin + " has no 'workflow' text", "Add a 'workflow:' key holding the workflow syntax.");
        }
        var agents = new ArrayList<AgentDefinition>();
        var agentsNode = root.get("agents");
        if (agentsNode != null && !agentsNode.isNull()) {
            if (!agentsNode.isArray()) {
                throw new WorkflowException(CODE, "'agents' in " + origin + " must be a list", "Write each agent as a '- name: ...' entry.");
            }
            for (var agentNode : agentsNode) {
                agents.add(toAgent(agentNode, origin));
            }
        }
        return new WorkflowDocument(root.get("workflow").asText(), agents, origin);
    }

    public static boolean isDocumentError(WorkflowException ex) {
        return CODE.equals(ex.code());
    }

    private static AgentDefinition toAgent(JsonNode node, String origin) {
        var name = text(node, "name");
        if (name == null || name.isBlank()) {
            throw new WorkflowException(CODE, "Agent without a name in " + origin, "Every entry under 'agents' needs 'name'.");
        }
        var command = new ArrayList<String>();
        var commandNode = node.get("command");
        if (commandNode != null && commandNode.isArray()) {
            commandNode.forEach(part -> command.add(part.asText()));
        } else if (commandNode != null && commandNode.isTextual()) {
            command.addAll(List.of(commandNode.asText().trim().split("\\s+")));
        }
        Duration timeout = null;
        var timeoutNode = node.get("timeout");
        if (timeoutNode != null && timeoutNode.isNumber()) {
            timeout = Duration.ofMillis(timeoutNode.asLong());
        } else if (timeoutNode != null && !timeoutNode.isNull()) {
            try {
                timeout = DurationParser.parse(timeoutNode.asText()).orElse(null);
            } catch (IllegalArgumentException ex) {
                throw new WorkflowException(CODE, "Agent '" + name + "' in " + origin + ": " + ex.getMessage(), null, ex);
            }
        }
        return new AgentDefinition(
            name.trim(),
            AgentKind.TEMPORARY,
            text(node, "description"),
            text(node, "prompt"),
            text(node, "model"),
            timeout,
            command
        );
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
