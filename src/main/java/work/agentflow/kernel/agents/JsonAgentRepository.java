package work.agentflow.kernel.agents;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.shared.DurationParser;

/**
 * Stores defined agents as a pretty-printed JSON array. A missing file is an empty registry.
 */
public final class JsonAgentRepository implements AgentRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonAgentRepository.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();
    private static final TypeReference<List<Map<String, Object>>> LIST_TYPE = new TypeReference<>() {};

    private final Path file;

    public JsonAgentRepository(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    @Override
    public List<AgentDefinition> load() {
        if (!Files.isRegularFile(file)) {
            log.debug("Agent registry {} does not exist yet", file);
            return new ArrayList<>();
        }
        try {
            var raw = JSON.readValue(file.toFile(), LIST_TYPE);
            var definitions = new ArrayList<AgentDefinition>();
            for (var entry : raw) {
                definitions.add(fromMap(entry));
            }
            log.debug("Loaded {} defined agents from {}", definitions.size(), file);
            return definitions;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read agent registry: " + file, ex);
        }
    }

    @Override
    public void save(List<AgentDefinition> definitions) {
        var serializable = new ArrayList<Map<String, Object>>();
        for (var definition : definitions) {
            serializable.add(toMap(definition));
        }
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON_WRITER.writeValue(file.toFile(), serializable);
            log.info("Saved {} defined agents to {}", definitions.size(), file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write agent registry: " + file, ex);
        }
    }

    static Map<String, Object> toMap(AgentDefinition definition) {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", definition.name());
        map.put("description", definition.description());
        map.put("prompt", definition.prompt());
        if (definition.model() != null) {
            map.put("model", definition.model());
        }
        if (definition.timeout() != null) {
            map.put("timeout", DurationParser.format(definition.timeout()));
        }
        if (!definition.command().isEmpty()) {
            map.put("command", definition.command());
        }
        return map;
    }

    static AgentDefinition fromMap(Map<String, Object> map) {
        var name = map.get("name") instanceof String s && !s.isBlank() ? s : null;
        if (name == null) {
            throw new IllegalStateException("Agent registry entry without a name: " + map);
        }
        var command = new ArrayList<String>();
        if (map.get("command") instanceof List<?> list) {
            for (var part : list) {
                command.add(String.valueOf(part));
            }
        }
        return new AgentDefinition(
            name,
            AgentKind.DEFINED,
            asString(map.get("description")),
            asString(map.get("prompt")),
            asString(map.get("model")),
            DurationParser.parse(asString(map.get("timeout"))).orElse(null),
            command
        );
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
