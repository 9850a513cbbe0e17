package work.agentflow.kernel.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.agentflow.kernel.agents.AgentDefinition;
import work.agentflow.kernel.agents.AgentKind;
import work.agentflow.kernel.error.WorkflowException;
import work.agentflow.kernel.shared.DurationParser;

/**
 * Reads {@code agentflow.toml}:
 *
 * <pre>
 * [engine]
 * concurrency = 5
 * node-timeout = "2m"
 * failure-policy = "retry"
 * max-retries = 2
 *
 * [registry]
 * path = ".agentflow/agents.json"
 *
 * [agents.reviewer]
 * command = ["claude", "-p"]
 * model = "sonnet"
 * </pre>
 *
 * A missing file yields {@link AgentflowConfig#defaults()}.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CODE = "config_error";

    private ConfigLoader() {}

    public static AgentflowConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("No configuration at {}, using defaults", path);
            return AgentflowConfig.defaults();
        }
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new WorkflowException(CODE, "Failed to read configuration " + path, "Check the file permissions.", ex);
        }
        var base = path.toAbsolutePath().getParent();
        return parse(text, base, path.toString());
    }

    /**
     * @param base directory that relative paths resolve against, may be {@code null}
     */
    public static AgentflowConfig parse(String text, Path base, String origin) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            var first = result.errors().get(0);
            throw new WorkflowException(
                CODE,
                "Invalid configuration " + origin + ": " + first.getMessage(),
                "Fix the TOML syntax near line " + first.position().line() + "."
            );
        }
        var engine = readEngine(result.getTable("engine"), origin);
        var registry = Optional.ofNullable(result.getTable("registry"))
            .map(table -> table.getString("path"))
            .filter(value -> !value.isBlank())
            .map(Path::of)
            .map(p -> base == null || p.isAbsolute() ? p : base.resolve(p));
        var agents = readAgents(result.getTable("agents"), origin);
        log.debug("Loaded configuration from {}: {}", origin, engine);
        return new AgentflowConfig(engine, registry, agents);
    }

    private static EngineSettings readEngine(TomlTable table, String origin) {
        var builder = EngineSettings.builder();
        if (table == null) {
            return builder.build();
        }
        try {
            var concurrency = table.getLong("concurrency");
            if (concurrency != null) {
                builder.concurrency(Math.toIntExact(concurrency));
            }
            builder.nodeTimeout(duration(table, "node-timeout"));
            var mode = FailurePolicy.Mode.from(table.getString("failure-policy"));
            var retries = table.getLong("max-retries");
            builder.failurePolicy(new FailurePolicy(mode, retries == null ? 0 : Math.toIntExact(retries)));
            var loops = table.getLong("max-loop-iterations");
            if (loops != null) {
                builder.maxLoopIterations(Math.toIntExact(loops));
            }
            var truncate = table.getLong("truncate-limit");
            if (truncate != null) {
                builder.truncateLimit(Math.toIntExact(truncate));
            }
            var strict = table.getBoolean("strict-conditions");
            if (strict != null) {
                builder.strictConditions(strict);
            }
            var debugAgent = table.getString("debug-agent");
            if (debugAgent != null && !debugAgent.isBlank()) {
                builder.debugAgent(debugAgent.trim());
            }
            return builder.build();
        } catch (IllegalArgumentException | TomlInvalidTypeException ex) {
            throw new WorkflowException(CODE, "Invalid [engine] setting in " + origin + ": " + ex.getMessage(), "See the [engine] keys documented in agentflow.toml.", ex);
        }
    }

    private static List<AgentDefinition> readAgents(TomlTable table, String origin) {
        var agents = new ArrayList<AgentDefinition>();
        if (table == null) {
            return agents;
        }
        for (var name : table.keySet()) {
            var agent = table.getTable(name);
            if (agent == null) {
                throw new WorkflowException(CODE, "Agent '" + name + "' in " + origin + " must be a table", "Declare it as [agents." + name + "].");
            }
            var command = new ArrayList<String>();
            TomlArray array = agent.isArray("command") ? agent.getArray("command") : null;
            if (array != null) {
                for (int i = 0; i < array.size(); i++) {
                    command.add(String.valueOf(array.get(i)));
                }
            } else if (agent.isString("command")) {
                for (var part : agent.getString("command").trim().split("\\s+")) {
                    command.add(part);
                }
            }
            Duration timeout;
            try {
                timeout = duration(agent, "timeout").orElse(null);
            } catch (IllegalArgumentException ex) {
                throw new WorkflowException(CODE, "Agent '" + name + "' in " + origin + ": " + ex.getMessage(), null, ex);
            }
            agents.add(new AgentDefinition(
                name,
                AgentKind.DEFINED,
                agent.getString("description"),
                agent.getString("prompt"),
                agent.getString("model"),
                timeout,
                command
            ));
        }
        return agents;
    }

    /**
     * Strings use the duration syntax, bare integers are milliseconds.
     */
    private static Optional<Duration> duration(TomlTable table, String key) {
        if (table.isLong(key)) {
            return Optional.of(Duration.ofMillis(table.getLong(key)));
        }
        if (table.isString(key)) {
            return DurationParser.parse(table.getString(key));
        }
        return Optional.empty();
    }
}
