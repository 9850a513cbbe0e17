package work.agentflow.kernel.cli;

import java.nio.file.Path;
import java.util.Optional;
import picocli.CommandLine;
import work.agentflow.kernel.api.LogLevel;

/**
 * Options shared by every subcommand.
 */
final class CommonOptions {
    @CommandLine.Option(
        names = {"-C", "--workdir"},
        description = "Directory that relative paths, agentflow.toml and the agent registry resolve against (default: current directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path workingDirectory;

    @CommandLine.Option(
        names = "--config",
        description = "Configuration file (default: <workdir>/agentflow.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path configFile;

    @CommandLine.Option(
        names = "--registry",
        description = "Agent registry JSON file (default: [registry] path or <workdir>/.agentflow/agents.json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path registryFile;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    Path workingDirectory() {
        var dir = workingDirectory != null ? workingDirectory : Path.of("");
        return dir.toAbsolutePath().normalize();
    }

    Optional<Path> configFile() {
        return Optional.ofNullable(configFile);
    }

    Optional<Path> registryFile() {
        return Optional.ofNullable(registryFile);
    }

    LogLevel logLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("AGENTFLOW_LOG_LEVEL");
        }
        return LogLevel.from(candidate);
    }
}
