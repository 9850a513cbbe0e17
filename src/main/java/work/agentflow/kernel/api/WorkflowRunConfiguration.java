package work.agentflow.kernel.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.agentflow.kernel.config.FailurePolicy;

/**
 * Immutable configuration for one {@link WorkflowRunner} invocation. Empty optionals fall back to
 * {@code agentflow.toml}, then to built-in defaults.
 */
public record WorkflowRunConfiguration(
    WorkflowSource source,
    Path workingDirectory,
    Optional<Path> configFile,
    Optional<Path> registryFile,
    Optional<Integer> concurrency,
    Optional<Duration> nodeTimeout,
    Optional<FailurePolicy> failurePolicy,
    boolean interactive,
    boolean watch,
    LogLevel logLevel
) {
    public WorkflowRunConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(registryFile, "registryFile");
        Objects.requireNonNull(concurrency, "concurrency");
        Objects.requireNonNull(nodeTimeout, "nodeTimeout");
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WorkflowSource source;
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private Optional<Path> configFile = Optional.empty();
        private Optional<Path> registryFile = Optional.empty();
        private Optional<Integer> concurrency = Optional.empty();
        private Optional<Duration> nodeTimeout = Optional.empty();
        private Optional<FailurePolicy> failurePolicy = Optional.empty();
        private boolean interactive;
        private boolean watch;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder source(WorkflowSource source) {
            this.source = source;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder configFile(Optional<Path> configFile) {
            this.configFile = configFile;
            return this;
        }

        public Builder registryFile(Optional<Path> registryFile) {
            this.registryFile = registryFile;
            return this;
        }

        public Builder concurrency(Optional<Integer> concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder nodeTimeout(Optional<Duration> nodeTimeout) {
            this.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder failurePolicy(Optional<FailurePolicy> failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder interactive(boolean interactive) {
            this.interactive = interactive;
            return this;
        }

        public Builder watch(boolean watch) {
            this.watch = watch;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public WorkflowRunConfiguration build() {
            return new WorkflowRunConfiguration(
                source,
                workingDirectory,
                configFile,
                registryFile,
                concurrency,
                nodeTimeout,
                failurePolicy,
                interactive,
                watch,
                logLevel
            );
        }
    }
}
