package work.agentflow.kernel.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.agentflow.kernel.variables.VariableInterpolator;

/**
 * Immutable engine tuning, read from the {@code [engine]} table of {@code agentflow.toml}.
 *
 * @param concurrency ceiling on simultaneously running step invocations
 * @param nodeTimeout default deadline for a step invocation when its agent has none
 * @param maxLoopIterations how often one back edge may fire before it is treated as blocked
 * @param truncateLimit maximum characters of an interpolated value
 * @param debugAgent agent used for diagnostic nodes inserted by the {@code debug} command
 */
public record EngineSettings(
    int concurrency,
    Optional<Duration> nodeTimeout,
    FailurePolicy failurePolicy,
    int maxLoopIterations,
    int truncateLimit,
    boolean strictConditions,
    String debugAgent
) {
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 10;
    public static final String DEFAULT_DEBUG_AGENT = "diagnose";

    public EngineSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        if (maxLoopIterations < 0) {
            throw new IllegalArgumentException("max-loop-iterations must not be negative: " + maxLoopIterations);
        }
        Objects.requireNonNull(nodeTimeout, "nodeTimeout");
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        Objects.requireNonNull(debugAgent, "debugAgent");
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .concurrency(concurrency)
            .nodeTimeout(nodeTimeout)
            .failurePolicy(failurePolicy)
            .maxLoopIterations(maxLoopIterations)
            .truncateLimit(truncateLimit)
            .strictConditions(strictConditions)
            .debugAgent(debugAgent);
    }

    public static final class Builder {
        private int concurrency = DEFAULT_CONCURRENCY;
        private Optional<Duration> nodeTimeout = Optional.empty();
        private FailurePolicy failurePolicy = FailurePolicy.abort();
        private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;
        private int truncateLimit = VariableInterpolator.DEFAULT_LIMIT;
        private boolean strictConditions;
        private String debugAgent = DEFAULT_DEBUG_AGENT;

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder nodeTimeout(Optional<Duration> nodeTimeout) {
            this.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder maxLoopIterations(int maxLoopIterations) {
            this.maxLoopIterations = maxLoopIterations;
            return this;
        }

        public Builder truncateLimit(int truncateLimit) {
            this.truncateLimit = truncateLimit;
            return this;
        }

        public Builder strictConditions(boolean strictConditions) {
            this.strictConditions = strictConditions;
            return this;
        }

        public Builder debugAgent(String debugAgent) {
            this.debugAgent = debugAgent;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(
                concurrency,
                nodeTimeout,
                failurePolicy,
                maxLoopIterations,
                truncateLimit,
                strictConditions,
                debugAgent
            );
        }
    }
}
