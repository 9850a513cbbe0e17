package work.agentflow.kernel.runtime;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-invocation options.
 *
 * @param model model hint from the agent definition, may be {@code null}
 * @param timeout deadline enforced by the engine, may be {@code null}
 */
public record StepOptions(String model, Duration timeout, CancellationToken cancellation) {
    public StepOptions {
        Objects.requireNonNull(cancellation, "cancellation");
    }

    public Optional<String> maybeModel() {
        return Optional.ofNullable(model);
    }

    public Optional<Duration> maybeTimeout() {
        return Optional.ofNullable(timeout);
    }
}
