package work.agentflow.kernel.steering;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.config.FailurePolicy;
import work.agentflow.kernel.runtime.Pause;
import work.agentflow.kernel.runtime.SteeringHandler;

/**
 * Steering without an operator: checkpoints and holds pass automatically, failures follow the
 * configured {@link FailurePolicy}.
 */
public final class UnattendedSteering implements SteeringHandler {
    private static final Logger log = LoggerFactory.getLogger(UnattendedSteering.class);

    private final FailurePolicy policy;

    public UnattendedSteering(FailurePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public FailurePolicy policy() {
        return policy;
    }

    @Override
    public Decision onPause(Pause pause) {
        var state = pause.state();
        var nodeId = pause.nodeId();
        switch (pause.kind()) {
            case CHECKPOINT, HOLD -> {
                log.info("Continuing automatically past {}", state.graph().node(nodeId).label());
                SteeringCommands.pass(state, nodeId);
                return Decision.resume();
            }
            case FAILURE -> {
                return onFailure(pause);
            }
        }
        throw new IllegalStateException("Unhandled pause kind: " + pause.kind());
    }

    private Decision onFailure(Pause pause) {
        var state = pause.state();
        var nodeId = pause.nodeId();
        var output = state.output(nodeId);
        var reason = output == null ? "unknown error" : "[" + output.errorKind() + "] " + output.error();
        var label = state.graph().node(nodeId).label();
        switch (policy.mode()) {
            case RETRY -> {
                int attempts = state.retryCount(nodeId);
                if (attempts < policy.maxRetries()) {
                    log.warn("{} failed, retry {}/{}: {}", label, attempts + 1, policy.maxRetries(), reason);
                    state.retry(nodeId);
                    return Decision.resume();
                }
                return Decision.abort("Node " + label + " failed after " + attempts + " retr" + (attempts == 1 ? "y" : "ies") + ": " + reason);
            }
            case SKIP -> {
                log.warn("{} failed, skipping: {}", label, reason);
                state.skip(nodeId);
                return Decision.resume();
            }
            case ABORT -> {
                return Decision.abort("Node " + label + " failed: " + reason);
            }
        }
        throw new IllegalStateException("Unhandled failure policy: " + policy.mode());
    }
}
