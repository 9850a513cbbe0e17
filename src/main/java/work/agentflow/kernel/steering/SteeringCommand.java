package work.agentflow.kernel.steering;

import work.agentflow.kernel.runtime.Pause;

/**
 * Represents a command the operator can issue while the run is paused.
 */
@FunctionalInterface
public interface SteeringCommand {
    SteeringOutcome execute(SteeringContext context, Pause pause);
}
