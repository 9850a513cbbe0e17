package work.agentflow.kernel.steering;

import java.util.Objects;

/**
 * What a steering command asks the session to do next.
 */
public record SteeringOutcome(Signal signal, String message) {
    public SteeringOutcome {
        Objects.requireNonNull(signal, "signal");
    }

    public static SteeringOutcome resume(String message) {
        return new SteeringOutcome(Signal.RESUME, message);
    }

    public static SteeringOutcome stay(String message) {
        return new SteeringOutcome(Signal.STAY, message);
    }

    public static SteeringOutcome abort(String message) {
        return new SteeringOutcome(Signal.ABORT, message);
    }

    public enum Signal {
        /** Leave the pause and let the scheduler continue. */
        RESUME,
        /** Remain paused and ask for another command. */
        STAY,
        ABORT
    }
}
