package work.agentflow.kernel.runtime;

/**
 * Called by the scheduler at every pause, never while a node is executing.
 */
@FunctionalInterface
public interface SteeringHandler {
    Decision onPause(Pause pause);

    record Decision(boolean abort, String message) {
        public static Decision resume() {
            return new Decision(false, null);
        }

        public static Decision abort(String message) {
            return new Decision(true, message);
        }
    }
}
