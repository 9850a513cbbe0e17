package work.agentflow.kernel.runtime;

/**
 * Observes a run. Callbacks arrive on the scheduler thread; exceptions are logged and ignored.
 */
public interface RunListener {
    default void onTransition(NodeTransition transition, ExecutionSnapshot snapshot) {}

    default void onPause(Pause.Kind kind, String nodeId, ExecutionSnapshot snapshot) {}

    default void onFinish(RunOutcome outcome) {}
}
