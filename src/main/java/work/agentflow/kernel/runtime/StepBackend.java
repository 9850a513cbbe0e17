package work.agentflow.kernel.runtime;

/**
 * Executes steps on behalf of the engine. Called from worker threads, so implementations must be
 * thread-safe. Exceptions are recorded as node failures of kind {@link ErrorKind#EXCEPTION}.
 */
public interface StepBackend {
    StepResult invoke(StepRequest request) throws Exception;
}
