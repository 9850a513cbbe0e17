package work.agentflow.kernel.runtime;

/**
 * Why a node invocation failed.
 */
public enum ErrorKind {
    /** The backend answered with {@code success=false}. */
    BACKEND,
    TIMEOUT,
    /** Interpolation failed before the backend was called. */
    VARIABLE,
    CANCELLED,
    /** The backend threw. */
    EXCEPTION
}
