package work.agentflow.kernel.runtime;

/**
 * Cooperative cancellation flag handed to every step invocation.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new StepCancelledException("Step invocation cancelled");
        }
    }

    public static final class StepCancelledException extends RuntimeException {
        public StepCancelledException(String message) {
            super(message);
        }
    }
}
