package work.agentflow.kernel.runtime;

public enum NodeStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    SKIPPED;

    /**
     * Terminal for edge evaluation: downstream nodes may decide on this status.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED;
    }

    public String symbol() {
        return switch (this) {
            case PENDING -> "○";
            case EXECUTING -> "●";
            case COMPLETED -> "✓";
            case FAILED -> "✗";
            case SKIPPED -> "⊗";
        };
    }
}
