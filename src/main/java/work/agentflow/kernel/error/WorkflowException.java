package work.agentflow.kernel.error;

/**
 * Base exception carrying a machine-readable code and an actionable hint for the operator.
 */
public class WorkflowException extends RuntimeException {
    private final String code;
    private final String hint;

    public WorkflowException(String code, String message, String hint) {
        super(message);
        this.code = code;
        this.hint = hint;
    }

    public WorkflowException(String code, String message, String hint, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.hint = hint;
    }

    public String code() {
        return code;
    }

    public String hint() {
        return hint;
    }

    /**
     * Message followed by the hint, the form shown to operators.
     */
    public String describe() {
        if (hint == null || hint.isBlank()) {
            return getMessage();
        }
        return getMessage() + System.lineSeparator() + "  hint: " + hint;
    }
}
