package work.agentflow.kernel.runtime;

public record StepResult(boolean success, Object payload, String error) {
    public static StepResult success(Object payload) {
        return new StepResult(true, payload, null);
    }

    public static StepResult failure(String error) {
        return new StepResult(false, null, error);
    }

    public static StepResult failure(String error, Object payload) {
        return new StepResult(false, payload, error);
    }
}
