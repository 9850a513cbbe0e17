package work.agentflow.kernel.runtime;

/**
 * Represents an executable step registered in the step registry.
 */
@FunctionalInterface
public interface StepFunction {
    StepResult invoke(StepRequest request) throws Exception;
}
