package work.agentflow.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.Set;

/**
 * Steps that ship with the kernel and need no configuration.
 */
public final class BuiltinSteps {
    public static final String ECHO = "echo";
    public static final String NOOP = "noop";
    public static final String DIAGNOSE = "diagnose";

    public static final Set<String> NAMES = Set.of(ECHO, NOOP, DIAGNOSE);

    private BuiltinSteps() {}

    public static StepRegistry register(StepRegistry registry) {
        registry.register(ECHO, BuiltinSteps::echo, "returns its instruction as payload");
        registry.register(NOOP, BuiltinSteps::noop, "succeeds without output");
        registry.register(DIAGNOSE, BuiltinSteps::diagnose, "reports the diagnostic request it received");
        return registry;
    }

    private static StepResult echo(StepRequest request) {
        request.options().cancellation().throwIfCancelled();
        return StepResult.success(request.instructionOrEmpty());
    }

    private static StepResult noop(StepRequest request) {
        return StepResult.success(null);
    }

    private static StepResult diagnose(StepRequest request) {
        request.options().cancellation().throwIfCancelled();
        var report = new LinkedHashMap<String, Object>();
        report.put("node", request.nodeId());
        report.put("request", request.instructionOrEmpty());
        request.options().maybeModel().ifPresent(model -> report.put("model", model));
        return StepResult.success(report);
    }
}
