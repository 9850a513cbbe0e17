package work.agentflow.kernel.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores step functions by agent name and dispatches invocations to them.
 */
public final class StepRegistry implements StepBackend {
    private final Map<String, Entry> functions = new ConcurrentHashMap<>();
    private volatile StepFunction fallback;

    public StepRegistry register(String name, StepFunction fn) {
        return register(name, fn, null);
    }

    public StepRegistry register(String name, StepFunction fn, String description) {
        functions.put(name, new Entry(name, fn, description));
        return this;
    }

    /**
     * Function used for agent names that have no registration of their own.
     */
    public StepRegistry setFallback(StepFunction fn) {
        this.fallback = fn;
        return this;
    }

    public Entry get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    @Override
    public StepResult invoke(StepRequest request) throws Exception {
        var entry = functions.get(request.stepName());
        if (entry != null) {
            return entry.function().invoke(request);
        }
        var fn = fallback;
        if (fn != null) {
            return fn.invoke(request);
        }
        return StepResult.failure("No step function registered for agent '" + request.stepName() + "'");
    }

    public record Entry(String name, StepFunction function, String description) {}
}
