package work.agentflow.kernel.steering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;
import work.agentflow.kernel.runtime.Pause;

/**
 * Stores steering commands by name, in registration order.
 */
public final class CommandRegistry {
    private static final BiPredicate<SteeringContext, Pause> ALWAYS = (context, pause) -> true;

    private final Map<String, Entry> commands = new ConcurrentHashMap<>();
    private final List<String> order = Collections.synchronizedList(new ArrayList<>());

    public CommandRegistry register(String name, String description, SteeringCommand command) {
        return register(name, description, ALWAYS, command);
    }

    /**
     * @param available precondition; commands whose precondition fails are not offered
     */
    public CommandRegistry register(String name, String description, BiPredicate<SteeringContext, Pause> available, SteeringCommand command) {
        if (commands.put(name, new Entry(name, description, available == null ? ALWAYS : available, command)) == null) {
            order.add(name);
        }
        return this;
    }

    public Entry get(String name) {
        return commands.get(name);
    }

    public List<String> names() {
        return List.copyOf(order);
    }

    /**
     * Commands whose precondition holds for this pause, in registration order.
     */
    public List<Entry> available(SteeringContext context, Pause pause) {
        var result = new ArrayList<Entry>();
        for (var name : names()) {
            var entry = commands.get(name);
            if (entry != null && entry.available().test(context, pause)) {
                result.add(entry);
            }
        }
        return result;
    }

    public record Entry(String name, String description, BiPredicate<SteeringContext, Pause> available, SteeringCommand command) {}
}
