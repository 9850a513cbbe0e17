package work.agentflow.kernel.steering;

import java.util.ArrayList;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.runtime.Pause;
import work.agentflow.kernel.runtime.SteeringHandler;

/**
 * Asks the operator for commands until one of them resumes or aborts the run.
 */
public final class InteractiveSteering implements SteeringHandler {
    private static final Logger log = LoggerFactory.getLogger(InteractiveSteering.class);

    private final CommandRegistry commands;
    private final SteeringContext context;

    public InteractiveSteering(SteeringContext context) {
        this(SteeringCommands.createDefault(), context);
    }

    public InteractiveSteering(CommandRegistry commands, SteeringContext context) {
        this.commands = Objects.requireNonNull(commands, "commands");
        this.context = Objects.requireNonNull(context, "context");
    }

    public SteeringContext context() {
        return context;
    }

    @Override
    public Decision onPause(Pause pause) {
        context.say(pause.describe());
        while (true) {
            var available = commands.available(context, pause);
            var options = new ArrayList<String>();
            for (var entry : available) {
                options.add(entry.name());
            }
            var choice = context.prompt().ask("What next?", options);
            if (choice == null) {
                log.info("Operator input closed at {}", pause.nodeId());
                return Decision.abort("Operator input closed while paused at " + pause.nodeId());
            }
            var entry = commands.get(choice);
            if (entry == null || !options.contains(choice)) {
                context.say("Unknown command '" + choice + "'. Available: " + String.join(", ", options));
                continue;
            }
            log.info("Steering command '{}' at {}", entry.name(), pause.nodeId());
            var outcome = entry.command().execute(context, pause);
            context.say(outcome.message());
            switch (outcome.signal()) {
                case RESUME -> {
                    return Decision.resume();
                }
                case ABORT -> {
                    return Decision.abort(outcome.message());
                }
                case STAY -> {
                    // ask again
                }
            }
        }
    }
}
