package work.agentflow.kernel.steering;

import java.util.Objects;
import java.util.Optional;
import work.agentflow.kernel.compile.WorkflowCompiler;
import work.agentflow.kernel.config.EngineSettings;

/**
 * Collaborators shared by the commands of one steering session.
 *
 * @param compiler used by {@code edit}; {@code null} disables editing
 */
public record SteeringContext(PromptCollaborator prompt, WorkflowCompiler compiler, EngineSettings settings, SnapshotStack snapshots) {
    public SteeringContext {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(settings, "settings");
        snapshots = snapshots == null ? new SnapshotStack() : snapshots;
    }

    public Optional<WorkflowCompiler> maybeCompiler() {
        return Optional.ofNullable(compiler);
    }

    public void say(String message) {
        if (message != null && !message.isBlank()) {
            prompt.say(message);
        }
    }
}
