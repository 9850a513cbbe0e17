package work.agentflow.kernel.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the workflow comes from: a document on disk or inline syntax.
 */
public record WorkflowSource(Optional<Path> path, Optional<String> inline) {
    public WorkflowSource {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(inline, "inline");
        if (path.isEmpty() && inline.isEmpty()) {
            throw new IllegalArgumentException("Either path or inline must be present.");
        }
    }

    public static WorkflowSource forFile(Path path) {
        return new WorkflowSource(Optional.of(path), Optional.empty());
    }

    public static WorkflowSource forInline(String syntax) {
        return new WorkflowSource(Optional.empty(), Optional.of(syntax));
    }

    public boolean isInline() {
        return inline.isPresent();
    }

    public String display() {
        return path.map(Path::toString).orElse("<inline>");
    }
}
