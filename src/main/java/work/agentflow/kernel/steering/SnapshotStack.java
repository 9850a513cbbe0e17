package work.agentflow.kernel.steering;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import work.agentflow.kernel.runtime.ExecutionState;

/**
 * Undo history: structural copies of the execution state taken before destructive commands.
 */
public final class SnapshotStack {
    private final Deque<Entry> entries = new ArrayDeque<>();

    public void push(String command, ExecutionState state) {
        entries.push(new Entry(command, state.copy()));
    }

    public Optional<Entry> pop() {
        return Optional.ofNullable(entries.poll());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public record Entry(String command, ExecutionState state) {}
}
