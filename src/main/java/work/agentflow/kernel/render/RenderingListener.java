package work.agentflow.kernel.render;

import java.io.PrintWriter;
import java.util.Objects;
import work.agentflow.kernel.runtime.ExecutionSnapshot;
import work.agentflow.kernel.runtime.NodeTransition;
import work.agentflow.kernel.runtime.Pause;
import work.agentflow.kernel.runtime.RunListener;

/**
 * Prints a fresh render whenever node statuses change.
 */
public final class RenderingListener implements RunListener {
    private final GraphRenderer renderer;
    private final PrintWriter out;
    private ExecutionSnapshot lastRendered;

    public RenderingListener(GraphRenderer renderer, PrintWriter out) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onTransition(NodeTransition transition, ExecutionSnapshot snapshot) {
        draw(snapshot);
    }

    @Override
    public void onPause(Pause.Kind kind, String nodeId, ExecutionSnapshot snapshot) {
        draw(snapshot);
    }

    private void draw(ExecutionSnapshot snapshot) {
        if (lastRendered != null
            && lastRendered.graph() == snapshot.graph()
            && lastRendered.statuses().equals(snapshot.statuses())
            && lastRendered.holds().equals(snapshot.holds())) {
            return;
        }
        lastRendered = snapshot;
        out.println(renderer.render(snapshot));
        out.flush();
    }
}
