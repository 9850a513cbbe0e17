package work.agentflow.kernel.render;

import work.agentflow.kernel.runtime.ExecutionSnapshot;

public interface GraphRenderer {
    String render(ExecutionSnapshot snapshot);
}
