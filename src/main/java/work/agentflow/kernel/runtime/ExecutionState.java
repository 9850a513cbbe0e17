package work.agentflow.kernel.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.agentflow.kernel.graph.WorkflowGraph;
import work.agentflow.kernel.variables.VariableStore;

/**
 * Mutable state of one run. Owned by the scheduler thread; steering commands touch it only while
 * the run is paused and nothing executes.
 */
public final class ExecutionState {
    private WorkflowGraph graph;
    private final Map<String, NodeStatus> statuses = new LinkedHashMap<>();
    private final Map<String, NodeOutput> outputs = new LinkedHashMap<>();
    private final List<String> completionOrder = new ArrayList<>();
    private final Set<String> activations = new LinkedHashSet<>();
    private final Set<String> holds = new LinkedHashSet<>();
    private final Set<String> bypassed = new LinkedHashSet<>();
    private final Map<String, Integer> loopIterations = new LinkedHashMap<>();
    private final Map<String, Integer> retryCounts = new LinkedHashMap<>();
    private VariableStore variables = new VariableStore();

    private final List<NodeTransition> transitions = new ArrayList<>();
    private final Deque<String> freshCompletions = new ArrayDeque<>();
    private long revision;

    public ExecutionState(WorkflowGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        for (var node : graph.nodes()) {
            statuses.put(node.id(), NodeStatus.PENDING);
        }
    }

    public WorkflowGraph graph() {
        return graph;
    }

    public VariableStore variables() {
        return variables;
    }

    public NodeStatus status(String nodeId) {
        return statuses.getOrDefault(nodeId, NodeStatus.PENDING);
    }

    public Map<String, NodeStatus> statuses() {
        return Map.copyOf(statuses);
    }

    public NodeOutput output(String nodeId) {
        return outputs.get(nodeId);
    }

    public Map<String, NodeOutput> outputs() {
        return Map.copyOf(outputs);
    }

    public List<String> completionOrder() {
        return List.copyOf(completionOrder);
    }

    /**
     * Most recently completed step or checkpoint that is still COMPLETED.
     */
    public Optional<String> lastCompleted() {
        for (int i = completionOrder.size() - 1; i >= 0; i--) {
            var id = completionOrder.get(i);
            if (graph.contains(id) && !graph.node(id).isSynthetic() && status(id) == NodeStatus.COMPLETED) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    public void begin(String nodeId) {
        activations.remove(nodeId);
        setStatus(nodeId, NodeStatus.EXECUTING);
    }

    /**
     * Marks the node COMPLETED, stores its output and captures the payload when the node declares
     * a capture name.
     */
    public void complete(String nodeId, NodeOutput output) {
        outputs.put(nodeId, output);
        completionOrder.add(nodeId);
        var node = graph.node(nodeId);
        if (node.capturesVariable() != null) {
            variables.capture(node.capturesVariable(), output.payload());
        }
        freshCompletions.add(nodeId);
        setStatus(nodeId, NodeStatus.COMPLETED);
    }

    public void fail(String nodeId, NodeOutput output) {
        outputs.put(nodeId, output);
        setStatus(nodeId, NodeStatus.FAILED);
    }

    /**
     * Operator or policy skip: the output, if any, is kept and downstream edges still evaluate.
     */
    public void skip(String nodeId) {
        activations.remove(nodeId);
        holds.remove(nodeId);
        setStatus(nodeId, NodeStatus.SKIPPED);
    }

    public void bypass(String nodeId) {
        bypassed.add(nodeId);
        setStatus(nodeId, NodeStatus.SKIPPED);
    }

    public boolean isBypassed(String nodeId) {
        return bypassed.contains(nodeId);
    }

    public void retry(String nodeId) {
        retryCounts.merge(nodeId, 1, Integer::sum);
        reset(List.of(nodeId));
        activate(nodeId);
    }

    public int retryCount(String nodeId) {
        return retryCounts.getOrDefault(nodeId, 0);
    }

    /**
     * Returns the given nodes to PENDING and clears their outputs. Captured variables stay until
     * they are overwritten.
     */
    public void reset(Collection<String> nodeIds) {
        for (var id : nodeIds) {
            outputs.remove(id);
            bypassed.remove(id);
            activations.remove(id);
            setStatus(id, NodeStatus.PENDING);
        }
    }

    public void activate(String nodeId) {
        activations.add(nodeId);
        revision++;
    }

    public boolean isActivated(String nodeId) {
        return activations.contains(nodeId);
    }

    public void hold(String nodeId) {
        holds.add(nodeId);
        revision++;
    }

    public void release(String nodeId) {
        if (holds.remove(nodeId)) {
            revision++;
        }
    }

    public boolean isHeld(String nodeId) {
        return holds.contains(nodeId);
    }

    public int loopIterations(String edgeKey) {
        return loopIterations.getOrDefault(edgeKey, 0);
    }

    public int recordLoopIteration(String edgeKey) {
        revision++;
        return loopIterations.merge(edgeKey, 1, Integer::sum);
    }

    /**
     * Adopts a graph that extends the current one. Existing nodes keep their state, new nodes
     * start PENDING.
     */
    public void extendGraph(WorkflowGraph extended) {
        this.graph = Objects.requireNonNull(extended, "extended");
        for (var node : extended.nodes()) {
            if (!statuses.containsKey(node.id())) {
                statuses.put(node.id(), NodeStatus.PENDING);
                transitions.add(new NodeTransition(node.id(), NodeStatus.PENDING, NodeStatus.PENDING));
            }
        }
        revision++;
    }

    /**
     * Replaces the graph and starts over: every node PENDING, no outputs, no variables.
     */
    public void resetFor(WorkflowGraph replacement) {
        this.graph = Objects.requireNonNull(replacement, "replacement");
        statuses.clear();
        outputs.clear();
        completionOrder.clear();
        activations.clear();
        holds.clear();
        bypassed.clear();
        loopIterations.clear();
        retryCounts.clear();
        freshCompletions.clear();
        variables = new VariableStore();
        for (var node : replacement.nodes()) {
            statuses.put(node.id(), NodeStatus.PENDING);
            transitions.add(new NodeTransition(node.id(), NodeStatus.PENDING, NodeStatus.PENDING));
        }
        revision++;
    }

    public List<String> unfinishedIds() {
        var ids = new ArrayList<String>();
        for (var node : graph.nodes()) {
            if (!status(node.id()).isTerminal()) {
                ids.add(node.id());
            }
        }
        return ids;
    }

    /**
     * Structural copy used for undo. Transition and completion bookkeeping is not copied.
     */
    public ExecutionState copy() {
        var copy = new ExecutionState(graph);
        copy.copyFrom(this);
        return copy;
    }

    /**
     * Restores this state from a copy taken earlier; the restore itself is published as
     * transitions.
     */
    public void restore(ExecutionState saved) {
        var before = new LinkedHashMap<>(statuses);
        copyFrom(saved);
        for (var entry : statuses.entrySet()) {
            var previous = before.getOrDefault(entry.getKey(), NodeStatus.PENDING);
            if (previous != entry.getValue()) {
                transitions.add(new NodeTransition(entry.getKey(), previous, entry.getValue()));
            }
        }
        revision++;
    }

    private void copyFrom(ExecutionState other) {
        this.graph = other.graph;
        statuses.clear();
        statuses.putAll(other.statuses);
        outputs.clear();
        outputs.putAll(other.outputs);
        completionOrder.clear();
        completionOrder.addAll(other.completionOrder);
        activations.clear();
        activations.addAll(other.activations);
        holds.clear();
        holds.addAll(other.holds);
        bypassed.clear();
        bypassed.addAll(other.bypassed);
        loopIterations.clear();
        loopIterations.putAll(other.loopIterations);
        retryCounts.clear();
        retryCounts.putAll(other.retryCounts);
        freshCompletions.clear();
        variables = other.variables.copy();
    }

    public ExecutionSnapshot snapshot() {
        return new ExecutionSnapshot(graph, statuses, outputs, variables.asMap(), holds, completionOrder);
    }

    /**
     * Increases with every mutation; lets the engine notice a pause that steering left untouched.
     */
    public long revision() {
        return revision;
    }

    List<NodeTransition> drainTransitions() {
        var drained = List.copyOf(transitions);
        transitions.clear();
        return drained;
    }

    List<String> drainCompletions() {
        var drained = List.copyOf(freshCompletions);
        freshCompletions.clear();
        return drained;
    }

    private void setStatus(String nodeId, NodeStatus status) {
        var previous = statuses.put(nodeId, status);
        revision++;
        if (previous != status) {
            transitions.add(new NodeTransition(nodeId, previous == null ? NodeStatus.PENDING : previous, status));
        }
    }
}
