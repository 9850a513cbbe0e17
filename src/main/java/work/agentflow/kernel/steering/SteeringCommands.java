package work.agentflow.kernel.steering;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.error.WorkflowException;
import work.agentflow.kernel.graph.GraphEdge;
import work.agentflow.kernel.graph.GraphNode;
import work.agentflow.kernel.runtime.ExecutionState;
import work.agentflow.kernel.runtime.NodeOutput;
import work.agentflow.kernel.runtime.NodeStatus;
import work.agentflow.kernel.runtime.Pause;
import work.agentflow.kernel.variables.VariableReferences;

/**
 * The built-in steering commands.
 */
public final class SteeringCommands {
    private static final Logger log = LoggerFactory.getLogger(SteeringCommands.class);

    public static final String CONTINUE = "continue";
    public static final String RETRY = "retry";
    public static final String SKIP = "skip";
    public static final String JUMP = "jump";
    public static final String REPEAT = "repeat";
    public static final String EDIT = "edit";
    public static final String VIEW = "view";
    public static final String VARIABLES = "variables";
    public static final String DEBUG = "debug";
    public static final String FORK = "fork";
    public static final String UNDO = "undo";
    public static final String QUIT = "quit";

    private SteeringCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register(CONTINUE, "Continue past the checkpoint or held node",
            (ctx, pause) -> pause.kind() != Pause.Kind.FAILURE, SteeringCommands::continueRun);
        registry.register(RETRY, "Run the failed node again",
            (ctx, pause) -> pause.kind() == Pause.Kind.FAILURE, SteeringCommands::retry);
        registry.register(SKIP, "Skip this node and let downstream nodes run",
            (ctx, pause) -> pause.kind() != Pause.Kind.CHECKPOINT, SteeringCommands::skip);
        registry.register(JUMP, "Jump to another node and re-run from there", SteeringCommands::jump);
        registry.register(REPEAT, "Repeat the most recently completed node",
            (ctx, pause) -> pause.state().lastCompleted().isPresent(), SteeringCommands::repeat);
        registry.register(EDIT, "Replace the workflow with new syntax", SteeringCommands::edit);
        registry.register(VIEW, "Show the full output of a node",
            (ctx, pause) -> !pause.state().outputs().isEmpty(), SteeringCommands::view);
        registry.register(VARIABLES, "Show captured variables", SteeringCommands::variables);
        registry.register(DEBUG, "Insert a diagnostic step before this node", SteeringCommands::debug);
        registry.register(FORK, "Try alternative instructions in parallel before this node", SteeringCommands::fork);
        registry.register(UNDO, "Undo the last jump, repeat, edit, debug or fork",
            (ctx, pause) -> !ctx.snapshots().isEmpty(), SteeringCommands::undo);
        registry.register(QUIT, "Abort the run", SteeringCommands::quit);
        return registry;
    }

    public static CommandRegistry createDefault() {
        return register(new CommandRegistry());
    }

    /**
     * Completes a paused checkpoint with its label as payload, or releases a held node.
     */
    static void pass(ExecutionState state, String nodeId) {
        state.release(nodeId);
        var node = state.graph().node(nodeId);
        if (node.isCheckpoint() && state.status(nodeId) != NodeStatus.COMPLETED) {
            state.complete(nodeId, NodeOutput.success(node.stepName(), 0));
        }
    }

    private static SteeringOutcome continueRun(SteeringContext ctx, Pause pause) {
        pass(pause.state(), pause.nodeId());
        return SteeringOutcome.resume("Continuing past " + label(pause, pause.nodeId()));
    }

    private static SteeringOutcome retry(SteeringContext ctx, Pause pause) {
        var state = pause.state();
        state.retry(pause.nodeId());
        return SteeringOutcome.resume("Retrying " + label(pause, pause.nodeId()) + " (attempt " + (state.retryCount(pause.nodeId()) + 1) + ")");
    }

    private static SteeringOutcome skip(SteeringContext ctx, Pause pause) {
        pause.state().skip(pause.nodeId());
        return SteeringOutcome.resume("Skipped " + label(pause, pause.nodeId()));
    }

    private static SteeringOutcome jump(SteeringContext ctx, Pause pause) {
        var state = pause.state();
        var graph = state.graph();
        var candidates = new ArrayList<String>();
        for (var node : graph.nodes()) {
            var status = state.status(node.id());
            if (!node.isSynthetic() && (status == NodeStatus.COMPLETED || status == NodeStatus.PENDING || node.isCheckpoint())) {
                candidates.add(node.label());
            }
        }
        if (candidates.isEmpty()) {
            return SteeringOutcome.stay("No node to jump to.");
        }
        var choice = ctx.prompt().ask("Jump to which node?", candidates);
        var targetId = idOf(choice);
        if (targetId == null || !graph.contains(targetId)) {
            return SteeringOutcome.stay("Jump cancelled.");
        }
        ctx.snapshots().push(JUMP, state);

        var region = graph.forwardReachable(targetId);
        state.reset(region);
        state.activate(targetId);
        for (var ancestor : graph.forwardAncestors(targetId)) {
            if (region.contains(ancestor)) {
                continue;
            }
            var status = state.status(ancestor);
            if (status == NodeStatus.PENDING || status == NodeStatus.FAILED || status == NodeStatus.EXECUTING) {
                state.skip(ancestor);
            }
        }
        var paused = pause.nodeId();
        if (!region.contains(paused)) {
            var status = state.status(paused);
            if (status == NodeStatus.FAILED || status == NodeStatus.EXECUTING) {
                state.skip(paused);
            }
            state.release(paused);
        }
        log.info("Jumped to {}; reset {}", targetId, region);
        return SteeringOutcome.resume("Jumping to " + graph.node(targetId).label() + " (" + region.size() + " node(s) reset)");
    }

    private static SteeringOutcome repeat(SteeringContext ctx, Pause pause) {
        var state = pause.state();
        Optional<String> last = state.lastCompleted();
        if (last.isEmpty()) {
            return SteeringOutcome.stay("Nothing has completed yet.");
        }
        ctx.snapshots().push(REPEAT, state);
        var nodeId = last.get();
        state.reset(List.of(nodeId));
        state.activate(nodeId);
        return SteeringOutcome.resume("Repeating " + label(pause, nodeId));
    }

    private static SteeringOutcome edit(SteeringContext ctx, Pause pause) {
        var compiler = ctx.maybeCompiler();
        if (compiler.isEmpty()) {
            return SteeringOutcome.stay("Editing is not available in this session.");
        }
        var source = ctx.prompt().askText("New workflow syntax:");
        if (source == null || source.isBlank()) {
            return SteeringOutcome.stay("Edit cancelled.");
        }
        try {
            var compiled = compiler.get().compile(source);
            var state = pause.state();
            ctx.snapshots().push(EDIT, state);
            state.resetFor(compiled.graph());
            compiled.report().warnings().forEach(warning -> ctx.say(warning.toString()));
            return SteeringOutcome.resume("Workflow replaced (" + compiled.graph().nodes().size() + " node(s)); starting over.");
        } catch (WorkflowException ex) {
            log.info("Edit rejected: {}", ex.getMessage());
            return SteeringOutcome.stay(ex.describe() + System.lineSeparator() + "The original workflow is unchanged.");
        }
    }

    private static SteeringOutcome view(SteeringContext ctx, Pause pause) {
        var state = pause.state();
        var options = new ArrayList<String>();
        for (var node : state.graph().nodes()) {
            if (state.output(node.id()) != null) {
                options.add(node.label());
            }
        }
        if (options.isEmpty()) {
            return SteeringOutcome.stay("No node has produced output yet.");
        }
        var choice = ctx.prompt().ask("View which node?", options);
        var nodeId = idOf(choice);
        if (nodeId == null || state.output(nodeId) == null) {
            return SteeringOutcome.stay("Nothing selected.");
        }
        var output = state.output(nodeId);
        return SteeringOutcome.stay(label(pause, nodeId) + " (" + output.durationMs() + " ms):" + System.lineSeparator() + output.describe());
    }

    private static SteeringOutcome variables(SteeringContext ctx, Pause pause) {
        return SteeringOutcome.stay(pause.state().variables().summary());
    }

    private static SteeringOutcome debug(SteeringContext ctx, Pause pause) {
        var instruction = ctx.prompt().askText("Diagnostic instruction for " + label(pause, pause.nodeId()) + ":");
        if (instruction == null || instruction.isBlank()) {
            return SteeringOutcome.stay("Debug cancelled.");
        }
        var state = pause.state();
        ctx.snapshots().push(DEBUG, state);
        var graph = state.graph();
        var id = graph.nextId();
        var diagnostic = GraphNode.step(id, ctx.settings().debugAgent(), instruction, null, VariableReferences.find(instruction), -1);
        state.extendGraph(graph.insertBefore(pause.nodeId(), List.of(diagnostic), List.of(), id, id));
        holdForReview(state, pause.nodeId());
        return SteeringOutcome.resume("Inserted diagnostic step " + diagnostic.label() + " before " + label(pause, pause.nodeId()));
    }

    private static SteeringOutcome fork(SteeringContext ctx, Pause pause) {
        var state = pause.state();
        var paused = state.graph().node(pause.nodeId());
        var defaultAgent = paused.isStep() ? paused.stepName() : ctx.settings().debugAgent();
        var agent = ctx.prompt().askText("Agent for the alternatives [" + defaultAgent + "]:");
        if (agent == null) {
            return SteeringOutcome.stay("Fork cancelled.");
        }
        agent = agent.isBlank() ? defaultAgent : agent.trim();
        var instructions = new ArrayList<String>();
        while (true) {
            var text = ctx.prompt().askText("Alternative " + (instructions.size() + 1) + " (empty to finish):");
            if (text == null || text.isBlank()) {
                break;
            }
            instructions.add(text);
        }
        if (instructions.size() < 2) {
            return SteeringOutcome.stay("A fork needs at least two alternatives.");
        }
        ctx.snapshots().push(FORK, state);

        var graph = state.graph();
        int next = Integer.parseInt(graph.nextId().substring(1));
        var entry = "n" + next++;
        var nodes = new ArrayList<GraphNode>();
        var edges = new ArrayList<GraphEdge>();
        nodes.add(GraphNode.parallelEntry(entry));
        var branchIds = new ArrayList<String>();
        for (var instruction : instructions) {
            var id = "n" + next++;
            branchIds.add(id);
            nodes.add(GraphNode.step(id, agent, instruction, null, VariableReferences.find(instruction), -1));
            edges.add(GraphEdge.of(entry, id));
        }
        var merge = "n" + next;
        nodes.add(GraphNode.parallelMerge(merge));
        for (var id : branchIds) {
            edges.add(GraphEdge.of(id, merge));
        }
        state.extendGraph(graph.insertBefore(pause.nodeId(), nodes, edges, entry, merge));
        holdForReview(state, pause.nodeId());
        return SteeringOutcome.resume("Forked " + instructions.size() + " alternative(s) of " + agent + " before " + label(pause, pause.nodeId()));
    }

    private static SteeringOutcome undo(SteeringContext ctx, Pause pause) {
        var entry = ctx.snapshots().pop();
        if (entry.isEmpty()) {
            return SteeringOutcome.stay("Nothing to undo.");
        }
        pause.state().restore(entry.get().state());
        return SteeringOutcome.stay("Restored the state from before '" + entry.get().command() + "'.");
    }

    private static SteeringOutcome quit(SteeringContext ctx, Pause pause) {
        var answer = ctx.prompt().ask("Abort the run?", List.of("yes", "no"));
        if (!"yes".equals(answer)) {
            return SteeringOutcome.stay("Quit cancelled.");
        }
        var state = pause.state();
        var summary = new LinkedHashSet<String>();
        for (var status : NodeStatus.values()) {
            long count = state.snapshot().count(status);
            if (count > 0) {
                summary.add(count + " " + status.name().toLowerCase(Locale.ROOT));
            }
        }
        return SteeringOutcome.abort("Run aborted by operator (" + String.join(", ", summary) + ")");
    }

    /**
     * The paused node goes back to PENDING behind the inserted region and is held, so the run
     * pauses on it again once the region has run.
     */
    private static void holdForReview(ExecutionState state, String nodeId) {
        state.reset(List.of(nodeId));
        state.hold(nodeId);
    }

    private static String label(Pause pause, String nodeId) {
        return pause.state().graph().node(nodeId).label();
    }

    /**
     * Node labels start with the node id.
     */
    static String idOf(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        var trimmed = label.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
