package work.agentflow.kernel.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.config.EngineSettings;
import work.agentflow.kernel.error.ErrorDetails;
import work.agentflow.kernel.graph.GraphEdge;
import work.agentflow.kernel.graph.GraphNode;
import work.agentflow.kernel.graph.NodeKind;
import work.agentflow.kernel.graph.WorkflowGraph;
import work.agentflow.kernel.shared.DurationParser;
import work.agentflow.kernel.variables.VariableException;
import work.agentflow.kernel.variables.VariableInterpolator;

/**
 * Runs a workflow graph to completion.
 *
 * <p>A single scheduler thread owns the {@link ExecutionState}. Ready steps are handed to a fixed
 * worker pool and their results come back through a completion queue; the scheduler blocks on
 * that queue while work is in flight. Checkpoints, failures and held nodes pause the run, but only
 * once every in-flight node has finished, so steering always sees a quiet state.
 */
public final class ExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final StepBackend backend;
    private final EngineSettings settings;
    private final VariableInterpolator interpolator;
    private final ConditionEvaluator conditions = new ConditionEvaluator();
    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();

    public ExecutionEngine(StepBackend backend) {
        this(backend, EngineSettings.defaults());
    }

    public ExecutionEngine(StepBackend backend, EngineSettings settings) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.interpolator = new VariableInterpolator(settings.truncateLimit());
    }

    public ExecutionEngine addListener(RunListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public EngineSettings settings() {
        return settings;
    }

    public RunOutcome run(WorkflowGraph graph, SteeringHandler steering) {
        return run(new ExecutionState(graph), steering);
    }

    public RunOutcome run(ExecutionState state, SteeringHandler steering) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(steering, "steering");
        var executor = Executors.newFixedThreadPool(settings.concurrency(), new StepThreadFactory());
        try {
            var outcome = new Run(state, steering, executor).execute();
            for (var listener : listeners) {
                try {
                    listener.onFinish(outcome);
                } catch (RuntimeException ex) {
                    log.warn("Run listener failed on finish: {}", ex.getMessage(), ex);
                }
            }
            return outcome;
        } finally {
            executor.shutdownNow();
        }
    }

    private enum Readiness {
        READY,
        WAIT,
        BYPASS
    }

    private enum EdgeState {
        SATISFIED,
        BLOCKED,
        WAITING
    }

    private record InFlight(String nodeId, CancellationToken token, Duration timeout, long startNanos) {}

    private record NodeCompletion(InFlight ticket, NodeOutput output, Throwable error) {}

    private final class Run {
        private final ExecutionState state;
        private final SteeringHandler steering;
        private final ExecutorService executor;
        private final Map<String, InFlight> inFlight = new LinkedHashMap<>();
        private final BlockingQueue<NodeCompletion> completions = new LinkedBlockingQueue<>();

        Run(ExecutionState state, SteeringHandler steering, ExecutorService executor) {
            this.state = state;
            this.steering = steering;
            this.executor = executor;
        }

        RunOutcome execute() {
            log.info("Starting run of {} node(s)", state.graph().nodes().size());
            try {
                while (true) {
                    NodeCompletion polled;
                    while ((polled = completions.poll()) != null) {
                        apply(polled);
                    }
                    settle();
                    publish();

                    var pause = findPause();
                    if (pause != null) {
                        if (!inFlight.isEmpty()) {
                            apply(completions.take());
                            continue;
                        }
                        var decision = handle(pause);
                        if (decision.abort()) {
                            return abort(decision.message());
                        }
                        continue;
                    }

                    var ready = readySteps();
                    int capacity = settings.concurrency() - inFlight.size();
                    int started = 0;
                    for (var nodeId : ready) {
                        if (started >= capacity) {
                            break;
                        }
                        dispatch(state.graph().node(nodeId));
                        started++;
                    }
                    publish();
                    if (inFlight.isEmpty()) {
                        if (started > 0) {
                            continue;
                        }
                        return finish();
                    }
                    apply(completions.take());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return abort("Run interrupted");
            }
        }

        private void settle() {
            boolean changed;
            do {
                changed = fireLoops();
                var graph = state.graph();
                for (var node : graph.nodes()) {
                    if (state.status(node.id()) != NodeStatus.PENDING) {
                        continue;
                    }
                    var readiness = readiness(node);
                    if (readiness == Readiness.BYPASS) {
                        log.debug("Bypassing {}", node.label());
                        state.bypass(node.id());
                        changed = true;
                    } else if (readiness == Readiness.READY && node.isSynthetic()) {
                        state.begin(node.id());
                        var output = node.kind() == NodeKind.PARALLEL_MERGE
                            ? aggregate(node.id())
                            : NodeOutput.success(null, 0);
                        state.complete(node.id(), output);
                        changed = true;
                    }
                }
            } while (changed);
        }

        private boolean fireLoops() {
            boolean fired = false;
            for (var nodeId : state.drainCompletions()) {
                if (!state.graph().contains(nodeId) || state.status(nodeId) != NodeStatus.COMPLETED) {
                    continue;
                }
                for (var edge : state.graph().outgoing(nodeId)) {
                    if (!edge.backEdge() || !conditionHolds(edge)) {
                        continue;
                    }
                    var key = edge.from() + "->" + edge.to();
                    if (state.loopIterations(key) >= settings.maxLoopIterations()) {
                        log.warn("Loop {} reached {} iteration(s); not repeating {} again",
                            key, settings.maxLoopIterations(), state.graph().node(edge.to()).label());
                        continue;
                    }
                    int iteration = state.recordLoopIteration(key);
                    var region = state.graph().forwardReachable(edge.to());
                    for (var id : region) {
                        var running = inFlight.remove(id);
                        if (running != null) {
                            running.token().cancel();
                        }
                    }
                    state.reset(region);
                    state.activate(edge.to());
                    log.debug("Loop {} iteration {}: reset {}", key, iteration, region);
                    fired = true;
                }
            }
            return fired;
        }

        private Readiness readiness(GraphNode node) {
            if (state.isActivated(node.id())) {
                return Readiness.READY;
            }
            var incoming = state.graph().forwardIncoming(node.id());
            if (incoming.isEmpty()) {
                return Readiness.READY;
            }
            if (node.kind() == NodeKind.PARALLEL_MERGE) {
                boolean anyThrough = false;
                for (var edge : incoming) {
                    var edgeState = edgeState(edge);
                    if (edgeState == EdgeState.WAITING) {
                        return Readiness.WAIT;
                    }
                    anyThrough |= edgeState == EdgeState.SATISFIED;
                }
                return anyThrough ? Readiness.READY : Readiness.BYPASS;
            }
            boolean blocked = false;
            for (var edge : incoming) {
                var edgeState = edgeState(edge);
                if (edgeState == EdgeState.WAITING) {
                    return Readiness.WAIT;
                }
                blocked |= edgeState == EdgeState.BLOCKED;
            }
            return blocked ? Readiness.BYPASS : Readiness.READY;
        }

        private EdgeState edgeState(GraphEdge edge) {
            var status = state.status(edge.from());
            boolean through = status == NodeStatus.COMPLETED
                || (status == NodeStatus.SKIPPED && !state.isBypassed(edge.from()));
            if (through) {
                return conditionHolds(edge) ? EdgeState.SATISFIED : EdgeState.BLOCKED;
            }
            return status == NodeStatus.SKIPPED ? EdgeState.BLOCKED : EdgeState.WAITING;
        }

        private boolean conditionHolds(GraphEdge edge) {
            if (!edge.isConditional()) {
                return true;
            }
            return conditions.evaluate(edge.condition(), state.output(edge.from()), tributaries(edge.from()));
        }

        private List<NodeOutput> tributaries(String nodeId) {
            var graph = state.graph();
            if (graph.node(nodeId).kind() != NodeKind.PARALLEL_MERGE) {
                return List.of();
            }
            var outputs = new ArrayList<NodeOutput>();
            for (var edge : graph.forwardIncoming(nodeId)) {
                if (!state.isBypassed(edge.from())) {
                    outputs.add(state.output(edge.from()));
                }
            }
            return outputs;
        }

        /**
         * Branch payloads in declaration order; bypassed branches contribute {@code null} and do
         * not count towards success.
         */
        private NodeOutput aggregate(String mergeId) {
            var payloads = new ArrayList<Object>();
            boolean success = true;
            for (var edge : state.graph().forwardIncoming(mergeId)) {
                if (state.isBypassed(edge.from())) {
                    payloads.add(null);
                    continue;
                }
                var output = state.output(edge.from());
                payloads.add(output == null ? null : output.payload());
                success &= output != null && output.success();
            }
            var payload = Collections.unmodifiableList(payloads);
            return success
                ? NodeOutput.success(payload, 0)
                : new NodeOutput(false, payload, "One or more parallel branches failed", null, 0);
        }

        /**
         * Failures first, then checkpoints and held steps in graph order. Steps activated by a
         * command run before any pause is raised again.
         */
        private Pause findPause() {
            var graph = state.graph();
            for (var node : graph.nodes()) {
                if (node.isStep()
                    && state.isActivated(node.id())
                    && state.status(node.id()) == NodeStatus.PENDING
                    && !state.isHeld(node.id())) {
                    return null;
                }
            }
            for (var node : graph.nodes()) {
                if (state.status(node.id()) == NodeStatus.FAILED) {
                    return new Pause(Pause.Kind.FAILURE, node.id(), state);
                }
            }
            for (var node : graph.nodes()) {
                var status = state.status(node.id());
                if (node.isCheckpoint() && status == NodeStatus.EXECUTING) {
                    return new Pause(Pause.Kind.CHECKPOINT, node.id(), state);
                }
                if (status != NodeStatus.PENDING || readiness(node) != Readiness.READY) {
                    continue;
                }
                if (node.isCheckpoint()) {
                    return new Pause(Pause.Kind.CHECKPOINT, node.id(), state);
                }
                if (node.isStep() && state.isHeld(node.id())) {
                    return new Pause(Pause.Kind.HOLD, node.id(), state);
                }
            }
            return null;
        }

        private SteeringHandler.Decision handle(Pause pause) {
            if (pause.kind() == Pause.Kind.CHECKPOINT && state.status(pause.nodeId()) == NodeStatus.PENDING) {
                state.begin(pause.nodeId());
            }
            publish();
            var snapshot = state.snapshot();
            for (var listener : listeners) {
                try {
                    listener.onPause(pause.kind(), pause.nodeId(), snapshot);
                } catch (RuntimeException ex) {
                    log.warn("Run listener failed on pause: {}", ex.getMessage(), ex);
                }
            }
            log.info("Paused: {}", pause.describe());
            long before = state.revision();
            var decision = steering.onPause(pause);
            if (decision == null) {
                return SteeringHandler.Decision.abort("Steering returned no decision at " + pause.nodeId());
            }
            if (!decision.abort() && state.revision() == before) {
                log.warn("Steering resumed without resolving the pause at {}", pause.nodeId());
                return SteeringHandler.Decision.abort("Pause at " + pause.nodeId() + " was left unresolved");
            }
            return decision;
        }

        private List<String> readySteps() {
            var ready = new ArrayList<String>();
            for (var node : state.graph().nodes()) {
                if (node.isStep()
                    && state.status(node.id()) == NodeStatus.PENDING
                    && !state.isHeld(node.id())
                    && readiness(node) == Readiness.READY) {
                    ready.add(node.id());
                }
            }
            return ready;
        }

        private void dispatch(GraphNode node) {
            state.begin(node.id());
            String instruction;
            try {
                instruction = interpolator.interpolate(node.instruction(), state.variables(), node.id());
            } catch (VariableException ex) {
                log.warn("{}", ex.getMessage());
                state.fail(node.id(), NodeOutput.failure(ErrorKind.VARIABLE, ex.describe(), 0));
                return;
            }
            var timeout = node.timeout() != null ? node.timeout() : settings.nodeTimeout().orElse(null);
            var token = new CancellationToken();
            var request = new StepRequest(node.id(), node.stepName(), instruction, new StepOptions(node.model(), timeout, token));
            var ticket = new InFlight(node.id(), token, timeout, System.nanoTime());
            inFlight.put(node.id(), ticket);
            log.debug("Dispatching {}", node.label());

            var future = CompletableFuture.supplyAsync(() -> invoke(request), executor);
            if (timeout != null) {
                future = future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            future.whenComplete((output, error) -> completions.add(new NodeCompletion(ticket, output, error)));
        }

        private void apply(NodeCompletion completion) {
            var ticket = completion.ticket();
            if (inFlight.get(ticket.nodeId()) != ticket) {
                log.debug("Ignoring stale completion for {}", ticket.nodeId());
                return;
            }
            inFlight.remove(ticket.nodeId());
            NodeOutput output;
            if (completion.error() != null) {
                var cause = completion.error() instanceof CompletionException && completion.error().getCause() != null
                    ? completion.error().getCause()
                    : completion.error();
                if (cause instanceof TimeoutException) {
                    ticket.token().cancel();
                    output = NodeOutput.failure(
                        ErrorKind.TIMEOUT,
                        "Node " + ticket.nodeId() + " timed out after " + DurationParser.format(ticket.timeout()),
                        elapsedMillis(ticket.startNanos())
                    );
                } else {
                    output = NodeOutput.failure(ErrorKind.EXCEPTION, ErrorDetails.message(cause), elapsedMillis(ticket.startNanos()));
                }
            } else {
                output = completion.output();
            }
            var label = state.graph().node(ticket.nodeId()).label();
            if (output.success()) {
                log.debug("{} completed in {} ms", label, output.durationMs());
                state.complete(ticket.nodeId(), output);
            } else {
                log.warn("{} failed [{}]: {}", label, output.errorKind(), output.error());
                state.fail(ticket.nodeId(), output);
            }
        }

        private NodeOutput invoke(StepRequest request) {
            long start = System.nanoTime();
            var token = request.options().cancellation();
            try {
                var result = backend.invoke(request);
                if (token.isCancelled()) {
                    return NodeOutput.failure(ErrorKind.CANCELLED, "Invocation cancelled", elapsedMillis(start));
                }
                if (result == null) {
                    return NodeOutput.failure(ErrorKind.BACKEND, "Backend returned no result for " + request.stepName(), elapsedMillis(start));
                }
                return result.success()
                    ? NodeOutput.success(result.payload(), elapsedMillis(start))
                    : NodeOutput.failure(ErrorKind.BACKEND, result.error(), result.payload(), elapsedMillis(start));
            } catch (CancellationToken.StepCancelledException ex) {
                return NodeOutput.failure(ErrorKind.CANCELLED, ex.getMessage(), elapsedMillis(start));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return NodeOutput.failure(ErrorKind.CANCELLED, "Invocation interrupted", elapsedMillis(start));
            } catch (Exception ex) {
                return NodeOutput.failure(ErrorKind.EXCEPTION, ErrorDetails.message(ex), elapsedMillis(start));
            }
        }

        private RunOutcome abort(String message) {
            for (var ticket : inFlight.values()) {
                ticket.token().cancel();
                state.fail(ticket.nodeId(), NodeOutput.failure(ErrorKind.CANCELLED, "Cancelled: run aborted", elapsedMillis(ticket.startNanos())));
            }
            inFlight.clear();
            executor.shutdownNow();
            publish();
            var text = message == null || message.isBlank() ? "Run aborted" : message;
            log.info("Run aborted: {}", text);
            return new RunOutcome(RunOutcome.Status.ABORTED, state.snapshot(), state.unfinishedIds(), text);
        }

        private RunOutcome finish() {
            var unfinished = state.unfinishedIds();
            var snapshot = state.snapshot();
            if (unfinished.isEmpty()) {
                var message = "Workflow completed: " + snapshot.count(NodeStatus.COMPLETED) + " completed, "
                    + snapshot.count(NodeStatus.SKIPPED) + " skipped";
                log.info(message);
                return new RunOutcome(RunOutcome.Status.COMPLETED, snapshot, List.of(), message);
            }
            var message = "Workflow deadlocked: " + String.join(", ", unfinished) + " can never become ready";
            log.warn(message);
            return new RunOutcome(RunOutcome.Status.DEADLOCKED, snapshot, unfinished, message);
        }

        private void publish() {
            var transitions = state.drainTransitions();
            if (transitions.isEmpty()) {
                return;
            }
            var snapshot = state.snapshot();
            for (var transition : transitions) {
                log.debug("{}", transition);
                for (var listener : listeners) {
                    try {
                        listener.onTransition(transition, snapshot);
                    } catch (RuntimeException ex) {
                        log.warn("Run listener failed: {}", ex.getMessage(), ex);
                    }
                }
            }
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static final class StepThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            var thread = new Thread(task, "agentflow-step-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
