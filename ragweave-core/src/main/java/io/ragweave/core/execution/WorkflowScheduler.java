package io.ragweave.core.execution;

import io.ragweave.core.RagweaveConfig;
import io.ragweave.core.exception.ErrorKind;
import io.ragweave.core.execution.result.NodeFailure;
import io.ragweave.core.execution.result.RunResult;
import io.ragweave.core.execution.runner.AttemptObserver;
import io.ragweave.core.execution.runner.NodeOutcome;
import io.ragweave.core.execution.runner.NodeRunner;
import io.ragweave.core.execution.step.StepContext;
import io.ragweave.core.execution.step.StepHandler;
import io.ragweave.core.execution.step.StepHandlerRegistry;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.RetryPolicy;
import io.ragweave.core.workflow.WorkflowGraph;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Executes a {@link WorkflowGraph} in dependency order.
///
/// ### Run Loop
/// 1. Compute the ready set: pending nodes whose dependencies are all terminal.
/// 2. Dispatch ready nodes to the {@link NodeRunner} on the worker pool, up to
///    `maxConcurrentNodes` in flight for this run.
/// 3. Wait for the next worker event and apply it to the {@link ExecutionContext}.
/// 4. Repeat until every node is terminal.
///
/// ### Failure Propagation
/// When a node fails or is skipped, each dependent that does not tolerate it
/// (see {@link Node#tolerates(Node)}) is marked SKIPPED with
/// {@link ErrorKind#DEPENDENCY_FAILED}, transitively. A tolerating dependent runs
/// once its other dependencies finish, with whatever upstream outputs exist.
///
/// ### Cancellation and Timeout
/// When the run's {@link CancellationSignal} fires or the run timeout elapses,
/// in-flight workers are interrupted and every non-terminal node is marked
/// SKIPPED with {@link ErrorKind#CANCELLED}.
///
/// @implNote Thread-safe; each call to `run` owns its own context and event
/// queue. Only the thread calling `run` writes the context; workers communicate
/// through {@link SchedulerEvent}s. Listener callbacks happen on that thread.
///
/// @see NodeRunner for retry and timeout handling
/// @see ExecutionListener for lifecycle callbacks
public final class WorkflowScheduler {

    private static final Logger logger = Logger.getLogger(WorkflowScheduler.class.getName());

    private final StepHandlerRegistry handlers;
    private final NodeRunner nodeRunner;
    private final ExecutorService workers;
    private final Clock clock;

    public WorkflowScheduler(StepHandlerRegistry handlers, NodeRunner nodeRunner, ExecutorService workers) {
        this(handlers, nodeRunner, workers, Clock.systemUTC());
    }

    /// Creates a scheduler.
    ///
    /// @param handlers step handler lookup, not null
    /// @param nodeRunner runs nodes with retries and timeouts, not null
    /// @param workers shared pool on which node executions run, not null
    /// @param clock time source for node timestamps, not null
    public WorkflowScheduler(
            StepHandlerRegistry handlers, NodeRunner nodeRunner, ExecutorService workers, Clock clock) {
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.nodeRunner = Objects.requireNonNull(nodeRunner, "nodeRunner must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RunResult run(WorkflowGraph graph, Map<String, Object> initialInputs, RagweaveConfig config) {
        return run(graph, initialInputs, config, ExecutionListener.NOOP, new CancellationSignal());
    }

    public RunResult run(
            WorkflowGraph graph,
            Map<String, Object> initialInputs,
            RagweaveConfig config,
            ExecutionListener listener) {
        return run(graph, initialInputs, config, listener, new CancellationSignal());
    }

    /// Runs the graph to completion, cancellation or timeout.
    ///
    /// @param graph validated graph, not null
    /// @param initialInputs run inputs visible to every step, not null
    /// @param config run settings, not null
    /// @param listener lifecycle callbacks, not null
    /// @param cancellation signal that aborts the run when cancelled, not null
    /// @return result with outputs, failures and the final node states, never null
    public RunResult run(
            WorkflowGraph graph,
            Map<String, Object> initialInputs,
            RagweaveConfig config,
            ExecutionListener listener,
            CancellationSignal cancellation) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(initialInputs, "initialInputs must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        return new Run(graph, initialInputs, config, listener, cancellation).execute();
    }

    /// State of a single run, confined to the coordinating thread.
    private final class Run {
        private final String runId = UUID.randomUUID().toString();
        private final WorkflowGraph graph;
        private final RagweaveConfig config;
        private final ExecutionListener listener;
        private final CancellationSignal cancellation;
        private final ExecutionContext context;
        private final BlockingQueue<SchedulerEvent> events = new LinkedBlockingQueue<>();
        private final Map<String, Future<?>> inFlight = new LinkedHashMap<>();

        Run(
                WorkflowGraph graph,
                Map<String, Object> initialInputs,
                RagweaveConfig config,
                ExecutionListener listener,
                CancellationSignal cancellation) {
            this.graph = graph;
            this.config = config;
            this.listener = listener;
            this.cancellation = cancellation;
            this.context = new ExecutionContext(runId, graph, initialInputs);
        }

        RunResult execute() {
            long startNanos = System.nanoTime();
            Long deadlineNanos =
                    config.getRunTimeout().map(t -> startNanos + t.toNanos()).orElse(null);

            Runnable wake = () -> events.offer(new SchedulerEvent.Wake());
            cancellation.onCancel(wake);
            listener.onRunStart(runId, graph);
            logger.fine("Run " + runId + " started for workflow '" + graph.getId() + "'");

            try {
                while (!context.allTerminal()) {
                    if (cancellation.isCancelled()) {
                        abort(cancellation.getReason());
                        break;
                    }
                    dispatchReady();
                    if (inFlight.isEmpty()) {
                        if (context.allTerminal()) {
                            break;
                        }
                        throw new IllegalStateException(
                                "Run " + runId + " stalled with no runnable nodes");
                    }

                    SchedulerEvent event;
                    if (deadlineNanos == null) {
                        event = events.take();
                    } else {
                        long remaining = deadlineNanos - System.nanoTime();
                        event = remaining > 0 ? events.poll(remaining, TimeUnit.NANOSECONDS) : null;
                        if (event == null) {
                            abort("Run timed out after " + config.getRunTimeout().orElseThrow());
                            break;
                        }
                    }
                    apply(event);
                    SchedulerEvent next;
                    while ((next = events.poll()) != null) {
                        apply(next);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abort("Run interrupted");
            } finally {
                cancellation.removeOnCancel(wake);
            }

            RunResult result = buildResult(Duration.ofNanos(System.nanoTime() - startNanos));
            listener.onRunComplete(result);
            logger.fine("Run " + runId + " finished with status " + result.status());
            return result;
        }

        private void dispatchReady() {
            if (inFlight.size() >= config.getMaxConcurrentNodes()) {
                return;
            }
            List<Node> ready = graph.readySet(context.terminalIds(), context.startedIds());
            for (Node node : ready) {
                if (inFlight.size() >= config.getMaxConcurrentNodes()) {
                    return;
                }
                dispatch(node);
            }
        }

        private void dispatch(Node node) {
            Map<String, Object> upstream = new LinkedHashMap<>();
            Set<String> unavailable = new LinkedHashSet<>();
            for (String dependency : node.getDependsOn()) {
                NodeState state = context.state(dependency);
                if (state.status() == NodeStatus.SUCCEEDED) {
                    upstream.put(dependency, state.output());
                } else {
                    unavailable.add(dependency);
                }
            }
            StepContext stepContext =
                    new StepContext(
                            runId,
                            node,
                            context.getInitialInputs(),
                            upstream,
                            unavailable,
                            1,
                            cancellation,
                            config);

            RetryPolicy policy =
                    node.getRetryPolicy() != null ? node.getRetryPolicy() : config.getDefaultRetryPolicy();
            Duration timeout = node.getTimeout() != null ? node.getTimeout() : config.getDefaultNodeTimeout();
            String nodeId = node.getId();
            AttemptObserver observer =
                    new AttemptObserver() {
                        @Override
                        public void onAttemptStarted(int attempt) {
                            events.offer(new SchedulerEvent.AttemptStarted(nodeId, attempt));
                        }

                        @Override
                        public void onRetryScheduled(int failedAttempt, Duration delay, String message) {
                            events.offer(
                                    new SchedulerEvent.RetryScheduled(nodeId, failedAttempt, delay, message));
                        }
                    };

            context.markRunning(nodeId, clock.instant());
            Future<?> future =
                    workers.submit(
                            () -> {
                                NodeOutcome outcome;
                                try {
                                    outcome =
                                            nodeRunner.run(
                                                    nodeId,
                                                    policy,
                                                    timeout,
                                                    attempt -> invoke(stepContext.withAttempt(attempt)),
                                                    cancellation,
                                                    observer);
                                } catch (RuntimeException | Error e) {
                                    logger.log(Level.SEVERE, "Node runner failed for node '" + nodeId + "'", e);
                                    outcome =
                                            NodeOutcome.failure(
                                                    nodeId, ErrorKind.INTERNAL, String.valueOf(e), 0);
                                }
                                events.offer(new SchedulerEvent.NodeFinished(outcome));
                            });
            inFlight.put(nodeId, future);
        }

        private Object invoke(StepContext stepContext) throws Exception {
            StepHandler handler = handlers.getHandlerFor(stepContext.node());
            return handler.execute(stepContext);
        }

        private void apply(SchedulerEvent event) {
            if (event instanceof SchedulerEvent.AttemptStarted started) {
                if (!context.isTerminal(started.nodeId())) {
                    context.markAttemptStarted(started.nodeId(), started.attempt());
                    listener.onNodeStart(runId, graph.getNode(started.nodeId()), started.attempt());
                }
            } else if (event instanceof SchedulerEvent.RetryScheduled retry) {
                if (!context.isTerminal(retry.nodeId())) {
                    context.markAwaitingRetry(retry.nodeId(), retry.failedAttempt());
                    listener.onNodeRetry(
                            runId,
                            graph.getNode(retry.nodeId()),
                            retry.failedAttempt(),
                            retry.delay(),
                            retry.message());
                }
            } else if (event instanceof SchedulerEvent.NodeFinished finished) {
                onFinished(finished.outcome());
            }
        }

        private void onFinished(NodeOutcome outcome) {
            String nodeId = outcome.nodeId();
            inFlight.remove(nodeId);
            if (context.isTerminal(nodeId)) {
                return;
            }
            Node node = graph.getNode(nodeId);
            Instant now = clock.instant();
            if (outcome.isSuccess()) {
                context.markSucceeded(nodeId, outcome.output(), outcome.attempts(), now);
                listener.onNodeComplete(runId, node, outcome.output());
                return;
            }
            if (outcome.isCancelled()) {
                context.markSkipped(nodeId, outcome.failure(), now);
                listener.onNodeSkipped(runId, node, outcome.failure());
            } else {
                context.markFailed(nodeId, outcome.failure(), now);
                listener.onNodeFailed(runId, node, outcome.failure());
            }
            skipDependents(node);
        }

        private void skipDependents(Node failed) {
            for (String dependentId : graph.dependentsOf(failed.getId())) {
                Node dependent = graph.getNode(dependentId);
                if (context.status(dependentId) != NodeStatus.PENDING || dependent.tolerates(failed)) {
                    continue;
                }
                NodeFailure failure =
                        NodeFailure.skipped(
                                dependentId,
                                ErrorKind.DEPENDENCY_FAILED,
                                "Dependency '" + failed.getId() + "' did not succeed");
                context.markSkipped(dependentId, failure, clock.instant());
                listener.onNodeSkipped(runId, dependent, failure);
                skipDependents(dependent);
            }
        }

        private void abort(String reason) {
            logger.warning("Run " + runId + " aborted: " + reason);
            cancellation.cancel(reason);
            inFlight.values().forEach(f -> f.cancel(true));
            inFlight.clear();

            Instant now = clock.instant();
            for (Node node : graph.getNodes()) {
                if (!context.isTerminal(node.getId())) {
                    NodeFailure failure = NodeFailure.skipped(node.getId(), ErrorKind.CANCELLED, reason);
                    context.markSkipped(node.getId(), failure, now);
                    listener.onNodeSkipped(runId, node, failure);
                }
            }
        }

        private RunResult buildResult(Duration elapsed) {
            Map<String, NodeState> snapshot = context.snapshot();
            List<NodeFailure> failures = new ArrayList<>();
            int succeeded = 0;
            for (NodeState state : snapshot.values()) {
                if (state.status() == NodeStatus.SUCCEEDED) {
                    succeeded++;
                } else if (state.failure() != null) {
                    failures.add(state.failure());
                }
            }
            return new RunResult(
                    runId,
                    graph.getId(),
                    RunResult.statusOf(succeeded, failures.size()),
                    context.outputs(),
                    failures,
                    snapshot,
                    elapsed);
        }
    }
}
