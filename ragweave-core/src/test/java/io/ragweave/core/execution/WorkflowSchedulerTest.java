package io.ragweave.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.ragweave.core.RagweaveConfig;
import io.ragweave.core.exception.AdapterException;
import io.ragweave.core.exception.CycleDetectedException;
import io.ragweave.core.exception.ErrorKind;
import io.ragweave.core.exception.TransientException;
import io.ragweave.core.execution.result.NodeFailure;
import io.ragweave.core.execution.result.RunResult;
import io.ragweave.core.execution.result.RunStatus;
import io.ragweave.core.execution.runner.NodeRunner;
import io.ragweave.core.execution.step.DefaultStepHandlerRegistry;
import io.ragweave.core.execution.step.StepHandler;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.RetryPolicy;
import io.ragweave.core.workflow.StepKind;
import io.ragweave.core.workflow.WorkflowGraph;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

@DisplayName("WorkflowScheduler")
class WorkflowSchedulerTest {

    private static final RagweaveConfig CONFIG =
            RagweaveConfig.builder()
                    .defaultRetryPolicy(RetryPolicy.noRetry())
                    .defaultNodeTimeout(Duration.ofSeconds(5))
                    .build();

    private ExecutorService executor;
    private DefaultStepHandlerRegistry registry;
    private WorkflowScheduler scheduler;
    private List<String> executionOrder;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new DefaultStepHandlerRegistry();
        scheduler = new WorkflowScheduler(registry, new NodeRunner(executor), executor);
        executionOrder = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Node custom(String id, String... dependsOn) {
        return Node.builder().id(id).stepKind(StepKind.CUSTOM).handler(id).dependsOn(dependsOn).build();
    }

    /// Registers a handler that records its execution and returns "<id>-out".
    private void succeeding(String id) {
        registry.registerCustom(
                id,
                ctx -> {
                    executionOrder.add(id);
                    return id + "-out";
                });
    }

    private void failing(String id, RuntimeException failure) {
        registry.registerCustom(
                id,
                ctx -> {
                    executionOrder.add(id);
                    throw failure;
                });
    }

    private static WorkflowGraph diamond(Node c) {
        return WorkflowGraph.builder()
                .id("diamond")
                .node(custom("a"))
                .node(custom("b", "a"))
                .node(c)
                .node(custom("d", "b", "c"))
                .build();
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("runs every node after all of its dependencies")
        void shouldRespectDependencyOrder() {
            // Given
            List.of("a", "b", "c", "d").forEach(WorkflowSchedulerTest.this::succeeding);
            var graph = diamond(custom("c", "a"));

            // When
            RunResult result = scheduler.run(graph, Map.of(), CONFIG);

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(result.failures()).isEmpty();
            assertThat(executionOrder.get(0)).isEqualTo("a");
            assertThat(executionOrder.get(3)).isEqualTo("d");
            assertThat(executionOrder.subList(1, 3)).containsExactlyInAnyOrder("b", "c");
            assertThat(result.outputs())
                    .containsEntry("a", "a-out")
                    .containsEntry("d", "d-out")
                    .hasSize(4);
            assertThat(result.snapshot().values())
                    .allMatch(state -> state.status() == NodeStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("passes dependency outputs and run inputs to the step")
        void shouldPassUpstreamOutputs() {
            succeeding("a");
            var seen = new ConcurrentHashMap<String, Object>();
            registry.registerCustom(
                    "b",
                    ctx -> {
                        seen.putAll(ctx.upstreamOutputs());
                        seen.put("input", ctx.input("question").orElseThrow());
                        return "done";
                    });
            var graph = WorkflowGraph.builder().id("g").node(custom("a")).node(custom("b", "a")).build();

            scheduler.run(graph, Map.of("question", "why?"), CONFIG);

            assertThat(seen).containsEntry("a", "a-out").containsEntry("input", "why?");
        }

        @Test
        @DisplayName("a cyclic graph is rejected before anything executes")
        void shouldNotExecuteCyclicGraph() {
            var invocations = new AtomicInteger();
            registry.registerCustom("a", ctx -> invocations.incrementAndGet());
            registry.registerCustom("b", ctx -> invocations.incrementAndGet());

            assertThatThrownBy(
                            () -> scheduler.run(
                                    WorkflowGraph.builder()
                                            .id("cyclic")
                                            .allowMultipleRoots(true)
                                            .node(custom("a", "b"))
                                            .node(custom("b", "a"))
                                            .build(),
                                    Map.of(),
                                    CONFIG))
                    .isInstanceOf(CycleDetectedException.class);
            assertThat(invocations.get()).isZero();
        }
    }

    @Nested
    @DisplayName("failure propagation")
    class FailurePropagation {

        @Test
        @DisplayName("skips the join when one branch fails and reports PARTIAL")
        void shouldSkipDependentOfFailedNode() {
            // Given
            succeeding("a");
            succeeding("b");
            succeeding("d");
            failing("c", new AdapterException("stub", AdapterException.Reason.PROVIDER_ERROR, "boom"));

            // When
            RunResult result = scheduler.run(diamond(custom("c", "a")), Map.of(), CONFIG);

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.PARTIAL);
            assertThat(executionOrder).doesNotContain("d");
            assertThat(result.snapshot().get("b").status()).isEqualTo(NodeStatus.SUCCEEDED);
            assertThat(result.snapshot().get("c").status()).isEqualTo(NodeStatus.FAILED);
            assertThat(result.snapshot().get("d").status()).isEqualTo(NodeStatus.SKIPPED);
            assertThat(result.failures())
                    .extracting(NodeFailure::nodeId, NodeFailure::kind)
                    .containsExactly(
                            tuple("c", ErrorKind.ADAPTER),
                            tuple("d", ErrorKind.DEPENDENCY_FAILED));
            assertThat(result.failure("d").orElseThrow().message()).contains("'c'");
            assertThat(result.outputs()).containsOnlyKeys("a", "b");
        }

        @Test
        @DisplayName("runs the join with available inputs when the failed branch is optional")
        void shouldRunDependentOfOptionalFailure() {
            // Given
            succeeding("a");
            succeeding("b");
            failing("c", new AdapterException("stub", AdapterException.Reason.PROVIDER_ERROR, "boom"));
            var seenUpstream = new ConcurrentHashMap<String, Object>();
            var seenUnavailable = new CopyOnWriteArrayList<String>();
            registry.registerCustom(
                    "d",
                    ctx -> {
                        seenUpstream.putAll(ctx.upstreamOutputs());
                        seenUnavailable.addAll(ctx.unavailableDependencies());
                        return "d-out";
                    });
            var optionalC =
                    Node.builder()
                            .id("c")
                            .stepKind(StepKind.CUSTOM)
                            .handler("c")
                            .dependsOn("a")
                            .optional(true)
                            .build();

            // When
            RunResult result = scheduler.run(diamond(optionalC), Map.of(), CONFIG);

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.PARTIAL);
            assertThat(result.snapshot().get("d").status()).isEqualTo(NodeStatus.SUCCEEDED);
            assertThat(seenUpstream).containsOnlyKeys("b");
            assertThat(seenUnavailable).containsExactly("c");
            assertThat(result.failures()).extracting(NodeFailure::nodeId).containsExactly("c");
        }

        @Test
        @DisplayName("propagates skips transitively")
        void shouldSkipTransitively() {
            failing("a", new IllegalStateException("bug"));
            succeeding("b");
            succeeding("c");
            var graph =
                    WorkflowGraph.builder()
                            .id("chain")
                            .node(custom("a"))
                            .node(custom("b", "a"))
                            .node(custom("c", "b"))
                            .build();

            RunResult result = scheduler.run(graph, Map.of(), CONFIG);

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.failures())
                    .extracting(NodeFailure::kind)
                    .containsExactly(ErrorKind.INTERNAL, ErrorKind.DEPENDENCY_FAILED, ErrorKind.DEPENDENCY_FAILED);
            assertThat(executionOrder).containsExactly("a");
        }

        @Test
        @DisplayName("reports a missing custom handler as a VALIDATION failure")
        void shouldReportMissingHandler() {
            var graph = WorkflowGraph.builder().id("g").node(custom("orphan")).build();

            RunResult result = scheduler.run(graph, Map.of(), CONFIG);

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.failure("orphan").orElseThrow().kind()).isEqualTo(ErrorKind.VALIDATION);
        }

        @Test
        @DisplayName("retries transient failures using the node's policy")
        void shouldRetryTransientFailures() {
            var attempts = new AtomicInteger();
            registry.registerCustom(
                    "flaky",
                    ctx -> {
                        if (attempts.incrementAndGet() < 3) {
                            throw new TransientException(TransientException.Reason.RATE_LIMITED, "slow down");
                        }
                        return "attempt " + ctx.attempt();
                    });
            var node =
                    Node.builder()
                            .id("flaky")
                            .stepKind(StepKind.CUSTOM)
                            .handler("flaky")
                            .retryPolicy(RetryPolicy.of(3, Duration.ZERO, Duration.ZERO))
                            .build();
            var listener = mock(ExecutionListener.class);

            RunResult result =
                    scheduler.run(WorkflowGraph.builder().id("g").node(node).build(), Map.of(), CONFIG, listener);

            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(result.outputs()).containsEntry("flaky", "attempt 3");
            assertThat(result.snapshot().get("flaky").attempts()).isEqualTo(3);
            verify(listener).onNodeRetry(anyString(), eq(node), eq(1), any(Duration.class), eq("slow down"));
            verify(listener).onNodeRetry(anyString(), eq(node), eq(2), any(Duration.class), eq("slow down"));
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("never exceeds maxConcurrentNodes in-flight executions")
        void shouldBoundInFlightNodes() {
            // Given
            var running = new AtomicInteger();
            var maxObserved = new AtomicInteger();
            StepHandler slow =
                    ctx -> {
                        int now = running.incrementAndGet();
                        maxObserved.accumulateAndGet(now, Math::max);
                        Thread.sleep(50);
                        running.decrementAndGet();
                        return ctx.node().getId();
                    };
            var builder = WorkflowGraph.builder().id("wide").allowMultipleRoots(true);
            for (int i = 0; i < 6; i++) {
                registry.registerCustom("n" + i, slow);
                builder.node(custom("n" + i));
            }
            var config = CONFIG.toBuilder().maxConcurrentNodes(2).build();

            // When
            RunResult result = scheduler.run(builder.build(), Map.of(), config);

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(maxObserved.get()).isLessThanOrEqualTo(2);
            assertThat(maxObserved.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("independent branches run in parallel")
        void shouldRunIndependentBranchesInParallel() throws Exception {
            var bothStarted = new CountDownLatch(2);
            StepHandler rendezvous =
                    ctx -> {
                        bothStarted.countDown();
                        if (!bothStarted.await(2, TimeUnit.SECONDS)) {
                            throw new IllegalStateException("branches did not overlap");
                        }
                        return "ok";
                    };
            succeeding("a");
            registry.registerCustom("b", rendezvous);
            registry.registerCustom("c", rendezvous);
            succeeding("d");

            RunResult result = scheduler.run(diamond(custom("c", "a")), Map.of(), CONFIG);

            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        }
    }

    @Nested
    @DisplayName("cancellation and timeout")
    class CancellationAndTimeout {

        @Test
        @DisplayName("run timeout interrupts in-flight nodes and skips the rest as CANCELLED")
        void shouldAbortOnRunTimeout() {
            // Given
            var interrupted = new CountDownLatch(1);
            registry.registerCustom(
                    "a",
                    ctx -> {
                        try {
                            Thread.sleep(10_000);
                        } catch (InterruptedException e) {
                            interrupted.countDown();
                            throw e;
                        }
                        return "late";
                    });
            succeeding("b");
            var graph = WorkflowGraph.builder().id("g").node(custom("a")).node(custom("b", "a")).build();
            var config = CONFIG.toBuilder().runTimeout(Duration.ofMillis(100)).build();

            // When
            RunResult result = scheduler.run(graph, Map.of(), config);

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.failures())
                    .extracting(NodeFailure::kind)
                    .containsOnly(ErrorKind.CANCELLED);
            assertThat(result.snapshot().values())
                    .allMatch(state -> state.status() == NodeStatus.SKIPPED);
            assertThat(executionOrder).doesNotContain("b");
            assertThat(result.elapsed()).isLessThan(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("an external cancellation stops the run")
        void shouldStopOnExternalCancellation() {
            var signal = new CancellationSignal();
            succeeding("a");
            registry.registerCustom(
                    "b",
                    ctx -> {
                        signal.cancel("user aborted");
                        Thread.sleep(10_000);
                        return "never";
                    });
            succeeding("c");
            var graph =
                    WorkflowGraph.builder()
                            .id("g")
                            .node(custom("a"))
                            .node(custom("b", "a"))
                            .node(custom("c", "b"))
                            .build();

            RunResult result = scheduler.run(graph, Map.of(), CONFIG, ExecutionListener.NOOP, signal);

            assertThat(result.status()).isEqualTo(RunStatus.PARTIAL);
            assertThat(result.outputs()).containsOnlyKeys("a");
            assertThat(result.failure("b").orElseThrow().kind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(result.failure("c").orElseThrow().message()).isEqualTo("user aborted");
        }

        @Test
        @DisplayName("a signal reused across runs keeps no callbacks from finished runs")
        void shouldReleaseSignalCallbacksWhenRunEnds() {
            // Given
            var signal = new CancellationSignal();
            succeeding("a");
            var graph = WorkflowGraph.builder().id("g").node(custom("a")).build();

            // When
            for (int i = 0; i < 3; i++) {
                RunResult result = scheduler.run(graph, Map.of(), CONFIG, ExecutionListener.NOOP, signal);
                assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
            }

            // Then
            assertThat(signal.pendingCallbacks()).isZero();
        }
    }

    @Nested
    @DisplayName("listener")
    class Listener {

        @Test
        @DisplayName("receives lifecycle callbacks in order")
        void shouldNotifyLifecycle() {
            succeeding("a");
            failing("b", new IllegalStateException("bad"));
            succeeding("c");
            var graph =
                    WorkflowGraph.builder()
                            .id("g")
                            .node(custom("a"))
                            .node(custom("b", "a"))
                            .node(custom("c", "b"))
                            .build();
            var listener = mock(ExecutionListener.class);

            RunResult result = scheduler.run(graph, Map.of(), CONFIG, listener);

            InOrder order = inOrder(listener);
            order.verify(listener).onRunStart(result.runId(), graph);
            order.verify(listener).onNodeStart(result.runId(), graph.getNode("a"), 1);
            order.verify(listener).onNodeComplete(result.runId(), graph.getNode("a"), "a-out");
            order.verify(listener).onNodeStart(result.runId(), graph.getNode("b"), 1);
            order.verify(listener).onNodeFailed(eq(result.runId()), eq(graph.getNode("b")), any(NodeFailure.class));
            order.verify(listener).onNodeSkipped(eq(result.runId()), eq(graph.getNode("c")), any(NodeFailure.class));
            order.verify(listener).onRunComplete(result);
        }
    }
}
