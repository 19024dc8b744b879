package io.ragweave.core;

import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.VectorStoreAdapter;
import io.ragweave.core.cache.CacheLayer;
import io.ragweave.core.execution.CancellationSignal;
import io.ragweave.core.execution.ExecutionListener;
import io.ragweave.core.execution.WorkflowScheduler;
import io.ragweave.core.execution.result.RunResult;
import io.ragweave.core.execution.step.StepHandlerRegistry;
import io.ragweave.core.prompt.PromptTemplateRegistry;
import io.ragweave.core.retrieval.RetrievalPipeline;
import io.ragweave.core.workflow.WorkflowGraph;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/// Container holding the wired components needed to run workflows.
///
/// Implements {@link AutoCloseable} so the worker pool is released when the
/// environment is no longer needed.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @implNote Safe for concurrent reads and concurrent runs. Each run owns its
/// own execution context; registries and the cache layer are thread-safe.
///
/// @apiNote Create instances via {@link RagweaveFactory#createEnvironment()} or
/// {@link RagweaveFactory.Builder} rather than direct construction.
///
/// @see RagweaveFactory.Builder
public final class RagweaveEnvironment implements AutoCloseable {

    private final RagweaveConfig config;
    private final WorkflowScheduler scheduler;
    private final StepHandlerRegistry stepHandlerRegistry;
    private final PromptTemplateRegistry promptTemplateRegistry;
    private final CacheLayer cacheLayer;
    private final LlmAdapter llmAdapter;
    private final VectorStoreAdapter vectorStore;
    private final RetrievalPipeline retrievalPipeline;
    private final ExecutorService executorService;
    private final ExecutorService attemptExecutor;

    /// Creates a new environment with the specified components.
    ///
    /// @param config default run configuration, not null
    /// @param scheduler scheduler executing graphs, not null
    /// @param stepHandlerRegistry handlers for every step kind, not null
    /// @param promptTemplateRegistry templates available to ASSEMBLE_PROMPT nodes, not null
    /// @param cacheLayer shared cache for generations and embeddings, not null
    /// @param llmAdapter cache-backed language-model adapter, not null
    /// @param vectorStore vector search backend, not null
    /// @param retrievalPipeline pipeline backing RETRIEVE nodes, not null
    /// @param executorService worker pool running node executions, not null
    /// @param attemptExecutor pool running single node attempts, not null
    public RagweaveEnvironment(
            RagweaveConfig config,
            WorkflowScheduler scheduler,
            StepHandlerRegistry stepHandlerRegistry,
            PromptTemplateRegistry promptTemplateRegistry,
            CacheLayer cacheLayer,
            LlmAdapter llmAdapter,
            VectorStoreAdapter vectorStore,
            RetrievalPipeline retrievalPipeline,
            ExecutorService executorService,
            ExecutorService attemptExecutor) {
        this.config = config;
        this.scheduler = scheduler;
        this.stepHandlerRegistry = stepHandlerRegistry;
        this.promptTemplateRegistry = promptTemplateRegistry;
        this.cacheLayer = cacheLayer;
        this.llmAdapter = llmAdapter;
        this.vectorStore = vectorStore;
        this.retrievalPipeline = retrievalPipeline;
        this.executorService = executorService;
        this.attemptExecutor = attemptExecutor;
    }

    /// Runs a graph with the environment's default configuration.
    ///
    /// @param graph graph to execute, not null
    /// @param initialInputs run inputs, not null
    /// @return the run result, never null
    public RunResult run(WorkflowGraph graph, Map<String, Object> initialInputs) {
        return scheduler.run(graph, initialInputs, config);
    }

    public RunResult run(
            WorkflowGraph graph, Map<String, Object> initialInputs, ExecutionListener listener) {
        return scheduler.run(graph, initialInputs, config, listener);
    }

    public RunResult run(
            WorkflowGraph graph,
            Map<String, Object> initialInputs,
            ExecutionListener listener,
            CancellationSignal cancellation) {
        return scheduler.run(graph, initialInputs, config, listener, cancellation);
    }

    public RagweaveConfig getConfig() {
        return config;
    }

    public WorkflowScheduler getScheduler() {
        return scheduler;
    }

    public StepHandlerRegistry getStepHandlerRegistry() {
        return stepHandlerRegistry;
    }

    public PromptTemplateRegistry getPromptTemplateRegistry() {
        return promptTemplateRegistry;
    }

    public CacheLayer getCacheLayer() {
        return cacheLayer;
    }

    /// Returns the language-model adapter used by GENERATE nodes.
    ///
    /// @return cache-backed adapter, never null
    public LlmAdapter getLlmAdapter() {
        return llmAdapter;
    }

    public VectorStoreAdapter getVectorStore() {
        return vectorStore;
    }

    public RetrievalPipeline getRetrievalPipeline() {
        return retrievalPipeline;
    }

    /// Shuts down the worker and attempt pools.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not block.
    /// Runs already in progress complete normally.
    @Override
    public void close() {
        executorService.shutdown();
        attemptExecutor.shutdown();
    }
}
