package io.ragweave.core;

import io.ragweave.core.adapter.CacheAdapter;
import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.LlmAdapterFactory;
import io.ragweave.core.adapter.VectorStoreAdapter;
import io.ragweave.core.adapter.memory.InMemoryCacheAdapter;
import io.ragweave.core.adapter.memory.InMemoryVectorStore;
import io.ragweave.core.adapter.spi.LlmProvider;
import io.ragweave.core.adapter.stub.StubLlmProvider;
import io.ragweave.core.cache.CacheLayer;
import io.ragweave.core.cache.CachingLlmAdapter;
import io.ragweave.core.execution.WorkflowScheduler;
import io.ragweave.core.execution.runner.NodeRunner;
import io.ragweave.core.execution.step.AssemblePromptStepHandler;
import io.ragweave.core.execution.step.DefaultStepHandlerRegistry;
import io.ragweave.core.execution.step.GenerateStepHandler;
import io.ragweave.core.execution.step.RetrieveStepHandler;
import io.ragweave.core.execution.step.StepHandler;
import io.ragweave.core.execution.step.StepHandlerRegistry;
import io.ragweave.core.prompt.DefaultPromptTemplateRegistry;
import io.ragweave.core.prompt.PromptAssembler;
import io.ragweave.core.prompt.PromptTemplate;
import io.ragweave.core.prompt.PromptTemplateRegistry;
import io.ragweave.core.retrieval.Reranker;
import io.ragweave.core.retrieval.RetrievalPipeline;
import io.ragweave.core.token.TokenEstimator;
import io.ragweave.core.token.WhitespaceTokenEstimator;
import io.ragweave.core.workflow.StepKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link RagweaveEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Builder with explicit providers**:
/// {@snippet :
/// var env = RagweaveFactory.builder()
///     .config(RagweaveConfig.builder().maxConcurrentNodes(8).build())
///     .loadCredentials(properties)
///     .llmProviders(List.of(new LangChain4jProvider()))
///     .model("gpt-4o-mini")
///     .vectorStore(vectorStore)
///     .template(new PromptTemplate("answer", "{context}\n\nQ: {question}", 2000))
///     .build();
/// }
///
/// **Quick start in stub mode**:
/// {@snippet :
/// var env = RagweaveFactory.builder().stubMode(true).build();
/// }
///
/// @implNote Utility class with only static methods. All dependencies are wired
/// explicitly via constructor injection.
///
/// @see RagweaveEnvironment
/// @see RagweaveConfig
public final class RagweaveFactory {

    private static final Logger logger = Logger.getLogger(RagweaveFactory.class.getName());

    /// Model used when neither an adapter nor a model name is configured.
    public static final String DEFAULT_MODEL = "stub-model";

    static final String CREDENTIALS_PREFIX = "ragweave.credentials.";
    static final String STUB_ENABLED_KEY = "ragweave.stub.enabled";

    private RagweaveFactory() {}

    /// Creates an environment with default configuration and credentials
    /// discovered from environment variables.
    ///
    /// @return a fully-configured environment, never null
    /// @throws IllegalStateException if no provider supports {@link #DEFAULT_MODEL}
    public static RagweaveEnvironment createEnvironment() {
        return createEnvironment(RagweaveConfig.defaults(), loadCredentialsFromEnvironment());
    }

    public static RagweaveEnvironment createEnvironment(RagweaveConfig config) {
        return createEnvironment(config, loadCredentialsFromEnvironment());
    }

    /// Creates an environment with custom configuration and explicit credentials.
    ///
    /// Only the built-in stub provider is available; use {@link #builder()} to
    /// register real model providers.
    ///
    /// @param config default run configuration, not null
    /// @param credentials API keys and settings, not null (may be empty)
    /// @return a fully-configured environment, never null
    public static RagweaveEnvironment createEnvironment(
            RagweaveConfig config, Map<String, String> credentials) {
        return builder().config(config).credentials(credentials).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Discovers API credentials from environment variables.
    ///
    /// Picks up variables named `*_API_KEY`, `*_KEY`, `*_SECRET` or `*_TOKEN`,
    /// plus `RAGWEAVE_STUB_ENABLED`.
    ///
    /// @return map of discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (value != null
                                    && !value.isEmpty()
                                    && (isApiKeyPattern(key) || key.equals("RAGWEAVE_STUB_ENABLED"))) {
                                credentials.put(key, value);
                            }
                        });
        return credentials;
    }

    /// Loads credentials from a Properties object.
    ///
    /// Supports prefixed keys (`ragweave.credentials.OPENAI_API_KEY=...`, prefix
    /// stripped), direct API key names and `ragweave.stub.enabled`.
    ///
    /// @param properties the properties to read, not null
    /// @return credential keys to values, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        properties.forEach(
                (key, value) -> {
                    String keyStr = key.toString();
                    String valueStr = value.toString();
                    if (valueStr.isEmpty()) {
                        return;
                    }
                    if (keyStr.startsWith(CREDENTIALS_PREFIX)) {
                        credentials.put(keyStr.substring(CREDENTIALS_PREFIX.length()), valueStr);
                    } else if (keyStr.equals(STUB_ENABLED_KEY) || isApiKeyPattern(keyStr)) {
                        credentials.put(keyStr, valueStr);
                    }
                });
        return credentials;
    }

    /// Loads credentials from environment variables and properties; properties win.
    ///
    /// @param properties the properties to merge over environment credentials, not null
    /// @return merged credentials, never null
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase(Locale.ROOT);
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    /// Builds the stub provider for the stub-mode setting in credentials.
    ///
    /// An explicit `true` or `false` is fixed on the provider; otherwise the
    /// provider falls back to the system property and environment variable.
    private static StubLlmProvider stubProvider(Map<String, String> credentials) {
        String enabled = credentials.get(STUB_ENABLED_KEY);
        if (enabled == null) {
            enabled = credentials.get("RAGWEAVE_STUB_ENABLED");
        }
        if ("true".equalsIgnoreCase(enabled)) {
            return new StubLlmProvider(true);
        }
        if ("false".equalsIgnoreCase(enabled)) {
            return new StubLlmProvider(false);
        }
        return new StubLlmProvider();
    }

    private static ExecutorService createPool(String threadPrefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory =
                runnable -> {
                    Thread thread = new Thread(runnable, threadPrefix + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                };
        return Executors.newCachedThreadPool(threadFactory);
    }

    /// Fluent builder for {@link RagweaveEnvironment}.
    ///
    /// Every adapter is optional: missing ones default to the in-memory
    /// implementations, and the language model is resolved from
    /// {@link #model(String)} through the registered providers unless an
    /// adapter is supplied directly.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static final class Builder {
        private RagweaveConfig config = RagweaveConfig.defaults();
        private Map<String, String> credentials = new HashMap<>();
        private final List<LlmProvider> llmProviders = new ArrayList<>();
        private String model;
        private LlmAdapter llmAdapter;
        private VectorStoreAdapter vectorStore;
        private CacheAdapter cacheAdapter;
        private Reranker reranker;
        private TokenEstimator tokenEstimator = WhitespaceTokenEstimator.INSTANCE;
        private final List<PromptTemplate> templates = new ArrayList<>();
        private final Map<String, StepHandler> customHandlers = new LinkedHashMap<>();
        private ExecutorService executorService;

        private Builder() {}

        public Builder config(RagweaveConfig config) {
            this.config = config;
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        /// Loads credentials from environment variables and properties.
        ///
        /// @param properties the properties to merge over environment credentials, not null
        /// @return this builder for chaining, never null
        public Builder loadCredentials(Properties properties) {
            this.credentials.putAll(RagweaveFactory.loadCredentials(properties));
            return this;
        }

        /// Sets the language-model providers.
        ///
        /// When none are set, providers are discovered with
        /// {@link LlmAdapterFactory#loadProviders()}. The built-in
        /// {@link StubLlmProvider} is always included.
        ///
        /// @param providers providers to select from, not null
        /// @return this builder for chaining, never null
        public Builder llmProviders(List<LlmProvider> providers) {
            this.llmProviders.clear();
            this.llmProviders.addAll(providers);
            return this;
        }

        public Builder llmProvider(LlmProvider provider) {
            this.llmProviders.add(provider);
            return this;
        }

        /// Sets the model name resolved through the providers.
        ///
        /// Ignored when {@link #llmAdapter(LlmAdapter)} is set.
        ///
        /// @param model model identifier (e.g., "gpt-4o-mini"), not null
        /// @return this builder for chaining, never null
        public Builder model(String model) {
            this.model = model;
            return this;
        }

        /// Uses the given adapter instead of resolving one from providers.
        ///
        /// @param llmAdapter adapter to wrap with the cache layer, not null
        /// @return this builder for chaining, never null
        public Builder llmAdapter(LlmAdapter llmAdapter) {
            this.llmAdapter = llmAdapter;
            return this;
        }

        public Builder vectorStore(VectorStoreAdapter vectorStore) {
            this.vectorStore = vectorStore;
            return this;
        }

        public Builder cacheAdapter(CacheAdapter cacheAdapter) {
            this.cacheAdapter = cacheAdapter;
            return this;
        }

        /// Sets the retrieval re-ranking stage.
        ///
        /// @param reranker reranker, may be null to keep vector order
        /// @return this builder for chaining, never null
        public Builder reranker(Reranker reranker) {
            this.reranker = reranker;
            return this;
        }

        public Builder tokenEstimator(TokenEstimator tokenEstimator) {
            this.tokenEstimator = tokenEstimator;
            return this;
        }

        public Builder template(PromptTemplate template) {
            this.templates.add(template);
            return this;
        }

        /// Registers a handler for CUSTOM nodes naming `name`.
        ///
        /// @param name handler name referenced by {@link io.ragweave.core.workflow.Node#getHandler()}, not null
        /// @param handler the handler, not null
        /// @return this builder for chaining, never null
        public Builder customHandler(String name, StepHandler handler) {
            this.customHandlers.put(name, handler);
            return this;
        }

        /// Enables or disables stub mode for running without API calls.
        ///
        /// @param enabled `true` to enable stub mode
        /// @return this builder for chaining, never null
        public Builder stubMode(boolean enabled) {
            this.credentials.put(STUB_ENABLED_KEY, String.valueOf(enabled));
            return this;
        }

        /// Sets the worker pool on which node executions run.
        ///
        /// Any pool works, bounded ones included: attempts of a node run on a
        /// separate cached pool owned by the environment, so a node never waits
        /// for a thread of the pool it occupies.
        ///
        /// @param executorService the pool, may be null for an auto-created cached pool
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Builds the environment.
        ///
        /// @apiNote **Side effects**:
        /// - Auto-loads environment credentials if none were explicitly provided
        /// - Creates a worker pool if none was provided, and always an attempt pool
        ///
        /// @return the configured environment, never null
        /// @throws IllegalStateException if no provider supports the configured model
        public RagweaveEnvironment build() {
            if (credentials.isEmpty()) {
                credentials = RagweaveFactory.loadCredentialsFromEnvironment();
            }

            LlmAdapter rawLlm = llmAdapter;
            if (rawLlm == null) {
                List<LlmProvider> providers =
                        new ArrayList<>(
                                llmProviders.isEmpty()
                                        ? LlmAdapterFactory.loadProviders()
                                        : llmProviders);
                providers.add(stubProvider(credentials));
                LlmAdapterFactory adapterFactory = new LlmAdapterFactory(credentials, providers);
                rawLlm = adapterFactory.createAdapter(model != null ? model : DEFAULT_MODEL);
            }

            VectorStoreAdapter store = vectorStore != null ? vectorStore : new InMemoryVectorStore();
            CacheAdapter cacheBackend = cacheAdapter != null ? cacheAdapter : new InMemoryCacheAdapter();
            CacheLayer cacheLayer = new CacheLayer(cacheBackend, config.getDefaultCacheTtl());
            LlmAdapter cachingLlm = new CachingLlmAdapter(rawLlm, cacheLayer, config.getDefaultCacheTtl());

            PromptTemplateRegistry templateRegistry = new DefaultPromptTemplateRegistry();
            templates.forEach(templateRegistry::register);

            RetrievalPipeline retrievalPipeline =
                    new RetrievalPipeline(rawLlm, store, cacheLayer, reranker, tokenEstimator);

            StepHandlerRegistry handlerRegistry = new DefaultStepHandlerRegistry();
            handlerRegistry.register(StepKind.RETRIEVE, new RetrieveStepHandler(retrievalPipeline));
            handlerRegistry.register(
                    StepKind.ASSEMBLE_PROMPT,
                    new AssemblePromptStepHandler(
                            templateRegistry, new PromptAssembler(tokenEstimator), tokenEstimator));
            handlerRegistry.register(StepKind.GENERATE, new GenerateStepHandler(cachingLlm));
            customHandlers.forEach(handlerRegistry::registerCustom);

            ExecutorService workers =
                    executorService != null ? executorService : createPool("ragweave-worker-");
            ExecutorService attempts = createPool("ragweave-attempt-");
            WorkflowScheduler scheduler =
                    new WorkflowScheduler(handlerRegistry, new NodeRunner(attempts), workers);

            logger.info(
                    "Ragweave environment ready: model="
                            + rawLlm.modelId()
                            + ", templates="
                            + templates.size()
                            + ", customHandlers="
                            + customHandlers.keySet());

            return new RagweaveEnvironment(
                    config,
                    scheduler,
                    handlerRegistry,
                    templateRegistry,
                    cacheLayer,
                    cachingLlm,
                    store,
                    retrievalPipeline,
                    workers,
                    attempts);
        }
    }
}
