package io.ragweave.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.spi.LlmProvider;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link LlmProvider}.
///
/// Creates {@link ChatModel} and {@link EmbeddingModel} instances for supported
/// AI providers and wraps them in {@link LangChain4jLlmAdapter}. Supports
/// Anthropic (Claude), OpenAI (GPT/o-series), Google (Gemini/Gemma) and
/// DeepSeek chat models. DeepSeek uses the OpenAI-compatible API with a custom
/// base URL.
///
/// ### Embeddings
/// ```
/// Chat model        Embedding model
/// ------------------+----------------------------------------------
/// gemini, gemma     │ Google text-embedding-004
/// everything else   │ OpenAI text-embedding-3-small, if an OpenAI key is present
/// ```
/// The credential `embedding_model` overrides the embedding model name.
///
/// Discovered through `META-INF/services/io.ragweave.core.adapter.spi.LlmProvider`.
///
/// @implNote Stateless and thread-safe. Each call to {@link #createAdapter}
/// creates new model instances.
public class LangChain4jProvider implements LlmProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jProvider.class.getName());

    static final String EMBEDDING_MODEL_KEY = "embedding_model";
    static final String OPENAI_EMBEDDING_MODEL = "text-embedding-3-small";
    static final String GOOGLE_EMBEDDING_MODEL = "text-embedding-004";

    private static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";
    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final double DEFAULT_TEMPERATURE = 0.7;

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("o3")
                || modelName.startsWith("o4")
                || modelName.startsWith("gemini")
                || modelName.startsWith("gemma")
                || modelName.startsWith("deepseek");
    }

    /// Creates an adapter for the model.
    ///
    /// @param modelName chat model name, not null
    /// @param credentials API keys, not null
    /// @return configured adapter, never null
    /// @throws IllegalArgumentException if the model is not supported
    /// @throws IllegalStateException if the required API key is missing
    @Override
    public LlmAdapter createAdapter(String modelName, Map<String, String> credentials) {
        logger.info("Creating LangChain4j adapter for model: " + modelName);
        ChatModel chatModel = createChatModel(modelName, credentials);
        EmbeddingModel embeddingModel = createEmbeddingModel(modelName, credentials);
        if (embeddingModel == null) {
            logger.info("No embedding model available for " + modelName + "; embed() will fail");
        }
        return new LangChain4jLlmAdapter(vendorOf(modelName), modelName, chatModel, embeddingModel);
    }

    @Override
    public int getPriority() {
        return 100;
    }

    private ChatModel createChatModel(String modelName, Map<String, String> credentials) {
        if (modelName.startsWith("claude")) {
            return AnthropicChatModel.builder()
                    .apiKey(requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                    .modelName(modelName)
                    .temperature(DEFAULT_TEMPERATURE)
                    .maxTokens(DEFAULT_MAX_TOKENS)
                    .timeout(DEFAULT_TIMEOUT)
                    .build();
        } else if (isOpenAi(modelName)) {
            return openAiChatModel(
                    modelName, requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY"), null);
        } else if (isGoogle(modelName)) {
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY"))
                    .modelName(modelName)
                    .temperature(DEFAULT_TEMPERATURE)
                    .maxOutputTokens(DEFAULT_MAX_TOKENS)
                    .timeout(DEFAULT_TIMEOUT)
                    .build();
        } else if (modelName.startsWith("deepseek")) {
            return openAiChatModel(
                    modelName,
                    requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY"),
                    DEEPSEEK_BASE_URL);
        }
        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private static ChatModel openAiChatModel(String modelName, String apiKey, String baseUrl) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .temperature(DEFAULT_TEMPERATURE)
                        .maxTokens(DEFAULT_MAX_TOKENS)
                        .timeout(DEFAULT_TIMEOUT);
        if (baseUrl != null) builder.baseUrl(baseUrl);
        return builder.build();
    }

    /// Picks the embedding model that matches the chat model's vendor.
    ///
    /// @return embedding model, or null if no suitable key is present
    private EmbeddingModel createEmbeddingModel(String modelName, Map<String, String> credentials) {
        String override = credentials.get(EMBEDDING_MODEL_KEY);
        if (isGoogle(modelName)) {
            return GoogleAiEmbeddingModel.builder()
                    .apiKey(requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY"))
                    .modelName(override != null ? override : GOOGLE_EMBEDDING_MODEL)
                    .build();
        }
        String openAiKey = findApiKey(credentials, "openai_api_key", "OPENAI_API_KEY");
        if (openAiKey == null) {
            return null;
        }
        return OpenAiEmbeddingModel.builder()
                .apiKey(openAiKey)
                .modelName(override != null ? override : OPENAI_EMBEDDING_MODEL)
                .timeout(DEFAULT_TIMEOUT)
                .build();
    }

    private static boolean isOpenAi(String modelName) {
        return modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("o3")
                || modelName.startsWith("o4");
    }

    private static boolean isGoogle(String modelName) {
        return modelName.startsWith("gemini") || modelName.startsWith("gemma");
    }

    private static String vendorOf(String modelName) {
        if (modelName.startsWith("claude")) return "anthropic";
        if (isGoogle(modelName)) return "google";
        if (modelName.startsWith("deepseek")) return "deepseek";
        return "openai";
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-null value found, never null
    /// @throws IllegalStateException if no key name resolves to a value
    private static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        String value = findApiKey(credentials, keyNames);
        if (value == null) {
            throw new IllegalStateException(
                    "API key not found. Provide one of: " + String.join(", ", keyNames));
        }
        return value;
    }

    private static String findApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null) return value;
        }
        return null;
    }
}
