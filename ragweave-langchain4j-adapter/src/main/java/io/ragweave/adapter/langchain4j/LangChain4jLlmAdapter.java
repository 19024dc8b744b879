package io.ragweave.adapter.langchain4j;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.ragweave.core.adapter.GenerationParameters;
import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.LlmRequest;
import io.ragweave.core.adapter.LlmResponse;
import io.ragweave.core.exception.AdapterException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link LlmAdapter}.
///
/// Wraps a {@link ChatModel} for generation and an optional
/// {@link EmbeddingModel} for embeddings. Each prompt is sent as a single user
/// message; conversation history is already rendered into the prompt by the
/// prompt assembler. Generation parameters travel on the `ChatRequest` and
/// override the model's defaults per call.
///
/// Every LangChain4j failure is translated before it leaves this class, so
/// the node runner sees only transient or adapter errors.
///
/// @implNote Thread-safe if the wrapped models are. The adapter holds no
/// mutable state.
///
/// @see LangChain4jProvider for adapter creation
public class LangChain4jLlmAdapter implements LlmAdapter {

    private static final Logger logger = Logger.getLogger(LangChain4jLlmAdapter.class.getName());

    private final String provider;
    private final String modelId;
    private final ChatModel chatModel;
    private final EmbeddingModel embeddingModel;

    /// Creates an adapter.
    ///
    /// @param provider provider name used in error reports and response metadata, not null
    /// @param modelId chat model name, part of every cache fingerprint, not null
    /// @param chatModel model used for generation, not null
    /// @param embeddingModel model used for embeddings, may be null if embeddings are not needed
    public LangChain4jLlmAdapter(
            String provider, String modelId, ChatModel chatModel, EmbeddingModel embeddingModel) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel must not be null");
        this.embeddingModel = embeddingModel;
    }

    @Override
    public LlmResponse generate(LlmRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Instant start = Instant.now();
        GenerationParameters parameters = request.parameters();

        ChatRequest.Builder chatRequest =
                ChatRequest.builder()
                        .messages(UserMessage.from(request.prompt()))
                        .temperature(parameters.temperature())
                        .topP(parameters.topP())
                        .maxOutputTokens(parameters.maxTokens());
        if (!parameters.stopSequences().isEmpty()) {
            chatRequest.stopSequences(parameters.stopSequences());
        }

        ChatResponse response;
        try {
            response = chatModel.chat(chatRequest.build());
        } catch (RuntimeException e) {
            logger.warning("Generation with " + provider + ":" + modelId + " failed: " + e.getMessage());
            throw LangChain4jErrors.translate(provider, e);
        }

        AiMessage message = response != null ? response.aiMessage() : null;
        if (message == null || message.text() == null) {
            throw new AdapterException(
                    provider,
                    AdapterException.Reason.MALFORMED_RESPONSE,
                    "No text in response from " + provider + ":" + modelId);
        }

        TokenUsage usage = response.metadata() != null ? response.metadata().tokenUsage() : null;
        Duration latency = Duration.between(start, Instant.now());
        logger.fine(
                "Generated "
                        + message.text().length()
                        + " chars with "
                        + provider
                        + ":"
                        + modelId
                        + " in "
                        + latency.toMillis()
                        + "ms");

        return new LlmResponse(
                message.text(),
                usage != null ? count(usage.inputTokenCount()) : 0,
                usage != null ? count(usage.outputTokenCount()) : 0,
                latency,
                provider + ":" + modelId);
    }

    @Override
    public float[] embed(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (embeddingModel == null) {
            throw new AdapterException(
                    provider,
                    AdapterException.Reason.INVALID_REQUEST,
                    "No embedding model configured for " + provider + ":" + modelId);
        }

        Response<Embedding> response;
        try {
            response = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            logger.warning("Embedding with " + provider + " failed: " + e.getMessage());
            throw LangChain4jErrors.translate(provider, e);
        }

        if (response == null || response.content() == null) {
            throw new AdapterException(
                    provider, AdapterException.Reason.MALFORMED_RESPONSE, "No embedding returned by " + provider);
        }
        return response.content().vector();
    }

    @Override
    public String modelId() {
        return modelId;
    }

    /// Returns whether this adapter can compute embeddings.
    ///
    /// @return true if an embedding model is configured
    public boolean supportsEmbeddings() {
        return embeddingModel != null;
    }

    private static int count(Integer tokens) {
        return tokens != null ? tokens : 0;
    }
}
