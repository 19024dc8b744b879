package io.ragweave.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.ragweave.core.adapter.GenerationParameters;
import io.ragweave.core.adapter.LlmRequest;
import io.ragweave.core.adapter.LlmResponse;
import io.ragweave.core.exception.AdapterException;
import io.ragweave.core.exception.TransientException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("LangChain4jLlmAdapter")
@ExtendWith(MockitoExtension.class)
class LangChain4jLlmAdapterTest {

    @Mock private ChatModel chatModel;
    @Mock private EmbeddingModel embeddingModel;

    private LangChain4jLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new LangChain4jLlmAdapter("openai", "gpt-4o-mini", chatModel, embeddingModel);
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("sends the prompt as a user message with request parameters")
        void shouldSendPromptWithParameters() {
            // Given
            when(chatModel.chat(any(ChatRequest.class)))
                    .thenReturn(
                            ChatResponse.builder()
                                    .aiMessage(AiMessage.from("Paris"))
                                    .tokenUsage(new TokenUsage(12, 3))
                                    .build());
            GenerationParameters parameters = new GenerationParameters(0.1, 50, 0.9, List.of("###"));

            // When
            LlmResponse response = adapter.generate(LlmRequest.of("Capital of France?", parameters));

            // Then
            assertThat(response.text()).isEqualTo("Paris");
            assertThat(response.promptTokens()).isEqualTo(12);
            assertThat(response.completionTokens()).isEqualTo(3);
            assertThat(response.provider()).isEqualTo("openai:gpt-4o-mini");

            ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
            verify(chatModel).chat(request.capture());
            assertThat(request.getValue().messages())
                    .containsExactly(UserMessage.from("Capital of France?"));
            assertThat(request.getValue().parameters().temperature()).isEqualTo(0.1);
            assertThat(request.getValue().parameters().maxOutputTokens()).isEqualTo(50);
            assertThat(request.getValue().parameters().stopSequences()).containsExactly("###");
        }

        @Test
        @DisplayName("reports zero tokens when the provider omits usage")
        void shouldTolerateMissingUsage() {
            when(chatModel.chat(any(ChatRequest.class)))
                    .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("ok")).build());

            LlmResponse response = adapter.generate(LlmRequest.of("hi"));

            assertThat(response.totalTokens()).isZero();
        }

        @Test
        @DisplayName("rejects a response without text")
        void shouldRejectEmptyResponse() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(null);

            assertThatThrownBy(() -> adapter.generate(LlmRequest.of("hi")))
                    .isInstanceOf(AdapterException.class)
                    .extracting(e -> ((AdapterException) e).getReason())
                    .isEqualTo(AdapterException.Reason.MALFORMED_RESPONSE);
        }

        static Stream<Arguments> transientFailures() {
            return Stream.of(
                    Arguments.of(new RateLimitException("slow down"), TransientException.Reason.RATE_LIMITED),
                    Arguments.of(new TimeoutException("took too long"), TransientException.Reason.TIMEOUT),
                    Arguments.of(new HttpException(503, "unavailable"), TransientException.Reason.NETWORK),
                    Arguments.of(new HttpException(429, "quota"), TransientException.Reason.RATE_LIMITED),
                    Arguments.of(
                            new RuntimeException("io", new SocketTimeoutException("read timed out")),
                            TransientException.Reason.TIMEOUT),
                    Arguments.of(
                            new UncheckedIOException(new IOException("connection reset")),
                            TransientException.Reason.NETWORK));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("transientFailures")
        @DisplayName("translates retryable provider failures to transient errors")
        void shouldTranslateTransientFailures(RuntimeException failure, TransientException.Reason reason) {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(failure);

            assertThatThrownBy(() -> adapter.generate(LlmRequest.of("hi")))
                    .isInstanceOf(TransientException.class)
                    .hasCause(failure)
                    .extracting(e -> ((TransientException) e).getReason())
                    .isEqualTo(reason);
        }

        static Stream<Arguments> terminalFailures() {
            return Stream.of(
                    Arguments.of(new AuthenticationException("bad key"), AdapterException.Reason.UNAUTHORIZED),
                    Arguments.of(new HttpException(403, "forbidden"), AdapterException.Reason.UNAUTHORIZED),
                    Arguments.of(new HttpException(400, "bad request"), AdapterException.Reason.INVALID_REQUEST),
                    Arguments.of(new IllegalStateException("boom"), AdapterException.Reason.PROVIDER_ERROR));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @MethodSource("terminalFailures")
        @DisplayName("translates other provider failures to adapter errors")
        void shouldTranslateTerminalFailures(RuntimeException failure, AdapterException.Reason reason) {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(failure);

            assertThatThrownBy(() -> adapter.generate(LlmRequest.of("hi")))
                    .isInstanceOf(AdapterException.class)
                    .extracting(e -> ((AdapterException) e).getReason())
                    .isEqualTo(reason);
        }
    }

    @Nested
    @DisplayName("embed")
    class Embed {

        @Test
        @DisplayName("returns the embedding vector")
        void shouldReturnVector() {
            when(embeddingModel.embed("hello"))
                    .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f})));

            assertThat(adapter.embed("hello")).containsExactly(0.1f, 0.2f);
        }

        @Test
        @DisplayName("translates embedding failures")
        void shouldTranslateEmbeddingFailure() {
            when(embeddingModel.embed("hello")).thenThrow(new RateLimitException("slow down"));

            assertThatThrownBy(() -> adapter.embed("hello")).isInstanceOf(TransientException.class);
        }

        @Test
        @DisplayName("fails when no embedding model is configured")
        void shouldFailWithoutEmbeddingModel() {
            LangChain4jLlmAdapter chatOnly =
                    new LangChain4jLlmAdapter("anthropic", "claude-sonnet-4", chatModel, null);

            assertThat(chatOnly.supportsEmbeddings()).isFalse();
            assertThatThrownBy(() -> chatOnly.embed("hello"))
                    .isInstanceOf(AdapterException.class)
                    .hasMessageContaining("No embedding model");
        }
    }
}
