package io.ragweave.core.execution.step;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.ragweave.core.adapter.GenerationParameters;
import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.LlmRequest;
import io.ragweave.core.adapter.LlmResponse;
import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.prompt.AssembledPrompt;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.StepKind;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("GenerateStepHandler")
@ExtendWith(MockitoExtension.class)
class GenerateStepHandlerTest {

    @Mock private LlmAdapter llm;

    private GenerateStepHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GenerateStepHandler(llm);
    }

    private static LlmResponse response(String text) {
        return new LlmResponse(text, 3, 1, Duration.ofMillis(5), "mock:model");
    }

    @Test
    @DisplayName("sends the upstream assembled prompt with node generation parameters")
    void shouldGenerateFromAssembledPrompt() {
        // Given
        when(llm.generate(any())).thenReturn(response("42"));
        Node node =
                Node.builder()
                        .id("answer")
                        .stepKind(StepKind.GENERATE)
                        .dependsOn("prompt")
                        .config("temperature", 0.2)
                        .config("max_tokens", 64)
                        .build();
        AssembledPrompt assembled =
                new AssembledPrompt("qa", "Q: meaning of life", 4, List.of(), 0, List.of(), 0);

        // When
        LlmResponse result =
                handler.execute(StepContexts.of(node, Map.of(), Map.of("prompt", assembled)));

        // Then
        assertThat(result.text()).isEqualTo("42");
        verify(llm)
                .generate(
                        new LlmRequest(
                                "Q: meaning of life",
                                new GenerationParameters(0.2, 64, null, List.of()),
                                true));
    }

    @Test
    @DisplayName("renders an inline prompt template and honours cache=false")
    void shouldRenderInlinePromptUncached() {
        // Given
        when(llm.generate(any())).thenReturn(response("bonjour"));
        Node node =
                Node.builder()
                        .id("translate")
                        .stepKind(StepKind.GENERATE)
                        .dependsOn("draft")
                        .config("prompt", "Translate to {lang}: {draft}")
                        .config("cache", false)
                        .build();

        // When
        handler.execute(StepContexts.of(node, Map.of("lang", "French"), Map.of("draft", response("hello"))));

        // Then
        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llm).generate(request.capture());
        assertThat(request.getValue().prompt()).isEqualTo("Translate to French: hello");
        assertThat(request.getValue().cacheable()).isFalse();
    }

    @Test
    @DisplayName("rejects a node with neither an upstream prompt nor a prompt template")
    void shouldRejectMissingPrompt() {
        Node node = Node.builder().id("answer").stepKind(StepKind.GENERATE).build();

        assertThatThrownBy(() -> handler.execute(StepContexts.of(node, Map.of(), Map.of())))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'answer'");
    }
}
