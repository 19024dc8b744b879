package io.ragweave.core.adapter.stub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.ragweave.core.adapter.LlmRequest;
import io.ragweave.core.adapter.LlmResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StubLlmAdapter")
class StubLlmAdapterTest {

    private final StubLlmAdapter adapter = new StubLlmAdapter("stub-model", 32);

    @Test
    @DisplayName("returns scripted responses for matching prompts")
    void shouldReturnScriptedResponse() {
        adapter.respondTo("capital of France", "Paris");

        LlmResponse response = adapter.generate(LlmRequest.of("What is the capital of France?"));

        assertThat(response.text()).isEqualTo("Paris");
        assertThat(response.provider()).isEqualTo("stub:stub-model");
        assertThat(response.promptTokens()).isEqualTo(6);
        assertThat(adapter.getGenerateCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("falls back to a stub response describing the prompt")
    void shouldFallBackToStubResponse() {
        LlmResponse response = adapter.generate(LlmRequest.of("hello"));

        assertThat(response.text()).startsWith("[STUB RESPONSE]").contains("5 chars");
    }

    @Test
    @DisplayName("embeddings are deterministic unit vectors")
    void shouldEmbedDeterministically() {
        float[] first = adapter.embed("Retrieval augmented generation");
        float[] second = adapter.embed("retrieval AUGMENTED generation");

        assertThat(first).hasSize(32).containsExactly(second);
        double norm = 0;
        for (float v : first) {
            norm += v * v;
        }
        assertThat(norm).isCloseTo(1.0, within(1e-5));
    }
}
