package io.ragweave.core.adapter;

import java.time.Duration;
import java.util.Objects;

/// Result of a generation call.
///
/// @param text generated text, not null
/// @param promptTokens tokens consumed by the prompt, or 0 when the provider does not report it
/// @param completionTokens tokens produced, or 0 when the provider does not report it
/// @param latency wall-clock duration of the provider call, not null
/// @param provider identity of the provider that served the call (e.g. "openai:gpt-4o"), not null
public record LlmResponse(
        String text, int promptTokens, int completionTokens, Duration latency, String provider) {

    public LlmResponse {
        Objects.requireNonNull(text, "text must not be null");
        latency = latency != null ? latency : Duration.ZERO;
        provider = provider != null ? provider : "unknown";
    }

    /// Returns prompt plus completion tokens.
    ///
    /// @return total token count
    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
