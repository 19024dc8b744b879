package io.ragweave.core.adapter;

import java.util.Objects;

/// A single generation call.
///
/// @param prompt fully assembled prompt text, not null
/// @param parameters generation settings, never null (defaults applied)
/// @param cacheable whether the call may be served from or stored in the cache
public record LlmRequest(String prompt, GenerationParameters parameters, boolean cacheable) {

    public LlmRequest {
        Objects.requireNonNull(prompt, "prompt must not be null");
        parameters = parameters != null ? parameters : GenerationParameters.defaults();
    }

    public static LlmRequest of(String prompt) {
        return new LlmRequest(prompt, GenerationParameters.defaults(), true);
    }

    public static LlmRequest of(String prompt, GenerationParameters parameters) {
        return new LlmRequest(prompt, parameters, true);
    }

    /// Returns a copy of this request that bypasses the cache.
    ///
    /// @return uncached request, never null
    public LlmRequest uncached() {
        return new LlmRequest(prompt, parameters, false);
    }
}
