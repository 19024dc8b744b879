package io.ragweave.core.adapter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Generation settings sent with an {@link LlmRequest}.
///
/// Every field is optional; a null value leaves the provider default in place.
///
/// @param temperature sampling temperature, may be null
/// @param maxTokens maximum completion tokens, may be null
/// @param topP nucleus sampling cutoff, may be null
/// @param stopSequences sequences that end generation, never null (may be empty)
public record GenerationParameters(
        Double temperature, Integer maxTokens, Double topP, List<String> stopSequences) {

    public GenerationParameters {
        stopSequences = stopSequences != null ? List.copyOf(stopSequences) : List.of();
    }

    /// Returns parameters that defer everything to the provider.
    ///
    /// @return empty parameters, never null
    public static GenerationParameters defaults() {
        return new GenerationParameters(null, null, null, List.of());
    }

    /// Reads parameters from a node configuration map.
    ///
    /// Recognised keys: `temperature`, `max_tokens`, `top_p`, `stop`.
    ///
    /// @param config node configuration, not null
    /// @return parsed parameters, never null
    public static GenerationParameters fromConfig(Map<String, Object> config) {
        Double temperature = asDouble(config.get("temperature"));
        Double topP = asDouble(config.get("top_p"));
        Object maxTokens = config.get("max_tokens");
        Object stop = config.get("stop");
        return new GenerationParameters(
                temperature,
                maxTokens instanceof Number n ? n.intValue() : null,
                topP,
                stop instanceof List<?> l ? l.stream().map(String::valueOf).toList() : List.of());
    }

    /// Returns the non-null parameters as a map, used for cache fingerprints.
    ///
    /// @return ordered map of set parameters, never null
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (temperature != null) map.put("temperature", temperature);
        if (maxTokens != null) map.put("max_tokens", maxTokens);
        if (topP != null) map.put("top_p", topP);
        if (!stopSequences.isEmpty()) map.put("stop", stopSequences);
        return map;
    }

    private static Double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }
}
