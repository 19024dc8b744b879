package io.ragweave.core.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Content-addressed cache key.
///
/// The key is `namespace:sha256` where the digest covers the canonical
/// rendering of the model identity, the normalized text and the parameters
/// with their keys sorted. Two requests that differ only in parameter order or
/// in insignificant whitespace therefore share a key.
///
/// {@snippet :
/// CacheKey key = CacheKey.builder("embed")
///     .model("text-embedding-3-small")
///     .text("What is RAG?")
///     .build();
/// }
///
/// @param namespace logical cache area (e.g. "embed", "generate"), not null
/// @param fingerprint lowercase hex SHA-256 digest, not null
public record CacheKey(String namespace, String fingerprint) {

    public CacheKey {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    }

    /// Returns the string stored in the cache backend.
    ///
    /// @return `namespace:fingerprint`, never null
    public String value() {
        return namespace + ":" + fingerprint;
    }

    @Override
    public String toString() {
        return value();
    }

    public static Builder builder(String namespace) {
        return new Builder(namespace);
    }

    /// Collects the fingerprint inputs of a {@link CacheKey}.
    public static final class Builder {
        private final String namespace;
        private String model = "";
        private String text = "";
        private final Map<String, Object> parameters = new TreeMap<>();

        private Builder(String namespace) {
            this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        }

        public Builder model(String model) {
            this.model = Objects.requireNonNull(model, "model must not be null");
            return this;
        }

        /// Sets the text input. The text is normalized with {@link TextNormalizer}.
        public Builder text(String text) {
            this.text = TextNormalizer.normalize(text);
            return this;
        }

        public Builder parameter(String name, Object value) {
            if (value != null) {
                parameters.put(name, value);
            }
            return this;
        }

        public Builder parameters(Map<String, ?> values) {
            values.forEach(this::parameter);
            return this;
        }

        public CacheKey build() {
            StringBuilder canonical = new StringBuilder();
            appendField(canonical, "namespace", namespace);
            appendField(canonical, "model", model);
            appendField(canonical, "text", text);
            appendField(canonical, "parameters", render(parameters));
            return new CacheKey(namespace, sha256(canonical.toString()));
        }

        // Length prefixes keep field boundaries unambiguous.
        private static void appendField(StringBuilder out, String name, String value) {
            out.append(name).append('#').append(value.length()).append(':').append(value).append('\n');
        }

        private static String render(Object value) {
            if (value instanceof Map<?, ?> map) {
                Map<String, Object> sorted = new TreeMap<>();
                map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
                List<String> parts = new ArrayList<>();
                sorted.forEach((k, v) -> parts.add(quote(k) + "=" + render(v)));
                return "{" + String.join(",", parts) + "}";
            }
            if (value instanceof List<?> list) {
                return "[" + String.join(",", list.stream().map(Builder::render).toList()) + "]";
            }
            if (value instanceof String s) {
                return quote(s);
            }
            return String.valueOf(value);
        }

        private static String quote(String s) {
            return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }

        private static String sha256(String input) {
            try {
                MessageDigest digest = MessageDigest.getInstance("SHA-256");
                return HexFormat.of()
                        .formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 not available", e);
            }
        }
    }
}
