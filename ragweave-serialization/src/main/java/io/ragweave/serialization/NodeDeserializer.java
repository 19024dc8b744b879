package io.ragweave.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.ragweave.core.util.Durations;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.RetryPolicy;
import io.ragweave.core.workflow.StepKind;
import java.io.IOException;
import java.io.Serial;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Reads a workflow `Node` from its definition record.
///
/// Fields are extracted manually from the `JsonNode` tree. `config` is bound
/// to a plain `Map<String, Object>` so step handlers see numbers, strings,
/// booleans, lists and maps.
///
/// Durations (`timeout`, `backoff_base`, `backoff_cap`) accept an ISO-8601
/// string or a number of milliseconds. A `retry_policy` that omits a field
/// takes it from {@link RetryPolicy#DEFAULT}.
///
/// @implNote Package-private. Registered by {@link RagweaveJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = -6069271935406734512L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    NodeDeserializer() {
        super(Node.class);
    }

    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        return readNode(mapper, root, p);
    }

    static Node readNode(ObjectMapper mapper, JsonNode root, JsonParser p) throws IOException {
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Node definition must be a JSON object");
        }
        String id = requiredText(root, DefinitionFields.ID, p);
        String kind = requiredText(root, DefinitionFields.STEP_KIND, p);

        Node.Builder builder = Node.builder().id(id).stepKind(stepKind(kind, id, p));

        builder.dependsOn(textList(root, DefinitionFields.DEPENDS_ON, p));
        builder.optionalDependencies(
                new LinkedHashSet<>(textList(root, DefinitionFields.OPTIONAL_DEPENDS_ON, p)));

        if (root.hasNonNull(DefinitionFields.RETRY_POLICY)) {
            builder.retryPolicy(retryPolicy(root.get(DefinitionFields.RETRY_POLICY), p));
        }
        if (root.hasNonNull(DefinitionFields.TIMEOUT)) {
            builder.timeout(duration(root.get(DefinitionFields.TIMEOUT), DefinitionFields.TIMEOUT, p));
        }
        builder.optional(root.path(DefinitionFields.OPTIONAL).asBoolean(false));
        if (root.hasNonNull(DefinitionFields.HANDLER)) {
            builder.handler(root.get(DefinitionFields.HANDLER).asText());
        }
        if (root.hasNonNull(DefinitionFields.CONFIG)) {
            JsonNode config = root.get(DefinitionFields.CONFIG);
            if (!config.isObject()) {
                throw JsonMappingException.from(p, "Node '" + id + "' config must be a JSON object");
            }
            builder.config(mapper.convertValue(config, OBJECT_MAP));
        }
        return builder.build();
    }

    private static StepKind stepKind(String value, String nodeId, JsonParser p)
            throws JsonMappingException {
        try {
            return StepKind.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(
                    p, "Unknown step_kind '" + value + "' in node '" + nodeId + "'", e);
        }
    }

    private static RetryPolicy retryPolicy(JsonNode node, JsonParser p) throws IOException {
        if (!node.isObject()) {
            throw JsonMappingException.from(p, "retry_policy must be a JSON object");
        }
        RetryPolicy defaults = RetryPolicy.DEFAULT;
        int maxAttempts = node.path(DefinitionFields.MAX_ATTEMPTS).asInt(defaults.maxAttempts());
        Duration base =
                node.hasNonNull(DefinitionFields.BACKOFF_BASE)
                        ? duration(node.get(DefinitionFields.BACKOFF_BASE), DefinitionFields.BACKOFF_BASE, p)
                        : defaults.backoffBase();
        Duration cap =
                node.hasNonNull(DefinitionFields.BACKOFF_CAP)
                        ? duration(node.get(DefinitionFields.BACKOFF_CAP), DefinitionFields.BACKOFF_CAP, p)
                        : defaults.backoffCap();
        return RetryPolicy.of(maxAttempts, base, cap);
    }

    static Duration duration(JsonNode value, String field, JsonParser p) throws JsonMappingException {
        if (!value.isIntegralNumber() && !value.isTextual()) {
            throw JsonMappingException.from(
                    p, "'" + field + "' must be an ISO-8601 string or milliseconds, got " + value);
        }
        try {
            return value.isIntegralNumber()
                    ? Durations.ofMillis(value.asLong())
                    : Durations.parse(value.asText());
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid '" + field + "': " + e.getMessage(), e);
        }
    }

    private static String requiredText(JsonNode root, String field, JsonParser p)
            throws JsonMappingException {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw JsonMappingException.from(p, "Node definition is missing '" + field + "'");
        }
        return value.asText();
    }

    private static List<String> textList(JsonNode root, String field, JsonParser p)
            throws JsonMappingException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw JsonMappingException.from(p, "'" + field + "' must be an array of node ids");
        }
        List<String> ids = new ArrayList<>(value.size());
        value.forEach(element -> ids.add(element.asText()));
        return ids;
    }
}
