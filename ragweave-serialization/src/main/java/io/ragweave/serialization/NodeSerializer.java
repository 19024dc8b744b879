package io.ragweave.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.RetryPolicy;
import java.io.IOException;
import java.io.Serial;
import java.util.Collection;

/// Serializes a workflow `Node` to its definition record.
///
/// Every object begins with `"id"` and `"step_kind"`. Optional fields are
/// omitted when unset so a written definition reads like a hand-written one.
///
/// ```
/// Field                 Written when
/// ----------------------+------------------------------
/// depends_on            │ node has dependencies
/// optional_depends_on   │ some dependencies are tolerated
/// retry_policy          │ node overrides the run default
/// timeout               │ node overrides the run default
/// optional              │ true
/// handler               │ CUSTOM nodes
/// config                │ config map is not empty
/// ```
///
/// Durations are written as ISO-8601 strings.
///
/// @implNote Package-private. Registered by {@link RagweaveJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 4409117356228931085L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField(DefinitionFields.ID, node.getId());
        gen.writeStringField(DefinitionFields.STEP_KIND, node.getStepKind().name());

        writeIds(gen, DefinitionFields.DEPENDS_ON, node.getDependsOn());
        writeIds(gen, DefinitionFields.OPTIONAL_DEPENDS_ON, node.getOptionalDependencies());

        RetryPolicy policy = node.getRetryPolicy();
        if (policy != null) {
            gen.writeObjectFieldStart(DefinitionFields.RETRY_POLICY);
            gen.writeNumberField(DefinitionFields.MAX_ATTEMPTS, policy.maxAttempts());
            gen.writeStringField(DefinitionFields.BACKOFF_BASE, policy.backoffBase().toString());
            gen.writeStringField(DefinitionFields.BACKOFF_CAP, policy.backoffCap().toString());
            gen.writeEndObject();
        }
        if (node.getTimeout() != null) {
            gen.writeStringField(DefinitionFields.TIMEOUT, node.getTimeout().toString());
        }
        if (node.isOptional()) {
            gen.writeBooleanField(DefinitionFields.OPTIONAL, true);
        }
        if (node.getHandler() != null) {
            gen.writeStringField(DefinitionFields.HANDLER, node.getHandler());
        }
        if (!node.getConfig().isEmpty()) {
            provider.defaultSerializeField(DefinitionFields.CONFIG, node.getConfig(), gen);
        }

        gen.writeEndObject();
    }

    private static void writeIds(JsonGenerator gen, String field, Collection<String> ids)
            throws IOException {
        if (ids.isEmpty()) {
            return;
        }
        gen.writeArrayFieldStart(field);
        for (String id : ids) {
            gen.writeString(id);
        }
        gen.writeEndArray();
    }
}
