package io.ragweave.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.ragweave.core.workflow.WorkflowGraph;
import java.io.IOException;
import java.io.Serial;

/// Reads a `WorkflowGraph` definition and validates it through
/// {@link WorkflowGraph.Builder#build()}.
///
/// Structural problems in the JSON surface as `JsonMappingException`; graph
/// problems (cycles, dangling dependencies, duplicate ids) surface as the
/// engine's validation exceptions.
///
/// @implNote Package-private. Registered by {@link RagweaveJacksonModule}.
class WorkflowGraphDeserializer extends StdDeserializer<WorkflowGraph> {

    @Serial private static final long serialVersionUID = -1939950725614797152L;

    WorkflowGraphDeserializer() {
        super(WorkflowGraph.class);
    }

    @Override
    public WorkflowGraph deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Workflow definition must be a JSON object");
        }

        WorkflowGraph.Builder builder =
                WorkflowGraph.builder()
                        .id(root.path(DefinitionFields.ID).asText(null))
                        .allowMultipleRoots(
                                root.path(DefinitionFields.ALLOW_MULTIPLE_ROOTS).asBoolean(false));

        JsonNode nodes = root.get(DefinitionFields.NODES);
        if (nodes == null || !nodes.isArray()) {
            throw JsonMappingException.from(p, "Workflow definition must contain a 'nodes' array");
        }
        for (JsonNode node : nodes) {
            builder.node(NodeDeserializer.readNode(mapper, node, p));
        }
        return builder.build();
    }
}
