package io.ragweave.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.WorkflowGraph;
import java.io.IOException;
import java.io.Serial;

/// Writes a `WorkflowGraph` as `{id, allow_multiple_roots, nodes: [...]}`.
///
/// Nodes are written in declaration order through {@link NodeSerializer}.
///
/// @implNote Package-private. Registered by {@link RagweaveJacksonModule}.
class WorkflowGraphSerializer extends StdSerializer<WorkflowGraph> {

    @Serial private static final long serialVersionUID = 2781460338912064511L;

    WorkflowGraphSerializer() {
        super(WorkflowGraph.class);
    }

    @Override
    public void serialize(WorkflowGraph graph, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField(DefinitionFields.ID, graph.getId());
        if (graph.isAllowMultipleRoots()) {
            gen.writeBooleanField(DefinitionFields.ALLOW_MULTIPLE_ROOTS, true);
        }
        gen.writeArrayFieldStart(DefinitionFields.NODES);
        for (Node node : graph.getNodes()) {
            provider.defaultSerializeValue(node, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
