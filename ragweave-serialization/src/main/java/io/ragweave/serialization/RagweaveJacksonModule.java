package io.ragweave.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.ragweave.core.execution.result.RunResult;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.WorkflowGraph;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Ragweave serialization configuration in one place.
///
/// - `WorkflowGraph`: {@link WorkflowGraphSerializer} / {@link WorkflowGraphDeserializer}
/// - `Node`: {@link NodeSerializer} / {@link NodeDeserializer}
/// - `RunResult`: {@link RunResultSerializer} (write only)
///
/// The engine types are immutable and builder-constructed, so every pair reads
/// and writes the JSON tree explicitly rather than through bean reflection.
///
/// @see WorkflowDefinitionSerializer for the convenience factory API
public class RagweaveJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = -3358417262718349203L;

    public RagweaveJacksonModule() {
        super("RagweaveJacksonModule");

        addSerializer(WorkflowGraph.class, new WorkflowGraphSerializer());
        addDeserializer(WorkflowGraph.class, new WorkflowGraphDeserializer());

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());

        addSerializer(RunResult.class, new RunResultSerializer());
    }
}
